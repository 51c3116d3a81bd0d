package io.clusterengine.dispatcher;

import lombok.Getter;

/**
 * Thrown at a checkpoint once the action ran past its timeout.
 */
@Getter
public class ActionTimeoutException extends ActionAbortedException {

    private final String actionId;
    private final long timeoutSeconds;

    public ActionTimeoutException(String actionId, long timeoutSeconds) {
        super("Action " + actionId + " timed out after " + timeoutSeconds + "s");
        this.actionId = actionId;
        this.timeoutSeconds = timeoutSeconds;
    }
}
