package io.clusterengine.dispatcher;

import lombok.Getter;

/**
 * Thrown at a checkpoint once cancellation of the action has been requested.
 */
@Getter
public class ActionCancelledException extends ActionAbortedException {

    private final String actionId;

    public ActionCancelledException(String actionId) {
        super("Action " + actionId + " cancelled");
        this.actionId = actionId;
    }
}
