package io.clusterengine.lock;

import lombok.Getter;

/**
 * Thrown when an action releases a lock it does not own. The lock table is left untouched.
 */
@Getter
public class InconsistentLockReleaseException extends Exception {

    private final String targetId;
    private final String actionId;
    private final String holderActionId;

    public InconsistentLockReleaseException(String targetId, String actionId, String holderActionId) {
        super("Action " + actionId + " released lock on " + targetId + " held by "
                + (holderActionId != null ? "action " + holderActionId : "nobody"));
        this.targetId = targetId;
        this.actionId = actionId;
        this.holderActionId = holderActionId;
    }
}
