package io.clusterengine.lock;

import lombok.Getter;

/**
 * Thrown when a target is already locked by a different action. Retryable.
 */
@Getter
public class LockBusyException extends Exception {

    private final String targetId;
    private final String holderActionId;

    public LockBusyException(String targetId, String holderActionId) {
        super("Target " + targetId + " is locked by action " + holderActionId);
        this.targetId = targetId;
        this.holderActionId = holderActionId;
    }
}
