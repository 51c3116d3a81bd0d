package io.clusterengine.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Action lifecycle status.
 *
 * INIT -> WAITING -> RUNNING -> SUCCEEDED | FAILED | CANCELLED.
 * An action that never started may end in CANCELLED or FAILED directly.
 */
public enum ActionStatus {
    INIT,
    WAITING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ActionStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<ActionStatus> allowedTransitions() {
        switch (this) {
            case INIT:
                return EnumSet.of(WAITING, CANCELLED, FAILED);
            case WAITING:
                return EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING:
                return EnumSet.of(SUCCEEDED, FAILED, CANCELLED);
            default:
                return EnumSet.noneOf(ActionStatus.class);
        }
    }
}
