package io.clusterengine.dispatcher;

import io.clusterengine.models.Action;

import java.time.Clock;
import java.time.Instant;

/**
 * Token backed by an action's cancel flag and, when the action has one, its timeout.
 */
public class ActionCancellationToken implements CancellationToken {

    private final Action action;
    private final Clock clock;
    private final Instant deadline;

    public ActionCancellationToken(Action action) {
        this(action, Clock.systemUTC());
    }

    public ActionCancellationToken(Action action, Clock clock) {
        this.action = action;
        this.clock = clock;
        this.deadline = action.getTimeoutSeconds() > 0
                ? clock.instant().plusSeconds(action.getTimeoutSeconds())
                : null;
    }

    @Override
    public boolean isCancelled() {
        return action.isCancelRequested();
    }

    @Override
    public boolean isTimedOut() {
        return deadline != null && clock.instant().isAfter(deadline);
    }

    @Override
    public void checkpoint() throws ActionAbortedException {
        if (isCancelled()) {
            throw new ActionCancelledException(action.getId());
        }
        if (isTimedOut()) {
            throw new ActionTimeoutException(action.getId(), action.getTimeoutSeconds());
        }
    }
}
