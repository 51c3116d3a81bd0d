package io.clusterengine.dispatcher;

import io.clusterengine.models.Action;
import lombok.Getter;

import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * Queue entry: an action that becomes eligible for a worker at {@code readyAtNanos}.
 * Entries ready at the same instant keep their enqueue order.
 */
@Getter
class PendingAction implements Delayed {

    private final Action action;
    private final long readyAtNanos;
    private final long sequence;

    PendingAction(Action action, long readyAtNanos, long sequence) {
        this.action = action;
        this.readyAtNanos = readyAtNanos;
        this.sequence = sequence;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(readyAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
        if (other == this) {
            return 0;
        }
        if (other instanceof PendingAction) {
            PendingAction that = (PendingAction) other;
            int byTime = Long.compare(readyAtNanos - that.readyAtNanos, 0L);
            return byTime != 0 ? byTime : Long.compare(sequence, that.sequence);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
    }
}
