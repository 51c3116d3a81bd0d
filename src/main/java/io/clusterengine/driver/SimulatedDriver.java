package io.clusterengine.driver;

import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.models.Action;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Driver that performs no real resource work. Every operation succeeds after the configured
 * delay and every check reports the node healthy. Used when no cloud driver is wired in.
 */
@Slf4j
public class SimulatedDriver implements Driver {

    private static final long CHECKPOINT_INTERVAL_MILLIS = 50L;

    private final long operationDelayMillis;

    public SimulatedDriver() {
        this(0L);
    }

    public SimulatedDriver(long operationDelayMillis) {
        this.operationDelayMillis = operationDelayMillis;
    }

    @Override
    public DriverOutcome execute(Action action, CancellationToken token) throws DriverException, ActionAbortedException {
        log.info("Simulating {} on {}", action.getType(), action.getTargetId());
        long remaining = operationDelayMillis;
        while (remaining > 0) {
            token.checkpoint();
            long step = Math.min(remaining, CHECKPOINT_INTERVAL_MILLIS);
            try {
                Thread.sleep(step);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("Interrupted while simulating " + action.getType(), e);
            }
            remaining -= step;
        }
        token.checkpoint();

        switch (action.getType()) {
            case NODE_CHECK:
                return DriverOutcome.ok(Map.of("healthy", true));
            default:
                return DriverOutcome.ok();
        }
    }
}
