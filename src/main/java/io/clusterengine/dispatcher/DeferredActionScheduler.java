package io.clusterengine.dispatcher;

import io.clusterengine.models.Action;

import java.time.Duration;

/**
 * Submits derived actions after a delay without holding a worker while waiting.
 */
public interface DeferredActionScheduler {

    /**
     * Submit {@code child} once {@code delay} has passed, unless {@code parent} is cancelled
     * first.
     */
    void scheduleDeferred(Action parent, Action child, Duration delay);
}
