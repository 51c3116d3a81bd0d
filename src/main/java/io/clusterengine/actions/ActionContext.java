package io.clusterengine.actions;

import io.clusterengine.dispatcher.DeferredActionScheduler;
import io.clusterengine.driver.Driver;
import io.clusterengine.lock.ActionLockManager;
import io.clusterengine.policies.PolicyManager;
import io.clusterengine.store.TargetRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Shared services available to action handlers.
 *
 * The worker running the action is passed separately to each execution.
 */
@Getter
@AllArgsConstructor
public class ActionContext {

    private final TargetRegistry registry;
    private final ActionLockManager lockManager;
    private final Driver driver;
    private final PolicyManager policyManager;
    private final DeferredActionScheduler scheduler;
    private final int nodeLockMaxRetries;
    private final long nodeLockRetryMillis;
}
