package io.clusterengine.actions;

import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.driver.DriverException;
import io.clusterengine.lock.LockBusyException;
import io.clusterengine.models.Action;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.store.TargetRegistry;

/**
 * Execution body for a family of action types.
 *
 * The body runs while the worker holds the lock on the action's target. Progress is reported
 * through the action's outputs as it happens, so a body that throws part way leaves an
 * accurate record of what it already did.
 */
public interface ActionHandler {

    /**
     * Runs the body of the action.
     *
     * @param workerId id of the worker executing the action, used as owner of any node locks
     * @throws ActionAbortedException when the token fired at a checkpoint
     * @throws DriverException when a resource operation failed
     * @throws LockBusyException when a node the action must touch stayed locked by another action
     * @throws InvalidPolicyConfigException when a policy binding request is invalid
     * @throws IllegalArgumentException when the action's inputs are invalid
     */
    void execute(Action action, ActionContext context, String workerId, CancellationToken token)
            throws ActionAbortedException, DriverException, LockBusyException, InvalidPolicyConfigException;

    /**
     * Cluster whose bound policies apply to the action, or null if none do.
     */
    String resolvePolicyCluster(Action action, TargetRegistry registry);
}
