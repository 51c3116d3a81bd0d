package io.clusterengine.driver;

import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.models.Action;

/**
 * Creates, destroys and inspects the compute resources behind nodes.
 *
 * Implementations receive node-level actions (NODE_CREATE, NODE_DELETE, NODE_JOIN, NODE_LEAVE,
 * NODE_CHECK) and are expected to poll {@code token} between the steps of long operations.
 */
public interface Driver {

    /**
     * Run the resource side of a node action.
     *
     * @throws DriverException when the operation failed
     * @throws ActionAbortedException when the token fired before the operation finished
     */
    DriverOutcome execute(Action action, CancellationToken token) throws DriverException, ActionAbortedException;
}
