package io.clusterengine.actions;

import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.ActionCancelledException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.driver.DriverException;
import io.clusterengine.driver.DriverOutcome;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.lock.InconsistentLockReleaseException;
import io.clusterengine.lock.LockBusyException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.clusterengine.config.Constants.*;

/**
 * Node-level building blocks shared by the cluster and node handlers.
 */
@Slf4j
public abstract class BaseActionHandler implements ActionHandler {

    /**
     * Takes the lock on a node for the running action, waiting a bounded number of short
     * rounds for another action to finish with it.
     */
    protected void lockNode(ActionContext context, Action action, String nodeId, String workerId,
                            CancellationToken token) throws LockBusyException, ActionAbortedException {
        int attempt = 0;
        while (true) {
            try {
                context.getLockManager().acquire(nodeId, action.getId(), workerId);
                return;
            } catch (LockBusyException e) {
                if (++attempt > context.getNodeLockMaxRetries()) {
                    throw e;
                }
                log.debug("Node {} busy with action {}, {} waiting (attempt {})",
                        nodeId, e.getHolderActionId(), action.getId(), attempt);
            }
            token.checkpoint();
            try {
                Thread.sleep(context.getNodeLockRetryMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionCancelledException(action.getId());
            }
        }
    }

    protected void unlockNode(ActionContext context, Action action, String nodeId) {
        try {
            context.getLockManager().release(nodeId, action.getId());
        } catch (InconsistentLockReleaseException e) {
            log.error("Node lock on {} no longer owned by {} (holder: {})", nodeId, action.getId(), e.getHolderActionId());
        }
    }

    /**
     * Runs one node operation through the driver on behalf of the action.
     *
     * @throws DriverException if the driver failed or reported an unsuccessful outcome
     */
    protected DriverOutcome runDriver(ActionContext context, Action action, ActionType nodeOperation, String nodeId,
                                      Map<String, Object> inputs, CancellationToken token)
            throws DriverException, ActionAbortedException {
        token.checkpoint();
        Action operation = action.getType() == nodeOperation && action.getTargetId().equals(nodeId)
                ? action
                : action.derive(nodeOperation, nodeId, inputs);
        DriverOutcome outcome = context.getDriver().execute(operation, token);
        if (outcome == null || !outcome.isSuccess()) {
            String message = outcome != null && outcome.getMessage() != null ? outcome.getMessage() : "no detail";
            throw new DriverException(nodeOperation + " failed for node " + nodeId + ": " + message,
                    outcome != null ? outcome.getData() : null, null);
        }
        return outcome;
    }

    /**
     * Registers a new member node and asks the driver to create it. The node ends ACTIVE, or
     * ERROR if the driver failed.
     */
    protected Node createMemberNode(ActionContext context, Action action, Cluster cluster, int index,
                                    CancellationToken token) throws DriverException, ActionAbortedException {
        token.checkpoint();
        Node node = new Node(UUID.randomUUID().toString(), cluster.getId(), cluster.getProfileId(), OffsetDateTime.now());
        node.setName(String.format(NODE_NAME_FORMAT, shortId(cluster.getId()), index));
        node.setIndex(index);
        context.getRegistry().saveNode(node);
        context.getRegistry().addNodeToCluster(cluster.getId(), node.getId());

        try {
            runDriver(context, action, ActionType.NODE_CREATE, node.getId(), new HashMap<>(), token);
        } catch (DriverException e) {
            context.getRegistry().updateNodeStatus(node.getId(), NodeStatus.ERROR);
            throw e;
        } catch (ActionAbortedException e) {
            // Creation may be half done on the driver side; leave an orphan in ERROR for inspection
            context.getRegistry().removeNodeFromCluster(cluster.getId(), node.getId());
            context.getRegistry().updateNodeStatus(node.getId(), NodeStatus.ERROR);
            throw e;
        }
        context.getRegistry().updateNodeStatus(node.getId(), NodeStatus.ACTIVE);
        log.info("[Cluster: {}] Created node {} ({})", cluster.getId(), node.getName(), node.getId());
        return node;
    }

    /**
     * Takes a node out of its cluster and, if requested, destroys it now or schedules the
     * destroy after the grace period. Membership is recorded in {@code nodes_removed} as
     * soon as it is gone.
     */
    protected void removeNode(ActionContext context, Action action, String nodeId, boolean destroy,
                              int gracePeriod, CancellationToken token) throws DriverException, ActionAbortedException {
        token.checkpoint();
        Node node = context.getRegistry().requireNode(nodeId);
        if (node.getStatus() == NodeStatus.DELETED) {
            log.info("Node {} already deleted, nothing to do for {}", nodeId, action.getId());
            return;
        }

        if (node.getClusterId() != null) {
            context.getRegistry().removeNodeFromCluster(node.getClusterId(), nodeId);
            appendOutput(action, OUTPUT_NODES_REMOVED, nodeId);
            log.info("[Cluster: {}] Node {} left the cluster", node.getClusterId(), nodeId);
        }
        if (!destroy) {
            return;
        }

        if (gracePeriod > 0) {
            Map<String, Object> childInputs = new HashMap<>();
            childInputs.put(INPUT_DEFERRED, true);
            childInputs.put(INPUT_DESTROY_AFTER_DELETION, true);
            Action destroyAction = action.derive(ActionType.NODE_DELETE, nodeId, childInputs);
            context.getScheduler().scheduleDeferred(action, destroyAction, Duration.ofSeconds(gracePeriod));
            appendOutput(action, OUTPUT_DEFERRED_DESTROYS, destroyAction.getId());
            return;
        }

        destroyNode(context, action, nodeId, token);
    }

    protected void destroyNode(ActionContext context, Action action, String nodeId, CancellationToken token)
            throws DriverException, ActionAbortedException {
        token.checkpoint();
        context.getRegistry().updateNodeStatus(nodeId, NodeStatus.DELETING);
        try {
            runDriver(context, action, ActionType.NODE_DELETE, nodeId, new HashMap<>(), token);
        } catch (DriverException e) {
            context.getRegistry().updateNodeStatus(nodeId, NodeStatus.ERROR);
            throw e;
        }
        context.getRegistry().updateNodeStatus(nodeId, NodeStatus.DELETED);
        log.info("Node {} destroyed by {}", nodeId, action.getId());
    }

    @SuppressWarnings("unchecked")
    protected static void appendOutput(Action action, String key, String value) {
        synchronized (action.getOutputs()) {
            Object existing = action.getOutput(key);
            List<String> values = existing instanceof Collection
                    ? new ArrayList<>((Collection<String>) existing)
                    : new ArrayList<>();
            values.add(value);
            action.putOutput(key, values);
        }
    }

    protected static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
