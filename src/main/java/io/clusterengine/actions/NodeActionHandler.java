package io.clusterengine.actions;

import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.driver.DriverException;
import io.clusterengine.driver.DriverOutcome;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.store.TargetRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static io.clusterengine.config.Constants.*;

/**
 * Bodies of the single-node actions. The dispatcher already holds the node's lock.
 */
@Slf4j
public class NodeActionHandler extends BaseActionHandler {

    @Override
    public String resolvePolicyCluster(Action action, TargetRegistry registry) {
        if (action.getType() == ActionType.NODE_JOIN) {
            return action.getStringInput(INPUT_CLUSTER_ID);
        }
        if (action.getBooleanInput(INPUT_DEFERRED, false)) {
            return null;
        }
        return registry.getNode(action.getTargetId()).map(Node::getClusterId).orElse(null);
    }

    @Override
    public void execute(Action action, ActionContext context, String workerId, CancellationToken token)
            throws ActionAbortedException, DriverException {
        switch (action.getType()) {
            case NODE_CREATE:
                create(action, context, token);
                break;
            case NODE_DELETE:
                delete(action, context, token);
                break;
            case NODE_JOIN:
                join(action, context, token);
                break;
            case NODE_LEAVE:
                leave(action, context, token);
                break;
            case NODE_CHECK:
                check(action, context, token);
                break;
            default:
                throw new IllegalArgumentException("Not a node action: " + action.getType());
        }
    }

    private void create(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        Node node = context.getRegistry().requireNode(action.getTargetId());
        if (node.getStatus() != NodeStatus.INIT) {
            throw new IllegalArgumentException("Node " + node.getId() + " is " + node.getStatus() + ", expected INIT");
        }
        try {
            runDriver(context, action, ActionType.NODE_CREATE, node.getId(), action.getInputs(), token);
        } catch (DriverException e) {
            context.getRegistry().updateNodeStatus(node.getId(), NodeStatus.ERROR);
            throw e;
        }
        context.getRegistry().updateNodeStatus(node.getId(), NodeStatus.ACTIVE);
        if (node.getClusterId() != null) {
            context.getRegistry().addNodeToCluster(node.getClusterId(), node.getId());
            appendOutput(action, OUTPUT_NODES_CREATED, node.getId());
        }
        log.info("Node {} created", node.getId());
    }

    /**
     * A deferred destroy only runs the driver side; a direct delete first takes the node out
     * of its cluster and may itself defer the destroy.
     */
    private void delete(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        String nodeId = action.getTargetId();
        if (action.getBooleanInput(INPUT_DEFERRED, false)) {
            Node node = context.getRegistry().requireNode(nodeId);
            if (node.getStatus() == NodeStatus.DELETED) {
                log.info("Node {} already deleted, deferred destroy {} has nothing to do", nodeId, action.getId());
                return;
            }
            destroyNode(context, action, nodeId, token);
            return;
        }
        boolean destroy = action.getBooleanInput(INPUT_DESTROY_AFTER_DELETION, true);
        int gracePeriod = action.getIntInput(INPUT_GRACE_PERIOD, 0);
        removeNode(context, action, nodeId, destroy, gracePeriod, token);
    }

    private void join(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        String clusterId = action.getStringInput(INPUT_CLUSTER_ID);
        if (clusterId == null || clusterId.isBlank()) {
            throw new IllegalArgumentException("Input '" + INPUT_CLUSTER_ID + "' is required for " + action.getType());
        }
        Cluster cluster = context.getRegistry().requireCluster(clusterId);
        Node node = context.getRegistry().requireNode(action.getTargetId());
        if (clusterId.equals(node.getClusterId())) {
            log.info("Node {} is already a member of cluster {}", node.getId(), clusterId);
            return;
        }
        if (node.getClusterId() != null) {
            throw new IllegalArgumentException("Node " + node.getId() + " is owned by cluster " + node.getClusterId());
        }
        runDriver(context, action, ActionType.NODE_JOIN, node.getId(), action.getInputs(), token);
        context.getRegistry().addNodeToCluster(cluster.getId(), node.getId());
        appendOutput(action, OUTPUT_NODES_ADDED, node.getId());
        log.info("[Cluster: {}] Node {} joined", cluster.getId(), node.getId());
    }

    private void leave(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        Node node = context.getRegistry().requireNode(action.getTargetId());
        Optional<String> clusterId = Optional.ofNullable(node.getClusterId());
        if (clusterId.isEmpty()) {
            log.info("Node {} is not a member of any cluster", node.getId());
            return;
        }
        runDriver(context, action, ActionType.NODE_LEAVE, node.getId(), new HashMap<>(), token);
        context.getRegistry().removeNodeFromCluster(clusterId.get(), node.getId());
        action.putOutput(OUTPUT_NODES_REMOVED, List.of(node.getId()));
        log.info("[Cluster: {}] Node {} left", clusterId.get(), node.getId());
    }

    private void check(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        Node node = context.getRegistry().requireNode(action.getTargetId());
        DriverOutcome outcome;
        try {
            outcome = runDriver(context, action, ActionType.NODE_CHECK, node.getId(), new HashMap<>(), token);
        } catch (DriverException e) {
            context.getRegistry().updateNodeStatus(node.getId(), NodeStatus.ERROR);
            throw e;
        }
        boolean healthy = !Boolean.FALSE.equals(outcome.getData().get("healthy"));
        context.getRegistry().updateNodeStatus(node.getId(), healthy ? NodeStatus.ACTIVE : NodeStatus.ERROR);
        action.putOutput(healthy ? OUTPUT_HEALTHY_NODES : OUTPUT_UNHEALTHY_NODES, List.of(node.getId()));
    }
}
