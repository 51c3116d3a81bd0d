package io.clusterengine.actions;

import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.driver.DriverException;
import io.clusterengine.driver.DriverOutcome;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.lock.LockBusyException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.policies.BindingOptions;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.store.TargetRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.*;

/**
 * Bodies of the cluster-level actions.
 *
 * Membership changes are applied node by node, each under that node's lock. Scale-out and
 * add-nodes raise the desired capacity by the nodes actually added; scale-in and del-nodes
 * lower it by the nodes actually removed unless a deletion policy has taken over that
 * bookkeeping. A policy-owned reduction is still applied here when the removal stops early,
 * since POST hooks do not run for a failed or cancelled body.
 */
@Slf4j
public class ClusterActionHandler extends BaseActionHandler {

    private final Random random;

    public ClusterActionHandler() {
        this(new Random());
    }

    public ClusterActionHandler(Random random) {
        this.random = random;
    }

    @Override
    public String resolvePolicyCluster(Action action, TargetRegistry registry) {
        return action.getTargetId();
    }

    @Override
    public void execute(Action action, ActionContext context, String workerId, CancellationToken token)
            throws ActionAbortedException, DriverException, LockBusyException, InvalidPolicyConfigException {
        switch (action.getType()) {
            case CLUSTER_CREATE:
                create(action, context, token);
                break;
            case CLUSTER_SCALE_OUT:
                scaleOut(action, context, token);
                break;
            case CLUSTER_SCALE_IN:
            case CLUSTER_DEL_NODES:
                deleteNodes(action, context, workerId, token);
                break;
            case CLUSTER_DELETE:
                delete(action, context, workerId, token);
                break;
            case CLUSTER_ADD_NODES:
                addNodes(action, context, workerId, token);
                break;
            case CLUSTER_CHECK:
                check(action, context, token);
                break;
            case CLUSTER_ATTACH_POLICY:
                context.getPolicyManager().attach(action.getTargetId(), requirePolicyId(action), BindingOptions.fromInputs(action));
                break;
            case CLUSTER_DETACH_POLICY:
                context.getPolicyManager().detach(action.getTargetId(), requirePolicyId(action));
                break;
            case CLUSTER_UPDATE_POLICY:
                context.getPolicyManager().updateBinding(action.getTargetId(), requirePolicyId(action), BindingOptions.fromInputs(action));
                break;
            default:
                throw new IllegalArgumentException("Not a cluster action: " + action.getType());
        }
    }

    private void create(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        Cluster cluster = context.getRegistry().requireCluster(action.getTargetId());
        int existing = cluster.getNodeIds().size();
        int toCreate = Math.max(0, cluster.getDesiredCapacity() - existing);
        log.info("[Cluster: {}] Creating {} node(s)", cluster.getId(), toCreate);

        try {
            for (int i = 0; i < toCreate; i++) {
                Node node = createMemberNode(context, action, cluster, nextIndex(context, cluster.getId()), token);
                appendOutput(action, OUTPUT_NODES_CREATED, node.getId());
            }
        } catch (DriverException e) {
            context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ERROR, e.getMessage());
            throw e;
        }
        context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ACTIVE, "Cluster creation succeeded");
    }

    private void scaleOut(Action action, ActionContext context, CancellationToken token)
            throws ActionAbortedException, DriverException {
        Cluster cluster = context.getRegistry().requireCluster(action.getTargetId());
        int count = action.getIntInput(INPUT_COUNT, 1);
        if (count < 0) {
            throw new IllegalArgumentException("Scale-out count must not be negative, got " + count);
        }
        int target = cluster.getDesiredCapacity() + count;
        if (!cluster.isWithinBounds(target)) {
            throw new IllegalArgumentException("Scaling out by " + count + " would exceed max_size " + cluster.getMaxSize());
        }

        int created = 0;
        try {
            for (int i = 0; i < count; i++) {
                Node node = createMemberNode(context, action, cluster, nextIndex(context, cluster.getId()), token);
                appendOutput(action, OUTPUT_NODES_CREATED, node.getId());
                created++;
            }
        } catch (DriverException e) {
            context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ERROR, e.getMessage());
            throw e;
        } finally {
            if (created > 0) {
                int capacity = context.getRegistry().updateClusterCapacity(cluster.getId(), created);
                log.info("[Cluster: {}] Desired capacity raised by {} to {}", cluster.getId(), created, capacity);
            }
        }
        context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ACTIVE, "Cluster scale-out succeeded");
    }

    /**
     * Scale-in and del-nodes: remove the candidates chosen by a deletion policy, the nodes
     * named in the request, or random members as a fallback.
     */
    private void deleteNodes(Action action, ActionContext context, String workerId, CancellationToken token)
            throws ActionAbortedException, DriverException, LockBusyException {
        Cluster cluster = context.getRegistry().requireCluster(action.getTargetId());
        List<String> candidates = chooseCandidates(action, context, cluster);
        validateMembers(cluster, candidates);
        if (action.getType() == ActionType.CLUSTER_SCALE_IN && action.hasInput(INPUT_COUNT)
                && candidates.size() != action.getIntInput(INPUT_COUNT, 1)) {
            log.warn("[Cluster: {}] Scale-in asked for {} node(s) but {} candidate(s) were chosen: {}",
                    cluster.getId(), action.getIntInput(INPUT_COUNT, 1), candidates.size(), candidates);
        }

        boolean destroy = action.getBooleanInput(INPUT_DESTROY_AFTER_DELETION, true);
        int gracePeriod = action.getIntInput(INPUT_GRACE_PERIOD, 0);
        boolean handlerOwnsCapacity = !action.hasInput(INPUT_REDUCE_DESIRED_CAPACITY);
        boolean policyReduces = action.getBooleanInput(INPUT_REDUCE_DESIRED_CAPACITY, false);
        log.info("[Cluster: {}] {} removing {} (destroy={}, grace={}s)",
                cluster.getId(), action.getType(), candidates, destroy, gracePeriod);

        boolean completed = false;
        try {
            removeAll(action, context, workerId, candidates, destroy, gracePeriod, token);
            completed = true;
        } catch (DriverException e) {
            context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ERROR, e.getMessage());
            throw e;
        } finally {
            int removed = removedCount(action);
            // POST hooks only run after a complete body, so partial progress is settled here
            boolean reduce = handlerOwnsCapacity || (policyReduces && !completed);
            if (reduce && removed > 0) {
                int capacity = context.getRegistry().updateClusterCapacity(cluster.getId(), -removed);
                log.info("[Cluster: {}] Desired capacity lowered by {} to {}", cluster.getId(), removed, capacity);
            }
        }
        context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ACTIVE, "Node removal succeeded");
    }

    private void delete(Action action, ActionContext context, String workerId, CancellationToken token)
            throws ActionAbortedException, DriverException, LockBusyException {
        Cluster cluster = context.getRegistry().requireCluster(action.getTargetId());
        context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.DELETING, "Deletion in progress");

        List<String> members = action.hasInput(INPUT_CANDIDATES)
                ? action.getStringListInput(INPUT_CANDIDATES)
                : new ArrayList<>(cluster.getNodeIds());
        int gracePeriod = action.getIntInput(INPUT_GRACE_PERIOD, 0);

        try {
            removeAll(action, context, workerId, members, true, gracePeriod, token);
        } catch (DriverException e) {
            context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ERROR, e.getMessage());
            throw e;
        }

        context.getRegistry().updateCluster(cluster.getId(), c -> {
            c.getBindings().clear();
            c.setDesiredCapacity(0);
            c.setStatus(ClusterStatus.DELETED);
            c.setStatusReason("Cluster deleted");
            return c;
        });
        log.info("[Cluster: {}] Deleted", cluster.getId());
    }

    private void addNodes(Action action, ActionContext context, String workerId, CancellationToken token)
            throws ActionAbortedException, DriverException, LockBusyException {
        Cluster cluster = context.getRegistry().requireCluster(action.getTargetId());
        List<String> nodeIds = action.getStringListInput(INPUT_NODES);
        if (nodeIds.isEmpty()) {
            throw new IllegalArgumentException("No nodes given to add to cluster " + cluster.getId());
        }

        List<String> problems = new ArrayList<>();
        for (String nodeId : nodeIds) {
            Node node = context.getRegistry().requireNode(nodeId);
            if (node.getClusterId() != null) {
                problems.add(nodeId + " is owned by cluster " + node.getClusterId());
            } else if (node.getStatus() != NodeStatus.ACTIVE) {
                problems.add(nodeId + " is " + node.getStatus());
            }
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Cannot add nodes to cluster " + cluster.getId() + ": " + problems);
        }
        if (!cluster.isWithinBounds(cluster.getDesiredCapacity() + nodeIds.size())) {
            throw new IllegalArgumentException("Adding " + nodeIds.size() + " node(s) would exceed max_size " + cluster.getMaxSize());
        }

        int added = 0;
        try {
            for (String nodeId : nodeIds) {
                lockNode(context, action, nodeId, workerId, token);
                try {
                    HashMap<String, Object> joinInputs = new HashMap<>();
                    joinInputs.put(INPUT_CLUSTER_ID, cluster.getId());
                    runDriver(context, action, ActionType.NODE_JOIN, nodeId, joinInputs, token);
                    context.getRegistry().addNodeToCluster(cluster.getId(), nodeId);
                    appendOutput(action, OUTPUT_NODES_ADDED, nodeId);
                    added++;
                } finally {
                    unlockNode(context, action, nodeId);
                }
            }
        } finally {
            if (added > 0) {
                context.getRegistry().updateClusterCapacity(cluster.getId(), added);
            }
        }
    }

    private void check(Action action, ActionContext context, CancellationToken token) throws ActionAbortedException {
        Cluster cluster = context.getRegistry().requireCluster(action.getTargetId());
        List<String> healthy = new ArrayList<>();
        List<String> unhealthy = new ArrayList<>();

        for (String nodeId : cluster.getNodeIds()) {
            token.checkpoint();
            boolean nodeHealthy;
            try {
                DriverOutcome outcome = runDriver(context, action, ActionType.NODE_CHECK, nodeId, new HashMap<>(), token);
                nodeHealthy = !Boolean.FALSE.equals(outcome.getData().get("healthy"));
            } catch (DriverException e) {
                log.warn("[Cluster: {}] Check of node {} failed: {}", cluster.getId(), nodeId, e.getMessage());
                nodeHealthy = false;
            }
            if (nodeHealthy) {
                healthy.add(nodeId);
                context.getRegistry().updateNodeStatus(nodeId, NodeStatus.ACTIVE);
            } else {
                unhealthy.add(nodeId);
                context.getRegistry().updateNodeStatus(nodeId, NodeStatus.ERROR);
            }
        }

        action.putOutput(OUTPUT_HEALTHY_NODES, healthy);
        action.putOutput(OUTPUT_UNHEALTHY_NODES, unhealthy);
        log.info("[Cluster: {}] Check finished: {} healthy, {} unhealthy", cluster.getId(), healthy.size(), unhealthy.size());
        if (unhealthy.isEmpty()) {
            context.getRegistry().updateClusterStatus(cluster.getId(), ClusterStatus.ACTIVE, "All nodes healthy");
        }
    }

    private void removeAll(Action action, ActionContext context, String workerId, List<String> nodeIds,
                           boolean destroy, int gracePeriod, CancellationToken token)
            throws ActionAbortedException, DriverException, LockBusyException {
        for (String nodeId : nodeIds) {
            lockNode(context, action, nodeId, workerId, token);
            try {
                removeNode(context, action, nodeId, destroy, gracePeriod, token);
            } finally {
                unlockNode(context, action, nodeId);
            }
        }
    }

    private List<String> chooseCandidates(Action action, ActionContext context, Cluster cluster) {
        if (action.hasInput(INPUT_CANDIDATES)) {
            return action.getStringListInput(INPUT_CANDIDATES);
        }
        if (action.getType() == ActionType.CLUSTER_DEL_NODES) {
            List<String> nodes = action.getStringListInput(INPUT_NODES);
            if (nodes.isEmpty()) {
                throw new IllegalArgumentException("No nodes given to remove from cluster " + cluster.getId());
            }
            return nodes;
        }

        int count = action.getIntInput(INPUT_COUNT, 1);
        if (count < 0) {
            throw new IllegalArgumentException("Scale-in count must not be negative, got " + count);
        }
        if (!cluster.isWithinBounds(cluster.getDesiredCapacity() - count)) {
            throw new IllegalArgumentException("Scaling in by " + count + " would go below min_size " + cluster.getMinSize());
        }
        List<String> active = context.getRegistry().listNodes(cluster.getId()).stream()
                .filter(n -> n.getStatus() == NodeStatus.ACTIVE)
                .map(Node::getId)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
        Collections.shuffle(active, random);
        List<String> chosen = new ArrayList<>(active.subList(0, Math.min(count, active.size())));
        action.putInput(INPUT_CANDIDATES, chosen);
        return chosen;
    }

    private void validateMembers(Cluster cluster, List<String> candidates) {
        List<String> strangers = candidates.stream()
                .filter(id -> !cluster.getNodeIds().contains(id))
                .collect(Collectors.toList());
        if (!strangers.isEmpty()) {
            throw new IllegalArgumentException("Nodes " + strangers + " are not members of cluster " + cluster.getId());
        }
    }

    private int nextIndex(ActionContext context, String clusterId) {
        return context.getRegistry().listNodes(clusterId).stream()
                .mapToInt(Node::getIndex)
                .max()
                .orElse(0) + 1;
    }

    private static int removedCount(Action action) {
        Object removed = action.getOutput(OUTPUT_NODES_REMOVED);
        return removed instanceof Collection ? ((Collection<?>) removed).size() : 0;
    }

    private static String requirePolicyId(Action action) {
        String policyId = action.getStringInput(INPUT_POLICY_ID);
        if (policyId == null || policyId.isBlank()) {
            throw new IllegalArgumentException("Input '" + INPUT_POLICY_ID + "' is required for " + action.getType());
        }
        return policyId;
    }
}
