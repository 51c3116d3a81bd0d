package io.clusterengine.store;

import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read/write access to cluster, node and policy records.
 *
 * Returned objects are detached copies; changes must go through the update methods, which
 * apply atomically per record.
 */
public interface TargetRegistry {

    // =================================================================
    // CLUSTERS
    // =================================================================

    Optional<Cluster> getCluster(String clusterId);

    default Cluster requireCluster(String clusterId) {
        return getCluster(clusterId).orElseThrow(() -> new TargetNotFoundException("Cluster", clusterId));
    }

    List<Cluster> listClusters();

    void saveCluster(Cluster cluster);

    void deleteCluster(String clusterId);

    /**
     * Atomically applies {@code mutator} to the stored cluster.
     *
     * @return the cluster as stored after the update
     * @throws TargetNotFoundException if the cluster does not exist
     */
    Cluster updateCluster(String clusterId, UnaryOperator<Cluster> mutator);

    /**
     * Atomically adds {@code delta} to the cluster's desired capacity. The result never drops
     * below zero.
     *
     * @return the new desired capacity
     */
    default int updateClusterCapacity(String clusterId, int delta) {
        return updateCluster(clusterId, cluster -> {
            cluster.setDesiredCapacity(Math.max(0, cluster.getDesiredCapacity() + delta));
            return cluster;
        }).getDesiredCapacity();
    }

    default void updateClusterStatus(String clusterId, ClusterStatus status, String reason) {
        updateCluster(clusterId, cluster -> {
            cluster.setStatus(status);
            cluster.setStatusReason(reason);
            return cluster;
        });
    }

    // =================================================================
    // NODES
    // =================================================================

    Optional<Node> getNode(String nodeId);

    default Node requireNode(String nodeId) {
        return getNode(nodeId).orElseThrow(() -> new TargetNotFoundException("Node", nodeId));
    }

    /**
     * Nodes whose cluster id is the given cluster.
     */
    List<Node> listNodes(String clusterId);

    void saveNode(Node node);

    Node updateNode(String nodeId, UnaryOperator<Node> mutator);

    default void updateNodeStatus(String nodeId, NodeStatus status) {
        updateNode(nodeId, node -> {
            node.setStatus(status);
            return node;
        });
    }

    /**
     * Makes the node a member of the cluster (node side first, then cluster side).
     */
    default void addNodeToCluster(String clusterId, String nodeId) {
        updateNode(nodeId, node -> {
            node.setClusterId(clusterId);
            return node;
        });
        updateCluster(clusterId, cluster -> {
            cluster.getNodeIds().add(nodeId);
            return cluster;
        });
    }

    /**
     * Turns the node into an orphan (node side first, then cluster side).
     */
    default void removeNodeFromCluster(String clusterId, String nodeId) {
        updateNode(nodeId, node -> {
            if (clusterId.equals(node.getClusterId())) {
                node.setClusterId(null);
            }
            return node;
        });
        updateCluster(clusterId, cluster -> {
            cluster.getNodeIds().remove(nodeId);
            return cluster;
        });
    }

    // =================================================================
    // POLICIES
    // =================================================================

    Optional<PolicyRecord> getPolicy(String policyId);

    List<PolicyRecord> listPolicies();

    void savePolicy(PolicyRecord policy);

    void deletePolicy(String policyId);
}
