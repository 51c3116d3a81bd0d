package io.clusterengine.store;

import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Registry kept in process memory. Updates run inside {@link ConcurrentMap#compute} so each
 * record is modified by one writer at a time.
 */
@Slf4j
public class InMemoryTargetRegistry implements TargetRegistry {

    private final ConcurrentMap<String, Cluster> clusters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Node> nodes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PolicyRecord> policies = new ConcurrentHashMap<>();

    @Override
    public Optional<Cluster> getCluster(String clusterId) {
        return Optional.ofNullable(clusters.get(clusterId)).map(Cluster::copy);
    }

    @Override
    public List<Cluster> listClusters() {
        return clusters.values().stream().map(Cluster::copy).collect(Collectors.toList());
    }

    @Override
    public void saveCluster(Cluster cluster) {
        clusters.put(cluster.getId(), cluster.copy());
        log.debug("Saved cluster {}", cluster.getId());
    }

    @Override
    public void deleteCluster(String clusterId) {
        clusters.remove(clusterId);
        log.debug("Deleted cluster {}", clusterId);
    }

    @Override
    public Cluster updateCluster(String clusterId, UnaryOperator<Cluster> mutator) {
        Cluster updated = clusters.computeIfPresent(clusterId, (id, current) -> mutator.apply(current.copy()).copy());
        if (updated == null) {
            throw new TargetNotFoundException("Cluster", clusterId);
        }
        return updated.copy();
    }

    @Override
    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId)).map(Node::copy);
    }

    @Override
    public List<Node> listNodes(String clusterId) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (Objects.equals(clusterId, node.getClusterId())) {
                result.add(node.copy());
            }
        }
        return result;
    }

    @Override
    public void saveNode(Node node) {
        nodes.put(node.getId(), node.copy());
        log.debug("Saved node {}", node.getId());
    }

    @Override
    public Node updateNode(String nodeId, UnaryOperator<Node> mutator) {
        Node updated = nodes.computeIfPresent(nodeId, (id, current) -> mutator.apply(current.copy()).copy());
        if (updated == null) {
            throw new TargetNotFoundException("Node", nodeId);
        }
        return updated.copy();
    }

    @Override
    public Optional<PolicyRecord> getPolicy(String policyId) {
        return Optional.ofNullable(policies.get(policyId)).map(InMemoryTargetRegistry::copyOf);
    }

    @Override
    public List<PolicyRecord> listPolicies() {
        return policies.values().stream().map(InMemoryTargetRegistry::copyOf).collect(Collectors.toList());
    }

    @Override
    public void savePolicy(PolicyRecord policy) {
        policies.put(policy.getId(), copyOf(policy));
    }

    @Override
    public void deletePolicy(String policyId) {
        policies.remove(policyId);
    }

    private static PolicyRecord copyOf(PolicyRecord record) {
        return new PolicyRecord(record.getId(), record.getName(), record.getType(),
                new LinkedHashMap<>(record.getSpec()), record.getCreatedAt());
    }
}
