package io.clusterengine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyRecord;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

import static io.clusterengine.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of TargetRegistry.
 * Records are stored as JSON; updates use compare-and-swap on the key's mod revision.
 */
@Slf4j
public class EtcdTargetRegistry implements TargetRegistry {

    // TODO: Make etcd timeout configurable via engine config
    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    private static final int MAX_CAS_ATTEMPTS = 16;

    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdTargetRegistry(Client etcdClient) {
        this(etcdClient.getKVClient());
    }

    public EtcdTargetRegistry(KV kvClient) {
        this.kvClient = kvClient;
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("EtcdTargetRegistry initialized");
    }

    // =================================================================
    // CLUSTERS
    // =================================================================

    @Override
    public Optional<Cluster> getCluster(String clusterId) {
        return getObjectByPath(pathResolver.getClusterPath(clusterId), Cluster.class);
    }

    @Override
    public List<Cluster> listClusters() {
        return getAllObjectsByPrefix(pathResolver.getClustersPrefix(), Cluster.class);
    }

    @Override
    public void saveCluster(Cluster cluster) {
        storeObjectAsJson(pathResolver.getClusterPath(cluster.getId()), cluster);
        log.debug("Stored cluster {} in etcd", cluster.getId());
    }

    @Override
    public void deleteCluster(String clusterId) {
        executeEtcdDelete(pathResolver.getClusterPath(clusterId));
        log.debug("Deleted cluster {} from etcd", clusterId);
    }

    @Override
    public Cluster updateCluster(String clusterId, UnaryOperator<Cluster> mutator) {
        return compareAndSwap(pathResolver.getClusterPath(clusterId), "Cluster", clusterId, Cluster.class, mutator);
    }

    // =================================================================
    // NODES
    // =================================================================

    @Override
    public Optional<Node> getNode(String nodeId) {
        return getObjectByPath(pathResolver.getNodePath(nodeId), Node.class);
    }

    @Override
    public List<Node> listNodes(String clusterId) {
        List<Node> result = new ArrayList<>();
        for (Node node : getAllObjectsByPrefix(pathResolver.getNodesPrefix(), Node.class)) {
            if (Objects.equals(clusterId, node.getClusterId())) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public void saveNode(Node node) {
        storeObjectAsJson(pathResolver.getNodePath(node.getId()), node);
        log.debug("Stored node {} in etcd", node.getId());
    }

    @Override
    public Node updateNode(String nodeId, UnaryOperator<Node> mutator) {
        return compareAndSwap(pathResolver.getNodePath(nodeId), "Node", nodeId, Node.class, mutator);
    }

    // =================================================================
    // POLICIES
    // =================================================================

    @Override
    public Optional<PolicyRecord> getPolicy(String policyId) {
        return getObjectByPath(pathResolver.getPolicyPath(policyId), PolicyRecord.class);
    }

    @Override
    public List<PolicyRecord> listPolicies() {
        return getAllObjectsByPrefix(pathResolver.getPoliciesPrefix(), PolicyRecord.class);
    }

    @Override
    public void savePolicy(PolicyRecord policy) {
        storeObjectAsJson(pathResolver.getPolicyPath(policy.getId()), policy);
    }

    @Override
    public void deletePolicy(String policyId) {
        executeEtcdDelete(pathResolver.getPolicyPath(policyId));
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Read-modify-write guarded by the key's mod revision; retried on concurrent modification.
     */
    private <T> T compareAndSwap(String path, String kind, String id, Class<T> clazz, UnaryOperator<T> mutator) {
        ByteSequence keyBytes = ByteSequence.from(path, UTF_8);

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            GetResponse response = executeEtcdGet(path);
            if (response.getCount() == 0) {
                throw new TargetNotFoundException(kind, id);
            }
            KeyValue current = response.getKvs().get(0);
            T updated = mutator.apply(readJson(current.getValue().toString(UTF_8), clazz));
            ByteSequence valueBytes = ByteSequence.from(writeJson(updated), UTF_8);

            TxnResponse txnResponse = await(kvClient.txn()
                    .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(current.getModRevision())))
                    .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                    .commit(), "update " + path);

            if (txnResponse.isSucceeded()) {
                log.debug("Updated {} {} using CAS (attempt {})", kind, id, attempt);
                return updated;
            }
            log.debug("Concurrent modification of {} {}, retrying (attempt {})", kind, id, attempt);
        }
        throw new StoreException("Failed to update " + kind + " " + id + " after "
                + MAX_CAS_ATTEMPTS + " attempts due to concurrent modification");
    }

    private GetResponse executeEtcdPrefixQuery(String prefix) {
        // Trailing slash so /clusters does not match /clusters-archive
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        return await(kvClient.get(prefixBytes, GetOption.newBuilder().withPrefix(prefixBytes).build()), "prefix query " + prefix);
    }

    private GetResponse executeEtcdGet(String key) {
        return await(kvClient.get(ByteSequence.from(key, UTF_8)), "get " + key);
    }

    private void executeEtcdPut(String key, String value) {
        await(kvClient.put(ByteSequence.from(key, UTF_8), ByteSequence.from(value, UTF_8)), "put " + key);
    }

    private void executeEtcdDelete(String key) {
        await(kvClient.delete(ByteSequence.from(key, UTF_8)), "delete " + key);
    }

    private <T> List<T> getAllObjectsByPrefix(String prefix, Class<T> clazz) {
        GetResponse response = executeEtcdPrefixQuery(prefix);
        List<T> items = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            items.add(readJson(kv.getValue().toString(UTF_8), clazz));
        }
        return items;
    }

    private <T> Optional<T> getObjectByPath(String path, Class<T> clazz) {
        GetResponse response = executeEtcdGet(path);
        if (response.getCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(readJson(response.getKvs().get(0).getValue().toString(UTF_8), clazz));
    }

    private void storeObjectAsJson(String path, Object object) {
        executeEtcdPut(path, writeJson(object));
    }

    private <T> T readJson(String json, Class<T> clazz) {
        try {
            return objectMapper.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + clazz.getSimpleName() + " from etcd", e);
        }
    }

    private String writeJson(Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        try {
            return future.get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted during etcd " + operation, e);
        } catch (ExecutionException e) {
            log.error("etcd {} failed: {}", operation, e.getMessage());
            throw new StoreException("etcd " + operation + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new StoreException("Timeout during etcd " + operation, e);
        }
    }
}
