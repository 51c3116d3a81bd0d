package io.clusterengine;

import io.clusterengine.config.EngineConfig;
import io.clusterengine.dispatcher.ActionDispatcher;
import io.clusterengine.driver.Driver;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.lock.ActionLockManager;
import io.clusterengine.lock.EtcdActionLockManager;
import io.clusterengine.lock.InMemoryActionLockManager;
import io.clusterengine.metrics.MetricsProvider;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.notification.NotificationSink;
import io.clusterengine.policies.BindingOptions;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.policies.PolicyEngine;
import io.clusterengine.policies.PolicyManager;
import io.clusterengine.policies.PolicyRegistry;
import io.clusterengine.store.EtcdTargetRegistry;
import io.clusterengine.store.InMemoryTargetRegistry;
import io.clusterengine.store.TargetRegistry;
import io.etcd.jetcd.Client;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static io.clusterengine.config.Constants.*;

/**
 * The engine context: owns the registry, lock table, policy machinery and dispatcher, and is
 * the entry point callers use to request work.
 *
 * Every mutating request becomes an action; the methods here return the submitted action so
 * the caller can poll it or wait on {@link #whenTerminal(String)}.
 */
@Slf4j
@Getter
public class ClusterEngine {

    private final EngineConfig config;
    private final TargetRegistry registry;
    private final ActionLockManager lockManager;
    private final PolicyRegistry policyRegistry;
    private final PolicyManager policyManager;
    private final PolicyEngine policyEngine;
    private final ActionDispatcher dispatcher;
    private final NotificationSink notifier;
    private final MetricsProvider metrics;
    private final Client etcdClient;

    public ClusterEngine(EngineConfig config,
                         TargetRegistry registry,
                         ActionLockManager lockManager,
                         PolicyRegistry policyRegistry,
                         Driver driver,
                         NotificationSink notifier,
                         MeterRegistry meterRegistry) {
        this(config, registry, lockManager, policyRegistry, driver, notifier, meterRegistry, null);
    }

    private ClusterEngine(EngineConfig config,
                          TargetRegistry registry,
                          ActionLockManager lockManager,
                          PolicyRegistry policyRegistry,
                          Driver driver,
                          NotificationSink notifier,
                          MeterRegistry meterRegistry,
                          Client etcdClient) {
        this.config = config;
        this.registry = registry;
        this.lockManager = lockManager;
        this.policyRegistry = policyRegistry;
        this.notifier = notifier;
        this.etcdClient = etcdClient;
        this.metrics = new MetricsProvider(meterRegistry, config.getEngineId());
        this.policyManager = new PolicyManager(registry, policyRegistry);
        this.policyEngine = new PolicyEngine(registry, policyManager);
        this.dispatcher = new ActionDispatcher(config, registry, lockManager, policyEngine, policyManager,
                driver, notifier, metrics);
    }

    /**
     * Builds an engine on the store backend named in the configuration.
     */
    public static ClusterEngine create(EngineConfig config, Driver driver, NotificationSink notifier,
                                       MeterRegistry meterRegistry) {
        PolicyRegistry policyRegistry = new PolicyRegistry(config.getPolicyTypeAliases());
        if (STORE_BACKEND_ETCD.equals(config.getStoreBackend())) {
            log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
            Client client = Client.builder().endpoints(config.getEtcdEndpoints()).build();
            return new ClusterEngine(config, new EtcdTargetRegistry(client), new EtcdActionLockManager(client),
                    policyRegistry, driver, notifier, meterRegistry, client);
        }
        return new ClusterEngine(config, new InMemoryTargetRegistry(), new InMemoryActionLockManager(),
                policyRegistry, driver, notifier, meterRegistry, null);
    }

    public void start() {
        policyRegistry.seal();
        dispatcher.start();
        log.info("Cluster engine {} started ({} store, policy types {})",
                config.getEngineId(), config.getStoreBackend(), policyRegistry.getRegisteredTypes());
    }

    /**
     * Drains the dispatcher, then closes the notification sink and the store connection.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down cluster engine {}", config.getEngineId());
        try {
            dispatcher.shutdown();
        } finally {
            notifier.close();
            if (etcdClient != null) {
                etcdClient.close();
            }
        }
        log.info("Cluster engine {} shut down", config.getEngineId());
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    /**
     * Registers a cluster and submits the action that creates its nodes.
     */
    public Action createCluster(String name, String profileId, int desiredCapacity, int minSize, int maxSize) {
        Cluster cluster = new Cluster(UUID.randomUUID().toString(), profileId, desiredCapacity, minSize, maxSize);
        cluster.setName(name);
        if (!cluster.isWithinBounds(desiredCapacity)) {
            throw new IllegalArgumentException("Desired capacity " + desiredCapacity + " outside ["
                    + minSize + ", " + (maxSize < 0 ? "unbounded" : maxSize) + "]");
        }
        registry.saveCluster(cluster);
        log.info("[Cluster: {}] Registered cluster {} with desired capacity {}", cluster.getId(), name, desiredCapacity);
        return submit(Action.of(ActionType.CLUSTER_CREATE, cluster.getId()));
    }

    public Action deleteCluster(String clusterId) {
        registry.requireCluster(clusterId);
        return submit(Action.of(ActionType.CLUSTER_DELETE, clusterId));
    }

    /**
     * @param count nodes to add, or null to let a scaling policy decide (default 1)
     */
    public Action scaleOut(String clusterId, Integer count) {
        return submit(Action.of(ActionType.CLUSTER_SCALE_OUT, clusterId, countInput(count)));
    }

    /**
     * @param count nodes to remove, or null to let a scaling policy decide (default 1)
     */
    public Action scaleIn(String clusterId, Integer count) {
        return submit(Action.of(ActionType.CLUSTER_SCALE_IN, clusterId, countInput(count)));
    }

    public Action addNodes(String clusterId, List<String> nodeIds) {
        return submit(Action.of(ActionType.CLUSTER_ADD_NODES, clusterId, Map.of(INPUT_NODES, List.copyOf(nodeIds))));
    }

    public Action deleteNodes(String clusterId, List<String> nodeIds) {
        return submit(Action.of(ActionType.CLUSTER_DEL_NODES, clusterId, Map.of(INPUT_NODES, List.copyOf(nodeIds))));
    }

    public Action checkCluster(String clusterId) {
        return submit(Action.of(ActionType.CLUSTER_CHECK, clusterId));
    }

    // =================================================================
    // NODE OPERATIONS
    // =================================================================

    /**
     * Registers a node, optionally as member of a cluster, and submits the action that
     * creates it.
     */
    public Action createNode(String name, String profileId, String clusterId) {
        if (clusterId != null) {
            registry.requireCluster(clusterId);
        }
        Node node = new Node(UUID.randomUUID().toString(), clusterId, profileId, OffsetDateTime.now());
        node.setName(name);
        node.setStatus(NodeStatus.INIT);
        registry.saveNode(node);
        return submit(Action.of(ActionType.NODE_CREATE, node.getId()));
    }

    public Action deleteNode(String nodeId) {
        registry.requireNode(nodeId);
        return submit(Action.of(ActionType.NODE_DELETE, nodeId));
    }

    public Action joinNode(String nodeId, String clusterId) {
        return submit(Action.of(ActionType.NODE_JOIN, nodeId, Map.of(INPUT_CLUSTER_ID, clusterId)));
    }

    public Action leaveNode(String nodeId) {
        return submit(Action.of(ActionType.NODE_LEAVE, nodeId));
    }

    public Action checkNode(String nodeId) {
        return submit(Action.of(ActionType.NODE_CHECK, nodeId));
    }

    // =================================================================
    // POLICIES
    // =================================================================

    public PolicyRecord createPolicy(String name, String type, Map<String, Object> spec) throws InvalidPolicyConfigException {
        return policyManager.createPolicy(name, type, spec);
    }

    public void deletePolicy(String policyId) throws InvalidPolicyConfigException {
        policyManager.deletePolicy(policyId);
    }

    /**
     * Submits the attach as an action so it serializes with other work on the cluster. The
     * policy and options are validated up front.
     */
    public Action attachPolicy(String clusterId, String policyId, BindingOptions options) throws InvalidPolicyConfigException {
        policyManager.loadPolicy(policyId);
        return submit(Action.of(ActionType.CLUSTER_ATTACH_POLICY, clusterId, bindingInputs(policyId, options)));
    }

    public Action detachPolicy(String clusterId, String policyId) {
        return submit(Action.of(ActionType.CLUSTER_DETACH_POLICY, clusterId, Map.of(INPUT_POLICY_ID, policyId)));
    }

    public Action updatePolicy(String clusterId, String policyId, BindingOptions options) {
        return submit(Action.of(ActionType.CLUSTER_UPDATE_POLICY, clusterId, bindingInputs(policyId, options)));
    }

    // =================================================================
    // ACTIONS
    // =================================================================

    public Action submit(Action action) {
        return dispatcher.submit(action);
    }

    public boolean cancel(String actionId) {
        return dispatcher.cancel(actionId);
    }

    public Optional<Action> getAction(String actionId) {
        return dispatcher.getAction(actionId);
    }

    public List<Action> listActions() {
        return dispatcher.listActions();
    }

    public CompletableFuture<Action> whenTerminal(String actionId) {
        return dispatcher.whenTerminal(actionId);
    }

    private static Map<String, Object> countInput(Integer count) {
        Map<String, Object> inputs = new HashMap<>();
        if (count != null) {
            inputs.put(INPUT_COUNT, count);
        }
        return inputs;
    }

    private static Map<String, Object> bindingInputs(String policyId, BindingOptions options) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put(INPUT_POLICY_ID, policyId);
        if (options != null) {
            if (options.getLevel() != null) {
                inputs.put(INPUT_LEVEL, options.getLevel().name());
            }
            if (options.getEnabled() != null) {
                inputs.put(INPUT_ENABLED, options.getEnabled());
            }
            if (options.getPriority() != null) {
                inputs.put(INPUT_PRIORITY, options.getPriority());
            }
            if (options.getCooldownSeconds() != null) {
                inputs.put(INPUT_COOLDOWN, options.getCooldownSeconds());
            }
        }
        return inputs;
    }
}
