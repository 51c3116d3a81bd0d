package io.clusterengine;

import io.clusterengine.config.EngineConfig;
import io.clusterengine.dispatcher.ActionAbortedException;
import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.driver.DriverException;
import io.clusterengine.driver.DriverOutcome;
import io.clusterengine.driver.SimulatedDriver;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.enums.EnforcementLevel;
import io.clusterengine.enums.ErrorType;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.lock.InMemoryActionLockManager;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.models.PolicyResult;
import io.clusterengine.notification.LoggingNotificationSink;
import io.clusterengine.policies.BindingOptions;
import io.clusterengine.policies.PolicyRegistry;
import io.clusterengine.store.InMemoryTargetRegistry;
import io.clusterengine.store.TargetNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.clusterengine.config.Constants.*;
import static org.assertj.core.api.Assertions.*;

class ClusterEngineTest {

    private static final long WAIT_SECONDS = 10;

    private CountingDriver driver;
    private ClusterEngine engine;

    @BeforeEach
    void setUp() {
        EngineConfig.Engine engineSettings = new EngineConfig.Engine();
        engineSettings.setId("engine-test");
        engineSettings.setWorkers(4);
        EngineConfig.Dispatcher dispatcherSettings = new EngineConfig.Dispatcher();
        dispatcherSettings.setLock_max_retries(500);
        dispatcherSettings.setLock_retry_base_millis(5L);
        dispatcherSettings.setLock_retry_max_millis(20L);
        dispatcherSettings.setDrain_timeout_seconds(2L);
        EngineConfig.ConfigModel model = new EngineConfig.ConfigModel();
        model.setEngine(engineSettings);
        model.setDispatcher(dispatcherSettings);

        driver = new CountingDriver();
        engine = new ClusterEngine(new EngineConfig(model), new InMemoryTargetRegistry(), new InMemoryActionLockManager(),
                new PolicyRegistry(), driver, new LoggingNotificationSink(), new SimpleMeterRegistry());
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void testCreateCluster_BuildsActiveNodes() throws Exception {
        // When
        String clusterId = createCluster(4, 0, -1);

        // Then
        Cluster cluster = engine.getRegistry().requireCluster(clusterId);
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.ACTIVE);
        assertThat(cluster.getNodeIds()).hasSize(4);
        assertThat(engine.getRegistry().listNodes(clusterId))
                .extracting(Node::getStatus).containsOnly(NodeStatus.ACTIVE);
        assertThat(engine.getRegistry().listNodes(clusterId))
                .extracting(Node::getIndex).containsExactlyInAnyOrder(1, 2, 3, 4);
    }

    @Test
    void testCreateCluster_OutOfBoundsRejected() {
        assertThatThrownBy(() -> engine.createCluster("bad", "profile-1", 5, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(engine.getRegistry().listClusters()).isEmpty();
    }

    @Test
    void testScaleIn_WithDeletionPolicyRemovesOneNode() throws Exception {
        // Given
        String clusterId = createCluster(4, 0, -1);
        attachDeletionPolicy(clusterId);

        // When
        Action action = awaitDone(engine.scaleIn(clusterId, 1));

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        List<Node> deleted = nodesWithStatus(NodeStatus.DELETED);
        assertThat(deleted).hasSize(1);
        assertThat(deleted.get(0).getClusterId()).isNull();
        Cluster cluster = engine.getRegistry().requireCluster(clusterId);
        assertThat(cluster.getDesiredCapacity()).isEqualTo(3);
        assertThat(cluster.getNodeIds()).hasSize(3).doesNotContain(deleted.get(0).getId());
        assertThat(action.getPolicyResults()).extracting(PolicyResult::getPolicyType).contains(POLICY_TYPE_DELETION);
    }

    @Test
    void testScaleIn_PolicyReducesCapacityForNodesRemovedBeforeFailure() throws Exception {
        // Given
        String clusterId = createCluster(4, 0, -1);
        attachDeletionPolicy(clusterId);
        driver.failDeleteNumber = 2;

        // When
        Action action = awaitDone(engine.scaleIn(clusterId, 2));

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat((List<?>) action.getOutput(OUTPUT_NODES_REMOVED)).hasSize(2);
        Cluster cluster = engine.getRegistry().requireCluster(clusterId);
        assertThat(cluster.getNodeIds()).hasSize(2);
        assertThat(cluster.getDesiredCapacity()).isEqualTo(2);
    }

    @Test
    void testScaleIn_ScalingPolicyCountReachesDeletionPolicy() throws Exception {
        // Given
        String clusterId = createCluster(4, 0, -1);
        attachDeletionPolicy(clusterId);
        PolicyRecord scaling = engine.createPolicy("scale-in", POLICY_TYPE_SCALING,
                Map.of("event", "CLUSTER_SCALE_IN", "adjustment", Map.of("type", "CHANGE_IN_CAPACITY", "number", 2)));
        awaitDone(engine.attachPolicy(clusterId, scaling.getId(), null));

        // When
        Action action = awaitDone(engine.scaleIn(clusterId, null));

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(action.getIntInput(INPUT_COUNT, 0)).isEqualTo(2);
        assertThat(action.getStringListInput(INPUT_CANDIDATES)).hasSize(2);
        assertThat(nodesWithStatus(NodeStatus.DELETED)).hasSize(2);
        Cluster cluster = engine.getRegistry().requireCluster(clusterId);
        assertThat(cluster.getNodeIds()).hasSize(2);
        assertThat(cluster.getDesiredCapacity()).isEqualTo(2);
    }

    @Test
    void testScaleIn_ConcurrentRequestsSerialize() throws Exception {
        // Given
        String clusterId = createCluster(5, 0, -1);
        attachDeletionPolicy(clusterId);

        // When
        List<Action> actions = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            actions.add(engine.scaleIn(clusterId, 1));
        }
        for (Action action : actions) {
            awaitDone(action);
        }

        // Then
        assertThat(actions).extracting(Action::getStatus).containsOnly(ActionStatus.SUCCEEDED);
        assertThat(nodesWithStatus(NodeStatus.DELETED)).hasSize(3);
        assertThat(driver.deletesPerNode.values()).containsOnly(1);
        Cluster cluster = engine.getRegistry().requireCluster(clusterId);
        assertThat(cluster.getDesiredCapacity()).isEqualTo(2);
        assertThat(cluster.getNodeIds()).hasSize(2);
        assertThat(engine.getLockManager().isLocked(clusterId)).isEmpty();
    }

    @Test
    void testScaleOut_CriticalPolicyPreventsBody() throws Exception {
        // Given
        String clusterId = createCluster(2, 0, 2);
        int createsBefore = driver.creates.get();
        PolicyRecord scaling = engine.createPolicy("scale-out", POLICY_TYPE_SCALING,
                Map.of("event", "CLUSTER_SCALE_OUT"));
        awaitDone(engine.attachPolicy(clusterId, scaling.getId(), null));

        // When
        Action action = awaitDone(engine.scaleOut(clusterId, null));

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(action.getError().getType()).isEqualTo(ErrorType.POLICY_REJECTED);
        assertThat(action.getError().getPolicyId()).isEqualTo(scaling.getId());
        assertThat(driver.creates.get()).isEqualTo(createsBefore);
        assertThat(engine.getRegistry().requireCluster(clusterId).getDesiredCapacity()).isEqualTo(2);
    }

    @Test
    void testScaleOut_ScalingPolicyDecidesCount() throws Exception {
        // Given
        String clusterId = createCluster(2, 0, -1);
        PolicyRecord scaling = engine.createPolicy("scale-out", POLICY_TYPE_SCALING,
                Map.of("event", "CLUSTER_SCALE_OUT", "adjustment", Map.of("type", "CHANGE_IN_CAPACITY", "number", 3)));
        awaitDone(engine.attachPolicy(clusterId, scaling.getId(), null));

        // When
        Action action = awaitDone(engine.scaleOut(clusterId, null));

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(action.getIntInput(INPUT_COUNT, 0)).isEqualTo(3);
        assertThat(engine.getRegistry().requireCluster(clusterId).getDesiredCapacity()).isEqualTo(5);
    }

    @Test
    void testAttachPolicy_OptionsApplied() throws Exception {
        // Given
        String clusterId = createCluster(1, 0, -1);
        PolicyRecord policy = engine.createPolicy("health", POLICY_TYPE_HEALTH, Map.of());
        BindingOptions options = BindingOptions.builder().level(EnforcementLevel.WARNING).priority(10).build();

        // When
        Action attach = awaitDone(engine.attachPolicy(clusterId, policy.getId(), options));

        // Then
        assertThat(attach.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        PolicyBinding binding = engine.getPolicyManager().getBinding(clusterId, policy.getId()).get();
        assertThat(binding.getLevel()).isEqualTo(EnforcementLevel.WARNING);
        assertThat(binding.getPriority()).isEqualTo(10);
        assertThat(binding.isEnabled()).isTrue();

        // When
        awaitDone(engine.detachPolicy(clusterId, policy.getId()));
        engine.deletePolicy(policy.getId());

        // Then
        assertThat(engine.getPolicyManager().getBinding(clusterId, policy.getId())).isEmpty();
        assertThat(engine.getRegistry().getPolicy(policy.getId())).isEmpty();
    }

    @Test
    void testAttachPolicy_UnknownPolicyRejectedUpFront() {
        assertThatThrownBy(() -> engine.attachPolicy("c1", "no-such-policy", null))
                .isInstanceOf(TargetNotFoundException.class);
    }

    @Test
    void testDeleteCluster_MarksEverythingDeleted() throws Exception {
        // Given
        String clusterId = createCluster(3, 0, -1);

        // When
        Action action = awaitDone(engine.deleteCluster(clusterId));

        // Then
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(engine.getRegistry().requireCluster(clusterId).getStatus()).isEqualTo(ClusterStatus.DELETED);
        assertThat(nodesWithStatus(NodeStatus.DELETED)).hasSize(3);
    }

    @Test
    void testNodeLifecycle_CreateJoinLeaveDelete() throws Exception {
        // Given
        String clusterId = createCluster(1, 0, -1);
        Action create = awaitDone(engine.createNode("standalone", "profile-1", null));
        String nodeId = create.getTargetId();
        assertThat(engine.getRegistry().requireNode(nodeId).getStatus()).isEqualTo(NodeStatus.ACTIVE);

        // When
        awaitDone(engine.joinNode(nodeId, clusterId));

        // Then
        assertThat(engine.getRegistry().requireCluster(clusterId).getNodeIds()).contains(nodeId);

        // When
        awaitDone(engine.leaveNode(nodeId));
        Action delete = awaitDone(engine.deleteNode(nodeId));

        // Then
        assertThat(delete.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(engine.getRegistry().requireNode(nodeId).getStatus()).isEqualTo(NodeStatus.DELETED);
        assertThat(engine.getRegistry().requireCluster(clusterId).getNodeIds()).doesNotContain(nodeId);
    }

    @Test
    void testCheckCluster_AllHealthy() throws Exception {
        String clusterId = createCluster(2, 0, -1);

        Action check = awaitDone(engine.checkCluster(clusterId));

        assertThat(check.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat((List<?>) check.getOutput(OUTPUT_HEALTHY_NODES)).hasSize(2);
        assertThat(engine.getAction(check.getId())).isPresent();
        assertThat(engine.listActions()).extracting(Action::getType).contains(ActionType.CLUSTER_CHECK);
    }

    @Test
    void testShutdown_RejectsNewActions() throws Exception {
        String clusterId = createCluster(1, 0, -1);

        engine.shutdown();

        assertThatThrownBy(() -> engine.checkCluster(clusterId))
                .isInstanceOf(RejectedExecutionException.class);
    }

    private String createCluster(int desired, int min, int max) throws Exception {
        Action action = awaitDone(engine.createCluster("test-cluster", "profile-1", desired, min, max));
        assertThat(action.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        return action.getTargetId();
    }

    private void attachDeletionPolicy(String clusterId) throws Exception {
        PolicyRecord deletion = engine.createPolicy("deletion", POLICY_TYPE_DELETION, Map.of(
                "criteria", "RANDOM",
                "destroy_after_deletion", true,
                "grace_period", 0,
                "reduce_desired_capacity", true));
        Action attach = awaitDone(engine.attachPolicy(clusterId, deletion.getId(), null));
        assertThat(attach.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
    }

    private Action awaitDone(Action action) throws Exception {
        return engine.whenTerminal(action.getId()).get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private List<Node> nodesWithStatus(NodeStatus status) {
        List<Node> result = new ArrayList<>();
        for (Node node : engine.getRegistry().listNodes(null)) {
            if (node.getStatus() == status) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Simulated driver that also counts creates and destroys per node.
     */
    private static class CountingDriver extends SimulatedDriver {

        final AtomicInteger creates = new AtomicInteger();
        final AtomicInteger deletes = new AtomicInteger();
        final ConcurrentMap<String, Integer> deletesPerNode = new ConcurrentHashMap<>();
        // 1-based position of the NODE_DELETE to fail, 0 for none
        volatile int failDeleteNumber;

        CountingDriver() {
            super(5L);
        }

        @Override
        public DriverOutcome execute(Action action, CancellationToken token) throws DriverException, ActionAbortedException {
            if (action.getType() == ActionType.NODE_DELETE && deletes.incrementAndGet() == failDeleteNumber) {
                return DriverOutcome.failed("simulated delete failure");
            }
            DriverOutcome outcome = super.execute(action, token);
            if (action.getType() == ActionType.NODE_CREATE) {
                creates.incrementAndGet();
            } else if (action.getType() == ActionType.NODE_DELETE) {
                deletesPerNode.merge(action.getTargetId(), 1, Integer::sum);
            }
            return outcome;
        }
    }
}
