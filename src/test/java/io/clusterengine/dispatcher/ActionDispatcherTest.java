package io.clusterengine.dispatcher;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionHandlerFactory;
import io.clusterengine.actions.ClusterActionHandler;
import io.clusterengine.actions.NodeActionHandler;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.Driver;
import io.clusterengine.driver.DriverException;
import io.clusterengine.driver.DriverOutcome;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.ErrorType;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.lock.InMemoryActionLockManager;
import io.clusterengine.metrics.MetricsProvider;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.notification.ActionEvent;
import io.clusterengine.notification.NotificationSink;
import io.clusterengine.policies.PolicyEngine;
import io.clusterengine.policies.PolicyManager;
import io.clusterengine.policies.PolicyRegistry;
import io.clusterengine.store.InMemoryTargetRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static io.clusterengine.config.Constants.*;
import static org.assertj.core.api.Assertions.*;

class ActionDispatcherTest {

    private static final long WAIT_SECONDS = 10;

    private InMemoryTargetRegistry registry;
    private InMemoryActionLockManager lockManager;
    private PolicyManager policyManager;
    private PolicyEngine policyEngine;
    private RecordingDriver driver;
    private List<ActionEvent> events;
    private ActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new InMemoryTargetRegistry();
        lockManager = new InMemoryActionLockManager();
        policyManager = new PolicyManager(registry, new PolicyRegistry());
        policyEngine = new PolicyEngine(registry, policyManager);
        driver = new RecordingDriver();
        events = new CopyOnWriteArrayList<>();

        registry.saveCluster(new Cluster("c1", "profile-1", 2, 0, -1));
        memberNode("n1", NodeStatus.ACTIVE);
        memberNode("n2", NodeStatus.ACTIVE);
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    @Test
    void testSubmit_RunsToSuccess() throws Exception {
        // Given
        startDispatcher(3);

        // When
        Action action = dispatcher.submit(Action.of(ActionType.CLUSTER_SCALE_OUT, "c1", Map.of(INPUT_COUNT, 1)));
        Action done = await(action);

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(done.getError()).isNull();
        assertThat(done.getOwner()).startsWith("test-engine-worker-");
        assertThat(done.getStartedAt()).isNotNull();
        assertThat(done.getEndedAt()).isNotNull();
        assertThat(registry.requireCluster("c1").getDesiredCapacity()).isEqualTo(3);
        assertThat(lockManager.size()).isZero();
        assertThat(dispatcher.getInFlightCount()).isZero();
        assertThat(events).extracting(ActionEvent::getStatus)
                .containsExactly(ActionStatus.WAITING, ActionStatus.RUNNING, ActionStatus.SUCCEEDED);
    }

    @Test
    void testSubmit_BeforeStartRejected() {
        // Given
        dispatcher = newDispatcher(3, new ActionHandlerFactory());

        // Then
        assertThatThrownBy(() -> dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1")))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void testSubmit_AfterShutdownRejected() {
        // Given
        startDispatcher(3);
        dispatcher.shutdown();

        // Then
        assertThat(dispatcher.isRunning()).isFalse();
        assertThatThrownBy(() -> dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1")))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void testSubmit_DuplicateRejected() {
        // Given
        startDispatcher(3);
        Action action = dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1"));

        // Then
        assertThatThrownBy(() -> dispatcher.submit(action))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already submitted");
    }

    @Test
    void testLockBusy_FailsAfterRetries() throws Exception {
        // Given
        startDispatcher(3);
        lockManager.acquire("c1", "foreign-action", "foreign-worker");

        // When
        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1")));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.LOCK_BUSY);
        assertThat(done.getAttempts()).isEqualTo(4);
        assertThat(done.getStartedAt()).isNull();
        assertThat(driver.actionIds).isEmpty();
        assertThat(lockManager.isLocked("c1").get().getActionId()).isEqualTo("foreign-action");
    }

    @Test
    void testSameTarget_RunsInSubmissionOrder() throws Exception {
        // Given
        startDispatcher(500);
        driver.gate = new CountDownLatch(1);
        Action first = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));
        assertThat(driver.started.await(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();
        Action second = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));
        Action third = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));
        Thread.sleep(50);

        // Then
        assertThat(second.getStatus()).isEqualTo(ActionStatus.WAITING);
        assertThat(third.getStatus()).isEqualTo(ActionStatus.WAITING);

        // When
        driver.gate.countDown();
        await(third);

        // Then
        assertThat(driver.actionIds).containsExactly(first.getId(), second.getId(), third.getId());
        assertThat(List.of(first, second, third)).extracting(Action::getStatus).containsOnly(ActionStatus.SUCCEEDED);
    }

    @Test
    void testDifferentTargets_RunConcurrently() throws Exception {
        // Given
        startDispatcher(3);
        driver.gate = new CountDownLatch(1);
        driver.started = new CountDownLatch(2);

        // When
        Action a = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));
        Action b = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n2"));

        // Then
        assertThat(driver.started.await(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(a.getStatus()).isEqualTo(ActionStatus.RUNNING);
        assertThat(b.getStatus()).isEqualTo(ActionStatus.RUNNING);
        driver.gate.countDown();
        assertThat(await(a).getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(await(b).getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
    }

    @Test
    void testCancel_WaitingActionNeverRuns() throws Exception {
        // Given
        startDispatcher(500);
        driver.gate = new CountDownLatch(1);
        Action first = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));
        assertThat(driver.started.await(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();
        Action second = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));

        // When
        assertThat(dispatcher.cancel(second.getId())).isTrue();

        // Then
        assertThat(dispatcher.whenTerminal(second.getId()).isDone()).isTrue();
        assertThat(second.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(second.getError().getType()).isEqualTo(ErrorType.CANCELLED);

        driver.gate.countDown();
        assertThat(await(first).getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(driver.actionIds).containsExactly(first.getId());
    }

    @Test
    void testCancel_RunningActionStopsAtCheckpoint() throws Exception {
        // Given
        startDispatcher(3);
        driver.holdUntilAborted = true;
        Action action = dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1"));
        assertThat(driver.started.await(WAIT_SECONDS, TimeUnit.SECONDS)).isTrue();

        // When
        dispatcher.cancel(action.getId());
        Action done = await(action);

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(lockManager.isLocked("n1")).isEmpty();
    }

    @Test
    void testCancel_UnknownAction() {
        startDispatcher(3);

        assertThat(dispatcher.cancel("no-such-action")).isFalse();
    }

    @Test
    void testTimeout_FailsWithTimeoutError() throws Exception {
        // Given
        startDispatcher(3);
        driver.holdUntilAborted = true;
        Action action = new Action(UUID.randomUUID().toString(), ActionType.NODE_CHECK, "n1", null, null, 1L);

        // When
        Action done = await(dispatcher.submit(action));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(lockManager.isLocked("n1")).isEmpty();
    }

    @Test
    void testGracePeriod_DestroysAfterDelay() throws Exception {
        // Given
        startDispatcher(3);
        Action parent = dispatcher.submit(Action.of(ActionType.CLUSTER_DEL_NODES, "c1",
                Map.of(INPUT_NODES, List.of("n1"), INPUT_GRACE_PERIOD, 1)));

        // When
        assertThat(await(parent).getStatus()).isEqualTo(ActionStatus.SUCCEEDED);

        // Then
        assertThat(registry.requireNode("n1").getClusterId()).isNull();
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.ACTIVE);
        assertThat(registry.requireCluster("c1").getDesiredCapacity()).isEqualTo(1);

        String childId = deferredChildId(parent);
        Action child = dispatcher.whenTerminal(childId).get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertThat(child.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(child.getParentId()).isEqualTo(parent.getId());
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.DELETED);
        assertThat(driver.calls).contains("NODE_DELETE:n1");
    }

    @Test
    void testGracePeriodZero_DestroysWithinAction() throws Exception {
        // Given
        startDispatcher(3);

        // When
        Action parent = await(dispatcher.submit(Action.of(ActionType.CLUSTER_DEL_NODES, "c1",
                Map.of(INPUT_NODES, List.of("n1"), INPUT_GRACE_PERIOD, 0))));

        // Then
        assertThat(parent.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(parent.getOutput(OUTPUT_DEFERRED_DESTROYS)).isNull();
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.DELETED);
    }

    @Test
    void testCancelParent_PreventsDeferredDestroy() throws Exception {
        // Given
        startDispatcher(3);
        Action parent = await(dispatcher.submit(Action.of(ActionType.CLUSTER_DEL_NODES, "c1",
                Map.of(INPUT_NODES, List.of("n2"), INPUT_GRACE_PERIOD, 60))));
        String childId = deferredChildId(parent);

        // When
        assertThat(dispatcher.cancel(parent.getId())).isTrue();

        // Then
        Action child = dispatcher.whenTerminal(childId).get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertThat(child.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(parent.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat(registry.requireNode("n2").getStatus()).isEqualTo(NodeStatus.ACTIVE);
        assertThat(registry.requireNode("n2").getClusterId()).isNull();
        assertThat(driver.calls).doesNotContain("NODE_DELETE:n2");
    }

    @Test
    void testShutdown_CancelsPendingDeferredDestroy() throws Exception {
        // Given
        startDispatcher(3);
        Action parent = await(dispatcher.submit(Action.of(ActionType.CLUSTER_DEL_NODES, "c1",
                Map.of(INPUT_NODES, List.of("n2"), INPUT_GRACE_PERIOD, 60))));
        String childId = deferredChildId(parent);

        // When
        dispatcher.shutdown();

        // Then
        Action child = dispatcher.getAction(childId).get();
        assertThat(child.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(child.getError().getType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(dispatcher.whenTerminal(childId).isDone()).isTrue();
        assertThat(dispatcher.getInFlightCount()).isZero();
        assertThat(registry.requireNode("n2").getStatus()).isEqualTo(NodeStatus.ACTIVE);
        assertThat(driver.calls).doesNotContain("NODE_DELETE:n2");
    }

    @Test
    void testPolicyRejection_BodyNeverRuns() throws Exception {
        // Given
        startDispatcher(3);
        PolicyRecord policy = policyManager.createPolicy("deletion", POLICY_TYPE_DELETION, Map.of());
        policyManager.attach("c1", policy.getId(), null);

        // When
        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_SCALE_IN, "c1", Map.of(INPUT_COUNT, -1))));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.POLICY_REJECTED);
        assertThat(done.getError().getPolicyId()).isEqualTo(policy.getId());
        assertThat(registry.requireCluster("c1").getNodeIds()).containsExactly("n1", "n2");
        assertThat(driver.actionIds).isEmpty();
    }

    @Test
    void testPolicyWarnings_RecordedOnSuccess() throws Exception {
        // Given
        startDispatcher(3);
        registry.updateNodeStatus("n2", NodeStatus.ERROR);
        PolicyRecord policy = policyManager.createPolicy("deletion", POLICY_TYPE_DELETION,
                Map.of("reduce_desired_capacity", true));
        policyManager.attach("c1", policy.getId(), null);

        // When
        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_SCALE_IN, "c1", Map.of(INPUT_COUNT, 2))));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.SUCCEEDED);
        assertThat((List<?>) done.getOutput(OUTPUT_POLICY_WARNINGS)).hasSize(1);
        assertThat(done.getOutput(OUTPUT_POLICY_WARNINGS).toString()).contains("only 1 eligible");
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.DELETED);
        assertThat(registry.requireCluster("c1").getDesiredCapacity()).isEqualTo(1);
    }

    @Test
    void testInconsistentLockRelease_FailsAction() throws Exception {
        // Given
        ClusterActionHandler stealing = new ClusterActionHandler() {
            @Override
            public void execute(Action action, ActionContext context, String workerId, CancellationToken token) {
                context.getLockManager().steal(action.getTargetId());
            }
        };
        dispatcher = newDispatcher(3, new ActionHandlerFactory(stealing, new NodeActionHandler()));
        dispatcher.start();

        // When
        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1")));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.INCONSISTENT_LOCK_RELEASE);
        assertThat(lockManager.size()).isZero();
    }

    @Test
    void testHandlerFailure_ReleasesLock() throws Exception {
        // Given
        startDispatcher(3);
        driver.failWith = "cloud api down";

        // When
        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_SCALE_OUT, "c1", Map.of(INPUT_COUNT, 1))));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.DRIVER_ERROR);
        assertThat(done.getStatusReason()).contains("cloud api down");
        assertThat(lockManager.size()).isZero();
    }

    @Test
    void testDriverAbort_EndsCancelled() throws Exception {
        // Given
        startDispatcher(3);
        driver.abortWith = new ActionAbortedException("operation stopped by the driver") {
        };

        // When
        Action done = await(dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1")));

        // Then
        assertThat(done.getStatus()).isEqualTo(ActionStatus.CANCELLED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(done.getStatusReason()).contains("operation stopped by the driver");
        assertThat(lockManager.size()).isZero();
    }

    @Test
    void testMissingTarget_FailsNotFound() throws Exception {
        startDispatcher(3);

        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "missing")));

        assertThat(done.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(done.getError().getType()).isEqualTo(ErrorType.TARGET_NOT_FOUND);
    }

    @Test
    void testPurge_ForgetsOldTerminalActions() throws Exception {
        // Given
        startDispatcher(3);
        Action done = await(dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1")));

        // When
        int untouched = dispatcher.purge(OffsetDateTime.now().minusMinutes(1));
        int removed = dispatcher.purge(OffsetDateTime.now().plusMinutes(1));

        // Then
        assertThat(untouched).isZero();
        assertThat(removed).isEqualTo(1);
        assertThat(dispatcher.getAction(done.getId())).isEmpty();
        assertThat(dispatcher.listActions()).isEmpty();
    }

    @Test
    void testPurge_KeepsParentWithPendingTimer() throws Exception {
        // Given
        startDispatcher(3);
        Action parent = await(dispatcher.submit(Action.of(ActionType.CLUSTER_DEL_NODES, "c1",
                Map.of(INPUT_NODES, List.of("n1"), INPUT_GRACE_PERIOD, 60))));

        // When
        dispatcher.purge(OffsetDateTime.now().plusMinutes(1));

        // Then
        assertThat(dispatcher.getAction(parent.getId())).isPresent();
        assertThat(dispatcher.cancel(parent.getId())).isTrue();
    }

    @Test
    void testBackoffMillis_DoublesUpToCap() {
        dispatcher = newDispatcher(3, new ActionHandlerFactory());

        assertThat(dispatcher.backoffMillis(1)).isEqualTo(5);
        assertThat(dispatcher.backoffMillis(2)).isEqualTo(10);
        assertThat(dispatcher.backoffMillis(3)).isEqualTo(20);
        assertThat(dispatcher.backoffMillis(4)).isEqualTo(20);
        assertThat(dispatcher.backoffMillis(200)).isEqualTo(20);
    }

    @Test
    void testListActions_FilterByTarget() throws Exception {
        startDispatcher(3);
        await(dispatcher.submit(Action.of(ActionType.CLUSTER_CHECK, "c1")));
        await(dispatcher.submit(Action.of(ActionType.NODE_CHECK, "n1")));

        assertThat(dispatcher.listActions()).hasSize(2);
        assertThat(dispatcher.listActions("n1")).extracting(Action::getType).containsExactly(ActionType.NODE_CHECK);
    }

    private void startDispatcher(int lockMaxRetries) {
        dispatcher = newDispatcher(lockMaxRetries, new ActionHandlerFactory());
        dispatcher.start();
    }

    private ActionDispatcher newDispatcher(int lockMaxRetries, ActionHandlerFactory handlers) {
        EngineConfig.Engine engine = new EngineConfig.Engine();
        engine.setId("test-engine");
        engine.setWorkers(2);
        EngineConfig.Dispatcher settings = new EngineConfig.Dispatcher();
        settings.setLock_max_retries(lockMaxRetries);
        settings.setLock_retry_base_millis(5L);
        settings.setLock_retry_max_millis(20L);
        settings.setDrain_timeout_seconds(2L);
        settings.setAction_retention_minutes(60L);
        settings.setPurge_interval_seconds(3600L);
        EngineConfig.ConfigModel model = new EngineConfig.ConfigModel();
        model.setEngine(engine);
        model.setDispatcher(settings);

        NotificationSink sink = events::add;
        return new ActionDispatcher(new EngineConfig(model), registry, lockManager, policyEngine, policyManager,
                driver, sink, new MetricsProvider(new SimpleMeterRegistry(), "test-engine"), handlers);
    }

    private Action await(Action action) throws Exception {
        return dispatcher.whenTerminal(action.getId()).get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private static String deferredChildId(Action parent) {
        List<?> children = (List<?>) parent.getOutput(OUTPUT_DEFERRED_DESTROYS);
        assertThat(children).hasSize(1);
        return (String) children.get(0);
    }

    private void memberNode(String nodeId, NodeStatus status) {
        Node node = new Node(nodeId, null, "profile-1", OffsetDateTime.now());
        node.setStatus(status);
        registry.saveNode(node);
        registry.addNodeToCluster("c1", nodeId);
    }

    /**
     * Records every driver call. Calls can be held on a gate, or until the action is
     * cancelled or times out.
     */
    private static class RecordingDriver implements Driver {

        final List<String> calls = new CopyOnWriteArrayList<>();
        final List<String> actionIds = new CopyOnWriteArrayList<>();
        volatile CountDownLatch started = new CountDownLatch(1);
        volatile CountDownLatch gate;
        volatile boolean holdUntilAborted;
        volatile String failWith;
        volatile ActionAbortedException abortWith;

        @Override
        public DriverOutcome execute(Action action, CancellationToken token) throws DriverException, ActionAbortedException {
            calls.add(action.getType() + ":" + action.getTargetId());
            actionIds.add(action.getId());
            started.countDown();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
            while (isHeld() && System.nanoTime() - deadline < 0) {
                token.checkpoint();
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DriverException("interrupted", e);
                }
            }
            if (abortWith != null) {
                throw abortWith;
            }
            if (failWith != null) {
                return DriverOutcome.failed(failWith);
            }
            return action.getType() == ActionType.NODE_CHECK ? DriverOutcome.ok(Map.of("healthy", true)) : DriverOutcome.ok();
        }

        private boolean isHeld() {
            CountDownLatch current = gate;
            return holdUntilAborted || (current != null && current.getCount() > 0);
        }
    }
}
