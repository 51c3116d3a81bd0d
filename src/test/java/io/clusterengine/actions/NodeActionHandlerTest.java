package io.clusterengine.actions;

import io.clusterengine.dispatcher.CancellationToken;
import io.clusterengine.dispatcher.DeferredActionScheduler;
import io.clusterengine.driver.Driver;
import io.clusterengine.driver.DriverException;
import io.clusterengine.driver.DriverOutcome;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.lock.InMemoryActionLockManager;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.policies.PolicyManager;
import io.clusterengine.policies.PolicyRegistry;
import io.clusterengine.store.InMemoryTargetRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static io.clusterengine.config.Constants.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NodeActionHandlerTest {

    private static final String WORKER = "test-worker-0";

    @Mock
    private Driver driver;

    @Mock
    private DeferredActionScheduler scheduler;

    private InMemoryTargetRegistry registry;
    private ActionContext context;
    private NodeActionHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        registry = new InMemoryTargetRegistry();
        PolicyManager policyManager = new PolicyManager(registry, new PolicyRegistry());
        context = new ActionContext(registry, new InMemoryActionLockManager(), driver, policyManager, scheduler, 2, 1L);
        handler = new NodeActionHandler();
        lenient().when(driver.execute(any(Action.class), any(CancellationToken.class))).thenReturn(DriverOutcome.ok());

        registry.saveCluster(new Cluster("c1", "profile-1", 1, 0, -1));
    }

    @Test
    void testCreate_ActivatesAndJoinsCluster() throws Exception {
        // Given
        registry.saveNode(new Node("n1", "c1", "profile-1", OffsetDateTime.now()));
        Action action = Action.of(ActionType.NODE_CREATE, "n1");

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.ACTIVE);
        assertThat(registry.requireCluster("c1").getNodeIds()).containsExactly("n1");
        verify(driver).execute(same(action), any());
    }

    @Test
    void testCreate_RequiresInitStatus() {
        // Given
        activeNode("n1", null);
        Action action = Action.of(ActionType.NODE_CREATE, "n1");

        // Then
        assertThatThrownBy(() -> handler.execute(action, context, WORKER, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected INIT");
        verifyNoInteractions(driver);
    }

    @Test
    void testCreate_DriverFailureMarksError() throws Exception {
        // Given
        registry.saveNode(new Node("n1", null, "profile-1", OffsetDateTime.now()));
        when(driver.execute(any(Action.class), any(CancellationToken.class))).thenReturn(DriverOutcome.failed("no capacity"));

        // Then
        assertThatThrownBy(() -> handler.execute(Action.of(ActionType.NODE_CREATE, "n1"), context, WORKER, CancellationToken.none()))
                .isInstanceOf(DriverException.class);
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.ERROR);
    }

    @Test
    void testDelete_LeavesClusterAndDestroys() throws Exception {
        // Given
        activeNode("n1", "c1");
        Action action = Action.of(ActionType.NODE_DELETE, "n1");

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        Node node = registry.requireNode("n1");
        assertThat(node.getStatus()).isEqualTo(NodeStatus.DELETED);
        assertThat(node.getClusterId()).isNull();
        assertThat(registry.requireCluster("c1").getNodeIds()).isEmpty();
        assertThat((List<String>) action.getOutput(OUTPUT_NODES_REMOVED)).containsExactly("n1");
    }

    @Test
    void testDelete_WithGracePeriodSchedulesDestroy() throws Exception {
        // Given
        activeNode("n1", "c1");
        Action action = Action.of(ActionType.NODE_DELETE, "n1", Map.of(INPUT_GRACE_PERIOD, 30));

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        verify(scheduler).scheduleDeferred(same(action), argThat(child -> child.getTargetId().equals("n1")), eq(Duration.ofSeconds(30)));
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.ACTIVE);
        verifyNoInteractions(driver);
    }

    @Test
    void testDeferredDelete_OnlyDestroys() throws Exception {
        // Given
        activeNode("n1", null);
        Action action = Action.of(ActionType.NODE_DELETE, "n1", Map.of(INPUT_DEFERRED, true));

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.DELETED);
        assertThat(action.getOutput(OUTPUT_NODES_REMOVED)).isNull();
        verify(driver).execute(same(action), any());
    }

    @Test
    void testDeferredDelete_AlreadyDeletedIsNoOp() throws Exception {
        // Given
        activeNode("n1", null);
        registry.updateNodeStatus("n1", NodeStatus.DELETED);

        // When
        handler.execute(Action.of(ActionType.NODE_DELETE, "n1", Map.of(INPUT_DEFERRED, true)), context, WORKER, CancellationToken.none());

        // Then
        verifyNoInteractions(driver);
    }

    @Test
    void testJoin_RequiresClusterId() {
        // Given
        activeNode("n1", null);

        // Then
        assertThatThrownBy(() -> handler.execute(Action.of(ActionType.NODE_JOIN, "n1"), context, WORKER, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(INPUT_CLUSTER_ID);
    }

    @Test
    void testJoin_AddsMembership() throws Exception {
        // Given
        activeNode("n1", null);
        Action action = Action.of(ActionType.NODE_JOIN, "n1", Map.of(INPUT_CLUSTER_ID, "c1"));

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        assertThat(registry.requireNode("n1").getClusterId()).isEqualTo("c1");
        assertThat(registry.requireCluster("c1").getNodeIds()).containsExactly("n1");
    }

    @Test
    void testJoin_NodeOwnedElsewhereRejected() {
        // Given
        registry.saveCluster(new Cluster("c2", "profile-1", 1, 0, -1));
        activeNode("n1", "c2");

        // Then
        assertThatThrownBy(() -> handler.execute(Action.of(ActionType.NODE_JOIN, "n1", Map.of(INPUT_CLUSTER_ID, "c1")),
                context, WORKER, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("owned by cluster c2");
    }

    @Test
    void testLeave_OrphansNode() throws Exception {
        // Given
        activeNode("n1", "c1");
        Action action = Action.of(ActionType.NODE_LEAVE, "n1");

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        assertThat(registry.requireNode("n1").getClusterId()).isNull();
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.ACTIVE);
        assertThat(registry.requireCluster("c1").getNodeIds()).isEmpty();
    }

    @Test
    void testCheck_UnhealthyMarksError() throws Exception {
        // Given
        activeNode("n1", "c1");
        when(driver.execute(any(Action.class), any(CancellationToken.class))).thenReturn(DriverOutcome.ok(Map.of("healthy", false)));
        Action action = Action.of(ActionType.NODE_CHECK, "n1");

        // When
        handler.execute(action, context, WORKER, CancellationToken.none());

        // Then
        assertThat(registry.requireNode("n1").getStatus()).isEqualTo(NodeStatus.ERROR);
        assertThat((List<String>) action.getOutput(OUTPUT_UNHEALTHY_NODES)).containsExactly("n1");
    }

    @Test
    void testResolvePolicyCluster() {
        // Given
        activeNode("n1", "c1");

        // Then
        assertThat(handler.resolvePolicyCluster(Action.of(ActionType.NODE_DELETE, "n1"), registry)).isEqualTo("c1");
        assertThat(handler.resolvePolicyCluster(Action.of(ActionType.NODE_JOIN, "n1", Map.of(INPUT_CLUSTER_ID, "c9")), registry)).isEqualTo("c9");
        assertThat(handler.resolvePolicyCluster(Action.of(ActionType.NODE_DELETE, "n1", Map.of(INPUT_DEFERRED, true)), registry)).isNull();
        assertThat(handler.resolvePolicyCluster(Action.of(ActionType.NODE_CHECK, "missing"), registry)).isNull();
    }

    private void activeNode(String nodeId, String clusterId) {
        Node node = new Node(nodeId, null, "profile-1", OffsetDateTime.now());
        node.setStatus(NodeStatus.ACTIVE);
        registry.saveNode(node);
        if (clusterId != null) {
            registry.addNodeToCluster(clusterId, nodeId);
        }
    }
}
