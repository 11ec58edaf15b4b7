package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.clusterautoscaler.cloudprovider.FakeBackendManager.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManagedNodeGroupTest {

    private FakeBackendManager manager;
    private ManagedNodeGroup nodeGroup;

    @BeforeEach
    void setUp() throws Exception {
        manager = new FakeBackendManager();
        manager.stage(snapshot()
                .pool("pool-a", 1, 5)
                .goal("pool-a", 3)
                .node("worker-1", "pool-a")
                .node("worker-2", "pool-a")
                .node("worker-3", "pool-a")
                .build());
        manager.refresh();
        nodeGroup = new ManagedNodeGroup(manager, "pool-a");
    }

    @Test
    void testConstructor_RejectsBlankId() {
        assertThatThrownBy(() -> new ManagedNodeGroup(manager, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReads_ServedFromCurrentIndex() throws Exception {
        assertThat(nodeGroup.id()).isEqualTo("pool-a");
        assertThat(nodeGroup.minSize()).isEqualTo(1);
        assertThat(nodeGroup.maxSize()).isEqualTo(5);
        assertThat(nodeGroup.targetSize()).isEqualTo(3);
        assertThat(nodeGroup.exist()).isTrue();
        assertThat(nodeGroup.nodes()).extracting(BackendNode::getNodeName)
                .containsExactly("worker-1", "worker-2", "worker-3");
        assertThat(nodeGroup.debug()).isEqualTo("pool-a (min: 1, max: 5, target: 3, nodes: 3)");
        assertThat(nodeGroup).hasToString("pool-a");
    }

    @Test
    void testReads_GroupGoneFromSnapshot() throws Exception {
        // Given
        manager.stage(snapshot().pool("pool-b", 0, 2).build());
        manager.refresh();

        // Then
        assertThat(nodeGroup.exist()).isFalse();
        assertThat(nodeGroup.minSize()).isZero();
        assertThat(nodeGroup.maxSize()).isZero();
        assertThat(nodeGroup.nodes()).isEmpty();
        assertThat(nodeGroup.debug()).contains("not present");
        assertThatThrownBy(() -> nodeGroup.targetSize())
                .isInstanceOf(DataIntegrityException.class)
                .hasMessage("node group pool-a is not present in cache generation 2");
    }

    @Test
    void testIncreaseSize_WritesNewTarget() throws Exception {
        // When
        nodeGroup.increaseSize(2);

        // Then
        assertThat(manager.getWrites()).containsExactly("target pool-a=5");
    }

    @Test
    void testIncreaseSize_RejectsNonPositiveDelta() {
        assertThatThrownBy(() -> nodeGroup.increaseSize(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
        assertThat(manager.getWrites()).isEmpty();
    }

    @Test
    void testIncreaseSize_RejectsGrowthPastMax() {
        assertThatThrownBy(() -> nodeGroup.increaseSize(3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("size increase too large for node group pool-a - desired: 6 max: 5");
        assertThat(manager.getWrites()).isEmpty();
    }

    @Test
    void testIncreaseSize_RejectsDeltaThatWouldOverflow() {
        assertThatThrownBy(() -> nodeGroup.increaseSize(Integer.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("size increase too large for node group pool-a - desired: 2147483650 max: 5");
        assertThat(manager.getWrites()).isEmpty();
    }

    @Test
    void testDecreaseTargetSize_RejectsPositiveDelta() {
        assertThatThrownBy(() -> nodeGroup.decreaseTargetSize(1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be negative");
    }

    @Test
    void testDecreaseTargetSize_RejectsDroppingExistingNodes() {
        assertThatThrownBy(() -> nodeGroup.decreaseTargetSize(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attempt to delete existing nodes");
    }

    @Test
    void testDecreaseTargetSize_ReducesUnfulfilledTarget() throws Exception {
        // Given a target above the number of registered nodes
        manager.stage(snapshot()
                .pool("pool-a", 1, 5)
                .goal("pool-a", 5)
                .node("worker-1", "pool-a")
                .build());
        manager.refresh();

        // When
        nodeGroup.decreaseTargetSize(-3);

        // Then
        assertThat(manager.getWrites()).containsExactly("target pool-a=2");
    }

    @Test
    void testDecreaseTargetSize_RejectsGoingBelowMin() throws Exception {
        // Given
        manager.stage(snapshot().pool("pool-a", 2, 5).goal("pool-a", 3).build());
        manager.refresh();

        // Then
        assertThatThrownBy(() -> nodeGroup.decreaseTargetSize(-2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("size decrease too large for node group pool-a - desired: 1 min: 2");
    }

    @Test
    void testDeleteNodes_ForwardsMemberNames() throws Exception {
        // When
        nodeGroup.deleteNodes(List.of(Node.named("worker-2"), Node.named("worker-3")));

        // Then
        assertThat(manager.getWrites()).containsExactly("delete pool-a=[worker-2, worker-3]");
    }

    @Test
    void testDeleteNodes_CollapsesRepeatedNames() throws Exception {
        // When
        nodeGroup.deleteNodes(List.of(Node.named("worker-1"), Node.named("worker-1")));

        // Then
        assertThat(manager.getWrites()).containsExactly("delete pool-a=[worker-1]");
    }

    @Test
    void testDeleteNodes_RepeatedNamesDoNotTripMinSize() throws Exception {
        // Given target 3 and min 1, two distinct nodes may go even if listed three times
        List<Node> nodes = List.of(Node.named("worker-1"), Node.named("worker-2"), Node.named("worker-2"));

        // When
        nodeGroup.deleteNodes(nodes);

        // Then
        assertThat(manager.getWrites()).containsExactly("delete pool-a=[worker-1, worker-2]");
    }

    @Test
    void testDeleteNodes_RejectsForeignNode() {
        assertThatThrownBy(() -> nodeGroup.deleteNodes(List.of(Node.named("worker-9"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("node worker-9 does not belong to node group pool-a");
        assertThat(manager.getWrites()).isEmpty();
    }

    @Test
    void testDeleteNodes_RejectsGoingBelowMin() {
        List<Node> nodes = List.of(Node.named("worker-1"), Node.named("worker-2"), Node.named("worker-3"));

        assertThatThrownBy(() -> nodeGroup.deleteNodes(nodes))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min size reached");
    }

    @Test
    void testScaleRequests_GroupGoneFromSnapshot() throws Exception {
        // Given
        manager.stage(snapshot().build());
        manager.refresh();

        // Then
        assertThatThrownBy(() -> nodeGroup.increaseSize(1)).isInstanceOf(DataIntegrityException.class);
        assertThatThrownBy(() -> nodeGroup.deleteNodes(List.of(Node.named("worker-1"))))
                .isInstanceOf(DataIntegrityException.class);
    }
}
