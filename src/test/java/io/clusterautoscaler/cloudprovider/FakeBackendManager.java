package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.NodePool;
import io.clusterautoscaler.models.NodePoolGoalState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend for tests. The next refresh returns whatever state was staged last,
 * or fails with the staged error.
 */
public class FakeBackendManager extends CachingBackendManager {

    private volatile BackendSnapshot staged = new BackendSnapshot(List.of(), Map.of(), List.of());
    private volatile Exception stagedFailure;
    private final AtomicInteger closeCalls = new AtomicInteger();
    private final List<String> writes = new ArrayList<>();

    public FakeBackendManager() {
        this(Map.of());
    }

    public FakeBackendManager(Map<String, NodeGroupSpec> nodeGroupSpecs) {
        super(nodeGroupSpecs);
    }

    public FakeBackendManager stage(BackendSnapshot snapshot) {
        this.staged = snapshot;
        this.stagedFailure = null;
        return this;
    }

    public FakeBackendManager failWith(Exception failure) {
        this.stagedFailure = failure;
        return this;
    }

    public int getCloseCalls() {
        return closeCalls.get();
    }

    public synchronized List<String> getWrites() {
        return List.copyOf(writes);
    }

    @Override
    protected BackendSnapshot fetchSnapshot() throws Exception {
        if (stagedFailure != null) {
            throw stagedFailure;
        }
        return staged;
    }

    @Override
    protected void closeBackend() {
        closeCalls.incrementAndGet();
    }

    @Override
    public synchronized void setTargetSize(String nodePoolId, int targetSize) throws BackendException {
        writes.add("target " + nodePoolId + "=" + targetSize);
    }

    @Override
    public synchronized void deleteNodes(String nodePoolId, List<String> nodeNames) throws BackendException {
        writes.add("delete " + nodePoolId + "=" + nodeNames);
    }

    // ------------------------- snapshot helpers -------------------------

    public static SnapshotBuilder snapshot() {
        return new SnapshotBuilder();
    }

    public static class SnapshotBuilder {
        private final List<NodePool> pools = new ArrayList<>();
        private final Map<String, NodePoolGoalState> goalStates = new HashMap<>();
        private final List<BackendNode> nodes = new ArrayList<>();

        public SnapshotBuilder pool(String id, int minSize, int maxSize) {
            pools.add(NodePool.builder().id(id).minSize(minSize).maxSize(maxSize).machineType("standard-4").build());
            return this;
        }

        public SnapshotBuilder goal(String poolId, int targetSize) {
            goalStates.put(poolId, NodePoolGoalState.builder().targetSize(targetSize).build());
            return this;
        }

        public SnapshotBuilder node(String nodeName, String poolId) {
            nodes.add(BackendNode.builder()
                    .id("id-" + nodeName)
                    .nodeName(nodeName)
                    .nodePoolId(poolId)
                    .providerId("etcd://" + nodeName)
                    .build());
            return this;
        }

        public BackendSnapshot build() {
            return new BackendSnapshot(List.copyOf(pools), Map.copyOf(goalStates), List.copyOf(nodes));
        }
    }
}
