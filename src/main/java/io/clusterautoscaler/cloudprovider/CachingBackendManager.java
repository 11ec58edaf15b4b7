package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.cloudprovider.errors.RefreshException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.NodePool;
import io.clusterautoscaler.models.NodePoolGoalState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Backend manager base that owns the cache discipline shared by all backends.
 * <p>
 * Subclasses only fetch raw state ({@link #fetchSnapshot()}) and release their connection
 * ({@link #closeBackend()}). This class filters the snapshot through the discovery options, builds
 * a complete {@link CachedIndex} off to the side and installs it with a single reference swap, so a
 * reader sees either the old or the new generation and never a mix of both.
 */
@Slf4j
public abstract class CachingBackendManager implements BackendManager {

    private final AtomicReference<CachedIndex> currentIndex = new AtomicReference<>(CachedIndex.EMPTY);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Map<String, NodeGroupSpec> nodeGroupSpecs;

    protected CachingBackendManager(Map<String, NodeGroupSpec> nodeGroupSpecs) {
        this.nodeGroupSpecs = Map.copyOf(nodeGroupSpecs);
    }

    /**
     * Fetch the complete raw state of the backend. Called by {@link #refresh()} only.
     */
    protected abstract BackendSnapshot fetchSnapshot() throws Exception;

    /**
     * Release the backend connection. Called at most once.
     */
    protected abstract void closeBackend() throws Exception;

    // =================================================================
    // REFRESH
    // =================================================================

    @Override
    public synchronized void refresh() throws RefreshException {
        if (closed.get()) {
            throw new RefreshException("Cannot refresh: backend manager has been cleaned up");
        }

        BackendSnapshot snapshot;
        try {
            snapshot = fetchSnapshot();
        } catch (Exception e) {
            throw new RefreshException("Failed to fetch backend state: " + e.getMessage(), e);
        }

        CachedIndex previous = currentIndex.get();
        CachedIndex candidate = buildIndex(snapshot, previous.getGeneration() + 1);

        if (previous.getGeneration() > 0 && candidate.hasSameContentAs(previous)) {
            log.debug("Backend state unchanged, keeping cache generation {}", previous.getGeneration());
            return;
        }

        currentIndex.set(candidate);
        log.info("Installed cache generation {}: {} node groups, {} nodes",
                candidate.getGeneration(), candidate.getPools().size(), candidate.getNodes().size());
    }

    private CachedIndex buildIndex(BackendSnapshot snapshot, long generation) {
        Map<String, NodePool> managedPools = new TreeMap<>();
        for (NodePool nodePool : snapshot.getNodePools()) {
            String id = nodePool.getId();
            if (id == null || id.isBlank()) {
                log.warn("Ignoring node pool without id: {}", nodePool);
                continue;
            }
            if (nodeGroupSpecs.isEmpty()) {
                managedPools.put(id, nodePool.toBuilder().build());
                continue;
            }
            NodeGroupSpec spec = nodeGroupSpecs.get(id);
            if (spec == null) {
                log.debug("Node pool {} is not listed in the node group specs, not managing it", id);
                continue;
            }
            managedPools.put(id, nodePool.toBuilder()
                    .minSize(spec.getMinSize())
                    .maxSize(spec.getMaxSize())
                    .build());
        }

        for (String specId : nodeGroupSpecs.keySet()) {
            if (!managedPools.containsKey(specId)) {
                log.warn("Node group {} is configured but the backend does not report it", specId);
            }
        }

        Map<String, BackendNode> nodes = new TreeMap<>();
        Map<String, List<String>> members = new TreeMap<>();
        for (BackendNode node : snapshot.getNodes()) {
            String nodeName = node.getNodeName();
            if (nodeName == null || nodeName.isBlank()) {
                log.warn("Ignoring backend node {} without a node name", node.getId());
                continue;
            }
            if (!node.hasNodePool()) {
                // Kept so that lookups report the missing assignment instead of treating the node as unmanaged
                nodes.put(nodeName, node);
            } else if (managedPools.containsKey(node.getNodePoolId())) {
                nodes.put(nodeName, node);
                members.computeIfAbsent(node.getNodePoolId(), id -> new ArrayList<>()).add(nodeName);
            } else {
                log.debug("Node {} belongs to unmanaged node pool {}", nodeName, node.getNodePoolId());
            }
        }

        Map<String, CachedIndex.PoolEntry> pools = new TreeMap<>();
        for (Map.Entry<String, NodePool> entry : managedPools.entrySet()) {
            String id = entry.getKey();
            List<String> nodeNames = members.getOrDefault(id, List.of());
            NodePoolGoalState goalState = snapshot.getGoalStates().get(id);
            int targetSize = goalState != null && goalState.getTargetSize() != null
                    ? goalState.getTargetSize()
                    : nodeNames.size();
            pools.put(id, new CachedIndex.PoolEntry(entry.getValue(), targetSize, nodeNames));
        }

        return new CachedIndex(generation, pools, nodes, Instant.now());
    }

    // =================================================================
    // CACHED READS
    // =================================================================

    @Override
    public CachedIndex currentIndex() {
        return currentIndex.get();
    }

    @Override
    public List<NodeGroup> listNodeGroups() throws BackendException {
        if (closed.get()) {
            throw new BackendException("Cannot list node groups: backend manager has been cleaned up");
        }
        return currentIndex.get().getPools().keySet().stream()
                .map(id -> new ManagedNodeGroup(this, id))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<BackendNode> resolveNode(String nodeName) {
        return currentIndex.get().node(nodeName);
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    @Override
    public void cleanup() throws BackendException {
        if (!closed.compareAndSet(false, true)) {
            log.debug("Backend manager already cleaned up");
            return;
        }
        log.info("Cleaning up backend manager");
        try {
            closeBackend();
        } catch (Exception e) {
            throw new BackendException("Failed to release backend resources: " + e.getMessage(), e);
        }
    }

    protected boolean isClosed() {
        return closed.get();
    }
}
