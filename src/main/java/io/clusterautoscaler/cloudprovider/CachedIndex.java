package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.NodePool;
import lombok.Getter;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One generation of cached backend state: node name to backend node, pool id to pool entry.
 * Instances are never modified after construction; a refresh builds a new one and swaps it in whole.
 */
@Getter
public final class CachedIndex {

    /**
     * Placeholder visible before the first successful refresh.
     */
    public static final CachedIndex EMPTY = new CachedIndex(0L, Map.of(), Map.of(), Instant.EPOCH);

    private final long generation;
    private final Map<String, PoolEntry> pools;
    private final Map<String, BackendNode> nodes;
    private final Instant builtAt;

    public CachedIndex(long generation, Map<String, PoolEntry> pools, Map<String, BackendNode> nodes, Instant builtAt) {
        this.generation = generation;
        this.pools = Collections.unmodifiableMap(new LinkedHashMap<>(pools));
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.builtAt = builtAt;
    }

    public Optional<PoolEntry> pool(String nodePoolId) {
        return Optional.ofNullable(pools.get(nodePoolId));
    }

    public Optional<BackendNode> node(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    /**
     * Whether both indexes describe the same backend state, regardless of generation.
     */
    public boolean hasSameContentAs(CachedIndex other) {
        return other != null && pools.equals(other.pools) && nodes.equals(other.nodes);
    }

    /**
     * Pool metadata together with the derived target size and member node names.
     */
    @Value
    public static class PoolEntry {
        NodePool nodePool;
        int targetSize;
        List<String> nodeNames;

        public PoolEntry(NodePool nodePool, int targetSize, List<String> nodeNames) {
            this.nodePool = nodePool;
            this.targetSize = targetSize;
            this.nodeNames = List.copyOf(nodeNames);
        }
    }
}
