package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.CloudProviderException;
import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.Node;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Node group handle backed by a {@link BackendManager}'s cache.
 * Two handles with the same id are equal, whichever generation produced them.
 */
@Slf4j
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ManagedNodeGroup implements NodeGroup {

    private final BackendManager manager;

    @EqualsAndHashCode.Include
    private final String id;

    public ManagedNodeGroup(BackendManager manager, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node group id must not be empty");
        }
        this.manager = manager;
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int minSize() {
        return entry().map(e -> e.getNodePool().getMinSize()).orElse(0);
    }

    @Override
    public int maxSize() {
        return entry().map(e -> e.getNodePool().getMaxSize()).orElse(0);
    }

    @Override
    public int targetSize() throws DataIntegrityException {
        return requireEntry().getTargetSize();
    }

    @Override
    public void increaseSize(int delta) throws CloudProviderException {
        if (delta <= 0) {
            throw new IllegalArgumentException("size increase must be positive, got " + delta);
        }
        CachedIndex.PoolEntry entry = requireEntry();
        // Compared as a difference so that a huge delta cannot wrap around
        if (delta > entry.getNodePool().getMaxSize() - entry.getTargetSize()) {
            throw new IllegalArgumentException(String.format(
                    "size increase too large for node group %s - desired: %d max: %d",
                    id, (long) entry.getTargetSize() + delta, entry.getNodePool().getMaxSize()));
        }
        int newSize = entry.getTargetSize() + delta;
        log.info("Increasing node group {} target size {} -> {}", id, entry.getTargetSize(), newSize);
        manager.setTargetSize(id, newSize);
    }

    @Override
    public void decreaseTargetSize(int delta) throws CloudProviderException {
        if (delta >= 0) {
            throw new IllegalArgumentException("size decrease must be negative, got " + delta);
        }
        CachedIndex.PoolEntry entry = requireEntry();
        int newSize = entry.getTargetSize() + delta;
        int existingNodes = entry.getNodeNames().size();
        if (newSize < existingNodes) {
            throw new IllegalArgumentException(String.format(
                    "attempt to delete existing nodes in node group %s - target size: %d delta: %d existing nodes: %d",
                    id, entry.getTargetSize(), delta, existingNodes));
        }
        if (newSize < entry.getNodePool().getMinSize()) {
            throw new IllegalArgumentException(String.format(
                    "size decrease too large for node group %s - desired: %d min: %d",
                    id, newSize, entry.getNodePool().getMinSize()));
        }
        log.info("Decreasing node group {} target size {} -> {}", id, entry.getTargetSize(), newSize);
        manager.setTargetSize(id, newSize);
    }

    @Override
    public void deleteNodes(List<Node> nodes) throws CloudProviderException {
        CachedIndex.PoolEntry entry = requireEntry();
        List<String> nodeNames = nodes.stream().map(Node::getName).distinct().collect(Collectors.toList());
        if (entry.getTargetSize() - nodeNames.size() < entry.getNodePool().getMinSize()) {
            throw new IllegalArgumentException(String.format(
                    "min size reached for node group %s, nodes will not be deleted", id));
        }
        for (String nodeName : nodeNames) {
            if (!entry.getNodeNames().contains(nodeName)) {
                throw new IllegalArgumentException(String.format(
                        "node %s does not belong to node group %s", nodeName, id));
            }
        }
        log.info("Deleting {} nodes from node group {}: {}", nodeNames.size(), id, nodeNames);
        manager.deleteNodes(id, nodeNames);
    }

    @Override
    public List<BackendNode> nodes() {
        CachedIndex index = manager.currentIndex();
        return index.pool(id)
                .map(entry -> entry.getNodeNames().stream()
                        .map(index::node)
                        .flatMap(Optional::stream)
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    @Override
    public boolean exist() {
        return entry().isPresent();
    }

    @Override
    public String debug() {
        return entry()
                .map(e -> String.format("%s (min: %d, max: %d, target: %d, nodes: %d)", id,
                        e.getNodePool().getMinSize(), e.getNodePool().getMaxSize(),
                        e.getTargetSize(), e.getNodeNames().size()))
                .orElse(id + " (not present in current snapshot)");
    }

    @Override
    public String toString() {
        return id;
    }

    private Optional<CachedIndex.PoolEntry> entry() {
        return manager.currentIndex().pool(id);
    }

    private CachedIndex.PoolEntry requireEntry() throws DataIntegrityException {
        return entry().orElseThrow(() -> new DataIntegrityException(
                "node group " + id + " is not present in cache generation " + manager.currentIndex().getGeneration()));
    }
}
