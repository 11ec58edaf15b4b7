package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.cloudprovider.errors.RefreshException;
import io.clusterautoscaler.models.BackendNode;

import java.util.List;
import java.util.Optional;

/**
 * Backend-specific collaborator owning the live connection and the cached view of pools and nodes.
 * Only {@link #refresh()} and the write operations talk to the backend; lookups are served from
 * {@link #currentIndex()}.
 */
public interface BackendManager {

    /**
     * Pull backend state and install it as the next cache generation.
     */
    void refresh() throws RefreshException;

    /**
     * Node group handles for every pool in the current snapshot.
     */
    List<NodeGroup> listNodeGroups() throws BackendException;

    /**
     * Cached backend record for the named node, empty when the backend does not manage it.
     */
    Optional<BackendNode> resolveNode(String nodeName);

    /**
     * Snapshot installed by the last successful refresh.
     */
    CachedIndex currentIndex();

    /**
     * Request a new target size for a pool.
     */
    void setTargetSize(String nodePoolId, int targetSize) throws BackendException;

    /**
     * Request deletion of member nodes; the pool's target size shrinks by the number of nodes.
     */
    void deleteNodes(String nodePoolId, List<String> nodeNames) throws BackendException;

    /**
     * Release the backend connection. Idempotent.
     */
    void cleanup() throws BackendException;
}
