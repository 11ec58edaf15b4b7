package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.CloudProviderException;
import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.Node;

import java.util.List;

/**
 * Handle to an independently scalable pool of homogeneous nodes.
 * Handles carry no state of their own; every query consults the provider's current snapshot.
 */
public interface NodeGroup {

    String id();

    int minSize();

    int maxSize();

    /**
     * Requested size of the group, which may differ from the number of registered nodes.
     */
    int targetSize() throws DataIntegrityException;

    /**
     * Request {@code delta} more nodes. Fails when the result would exceed {@link #maxSize()}.
     */
    void increaseSize(int delta) throws CloudProviderException;

    /**
     * Lower the target size without deleting registered nodes. {@code delta} must be negative.
     */
    void decreaseTargetSize(int delta) throws CloudProviderException;

    /**
     * Delete the given member nodes and shrink the target size accordingly.
     */
    void deleteNodes(List<Node> nodes) throws CloudProviderException;

    /**
     * Member nodes as recorded in the current snapshot.
     */
    List<BackendNode> nodes();

    /**
     * Whether the group is still present in the current snapshot.
     */
    boolean exist();

    String debug();
}
