package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.cloudprovider.errors.CapabilityUnsupportedException;
import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.cloudprovider.errors.RefreshException;
import io.clusterautoscaler.models.Node;
import io.clusterautoscaler.models.Taint;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Boundary between the generic autoscaling control loop and a specific backend's node management.
 * <p>
 * One implementation exists per backend. It is selected and built once at process start through
 * {@link CloudProviderBuilder}. Read accessors are served from the snapshot installed by the last
 * successful {@link #refresh()} and never block on network I/O, so they may be called concurrently.
 */
public interface CloudProvider {

    /**
     * Stable name of the backend kind.
     */
    String name();

    /**
     * All node groups in the current snapshot. A listing failure is logged and yields an empty list,
     * so an empty result does not prove that the backend has no groups.
     */
    List<NodeGroup> nodeGroups();

    /**
     * Resolve the node group owning the given node.
     *
     * @return the group, or empty when the node is not managed by this provider
     * @throws DataIntegrityException when the node is known to the backend but has no pool id
     */
    Optional<NodeGroup> nodeGroupForNode(Node node) throws DataIntegrityException;

    /**
     * Pricing model of the backend. Optional.
     */
    PricingModel pricing() throws CapabilityUnsupportedException;

    /**
     * Machine types that can be requested from the backend. Optional.
     */
    List<String> getAvailableMachineTypes() throws CapabilityUnsupportedException;

    /**
     * Build a theoretical node group for the given machine definition. The group is not created
     * on the backend and is not returned by {@link #nodeGroups()} until it is. Optional.
     */
    NodeGroup newNodeGroup(String machineType,
                           Map<String, String> labels,
                           Map<String, String> systemLabels,
                           List<Taint> taints,
                           Map<String, String> extraResources) throws CapabilityUnsupportedException;

    /**
     * The limiter supplied at construction, same instance.
     */
    ResourceLimiter getResourceLimiter();

    /**
     * Label key marking nodes that carry GPUs.
     */
    String gpuLabel();

    /**
     * GPU types the backend supports. May be empty, never null.
     */
    Set<String> getAvailableGpuTypes();

    /**
     * Release backend resources. A second call is a no-op.
     */
    void cleanup() throws BackendException;

    /**
     * Pull fresh backend state and install it as one atomic snapshot. Called once per control-loop tick.
     * On failure the previous snapshot stays in use.
     */
    void refresh() throws RefreshException;

    /**
     * Generation of the snapshot currently visible to readers; 0 until the first refresh succeeds.
     */
    long generation();
}
