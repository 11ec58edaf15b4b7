package io.clusterautoscaler.cloudprovider.etcd;

import io.clusterautoscaler.cloudprovider.AutoscalingOptions;
import io.clusterautoscaler.cloudprovider.BackendManager;
import io.clusterautoscaler.cloudprovider.CloudProvider;
import io.clusterautoscaler.cloudprovider.ManagedNodeGroup;
import io.clusterautoscaler.cloudprovider.NodeGroup;
import io.clusterautoscaler.cloudprovider.NodeGroupDiscoveryOptions;
import io.clusterautoscaler.cloudprovider.PricingModel;
import io.clusterautoscaler.cloudprovider.ResourceLimiter;
import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.cloudprovider.errors.CapabilityUnsupportedException;
import io.clusterautoscaler.cloudprovider.errors.ConstructionException;
import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.cloudprovider.errors.RefreshException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.Node;
import io.clusterautoscaler.models.Taint;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cloud provider for node pools recorded in etcd.
 * Everything except refresh, cleanup and scale requests is served from the manager's cache.
 */
@Slf4j
public class EtcdCloudProvider implements CloudProvider {

    public static final String PROVIDER_NAME = "etcd";

    private final BackendManager manager;
    private final ResourceLimiter resourceLimiter;
    private final String gpuLabel;
    private final Set<String> gpuTypes;

    public EtcdCloudProvider(BackendManager manager, ResourceLimiter resourceLimiter, String gpuLabel, Set<String> gpuTypes) {
        this.manager = manager;
        this.resourceLimiter = resourceLimiter;
        this.gpuLabel = gpuLabel;
        this.gpuTypes = gpuTypes != null ? Set.copyOf(gpuTypes) : Set.of();
    }

    /**
     * Builds the etcd manager and wraps it in a provider.
     */
    public static CloudProvider build(AutoscalingOptions options,
                                      NodeGroupDiscoveryOptions discoveryOptions,
                                      ResourceLimiter resourceLimiter) throws ConstructionException {
        EtcdBackendManager manager = EtcdBackendManager.create(options, discoveryOptions);
        return new EtcdCloudProvider(manager, resourceLimiter, options.getGpuLabel(), options.getGpuTypes());
    }

    @Override
    public String name() {
        return PROVIDER_NAME;
    }

    @Override
    public List<NodeGroup> nodeGroups() {
        try {
            return manager.listNodeGroups();
        } catch (BackendException e) {
            // Listing failures degrade to "no groups" so the control loop keeps running
            log.error("Failed to get node pools: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<NodeGroup> nodeGroupForNode(Node node) throws DataIntegrityException {
        Optional<BackendNode> backendNode = manager.resolveNode(node.getName());
        if (backendNode.isEmpty()) {
            log.debug("Node {} is not managed by cloud provider {}", node.getName(), PROVIDER_NAME);
            return Optional.empty();
        }

        BackendNode resolved = backendNode.get();
        if (!resolved.hasNodePool()) {
            throw new DataIntegrityException(String.format("missing node pool name for node %s (%s)",
                    resolved.getNodeName(), resolved.getId()));
        }
        return Optional.of(new ManagedNodeGroup(manager, resolved.getNodePoolId()));
    }

    @Override
    public PricingModel pricing() throws CapabilityUnsupportedException {
        throw new CapabilityUnsupportedException("Pricing");
    }

    @Override
    public List<String> getAvailableMachineTypes() throws CapabilityUnsupportedException {
        throw new CapabilityUnsupportedException("GetAvailableMachineTypes");
    }

    @Override
    public NodeGroup newNodeGroup(String machineType,
                                  Map<String, String> labels,
                                  Map<String, String> systemLabels,
                                  List<Taint> taints,
                                  Map<String, String> extraResources) throws CapabilityUnsupportedException {
        throw new CapabilityUnsupportedException("NewNodeGroup");
    }

    @Override
    public ResourceLimiter getResourceLimiter() {
        return resourceLimiter;
    }

    @Override
    public String gpuLabel() {
        return gpuLabel;
    }

    @Override
    public Set<String> getAvailableGpuTypes() {
        return gpuTypes;
    }

    @Override
    public void cleanup() throws BackendException {
        manager.cleanup();
    }

    @Override
    public void refresh() throws RefreshException {
        manager.refresh();
    }

    @Override
    public long generation() {
        return manager.currentIndex().getGeneration();
    }
}
