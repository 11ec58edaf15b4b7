package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.ConstructionException;
import io.clusterautoscaler.cloudprovider.etcd.EtcdCloudProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selects the backend by name and builds its cloud provider, once per process.
 * Failures surface as {@link ConstructionException}; deciding whether to abort is left to the caller.
 */
@Slf4j
public final class CloudProviderBuilder {

    private static final Map<String, CloudProviderFactory> FACTORIES = Map.of(
            EtcdCloudProvider.PROVIDER_NAME, EtcdCloudProvider::build
    );

    private CloudProviderBuilder() {
        // Utility class
    }

    /**
     * Builds a concrete backend's cloud provider.
     */
    @FunctionalInterface
    public interface CloudProviderFactory {
        CloudProvider create(AutoscalingOptions options,
                             NodeGroupDiscoveryOptions discoveryOptions,
                             ResourceLimiter resourceLimiter) throws ConstructionException;
    }

    public static Set<String> availableProviders() {
        return new TreeSet<>(FACTORIES.keySet());
    }

    public static CloudProvider build(AutoscalingOptions options,
                                      NodeGroupDiscoveryOptions discoveryOptions,
                                      ResourceLimiter resourceLimiter) throws ConstructionException {
        if (options == null) {
            throw new ConstructionException("Autoscaling options must be provided");
        }
        if (resourceLimiter == null) {
            throw new ConstructionException("Resource limiter must be provided");
        }
        NodeGroupDiscoveryOptions discovery = discoveryOptions != null
                ? discoveryOptions
                : NodeGroupDiscoveryOptions.autoDiscovery();

        CloudProviderFactory factory = FACTORIES.get(options.getCloudProviderName());
        if (factory == null) {
            throw new ConstructionException(String.format("Unknown cloud provider '%s', available providers: %s",
                    options.getCloudProviderName(), availableProviders()));
        }

        try {
            discovery.parseSpecs();
        } catch (IllegalArgumentException e) {
            throw new ConstructionException("Invalid node group discovery options: " + e.getMessage(), e);
        }

        log.info("Building cloud provider '{}' for cluster {} with resource limits {}",
                options.getCloudProviderName(), options.getClusterName(), resourceLimiter);
        CloudProvider provider = factory.create(options, discovery, resourceLimiter);
        log.info("Cloud provider '{}' built successfully", provider.name());
        return provider;
    }
}
