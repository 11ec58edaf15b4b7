package io.clusterautoscaler;

import io.clusterautoscaler.cloudprovider.CloudProvider;
import io.clusterautoscaler.cloudprovider.CloudProviderBuilder;
import io.clusterautoscaler.cloudprovider.ResourceLimiter;
import io.clusterautoscaler.cloudprovider.errors.ConstructionException;
import io.clusterautoscaler.config.AutoscalerConfig;
import io.clusterautoscaler.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot host for the cloud provider layer.
 * <p>
 * Builds the configured cloud provider once at startup, drives its refresh cycle and exposes
 * a read-only REST view of the node groups. A provider that cannot be built fails the context,
 * so the process never runs half-initialized.
 */
@Slf4j
@SpringBootApplication
public class ClusterAutoscalerApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Autoscaler cloud provider host");

        try {
            SpringApplication.run(ClusterAutoscalerApplication.class, args);
            log.info("Cluster Autoscaler cloud provider host started successfully");
        } catch (Exception e) {
            log.error("Failed to start Cluster Autoscaler: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    public AutoscalerConfig config() {
        AutoscalerConfig config = new AutoscalerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public ResourceLimiter resourceLimiter(AutoscalerConfig config) {
        ResourceLimiter resourceLimiter = config.toResourceLimiter();
        log.info("Resource limits: {}", resourceLimiter);
        return resourceLimiter;
    }

    /**
     * Cleanup is owned by the refresh loop, so Spring must not infer a destroy method here.
     */
    @Bean(destroyMethod = "")
    public CloudProvider cloudProvider(AutoscalerConfig config, ResourceLimiter resourceLimiter) {
        log.info("Initializing cloud provider '{}'", config.getCloudProviderName());
        try {
            return CloudProviderBuilder.build(
                    config.toAutoscalingOptions(),
                    config.toDiscoveryOptions(),
                    resourceLimiter);
        } catch (ConstructionException e) {
            log.error("Failed to create cloud provider '{}': {}", config.getCloudProviderName(), e.getMessage(), e);
            throw new IllegalStateException("Cloud provider construction failed", e);
        }
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RefreshLoop refreshLoop(CloudProvider cloudProvider, MetricsProvider metricsProvider, AutoscalerConfig config) {
        log.info("Initializing refresh loop with interval {}s", config.getRefreshIntervalSeconds());
        return new RefreshLoop(cloudProvider, metricsProvider, config.getRefreshIntervalSeconds());
    }
}
