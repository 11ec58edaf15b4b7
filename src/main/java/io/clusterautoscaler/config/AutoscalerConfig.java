package io.clusterautoscaler.config;

import io.clusterautoscaler.cloudprovider.AutoscalingOptions;
import io.clusterautoscaler.cloudprovider.NodeGroupDiscoveryOptions;
import io.clusterautoscaler.cloudprovider.ResourceLimiter;
import io.clusterautoscaler.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.clusterautoscaler.config.Constants.*;

/**
 * Configuration for the cluster autoscaler.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * Lookup order: the file named by {@code AUTOSCALER_CONFIG_FILE}, then application.yml on the classpath,
 * then built-in defaults. Problems with a single value fall back to its default and are logged.
 */
@Slf4j
@Getter
public class AutoscalerConfig {

    private final String cloudProviderName;
    private final String clusterName;
    private final List<String> etcdEndpoints;
    private final long etcdOperationTimeoutSeconds;
    private final long refreshIntervalSeconds;
    private final long cleanupTimeoutSeconds;
    private final String gpuLabel;
    private final Set<String> gpuTypes;
    private final List<String> nodeGroupSpecs;
    private final Map<String, Long> minResourceLimits;
    private final Map<String, Long> maxResourceLimits;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "AUTOSCALER_CONFIG_FILE";

    public AutoscalerConfig() {
        this(loadYamlConfig());
    }

    AutoscalerConfig(ConfigModel config) {
        this.cloudProviderName = parseCloudProviderName(config);
        this.clusterName = parseClusterName(config);
        this.etcdEndpoints = parseEndpoints(config);
        this.etcdOperationTimeoutSeconds = parseSeconds("etcd operation timeout",
                config.getEtcd() != null ? config.getEtcd().getOperation_timeout_seconds() : null,
                DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS);
        this.refreshIntervalSeconds = parseSeconds("refresh interval",
                config.getRefresh() != null ? config.getRefresh().getInterval_seconds() : null,
                DEFAULT_REFRESH_INTERVAL_SECONDS);
        this.cleanupTimeoutSeconds = parseSeconds("cleanup timeout",
                config.getCleanup() != null ? config.getCleanup().getTimeout_seconds() : null,
                DEFAULT_CLEANUP_TIMEOUT_SECONDS);
        this.gpuLabel = parseGpuLabel(config);
        this.gpuTypes = parseGpuTypes(config);
        this.nodeGroupSpecs = config.getNode_groups() != null ? List.copyOf(config.getNode_groups()) : List.of();
        this.minResourceLimits = parseLimits("min", config.getResource_limits() != null ? config.getResource_limits().getMin() : null);
        this.maxResourceLimits = parseLimits("max", config.getResource_limits() != null ? config.getResource_limits().getMax() : null);

        log.info("Loaded autoscaler config - provider: {}, cluster: {}, etcd endpoints: {}, refresh interval: {}s, node groups: {}",
                cloudProviderName, clusterName, String.join(", ", etcdEndpoints), refreshIntervalSeconds,
                nodeGroupSpecs.isEmpty() ? "auto-discovered" : nodeGroupSpecs);
    }

    public AutoscalingOptions toAutoscalingOptions() {
        return AutoscalingOptions.builder()
                .cloudProviderName(cloudProviderName)
                .clusterName(clusterName)
                .etcdEndpoints(etcdEndpoints)
                .gpuLabel(gpuLabel)
                .gpuTypes(gpuTypes)
                .etcdOperationTimeoutSeconds(etcdOperationTimeoutSeconds)
                .cleanupTimeoutSeconds(cleanupTimeoutSeconds)
                .build();
    }

    public NodeGroupDiscoveryOptions toDiscoveryOptions() {
        return new NodeGroupDiscoveryOptions(nodeGroupSpecs);
    }

    public ResourceLimiter toResourceLimiter() {
        return new ResourceLimiter(minResourceLimits, maxResourceLimits);
    }

    static ConfigModel parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        ConfigModel config = yaml.load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = EnvironmentUtils.getEnv(EXTERNAL_CONFIG_ENV_VAR, null);
        if (externalConfigPath != null) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = AutoscalerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = parseYaml(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private String parseCloudProviderName(ConfigModel config) {
        if (config.getCloud_provider() != null && config.getCloud_provider().getName() != null
                && !config.getCloud_provider().getName().isBlank()) {
            return config.getCloud_provider().getName().trim();
        }
        return DEFAULT_CLOUD_PROVIDER;
    }

    private String parseClusterName(ConfigModel config) {
        if (config.getCloud_provider() != null && config.getCloud_provider().getCluster_name() != null
                && !config.getCloud_provider().getCluster_name().isBlank()) {
            return config.getCloud_provider().getCluster_name().trim();
        }
        return DEFAULT_CLUSTER_NAME;
    }

    private List<String> parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return List.copyOf(config.getEtcd().getEndpoints());
        }
        return List.of(DEFAULT_ETCD_ENDPOINT);
    }

    private long parseSeconds(String name, Integer value, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive {} of {}s, using default {}s", name, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private String parseGpuLabel(ConfigModel config) {
        if (config.getCloud_provider() != null && config.getCloud_provider().getGpu_label() != null
                && !config.getCloud_provider().getGpu_label().isBlank()) {
            return config.getCloud_provider().getGpu_label().trim();
        }
        return DEFAULT_GPU_LABEL;
    }

    private Set<String> parseGpuTypes(ConfigModel config) {
        if (config.getCloud_provider() != null && config.getCloud_provider().getGpu_types() != null) {
            return Set.copyOf(new LinkedHashSet<>(config.getCloud_provider().getGpu_types()));
        }
        return Set.of();
    }

    private Map<String, Long> parseLimits(String bound, Map<String, Number> limits) {
        Map<String, Long> parsed = new HashMap<>();
        if (limits == null) {
            return parsed;
        }
        for (Map.Entry<String, Number> entry : limits.entrySet()) {
            if (entry.getValue() == null) {
                log.warn("Ignoring empty {} resource limit for {}", bound, entry.getKey());
                continue;
            }
            parsed.put(entry.getKey(), entry.getValue().longValue());
        }
        return parsed;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Autoscaler autoscaler; // Instance id, read by Spring @Value
        private Server server;         // Spring web server settings
        private CloudProvider cloud_provider;
        private Etcd etcd;
        private Refresh refresh;
        private Cleanup cleanup;
        private List<String> node_groups;
        private ResourceLimits resource_limits;
    }

    @Data
    public static class Autoscaler {
        private String id;
    }

    @Data
    public static class Server {
        private Integer port;
    }

    @Data
    public static class CloudProvider {
        private String name;
        private String cluster_name;
        private String gpu_label;
        private List<String> gpu_types;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
        private Integer operation_timeout_seconds;
    }

    @Data
    public static class Refresh {
        private Integer interval_seconds;
    }

    @Data
    public static class Cleanup {
        private Integer timeout_seconds;
    }

    @Data
    public static class ResourceLimits {
        private Map<String, Number> min;
        private Map<String, Number> max;
    }
}
