package io.clusterautoscaler.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_CLOUD_PROVIDER = "etcd";
    public static final String DEFAULT_CLUSTER_NAME = "default";
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final long DEFAULT_REFRESH_INTERVAL_SECONDS = 10L;
    public static final long DEFAULT_CLEANUP_TIMEOUT_SECONDS = 10L;
    public static final long DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS = 5L;
    public static final String DEFAULT_GPU_LABEL = "clusterautoscaler.io/gpu-node";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_NODE_POOLS = "node-pools";
    public static final String PATH_NODES = "nodes";

    // etcd path suffixes
    public static final String SUFFIX_CONF = "conf";
    public static final String SUFFIX_GOAL_STATE = "goal-state";
}
