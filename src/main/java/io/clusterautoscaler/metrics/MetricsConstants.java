package io.clusterautoscaler.metrics;

/**
 * Constants for metrics names and tags used by the autoscaler.
 */
public class MetricsConstants {
    public final static String REFRESH_LATENCY_METRIC_NAME = "cloud_provider_refresh_latency";
    public final static String REFRESH_SUCCESS_METRIC_NAME = "cloud_provider_refresh_success_count";
    public final static String REFRESH_FAILURES_METRIC_NAME = "cloud_provider_refresh_failures_count";
    public final static String CACHE_GENERATION_METRIC_NAME = "cloud_provider_cache_generation";
    public final static String NODE_GROUPS_METRIC_NAME = "cloud_provider_node_groups";
    public final static String PROVIDER_TAG = "provider";

    private MetricsConstants() {}
}
