package io.clusterautoscaler.cloudprovider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

import static io.clusterautoscaler.config.Constants.*;

/**
 * Scaling configuration handed to the cloud provider builder.
 */
@Value
@Builder
public class AutoscalingOptions {

    @Builder.Default
    String cloudProviderName = DEFAULT_CLOUD_PROVIDER;

    @Builder.Default
    String clusterName = DEFAULT_CLUSTER_NAME;

    @Singular
    List<String> etcdEndpoints;

    @Builder.Default
    String gpuLabel = DEFAULT_GPU_LABEL;

    @Singular
    Set<String> gpuTypes;

    @Builder.Default
    long etcdOperationTimeoutSeconds = DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS;

    @Builder.Default
    long cleanupTimeoutSeconds = DEFAULT_CLEANUP_TIMEOUT_SECONDS;
}
