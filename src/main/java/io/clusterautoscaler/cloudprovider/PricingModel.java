package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.CloudProviderException;
import io.clusterautoscaler.models.Node;

import java.time.Instant;

/**
 * Cost of running nodes and pods, as reported by backends that support pricing.
 */
public interface PricingModel {

    double nodePrice(Node node, Instant startTime, Instant endTime) throws CloudProviderException;

    double podPrice(String podName, Instant startTime, Instant endTime) throws CloudProviderException;
}
