package io.clusterautoscaler.cloudprovider;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable minimum and maximum aggregate resources (cores, memory, nodes, GPUs) for the whole cluster.
 * Unset limits read as 0; use {@link #hasMinLimitSet(String)} and {@link #hasMaxLimitSet(String)}
 * to tell them apart from an explicit 0.
 */
public final class ResourceLimiter {

    public static final String RESOURCE_CORES = "cpu";
    public static final String RESOURCE_MEMORY = "memory";
    public static final String RESOURCE_NODES = "nodes";

    private final Map<String, Long> minLimits;
    private final Map<String, Long> maxLimits;

    public ResourceLimiter(Map<String, Long> minLimits, Map<String, Long> maxLimits) {
        this.minLimits = Collections.unmodifiableMap(new TreeMap<>(minLimits != null ? minLimits : Map.of()));
        this.maxLimits = Collections.unmodifiableMap(new TreeMap<>(maxLimits != null ? maxLimits : Map.of()));
    }

    public long getMin(String resourceName) {
        return minLimits.getOrDefault(resourceName, 0L);
    }

    public long getMax(String resourceName) {
        return maxLimits.getOrDefault(resourceName, 0L);
    }

    public boolean hasMinLimitSet(String resourceName) {
        return minLimits.containsKey(resourceName);
    }

    public boolean hasMaxLimitSet(String resourceName) {
        return maxLimits.containsKey(resourceName);
    }

    /**
     * Names of all resources with at least one limit set.
     */
    public Set<String> getResources() {
        Set<String> resources = new TreeSet<>(minLimits.keySet());
        resources.addAll(maxLimits.keySet());
        return Collections.unmodifiableSet(resources);
    }

    @Override
    public String toString() {
        return getResources().stream()
                .map(resource -> String.format("%s : %d - %d", resource, getMin(resource), getMax(resource)))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
