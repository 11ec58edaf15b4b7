package io.clusterautoscaler.cloudprovider;

import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How node groups are discovered. With no static specs every pool reported by the backend is managed;
 * otherwise only the listed pools are, with the spec's bounds overriding the backend's.
 */
@Value
public class NodeGroupDiscoveryOptions {

    List<String> nodeGroupSpecs;

    public NodeGroupDiscoveryOptions(List<String> nodeGroupSpecs) {
        this.nodeGroupSpecs = nodeGroupSpecs != null ? List.copyOf(nodeGroupSpecs) : List.of();
    }

    public static NodeGroupDiscoveryOptions autoDiscovery() {
        return new NodeGroupDiscoveryOptions(List.of());
    }

    public boolean isAutoDiscovery() {
        return nodeGroupSpecs.isEmpty();
    }

    /**
     * Parsed specs keyed by pool id, in declaration order.
     *
     * @throws IllegalArgumentException on a malformed spec or a pool id declared twice
     */
    public Map<String, NodeGroupSpec> parseSpecs() {
        Map<String, NodeGroupSpec> specs = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (String raw : nodeGroupSpecs) {
            NodeGroupSpec spec = NodeGroupSpec.parse(raw);
            if (specs.putIfAbsent(spec.getId(), spec) != null) {
                duplicates.add(spec.getId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Node groups declared more than once: " + duplicates);
        }
        return specs;
    }
}
