package io.clusterautoscaler.cloudprovider;

import lombok.Value;

/**
 * Statically configured node group in the form {@code <min>:<max>:<poolId>}.
 */
@Value
public class NodeGroupSpec {

    private static final String SPEC_DELIMITER = ":";

    int minSize;
    int maxSize;
    String id;

    /**
     * Parse a spec string.
     *
     * @throws IllegalArgumentException when the spec is malformed or its bounds are inconsistent
     */
    public static NodeGroupSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Node group spec must not be empty");
        }
        String[] parts = spec.trim().split(SPEC_DELIMITER, 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Node group spec '" + spec + "' must have the form <min>:<max>:<id>");
        }

        int minSize = parseSize(spec, "min", parts[0]);
        int maxSize = parseSize(spec, "max", parts[1]);
        String id = parts[2].trim();

        if (id.isEmpty()) {
            throw new IllegalArgumentException("Node group spec '" + spec + "' has an empty id");
        }
        if (minSize < 0) {
            throw new IllegalArgumentException("Node group spec '" + spec + "': min size must be >= 0");
        }
        if (maxSize < minSize) {
            throw new IllegalArgumentException("Node group spec '" + spec + "': max size must be >= min size");
        }
        if (maxSize == 0) {
            throw new IllegalArgumentException("Node group spec '" + spec + "': max size must be > 0");
        }
        return new NodeGroupSpec(minSize, maxSize, id);
    }

    private static int parseSize(String spec, String field, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Node group spec '" + spec + "': " + field + " size '" + value + "' is not a number", e);
        }
    }

    @Override
    public String toString() {
        return minSize + SPEC_DELIMITER + maxSize + SPEC_DELIMITER + id;
    }
}
