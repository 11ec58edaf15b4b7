package io.clusterautoscaler.cloudprovider;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceLimiterTest {

    @Test
    void testLimits_SetAndUnsetResources() {
        // Given
        ResourceLimiter limiter = new ResourceLimiter(
                Map.of(ResourceLimiter.RESOURCE_CORES, 4L, ResourceLimiter.RESOURCE_NODES, 0L),
                Map.of(ResourceLimiter.RESOURCE_CORES, 128L, ResourceLimiter.RESOURCE_MEMORY, 1024L));

        // Then
        assertThat(limiter.getMin("cpu")).isEqualTo(4);
        assertThat(limiter.getMax("cpu")).isEqualTo(128);
        assertThat(limiter.getMin("memory")).isZero();
        assertThat(limiter.hasMinLimitSet("memory")).isFalse();
        assertThat(limiter.hasMinLimitSet("nodes")).isTrue();
        assertThat(limiter.hasMaxLimitSet("nodes")).isFalse();
        assertThat(limiter.getResources()).containsExactly("cpu", "memory", "nodes");
    }

    @Test
    void testToString_ListsEachResourceRange() {
        ResourceLimiter limiter = new ResourceLimiter(Map.of("cpu", 1L), Map.of("cpu", 8L, "memory", 64L));

        assertThat(limiter).hasToString("{cpu : 1 - 8, memory : 0 - 64}");
    }

    @Test
    void testConstructor_NullMapsMeanNoLimits() {
        ResourceLimiter limiter = new ResourceLimiter(null, null);

        assertThat(limiter.getResources()).isEmpty();
        assertThat(limiter).hasToString("{}");
    }
}
