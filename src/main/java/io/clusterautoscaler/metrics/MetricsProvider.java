package io.clusterautoscaler.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider creates counters, gauges and timers tagged with the autoscaler instance id.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String INSTANCE_TAG = "instance";

    private final MeterRegistry registry;
    private final String instanceId;
    private final Map<String, AtomicDouble> gaugeCache = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${autoscaler.id:cluster-autoscaler}") String autoscalerId) {
        this.registry = registry;
        this.instanceId = autoscalerId;
        log.info("MetricsProvider initialized for autoscaler instance: {}", instanceId);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Get or create a Gauge metric backed by the returned value holder.
     * Identical name and tags share one holder, so a value set on any returned instance is published.
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        return gaugeCache.computeIfAbsent(buildCacheKey(name, tags), k -> {
            AtomicDouble gaugeValue = new AtomicDouble(0);
            Gauge.builder(name, gaugeValue::get).tags(mapToTagArray(tags)).register(registry);
            return gaugeValue;
        });
    }

    /**
     * Create or retrieve a Timer metric publishing the p50, p90 and p99 percentiles.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = INSTANCE_TAG;
        tagArray[index] = instanceId;
        return tagArray;
    }

    private String buildCacheKey(String name, Map<String, String> tags) {
        StringBuilder key = new StringBuilder(name);
        tags.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> key.append(":").append(e.getKey()).append("=").append(e.getValue()));
        return key.toString();
    }
}
