package io.clusterautoscaler;

import com.google.common.util.concurrent.AtomicDouble;
import io.clusterautoscaler.cloudprovider.CloudProvider;
import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.cloudprovider.errors.RefreshException;
import io.clusterautoscaler.metrics.MetricsProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.clusterautoscaler.metrics.MetricsConstants.*;

/**
 * Drives one cloud provider refresh per tick.
 * A failed refresh is logged and counted; the loop keeps running on the last good snapshot
 * and retries on the next tick.
 */
@Slf4j
public class RefreshLoop {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final CloudProvider cloudProvider;
    private final long intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private final Timer refreshTimer;
    private final Counter refreshSuccessCounter;
    private final Counter refreshFailureCounter;
    private final AtomicDouble generationGauge;
    private final AtomicDouble nodeGroupsGauge;

    private volatile boolean isRunning = false;

    public RefreshLoop(CloudProvider cloudProvider, MetricsProvider metricsProvider, long intervalSeconds) {
        this.cloudProvider = cloudProvider;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("cloud-provider-refresh");
            t.setDaemon(true);
            return t;
        });

        Map<String, String> tags = Map.of(PROVIDER_TAG, cloudProvider.name());
        this.refreshTimer = metricsProvider.timer(REFRESH_LATENCY_METRIC_NAME, tags);
        this.refreshSuccessCounter = metricsProvider.counter(REFRESH_SUCCESS_METRIC_NAME, tags);
        this.refreshFailureCounter = metricsProvider.counter(REFRESH_FAILURES_METRIC_NAME, tags);
        this.generationGauge = metricsProvider.gauge(CACHE_GENERATION_METRIC_NAME, tags);
        this.nodeGroupsGauge = metricsProvider.gauge(NODE_GROUPS_METRIC_NAME, tags);
    }

    public void start() {
        log.info("Starting refresh loop for cloud provider {} every {}s", cloudProvider.name(), intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::runOnce,
                0,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    /**
     * Stop ticking and release the provider's backend resources.
     */
    public void stop() {
        log.info("Stopping refresh loop for cloud provider {}", cloudProvider.name());
        isRunning = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Refresh in progress did not finish within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            cloudProvider.cleanup();
        } catch (BackendException e) {
            log.error("Failed to clean up cloud provider {}: {}", cloudProvider.name(), e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return isRunning;
    }

    /**
     * One tick: refresh, then publish the visible generation and group count.
     */
    void runOnce() {
        long start = System.nanoTime();
        try {
            cloudProvider.refresh();
            refreshSuccessCounter.increment();
        } catch (RefreshException e) {
            refreshFailureCounter.increment();
            log.error("Refresh of cloud provider {} failed, continuing with cache generation {}: {}",
                    cloudProvider.name(), cloudProvider.generation(), e.getMessage());
        } catch (RuntimeException e) {
            // Escaping the scheduled task would cancel all future ticks
            refreshFailureCounter.increment();
            log.error("Unexpected error refreshing cloud provider {}: {}", cloudProvider.name(), e.getMessage(), e);
        } finally {
            refreshTimer.record(Duration.ofNanos(System.nanoTime() - start));
        }

        generationGauge.set(cloudProvider.generation());
        nodeGroupsGauge.set(cloudProvider.nodeGroups().size());
        log.debug("Cloud provider {} at cache generation {}", cloudProvider.name(), cloudProvider.generation());
    }
}
