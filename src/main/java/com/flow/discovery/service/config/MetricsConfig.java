package com.flow.discovery.service.config;

import com.flow.discovery.service.engine.Algorithm;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Metrics configuration for Flow Discovery Service.
 *
 * Provides custom metrics for discovery runs, fallthroughs and the mining cache.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter fallthroughs;
    private final Counter depthLimitHits;
    private final Counter degradedBranches;
    private final Counter rejectedRequests;
    private final Map<Algorithm, Counter> discoveries = new EnumMap<>(Algorithm.class);

    // Timers
    private final Map<Algorithm, Timer> discoveryTimers = new EnumMap<>(Algorithm.class);

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        // Initialize counters
        this.fallthroughs = Counter.builder("discovery.fallthrough.count")
                .description("Number of fallthroughs taken while mining")
                .register(registry);

        this.depthLimitHits = Counter.builder("discovery.depth_limit.count")
                .description("Number of branches cut off by the recursion ceiling")
                .register(registry);

        this.degradedBranches = Counter.builder("discovery.degraded.count")
                .description("Number of branches degraded to a flower model after an internal failure")
                .register(registry);

        this.rejectedRequests = Counter.builder("discovery.rejected.count")
                .description("Number of discovery requests rejected as malformed")
                .register(registry);

        for (Algorithm algorithm : Algorithm.values()) {
            discoveries.put(algorithm, Counter.builder("discovery.count")
                    .description("Number of completed discoveries")
                    .tag("algorithm", algorithm.name())
                    .register(registry));

            // Initialize timers
            discoveryTimers.put(algorithm, Timer.builder("discovery.duration")
                    .description("Time taken for discovery")
                    .tag("algorithm", algorithm.name())
                    .register(registry));
        }
    }

    public Counter discoveryCounter(Algorithm algorithm) {
        return discoveries.get(algorithm);
    }

    public Timer discoveryTimer(Algorithm algorithm) {
        return discoveryTimers.get(algorithm);
    }

    /**
     * Registers a gauge for cache monitoring.
     *
     * @param name the metric name
     * @param region the cache region, used as tag
     * @param description the metric description
     * @param valueSupplier supplier for the current value
     */
    public void registerCacheGauge(String name, String region, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
                .description(description)
                .tag("region", region)
                .register(registry);
    }
}
