package com.flow.discovery.service.engine;

import com.flow.discovery.service.config.DiscoveryConfig;
import com.flow.discovery.service.config.MetricsConfig;
import com.flow.discovery.service.log.ActivityStatistics;
import com.flow.discovery.service.log.EventLog;
import com.flow.discovery.service.log.InvalidLogException;
import com.flow.discovery.service.tree.ProcessTree;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for process discovery.
 *
 * Validates the parameters, filters the input log (cached), runs the selected
 * miner and computes the activity metrics of the input log.
 */
@Slf4j
@Service
public class DiscoveryService {

    private final DiscoveryConfig config;
    private final MiningCache cache;
    private final MetricsConfig metricsConfig;
    private final Map<Algorithm, InductiveMiner> miners = new EnumMap<>(Algorithm.class);

    public DiscoveryService(DiscoveryConfig config, MiningCache cache, MetricsConfig metricsConfig,
                            List<InductiveMiner> miners) {
        this.config = config;
        this.cache = cache;
        this.metricsConfig = metricsConfig;
        miners.forEach(miner -> this.miners.put(miner.algorithm(), miner));
    }

    @PostConstruct
    void init() {
        cache.regions().forEach(region -> {
            metricsConfig.registerCacheGauge("discovery.cache.size", region.getName(),
                    "Current entries of a mining cache region", region::size);
            metricsConfig.registerCacheGauge("discovery.cache.hit_rate", region.getName(),
                    "Hit rate of a mining cache region", region::getHitRate);
        });
        log.info("DiscoveryService initialized with algorithms: {}", miners.keySet());
    }

    // ==================== Discovery ====================

    public DiscoveryResult discover(EventLog eventLog, Algorithm algorithm) {
        return discover(eventLog, algorithm, defaultParameters());
    }

    /**
     * Mines a process tree.
     *
     * @throws InvalidLogException when the log is missing
     * @throws IllegalArgumentException when a parameter is out of range or the algorithm unsupported
     */
    public DiscoveryResult discover(EventLog eventLog, Algorithm algorithm, MiningParameters parameters) {
        MiningParameters resolved = validate(eventLog, algorithm, parameters);
        InductiveMiner miner = miners.get(algorithm);

        log.info("Starting {} discovery on {} variants ({} cases, {} events)",
                algorithm, eventLog.size(), eventLog.totalFrequency(), eventLog.eventCount());
        long start = System.nanoTime();

        EventLog filtered = cache.filteredLog(eventLog, resolved.activityThreshold(), resolved.tracesThreshold());
        var run = new MiningRun();
        ProcessTree tree = miner.mine(filtered, resolved, run);

        long elapsed = System.nanoTime() - start;
        recordMetrics(algorithm, resolved, run, elapsed);
        log.info("Finished {} discovery in {} ms: {} nodes, {} recursion calls, {} fallthroughs",
                algorithm, TimeUnit.NANOSECONDS.toMillis(elapsed), tree.nodeCount(),
                run.getRecursionCalls(), run.getFallthroughs());

        return DiscoveryResult.builder()
                .algorithm(algorithm)
                .tree(tree)
                .activities(ActivityStatistics.of(eventLog))
                .parameters(resolved)
                .run(run)
                .inputVariants(eventLog.size())
                .minedVariants(filtered.size())
                .durationMillis(TimeUnit.NANOSECONDS.toMillis(elapsed))
                .build();
    }

    // ==================== Queries ====================

    public MiningParameters defaultParameters() {
        return config.defaultParameters();
    }

    public Set<Algorithm> supportedAlgorithms() {
        return miners.keySet();
    }

    public void clearCache() {
        cache.clear();
    }

    // ==================== Helpers ====================

    private MiningParameters validate(EventLog eventLog, Algorithm algorithm, MiningParameters parameters) {
        try {
            if (eventLog == null) {
                throw new InvalidLogException("Event log is required");
            }
            if (algorithm == null || !miners.containsKey(algorithm)) {
                throw new IllegalArgumentException("Unsupported algorithm: " + algorithm);
            }
            if (parameters == null) {
                throw new IllegalArgumentException("Mining parameters are required");
            }
            return parameters.validate();
        } catch (RuntimeException e) {
            metricsConfig.getRejectedRequests().increment();
            log.warn("Rejected discovery request: {}", e.getMessage());
            throw e;
        }
    }

    private void recordMetrics(Algorithm algorithm, MiningParameters parameters, MiningRun run, long elapsedNanos) {
        metricsConfig.discoveryCounter(algorithm).increment();
        metricsConfig.discoveryTimer(algorithm).record(elapsedNanos, TimeUnit.NANOSECONDS);
        metricsConfig.getFallthroughs().increment(run.getFallthroughs());
        metricsConfig.getDepthLimitHits().increment(run.getDepthLimitHits());
        metricsConfig.getDegradedBranches().increment(run.getDegradedBranches());
        if (run.getDepthLimitHits() > 0) {
            log.warn("{} branch(es) hit the recursion ceiling of {}",
                    run.getDepthLimitHits(), parameters.maxRecursionDepth());
        }
    }
}
