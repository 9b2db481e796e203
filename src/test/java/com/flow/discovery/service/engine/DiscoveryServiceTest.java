package com.flow.discovery.service.engine;

import com.flow.discovery.service.config.DiscoveryConfig;
import com.flow.discovery.service.config.MetricsConfig;
import com.flow.discovery.service.config.MinerConfig;
import com.flow.discovery.service.cut.CutSearch;
import com.flow.discovery.service.log.EventLog;
import com.flow.discovery.service.log.InvalidLogException;
import com.flow.discovery.service.split.LogSplitter;
import com.flow.discovery.service.tree.ProcessTree;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flow.discovery.service.engine.InductiveMinerTest.log;
import static com.flow.discovery.service.tree.ProcessTree.activity;
import static com.flow.discovery.service.tree.ProcessTree.sequence;
import static com.flow.discovery.service.tree.ProcessTree.xor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryServiceTest {

    private SimpleMeterRegistry registry;
    private MiningCache cache;
    private DiscoveryService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var config = new DiscoveryConfig();
        var minerConfig = new MinerConfig();
        cache = minerConfig.miningCache(config);
        CutSearch cutSearch = minerConfig.cutSearch();
        LogSplitter splitter = minerConfig.logSplitter();
        NoiseFilter noiseFilter = minerConfig.noiseFilter(cache);

        service = new DiscoveryService(config, cache, new MetricsConfig(registry), List.of(
                minerConfig.inductiveMiner(cache, cutSearch, splitter),
                minerConfig.infrequentInductiveMiner(cache, cutSearch, splitter, noiseFilter),
                minerConfig.approximateInductiveMiner(config, cache, cutSearch, splitter, noiseFilter)));
        service.init();
    }

    // ==================== Discovery ====================

    @Test
    @DisplayName("Every algorithm mines a clean sequence identically")
    void allAlgorithmsAgreeOnSequence() {
        EventLog eventLog = log("ABC", 10);

        for (Algorithm algorithm : Algorithm.values()) {
            DiscoveryResult result = service.discover(eventLog, algorithm);

            assertThat(result.algorithm()).isEqualTo(algorithm);
            assertThat(result.tree()).isEqualTo(sequence(activity("A"), activity("B"), activity("C")));
        }
        assertThat(service.supportedAlgorithms()).containsExactlyInAnyOrder(Algorithm.values());
    }

    @Test
    @DisplayName("Default trace filtering drops rare variants before mining")
    void defaultTraceFiltering() {
        EventLog eventLog = log("ABC", 10, "ACB", 1);

        DiscoveryResult result = service.discover(eventLog, Algorithm.INDUCTIVE);

        assertThat(result.inputVariants()).isEqualTo(2);
        assertThat(result.minedVariants()).isEqualTo(1);
        assertThat(result.tree()).isEqualTo(sequence(activity("A"), activity("B"), activity("C")));
        assertThat(result.parameters().tracesThreshold()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Activity metrics describe the unfiltered input log")
    void activityMetricsOnInput() {
        EventLog eventLog = log("ABC", 10, "AXC", 1);

        DiscoveryResult result = service.discover(eventLog, Algorithm.INDUCTIVE);

        assertThat(result.tree().activities()).doesNotContain("X");
        assertThat(result.activities()).containsKeys("A", "B", "C", "X");
        assertThat(result.activities().get("A").frequency()).isEqualTo(11);
        assertThat(result.activities().get("X").frequency()).isEqualTo(1);
    }

    @Test
    @DisplayName("Request parameters override the defaults")
    void parameterOverride() {
        EventLog eventLog = log("ABC", 10, "ACB", 1);
        MiningParameters parameters = service.defaultParameters().toBuilder().tracesThreshold(0.0).build();

        DiscoveryResult result = service.discover(eventLog, Algorithm.INDUCTIVE, parameters);

        assertThat(result.minedVariants()).isEqualTo(2);
        assertThat(result.tree().activities()).containsExactly("A", "B", "C");
        assertThat(result.run().getRecursionCalls()).isGreaterThan(1);
    }

    @Test
    @DisplayName("A halfway minimum trace frequency keeps the variant at the even neighbour")
    void halfwayTraceThreshold() {
        EventLog eventLog = log("AB", 5, "AC", 2);
        MiningParameters parameters = service.defaultParameters().toBuilder().tracesThreshold(0.5).build();

        DiscoveryResult result = service.discover(eventLog, Algorithm.INDUCTIVE, parameters);

        assertThat(result.minedVariants()).isEqualTo(2);
        assertThat(result.tree().equivalentTo(sequence(activity("A"), xor(activity("B"), activity("C"))))).isTrue();
    }

    @Test
    @DisplayName("An empty log mines to a silent step")
    void emptyLog() {
        DiscoveryResult result = service.discover(EventLog.empty(), Algorithm.APPROXIMATE);

        assertThat(result.tree()).isEqualTo(ProcessTree.tau());
    }

    // ==================== Rejection ====================

    @Test
    @DisplayName("A missing log is rejected and counted")
    void nullLogRejected() {
        assertThatThrownBy(() -> service.discover(null, Algorithm.INDUCTIVE))
                .isInstanceOf(InvalidLogException.class);

        assertThat(registry.get("discovery.rejected.count").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Out-of-range parameters are rejected before mining")
    void invalidParametersRejected() {
        MiningParameters parameters = service.defaultParameters().toBuilder().noiseThreshold(1.5).build();

        assertThatThrownBy(() -> service.discover(log("AB", 1), Algorithm.INFREQUENT, parameters))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("noiseThreshold");

        assertThat(registry.get("discovery.rejected.count").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("discovery.count").tag("algorithm", "INFREQUENT").counter().count()).isZero();
    }

    @Test
    @DisplayName("A missing algorithm is rejected")
    void nullAlgorithmRejected() {
        assertThatThrownBy(() -> service.discover(log("AB", 1), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Metrics and Cache ====================

    @Test
    @DisplayName("Completed discoveries are counted and timed per algorithm")
    void discoveryMetrics() {
        service.discover(log("AB", 3), Algorithm.APPROXIMATE);
        service.discover(log("AB", 3), Algorithm.APPROXIMATE);

        assertThat(registry.get("discovery.count").tag("algorithm", "APPROXIMATE").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("discovery.duration").tag("algorithm", "APPROXIMATE").timer().count())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Cache gauges are registered per region and the cache can be cleared")
    void cacheGaugesAndClear() {
        service.discover(log("ABC", 5, "ACB", 5), Algorithm.INDUCTIVE);

        assertThat(registry.find("discovery.cache.size").gauges()).hasSize(5);
        assertThat(registry.get("discovery.cache.size").tag("region", "graphs").gauge().value())
                .isGreaterThan(0.0);
        assertThat(cache.size()).isPositive();

        service.clearCache();

        assertThat(cache.size()).isZero();
        assertThat(registry.get("discovery.cache.size").tag("region", "graphs").gauge().value()).isZero();
    }
}
