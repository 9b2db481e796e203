package com.flow.discovery.service.engine;

import com.flow.discovery.service.log.EventLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flow.discovery.service.engine.InductiveMinerTest.log;
import static org.assertj.core.api.Assertions.assertThat;

class MiningCacheTest {

    private final MiningCache cache = new MiningCache(4);

    @Test
    @DisplayName("Graphs are memoized by log content")
    void graphsMemoized() {
        var first = cache.graph(log("AB", 2));
        var second = cache.graph(log("AB", 2));

        assertThat(second).isSameAs(first);
        assertThat(cache.edgeFrequencies(log("AB", 2))).containsOnlyKeys(first.edges().get(0).pair());
    }

    @Test
    @DisplayName("Filtered logs are memoized per threshold pair")
    void filteredLogsMemoized() {
        EventLog eventLog = log("AB", 10, "AC", 1);

        EventLog filtered = cache.filteredLog(eventLog, 0.0, 0.5);

        assertThat(filtered.traces()).containsOnlyKeys(List.of("A", "B"));
        assertThat(cache.filteredLog(eventLog, 0.0, 0.5)).isSameAs(filtered);
        assertThat(cache.filteredLog(eventLog, 0.0, 0.0)).isEqualTo(eventLog);
    }

    @Test
    @DisplayName("Regions are bounded independently")
    void boundedRegions() {
        for (int i = 0; i < 10; i++) {
            cache.graph(log("A".repeat(i + 1), 1));
        }

        assertThat(cache.regions()).extracting(LruCache::getName)
                .containsExactly("edge-frequencies", "graphs", "filtered-graphs", "binnings", "filtered-logs");
        assertThat(cache.regions()).allSatisfy(region -> assertThat(region.size()).isLessThanOrEqualTo(4));
    }

    @Test
    @DisplayName("Clearing empties every region")
    void clear() {
        cache.graph(log("AB", 1));
        cache.filteredLog(log("AB", 1), 0.0, 0.0);

        cache.clear();

        assertThat(cache.size()).isZero();
    }
}
