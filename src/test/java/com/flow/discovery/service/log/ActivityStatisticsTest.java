package com.flow.discovery.service.log;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ActivityStatisticsTest {

    @Test
    @DisplayName("The most frequent activity gets the largest scale")
    void maxActivityHasLargestScale() {
        var frequencies = new LinkedHashMap<List<String>, Integer>();
        frequencies.put(List.of("A", "B"), 10);
        frequencies.put(List.of("A", "C"), 3);
        frequencies.put(List.of("A", "D"), 1);
        var metrics = ActivityStatistics.of(EventLog.of(frequencies));

        assertThat(metrics).containsOnlyKeys("A", "B", "C", "D");
        assertThat(metrics.get("A").frequency()).isEqualTo(14);
        assertThat(metrics.get("A").scale()).isEqualTo(3.0);
        assertThat(metrics.get("D").scale()).isEqualTo(1.0);
        assertThat(metrics.get("B").scale()).isLessThan(metrics.get("A").scale());
    }

    @Test
    @DisplayName("Width and height derive from the scale")
    void dimensionsFollowScale() {
        var metrics = ActivityStatistics.of(EventLog.fromTraces(List.of(List.of("A"))));
        ActivityMetrics a = metrics.get("A");

        assertThat(a.width()).isCloseTo(a.scale() / 2 + ActivityStatistics.MIN_NODE_WIDTH, within(1e-9));
        assertThat(a.height()).isCloseTo(a.width() / 3, within(1e-9));
    }

    @Test
    @DisplayName("Percentiles interpolate linearly")
    void percentileInterpolates() {
        long[] sorted = {1, 2, 3, 4};

        assertThat(ActivityStatistics.percentile(sorted, 0.5)).isCloseTo(2.5, within(1e-9));
        assertThat(ActivityStatistics.percentile(sorted, 0.0)).isEqualTo(1.0);
        assertThat(ActivityStatistics.percentile(sorted, 1.0)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Empty log has no metrics")
    void emptyLog() {
        assertThat(ActivityStatistics.of(EventLog.empty())).isEmpty();
    }
}
