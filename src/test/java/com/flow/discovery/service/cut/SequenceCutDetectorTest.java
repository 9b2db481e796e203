package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.log.EventLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceCutDetectorTest {

    private final SequenceCutDetector detector = new SequenceCutDetector();

    private static DirectlyFollowsGraph graph(List<List<String>> traces) {
        return DirectlyFollowsGraph.fromLog(EventLog.fromTraces(traces));
    }

    private static SortedSet<String> set(String... activities) {
        return new TreeSet<>(List.of(activities));
    }

    @Test
    @DisplayName("A single linear trace yields one partition per activity in order")
    void linearTrace() {
        var cut = detector.detect(graph(List.of(List.of("A", "B", "C", "D", "E", "F"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(
                set("A"), set("B"), set("C"), set("D"), set("E"), set("F"));
    }

    @Test
    @DisplayName("A skippable middle activity keeps its own partition")
    void skippedPartition() {
        var cut = detector.detect(graph(List.of(List.of("1", "2", "3"), List.of("1", "3"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(set("1"), set("2"), set("3"));
    }

    @Test
    @DisplayName("Mutually reachable activities share a partition")
    void loopInsideSequence() {
        var cut = detector.detect(graph(List.of(
                List.of("A", "B", "C", "B", "C", "D"), List.of("A", "B", "C", "D"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(set("A"), set("B", "C"), set("D"));
    }

    @Test
    @DisplayName("Parallel activities between fixed start and end share a partition")
    void parallelInsideSequence() {
        var cut = detector.detect(graph(List.of(
                List.of("A", "B", "C", "D"), List.of("A", "C", "B", "D"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(set("A"), set("B", "C"), set("D"));
    }

    @Test
    @DisplayName("A fully cyclic graph has no sequence cut")
    void noCut() {
        assertThat(detector.detect(graph(List.of(List.of("A", "B", "C"), List.of("B", "C", "A")))))
                .isEmpty();
    }

    @Test
    @DisplayName("A single node has no sequence cut")
    void singleNode() {
        assertThat(detector.detect(graph(List.of(List.of("A"))))).isEmpty();
    }
}
