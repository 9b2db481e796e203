package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.log.EventLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class LoopCutDetectorTest {

    private final LoopCutDetector detector = new LoopCutDetector();

    private static DirectlyFollowsGraph graph(List<List<String>> traces) {
        return DirectlyFollowsGraph.fromLog(EventLog.fromTraces(traces));
    }

    private static SortedSet<String> set(String... activities) {
        return new TreeSet<>(List.of(activities));
    }

    @Test
    @DisplayName("Alternating activities form body and redo part")
    void alternating() {
        var cut = detector.detect(graph(List.of(List.of("A", "B", "A", "B", "A", "B", "A"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().type()).isEqualTo(CutType.LOOP);
        assertThat(cut.get().partitions()).containsExactly(set("A"), set("B"));
    }

    @Test
    @DisplayName("Several redo parts are ordered by smallest label")
    void severalRedoParts() {
        var cut = detector.detect(graph(List.of(
                List.of("A", "C", "A", "B", "A"), List.of("A"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(set("A"), set("B"), set("C"));
    }

    @Test
    @DisplayName("A linear trace has no loop cut")
    void noCut() {
        assertThat(detector.detect(graph(List.of(List.of("A", "B", "C", "D", "E", "F"))))).isEmpty();
    }

    @Test
    @DisplayName("A redo candidate entered from a non-end node merges into the body")
    void invalidRedoMerges() {
        // C is entered from A, which is not an end node
        var cut = detector.detect(graph(List.of(
                List.of("A", "C", "B"), List.of("A", "B"))));

        assertThat(cut).isEmpty();
    }

    @Test
    @DisplayName("A redo candidate leaving towards a non-start node merges into the body")
    void redoExitToNonStart() {
        // D returns to C, which is an end node but not a start node
        var cut = detector.detect(graph(List.of(
                List.of("A", "C"), List.of("A", "C", "D", "C"))));

        assertThat(cut).isEmpty();
    }

    @Test
    @DisplayName("Several invalid candidates merge while a valid one stays a redo part")
    void severalInvalidCandidates() {
        var cut = detector.detect(graph(List.of(
                List.of("A", "B"),
                List.of("A", "B", "C", "A", "B"),
                List.of("A", "D", "B"),
                List.of("A", "E", "B"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(set("A", "B", "D", "E"), set("C"));
    }

    @Test
    @DisplayName("A redo part may span several connected activities")
    void multiNodeRedoPart() {
        var cut = detector.detect(graph(List.of(
                List.of("A", "B"), List.of("A", "B", "C", "D", "A", "B"))));

        assertThat(cut).isPresent();
        assertThat(cut.get().partitions()).containsExactly(set("A", "B"), set("C", "D"));
    }
}
