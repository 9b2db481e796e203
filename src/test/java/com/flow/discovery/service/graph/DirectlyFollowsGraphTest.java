package com.flow.discovery.service.graph;

import com.flow.discovery.service.log.EventLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectlyFollowsGraphTest {

    private static SortedSet<String> set(String... activities) {
        return new TreeSet<>(List.of(activities));
    }

    private static EventLog log() {
        var frequencies = new LinkedHashMap<List<String>, Integer>();
        frequencies.put(List.of("A", "B", "C"), 3);
        frequencies.put(List.of("A", "C"), 2);
        frequencies.put(List.of("D"), 1);
        frequencies.put(List.of(), 4);
        return EventLog.of(frequencies);
    }

    // ==================== Construction ====================

    @Test
    @DisplayName("Edges are weighted by summed trace frequency")
    void edgeWeights() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        assertThat(graph.edgeWeight("A", "B")).isEqualTo(3);
        assertThat(graph.edgeWeight("B", "C")).isEqualTo(3);
        assertThat(graph.edgeWeight("A", "C")).isEqualTo(2);
        assertThat(graph.edgeWeight("C", "A")).isZero();
        assertThat(graph.edgeCount()).isEqualTo(3);
        assertThat(graph.maxEdgeWeight()).isEqualTo(3);
    }

    @Test
    @DisplayName("Start and end nodes come from non-empty traces")
    void startAndEndNodes() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        assertThat(graph.nodes()).containsExactly("A", "B", "C", "D");
        assertThat(graph.startNodes()).containsExactly("A", "D");
        assertThat(graph.endNodes()).containsExactly("C", "D");
    }

    @Test
    @DisplayName("Repeated pairs within one trace count once per occurrence")
    void repeatedPairs() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(
                EventLog.builder().add(List.of("A", "B", "A", "B"), 2).build());

        assertThat(graph.edgeWeight("A", "B")).isEqualTo(4);
        assertThat(graph.edgeWeight("B", "A")).isEqualTo(2);
    }

    @Test
    @DisplayName("Builder rejects non-positive edge weights")
    void rejectsNonPositiveWeight() {
        assertThatThrownBy(() -> DirectlyFollowsGraph.builder().addEdge("A", "B", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Graph of the empty log has no nodes")
    void emptyLog() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(EventLog.empty());

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.hasEdges()).isFalse();
        assertThat(graph.strongestEdge()).isEmpty();
    }

    // ==================== Queries ====================

    @Test
    @DisplayName("Unknown nodes have no neighbours")
    void unknownNodes() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        assertThat(graph.successors("X")).isEmpty();
        assertThat(graph.predecessors("X")).isEmpty();
        assertThat(graph.reachableFrom("X")).isEmpty();
        assertThat(graph.containsNode("X")).isFalse();
    }

    @Test
    @DisplayName("Reachability follows edges transitively; a node reaches itself only on a cycle")
    void reachability() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        assertThat(graph.reachableFrom("A")).containsExactlyInAnyOrder("B", "C");
        assertThat(graph.isReachable("C", "A")).isFalse();
        assertThat(graph.isReachable("A", "A")).isFalse();

        DirectlyFollowsGraph cyclic = DirectlyFollowsGraph.fromLog(
                EventLog.fromTraces(List.of(List.of("A", "B", "A"))));
        assertThat(cyclic.isReachable("A", "A")).isTrue();
    }

    @Test
    @DisplayName("Weakly connected components are ordered by smallest node")
    void connectedComponents() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        assertThat(graph.connectedComponents()).containsExactly(set("A", "B", "C"), set("D"));
    }

    @Test
    @DisplayName("Retaining edges keeps nodes, start and end nodes")
    void retainEdges() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        DirectlyFollowsGraph heavy = graph.retainEdges(edge -> edge.weight() >= 3);

        assertThat(heavy.nodes()).isEqualTo(graph.nodes());
        assertThat(heavy.startNodes()).isEqualTo(graph.startNodes());
        assertThat(heavy.endNodes()).isEqualTo(graph.endNodes());
        assertThat(heavy.edges()).containsExactly(new Edge("A", "B", 3), new Edge("B", "C", 3));
    }

    @Test
    @DisplayName("Strongest edge ties resolve to source/target order")
    void strongestEdgeTie() {
        DirectlyFollowsGraph graph = DirectlyFollowsGraph.fromLog(log());

        assertThat(graph.strongestEdge()).contains(new Edge("A", "B", 3));
    }

    @Test
    @DisplayName("Graphs built from equal logs are equal")
    void equality() {
        assertThat(DirectlyFollowsGraph.fromLog(log())).isEqualTo(DirectlyFollowsGraph.fromLog(log()));
    }

    @Test
    @DisplayName("Edge frequencies match the graph's edge weights")
    void edgeFrequencies() {
        var frequencies = EdgeFrequencies.count(log());

        assertThat(frequencies).containsEntry(new DirectedPair("A", "B"), 3L)
                .containsEntry(new DirectedPair("A", "C"), 2L)
                .hasSize(3);
    }
}
