package com.flow.discovery.service.graph;

import com.flow.discovery.service.log.EventLog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Directly-follows graph of an event log.
 *
 * Nodes are all activities of the log, edges are weighted by the summed
 * frequency of the traces in which the pair occurs. Start and end nodes are
 * the first and last activities of non-empty traces. Queries about unknown
 * nodes return empty results. Instances are immutable; reachable sets are
 * memoized lazily, so a graph can be shared through the mining cache.
 */
public final class DirectlyFollowsGraph {

    private final SortedSet<String> nodes;
    private final SortedSet<String> startNodes;
    private final SortedSet<String> endNodes;
    private final Map<String, SortedMap<String, Long>> outgoing;
    private final Map<String, SortedMap<String, Long>> incoming;
    private final Map<String, Set<String>> reachable = new ConcurrentHashMap<>();

    private DirectlyFollowsGraph(Builder builder) {
        this.nodes = Collections.unmodifiableSortedSet(new TreeSet<>(builder.nodes));
        this.startNodes = Collections.unmodifiableSortedSet(new TreeSet<>(builder.startNodes));
        this.endNodes = Collections.unmodifiableSortedSet(new TreeSet<>(builder.endNodes));
        this.outgoing = freeze(builder.outgoing);
        this.incoming = freeze(builder.incoming);
    }

    // ==================== Construction ====================

    public static DirectlyFollowsGraph fromLog(EventLog eventLog) {
        return fromLog(eventLog, EdgeFrequencies.count(eventLog));
    }

    /**
     * Builds the graph of a log from its already counted edge frequencies.
     */
    public static DirectlyFollowsGraph fromLog(EventLog eventLog, Map<DirectedPair, Long> edgeFrequencies) {
        var builder = builder();
        eventLog.traces().keySet().forEach(trace -> {
            if (trace.isEmpty()) {
                return;
            }
            builder.addStartNode(trace.get(0));
            builder.addEndNode(trace.get(trace.size() - 1));
            trace.forEach(builder::addNode);
        });
        edgeFrequencies.forEach((pair, weight) -> builder.addEdge(pair.source(), pair.target(), weight));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A graph with the same nodes, start and end nodes, holding only the
     * edges accepted by the predicate.
     */
    public DirectlyFollowsGraph retainEdges(Predicate<Edge> predicate) {
        var builder = builder();
        nodes.forEach(builder::addNode);
        startNodes.forEach(builder::addStartNode);
        endNodes.forEach(builder::addEndNode);
        edges().stream()
                .filter(predicate)
                .forEach(edge -> builder.addEdge(edge.source(), edge.target(), edge.weight()));
        return builder.build();
    }

    // ==================== Structure ====================

    public SortedSet<String> nodes() {
        return nodes;
    }

    public SortedSet<String> startNodes() {
        return startNodes;
    }

    public SortedSet<String> endNodes() {
        return endNodes;
    }

    public boolean containsNode(String node) {
        return nodes.contains(node);
    }

    public boolean isStartNode(String node) {
        return startNodes.contains(node);
    }

    public boolean isEndNode(String node) {
        return endNodes.contains(node);
    }

    public Set<String> successors(String node) {
        return outgoing.getOrDefault(node, Collections.emptySortedMap()).keySet();
    }

    public Set<String> predecessors(String node) {
        return incoming.getOrDefault(node, Collections.emptySortedMap()).keySet();
    }

    public boolean containsEdge(String source, String target) {
        return successors(source).contains(target);
    }

    public long edgeWeight(String source, String target) {
        return outgoing.getOrDefault(source, Collections.emptySortedMap()).getOrDefault(target, 0L);
    }

    /**
     * All edges, ordered by source then target.
     */
    public List<Edge> edges() {
        var edges = new ArrayList<Edge>();
        outgoing.forEach((source, targets) ->
                targets.forEach((target, weight) -> edges.add(new Edge(source, target, weight))));
        return edges;
    }

    public int edgeCount() {
        return outgoing.values().stream().mapToInt(Map::size).sum();
    }

    public boolean hasEdges() {
        return !outgoing.isEmpty();
    }

    public long maxEdgeWeight() {
        return strongestEdge().map(Edge::weight).orElse(0L);
    }

    /**
     * The heaviest edge; ties resolve to the first edge in source/target order.
     */
    public Optional<Edge> strongestEdge() {
        Edge strongest = null;
        for (Edge edge : edges()) {
            if (strongest == null || edge.weight() > strongest.weight()) {
                strongest = edge;
            }
        }
        return Optional.ofNullable(strongest);
    }

    // ==================== Reachability ====================

    /**
     * Whether {@code target} can be reached from {@code source} by following at
     * least one edge. A node reaches itself only through a cycle.
     */
    public boolean isReachable(String source, String target) {
        return reachableFrom(source).contains(target);
    }

    public Set<String> reachableFrom(String source) {
        if (!nodes.contains(source)) {
            return Collections.emptySet();
        }
        return reachable.computeIfAbsent(source, this::forwardSearch);
    }

    private Set<String> forwardSearch(String source) {
        var visited = new TreeSet<String>();
        var queue = new ArrayDeque<>(successors(source));
        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (visited.add(node)) {
                queue.addAll(successors(node));
            }
        }
        return Collections.unmodifiableSet(visited);
    }

    /**
     * Weakly connected components, each sorted, ordered by their smallest node.
     */
    public List<SortedSet<String>> connectedComponents() {
        var components = new ArrayList<SortedSet<String>>();
        var visited = new TreeSet<String>();
        for (String start : nodes) {
            if (visited.contains(start)) {
                continue;
            }
            var component = new TreeSet<String>();
            var queue = new ArrayDeque<String>();
            queue.add(start);
            visited.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                component.add(node);
                for (String neighbour : neighbours(node)) {
                    if (visited.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    private Set<String> neighbours(String node) {
        var neighbours = new TreeSet<>(successors(node));
        neighbours.addAll(predecessors(node));
        return neighbours;
    }

    // ==================== Object ====================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectlyFollowsGraph other)) return false;
        return nodes.equals(other.nodes)
                && startNodes.equals(other.startNodes)
                && endNodes.equals(other.endNodes)
                && outgoing.equals(other.outgoing);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode() * 31 + outgoing.hashCode();
    }

    @Override
    public String toString() {
        return "DirectlyFollowsGraph{nodes=" + nodes
                + ", start=" + startNodes
                + ", end=" + endNodes
                + ", edges=" + edges() + "}";
    }

    private static Map<String, SortedMap<String, Long>> freeze(Map<String, SortedMap<String, Long>> adjacency) {
        var frozen = new TreeMap<String, SortedMap<String, Long>>();
        adjacency.forEach((node, targets) ->
                frozen.put(node, Collections.unmodifiableSortedMap(new TreeMap<>(targets))));
        return Collections.unmodifiableMap(frozen);
    }

    // ==================== Builder ====================

    public static final class Builder {

        private final Set<String> nodes = new TreeSet<>();
        private final Set<String> startNodes = new TreeSet<>();
        private final Set<String> endNodes = new TreeSet<>();
        private final Map<String, SortedMap<String, Long>> outgoing = new TreeMap<>();
        private final Map<String, SortedMap<String, Long>> incoming = new TreeMap<>();

        private Builder() {
        }

        public Builder addNode(String node) {
            nodes.add(node);
            return this;
        }

        public Builder addStartNode(String node) {
            nodes.add(node);
            startNodes.add(node);
            return this;
        }

        public Builder addEndNode(String node) {
            nodes.add(node);
            endNodes.add(node);
            return this;
        }

        /**
         * Adds {@code weight} to the edge, registering both endpoints as nodes.
         *
         * @throws IllegalArgumentException if the weight is not positive
         */
        public Builder addEdge(String source, String target, long weight) {
            if (weight <= 0) {
                throw new IllegalArgumentException(
                        "Edge " + source + "->" + target + " must have a positive weight, was " + weight);
            }
            nodes.add(source);
            nodes.add(target);
            outgoing.computeIfAbsent(source, k -> new TreeMap<>()).merge(target, weight, Long::sum);
            incoming.computeIfAbsent(target, k -> new TreeMap<>()).merge(source, weight, Long::sum);
            return this;
        }

        public DirectlyFollowsGraph build() {
            return new DirectlyFollowsGraph(this);
        }
    }
}
