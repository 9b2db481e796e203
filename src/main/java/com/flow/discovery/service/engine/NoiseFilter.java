package com.flow.discovery.service.engine;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.graph.Edge;
import com.flow.discovery.service.log.EventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops directly-follows edges lighter than a share of the heaviest edge.
 *
 * Nodes, start and end nodes are kept. If every edge would go, the strongest
 * one stays so the graph keeps its main connection. Used both as the noise
 * filter of the infrequent miner and as the graph simplification of the
 * approximate miner.
 */
@Slf4j
@RequiredArgsConstructor
public class NoiseFilter {

    private final MiningCache cache;

    /**
     * The filtered graph of a log, memoized per (log, threshold).
     */
    public DirectlyFollowsGraph filter(EventLog eventLog, double threshold) {
        if (threshold <= 0) {
            return cache.graph(eventLog);
        }
        return cache.filteredGraph(eventLog, threshold, () -> filter(cache.graph(eventLog), threshold));
    }

    public static DirectlyFollowsGraph filter(DirectlyFollowsGraph graph, double threshold) {
        if (threshold <= 0 || !graph.hasEdges()) {
            return graph;
        }
        double cutoff = threshold * graph.maxEdgeWeight();
        DirectlyFollowsGraph filtered = graph.retainEdges(edge -> edge.weight() >= cutoff);
        if (!filtered.hasEdges()) {
            Edge strongest = graph.strongestEdge().orElseThrow();
            log.debug("Filtering at {} removed every edge; keeping {}", threshold, strongest);
            filtered = graph.retainEdges(strongest::equals);
        }
        log.debug("Noise filter at {} kept {} of {} edges", threshold, filtered.edgeCount(), graph.edgeCount());
        return filtered;
    }
}
