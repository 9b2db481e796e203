package com.flow.discovery.service.engine;

import com.flow.discovery.service.graph.DirectedPair;
import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.graph.EdgeFrequencies;
import com.flow.discovery.service.log.EventLog;
import com.flow.discovery.service.log.LogFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.SortedMap;
import java.util.function.Supplier;

/**
 * Memoizes mining intermediates keyed by log content.
 *
 * Each region is a separate bounded LRU cache with its own lock. Log hashes
 * are computed once per {@link EventLog}, so lookups stay cheap during
 * recursion.
 */
@Slf4j
public class MiningCache {

    private final LruCache<EventLog, SortedMap<DirectedPair, Long>> edgeFrequencies;
    private final LruCache<EventLog, DirectlyFollowsGraph> graphs;
    private final LruCache<ThresholdKey, DirectlyFollowsGraph> filteredGraphs;
    private final LruCache<BinningKey, ActivityBinning> binnings;
    private final LruCache<LogFilterKey, EventLog> filteredLogs;

    public MiningCache(int maxEntries) {
        this.edgeFrequencies = new LruCache<>("edge-frequencies", maxEntries);
        this.graphs = new LruCache<>("graphs", maxEntries);
        this.filteredGraphs = new LruCache<>("filtered-graphs", maxEntries);
        this.binnings = new LruCache<>("binnings", maxEntries);
        this.filteredLogs = new LruCache<>("filtered-logs", maxEntries);
    }

    // ==================== Regions ====================

    public SortedMap<DirectedPair, Long> edgeFrequencies(EventLog eventLog) {
        return edgeFrequencies.getOrCompute(eventLog, EdgeFrequencies::count);
    }

    public DirectlyFollowsGraph graph(EventLog eventLog) {
        return graphs.getOrCompute(eventLog,
                key -> DirectlyFollowsGraph.fromLog(key, edgeFrequencies(key)));
    }

    public DirectlyFollowsGraph filteredGraph(EventLog eventLog, double threshold,
                                              Supplier<DirectlyFollowsGraph> filter) {
        return filteredGraphs.getOrCompute(new ThresholdKey(eventLog, threshold), key -> filter.get());
    }

    public ActivityBinning binning(EventLog eventLog, double minBinFreq, double simplificationThreshold,
                                   Supplier<ActivityBinning> binner) {
        return binnings.getOrCompute(new BinningKey(eventLog, minBinFreq, simplificationThreshold),
                key -> binner.get());
    }

    public EventLog filteredLog(EventLog eventLog, double activityThreshold, double tracesThreshold) {
        return filteredLogs.getOrCompute(new LogFilterKey(eventLog, activityThreshold, tracesThreshold),
                key -> LogFilter.apply(key.log(), key.activityThreshold(), key.tracesThreshold()));
    }

    // ==================== Management ====================

    public List<LruCache<?, ?>> regions() {
        return List.of(edgeFrequencies, graphs, filteredGraphs, binnings, filteredLogs);
    }

    public int size() {
        return regions().stream().mapToInt(LruCache::size).sum();
    }

    public void clear() {
        regions().forEach(region -> {
            region.clear();
            region.resetStats();
        });
        log.info("Cleared mining cache");
    }

    record ThresholdKey(EventLog log, double threshold) {
    }

    record BinningKey(EventLog log, double minBinFreq, double simplificationThreshold) {
    }

    record LogFilterKey(EventLog log, double activityThreshold, double tracesThreshold) {
    }
}
