package com.flow.discovery.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.discovery.service.engine.ActivityBinning;
import com.flow.discovery.service.engine.DiscoveryResult;
import com.flow.discovery.service.engine.MiningParameters;
import com.flow.discovery.service.engine.MiningRun;
import com.flow.discovery.service.log.ActivityMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * DTO for discovery results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscoveryResponse {

    private String algorithm;

    private TreeNodeResponse tree;

    /**
     * Compact rendering of the tree, e.g. {@code SEQUENCE(A, XOR(B, C))}.
     */
    private String treeText;

    /**
     * Frequency and display size of every activity of the input log.
     */
    private Map<String, ActivityMetrics> activities;

    /**
     * Activity bins applied by the approximate miner, keyed by representative.
     */
    private Map<String, SortedSet<String>> bins;

    /**
     * Activities removed with dropped bins.
     */
    private Set<String> droppedActivities;

    private StatisticsResponse statistics;

    private MiningParameters parameters;

    public static DiscoveryResponse from(DiscoveryResult result) {
        MiningRun run = result.run();
        ActivityBinning binning = run.getBinning();
        var cuts = new LinkedHashMap<String, Integer>();
        run.getCuts().forEach((type, count) -> cuts.put(type.name(), count));

        return DiscoveryResponse.builder()
                .algorithm(result.algorithm().name())
                .tree(TreeNodeResponse.from(result.tree()))
                .treeText(result.tree().toString())
                .activities(result.activities())
                .bins(binning == null ? null : binning.bins())
                .droppedActivities(binning == null ? null : binning.dropped())
                .statistics(StatisticsResponse.builder()
                        .inputVariants(result.inputVariants())
                        .minedVariants(result.minedVariants())
                        .sampledCases(run.getSampledCases())
                        .recursionCalls(run.getRecursionCalls())
                        .maxDepth(run.getMaxDepthReached())
                        .baseCases(run.getBaseCases())
                        .fallthroughs(run.getFallthroughs())
                        .flowerModels(run.getFlowerModels())
                        .depthLimitHits(run.getDepthLimitHits())
                        .degradedBranches(run.getDegradedBranches())
                        .cuts(cuts)
                        .durationMillis(result.durationMillis())
                        .build())
                .parameters(result.parameters())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatisticsResponse {
        private int inputVariants;
        private int minedVariants;
        private long sampledCases;
        private int recursionCalls;
        private int maxDepth;
        private int baseCases;
        private int fallthroughs;
        private int flowerModels;
        private int depthLimitHits;
        private int degradedBranches;
        private Map<String, Integer> cuts;
        private long durationMillis;
    }
}
