package com.flow.discovery.service.engine;

import com.flow.discovery.service.cut.CutType;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters of a single mining call. Not shared between calls.
 */
@Getter
public class MiningRun {

    private int recursionCalls;
    private int maxDepthReached;
    private int baseCases;
    private int fallthroughs;
    private int flowerModels;
    private int depthLimitHits;
    private int degradedBranches;
    private int filteredCuts;
    private int simplifiedCuts;
    private int gridCuts;
    private final Map<CutType, Integer> cuts = new EnumMap<>(CutType.class);
    private ActivityBinning binning;
    private long sampledCases;

    void enter(int depth) {
        recursionCalls++;
        maxDepthReached = Math.max(maxDepthReached, depth);
    }

    void baseCase() {
        baseCases++;
    }

    void cut(CutType type) {
        cuts.merge(type, 1, Integer::sum);
    }

    void fallthrough() {
        fallthroughs++;
    }

    void flowerModel() {
        flowerModels++;
    }

    void depthLimitHit() {
        depthLimitHits++;
    }

    void degraded() {
        degradedBranches++;
    }

    void filteredCut() {
        filteredCuts++;
    }

    void simplifiedCut() {
        simplifiedCuts++;
    }

    void gridCut() {
        gridCuts++;
    }

    void binned(ActivityBinning binning) {
        this.binning = binning;
    }

    void sampled(long cases) {
        this.sampledCases = cases;
    }

    public Map<CutType, Integer> getCuts() {
        return Collections.unmodifiableMap(cuts);
    }
}
