package com.flow.discovery.service.engine;

import com.flow.discovery.service.cut.Cut;
import com.flow.discovery.service.cut.CutSearch;
import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.log.EventLog;
import com.flow.discovery.service.split.LogSplitter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Inductive Miner that trades precision for robustness.
 *
 * Before mining, the log is sampled and its rare activities are binned. At
 * every level a cut is searched on the full graph under strict validation,
 * then on the simplified graph under relaxed validation, then on binned and
 * simplified approximations from a fixed parameter grid, before the standard
 * fallthrough applies.
 */
@Slf4j
public class ApproximateInductiveMiner extends InductiveMiner {

    static final List<GridPoint> PARAMETER_GRID = List.of(
            new GridPoint(0.1, 0.2),
            new GridPoint(0.2, 0.3),
            new GridPoint(0.3, 0.5));

    private final NoiseFilter noiseFilter;
    private final ActivityBinner binner;
    private final LogSampler sampler;
    private final CutQualityValidator strictValidator;
    private final CutQualityValidator relaxedValidator;
    private final ApproximationOptions options;

    public ApproximateInductiveMiner(MiningCache cache, CutSearch cutSearch, LogSplitter splitter,
                                     NoiseFilter noiseFilter, ActivityBinner binner, LogSampler sampler,
                                     CutQualityValidator strictValidator, CutQualityValidator relaxedValidator,
                                     ApproximationOptions options) {
        super(cache, cutSearch, splitter);
        this.noiseFilter = noiseFilter;
        this.binner = binner;
        this.sampler = sampler;
        this.strictValidator = strictValidator;
        this.relaxedValidator = relaxedValidator;
        this.options = options;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.APPROXIMATE;
    }

    // ==================== Preparation ====================

    @Override
    protected EventLog prepare(EventLog eventLog, MiningParameters parameters, MiningRun run) {
        EventLog sampled = sampler.sample(eventLog, parameters.sampleSize(), parameters.sampleRatio());
        if (sampled != eventLog) {
            run.sampled(sampled.totalFrequency());
        }
        if (!options.binningEnabled()) {
            return sampled;
        }
        ActivityBinning binning = binning(sampled, parameters.minBinFreq(), parameters.simplificationThreshold());
        run.binned(binning);
        if (!binning.isIdentity()) {
            log.info("Binned {} activities into {} bins, dropped {}",
                    sampled.alphabet().size(), binning.retainedActivities().size(), binning.dropped().size());
        }
        return binning.log();
    }

    // ==================== Cut Cascade ====================

    @Override
    protected Optional<CutDecision> decideCut(EventLog eventLog, MiningParameters parameters, MiningRun run) {
        DirectlyFollowsGraph full = cache.graph(eventLog);
        Optional<CutDecision> decision = search(eventLog, full, strictValidator);
        if (decision.isPresent()) {
            return decision;
        }

        if (options.simplificationEnabled() && parameters.simplificationThreshold() > 0) {
            DirectlyFollowsGraph simplified = noiseFilter.filter(eventLog, parameters.simplificationThreshold());
            if (simplified.edgeCount() < full.edgeCount()) {
                decision = search(eventLog, simplified, relaxedValidator);
                if (decision.isPresent()) {
                    run.simplifiedCut();
                    return decision;
                }
            }
        }

        if (!options.binningEnabled() && !options.simplificationEnabled()) {
            return Optional.empty();
        }
        for (GridPoint point : PARAMETER_GRID) {
            EventLog approximated = options.binningEnabled()
                    ? binning(eventLog, point.minBinFreq(), point.simplificationThreshold()).log()
                    : eventLog;
            if (approximated.isEmpty()) {
                continue;
            }
            DirectlyFollowsGraph graph = options.simplificationEnabled()
                    ? noiseFilter.filter(approximated, point.simplificationThreshold())
                    : cache.graph(approximated);
            if (approximated.equals(eventLog) && graph.edgeCount() == full.edgeCount()) {
                continue;
            }
            decision = search(approximated, graph, relaxedValidator);
            if (decision.isPresent()) {
                run.gridCut();
                log.debug("Cut found on approximation (minBinFreq={}, simplification={})",
                        point.minBinFreq(), point.simplificationThreshold());
                return decision;
            }
        }
        return Optional.empty();
    }

    private Optional<CutDecision> search(EventLog eventLog, DirectlyFollowsGraph graph, CutQualityValidator validator) {
        return cutSearch.findFirst(graph, cut -> evaluate(eventLog, cut, validator));
    }

    private Optional<CutDecision> evaluate(EventLog eventLog, Cut cut, CutQualityValidator validator) {
        List<EventLog> subLogs = splitter.split(eventLog, cut);
        if (options.validationEnabled() && !validator.accept(eventLog, cut, subLogs)) {
            return Optional.empty();
        }
        return Optional.of(new CutDecision(cut, eventLog, subLogs));
    }

    private ActivityBinning binning(EventLog eventLog, double minBinFreq, double simplificationThreshold) {
        return cache.binning(eventLog, minBinFreq, simplificationThreshold,
                () -> binner.bin(eventLog, minBinFreq, simplificationThreshold));
    }

    record GridPoint(double minBinFreq, double simplificationThreshold) {
    }
}
