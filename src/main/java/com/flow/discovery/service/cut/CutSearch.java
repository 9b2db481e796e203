package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Runs the cut detectors in priority order: exclusive, sequence, parallel, loop.
 */
@Slf4j
public class CutSearch {

    private final List<CutDetector> detectors;

    public CutSearch(List<CutDetector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(CutDetector::type))
                .toList();
    }

    public static CutSearch standard() {
        return new CutSearch(List.of(
                new ExclusiveCutDetector(),
                new SequenceCutDetector(),
                new ParallelCutDetector(),
                new LoopCutDetector()));
    }

    public List<CutDetector> detectors() {
        return detectors;
    }

    /**
     * The first cut found, or empty when no detector finds one.
     */
    public Optional<Cut> findCut(DirectlyFollowsGraph graph) {
        return findCut(graph, cut -> true);
    }

    /**
     * The first cut found that the acceptor accepts. A rejected cut does not
     * stop the search; the next detector is tried.
     */
    public Optional<Cut> findCut(DirectlyFollowsGraph graph, Predicate<Cut> acceptor) {
        return this.<Cut>findFirst(graph, cut -> acceptor.test(cut) ? Optional.of(cut) : Optional.empty());
    }

    /**
     * Evaluates every cut found, in priority order, and returns the first
     * non-empty evaluation.
     */
    public <T> Optional<T> findFirst(DirectlyFollowsGraph graph, Function<Cut, Optional<T>> evaluator) {
        for (CutDetector detector : detectors) {
            Optional<Cut> cut = detector.detect(graph);
            if (cut.isEmpty()) {
                continue;
            }
            Optional<T> result = evaluator.apply(cut.get());
            if (result.isPresent()) {
                log.debug("Found {} cut: {}", detector.type(), cut.get().partitions());
                return result;
            }
            log.debug("Rejected {} cut: {}", detector.type(), cut.get().partitions());
        }
        return Optional.empty();
    }
}
