package com.flow.discovery.service.engine;

import com.flow.discovery.service.log.ActivityMetrics;
import com.flow.discovery.service.tree.ProcessTree;
import lombok.Builder;

import java.util.Map;

/**
 * Outcome of one discovery call.
 *
 * @param activities metrics of every activity of the input log, before filtering
 * @param run counters collected while mining, including the applied binning
 * @param inputVariants distinct traces of the input log
 * @param minedVariants distinct traces left after threshold filtering
 */
@Builder
public record DiscoveryResult(
        Algorithm algorithm,
        ProcessTree tree,
        Map<String, ActivityMetrics> activities,
        MiningParameters parameters,
        MiningRun run,
        int inputVariants,
        int minedVariants,
        long durationMillis
) {
}
