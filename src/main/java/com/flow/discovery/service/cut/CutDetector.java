package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;

import java.util.Optional;

/**
 * Detects one kind of cut on a directly-follows graph.
 *
 * Implementations are pure functions of the graph. Finding no cut is a normal
 * result and is reported as {@link Optional#empty()}.
 */
public interface CutDetector {

    CutType type();

    Optional<Cut> detect(DirectlyFollowsGraph graph);
}
