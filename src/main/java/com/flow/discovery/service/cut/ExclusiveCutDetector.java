package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;

import java.util.Optional;

/**
 * Exclusive choice: the weakly connected components of the graph.
 */
public class ExclusiveCutDetector implements CutDetector {

    @Override
    public CutType type() {
        return CutType.EXCLUSIVE;
    }

    @Override
    public Optional<Cut> detect(DirectlyFollowsGraph graph) {
        var components = graph.connectedComponents();
        if (components.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new Cut(CutType.EXCLUSIVE, components));
    }
}
