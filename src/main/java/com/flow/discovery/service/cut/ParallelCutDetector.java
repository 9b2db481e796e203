package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Parallel: partitions whose nodes are fully interleaved with every node of
 * every other partition, i.e. connected by edges in both directions.
 *
 * Each partition must hold a start node and an end node. Partitions lacking
 * either are merged into the first partition that has both.
 */
public class ParallelCutDetector implements CutDetector {

    @Override
    public CutType type() {
        return CutType.PARALLEL;
    }

    @Override
    public Optional<Cut> detect(DirectlyFollowsGraph graph) {
        var nodes = new ArrayList<>(graph.nodes());
        if (nodes.size() < 2) {
            return Optional.empty();
        }
        var sets = new DisjointSets(nodes);
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                String a = nodes.get(i);
                String b = nodes.get(j);
                if (!graph.containsEdge(a, b) || !graph.containsEdge(b, a)) {
                    sets.union(a, b);
                }
            }
        }
        List<SortedSet<String>> groups = sets.sets();
        if (groups.size() < 2) {
            return Optional.empty();
        }

        var valid = new ArrayList<SortedSet<String>>();
        var invalid = new ArrayList<SortedSet<String>>();
        for (SortedSet<String> group : groups) {
            if (hasStartAndEnd(graph, group)) {
                valid.add(new TreeSet<>(group));
            } else {
                invalid.add(group);
            }
        }
        if (valid.isEmpty()) {
            return Optional.empty();
        }
        invalid.forEach(valid.get(0)::addAll);
        if (valid.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new Cut(CutType.PARALLEL, valid));
    }

    private static boolean hasStartAndEnd(DirectlyFollowsGraph graph, SortedSet<String> group) {
        return group.stream().anyMatch(graph::isStartNode) && group.stream().anyMatch(graph::isEndNode);
    }
}
