package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Sequence: groups of nodes that are pairwise either mutually reachable or
 * mutually unreachable, ordered so that every earlier group reaches every
 * later one.
 *
 * Groups are ranked by how many other groups they reach, the group holding a
 * start node winning ties. When some node of a later group still reaches a
 * node of an earlier group, every group between the two is merged.
 */
public class SequenceCutDetector implements CutDetector {

    @Override
    public CutType type() {
        return CutType.SEQUENCE;
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
                if (graph.isReachable(a, b) == graph.isReachable(b, a)) {
                    sets.union(a, b);
                }
            }
        }
        List<SortedSet<String>> groups = sets.sets();
        if (groups.size() < 2) {
            return Optional.empty();
        }
        groups = order(graph, groups);
        groups = repair(graph, groups);
        if (groups.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new Cut(CutType.SEQUENCE, groups));
    }

    private List<SortedSet<String>> order(DirectlyFollowsGraph graph, List<SortedSet<String>> groups) {
        var ordered = new ArrayList<>(groups);
        var reach = new HashMap<SortedSet<String>, Integer>();
        groups.forEach(group -> reach.put(group, reachedGroups(graph, group, groups)));
        Comparator<SortedSet<String>> byReach = Comparator.comparingInt(group -> -reach.get(group));
        Comparator<SortedSet<String>> byStart = Comparator.comparing(group -> !containsStartNode(graph, group));
        ordered.sort(byReach.thenComparing(byStart).thenComparing(group -> group.first()));
        return ordered;
    }

    private List<SortedSet<String>> repair(DirectlyFollowsGraph graph, List<SortedSet<String>> ordered) {
        var groups = new ArrayList<>(ordered);
        boolean merged = true;
        while (merged && groups.size() > 1) {
            merged = false;
            search:
            for (int i = 0; i < groups.size(); i++) {
                for (int j = groups.size() - 1; j > i; j--) {
                    if (reaches(graph, groups.get(j), groups.get(i))) {
                        mergeRange(groups, i, j);
                        merged = true;
                        break search;
                    }
                }
            }
        }
        return groups;
    }

    private static void mergeRange(List<SortedSet<String>> groups, int from, int to) {
        var union = new TreeSet<String>();
        for (int k = from; k <= to; k++) {
            union.addAll(groups.get(k));
        }
        groups.subList(from, to + 1).clear();
        groups.add(from, union);
    }

    private static int reachedGroups(DirectlyFollowsGraph graph, SortedSet<String> group, List<SortedSet<String>> groups) {
        int reached = 0;
        for (SortedSet<String> other : groups) {
            if (other != group && reaches(graph, group, other)) {
                reached++;
            }
        }
        return reached;
    }

    private static boolean reaches(DirectlyFollowsGraph graph, SortedSet<String> from, SortedSet<String> to) {
        for (String source : from) {
            for (String target : graph.reachableFrom(source)) {
                if (to.contains(target)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsStartNode(DirectlyFollowsGraph graph, SortedSet<String> group) {
        return group.stream().anyMatch(graph::isStartNode);
    }
}
