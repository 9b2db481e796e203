package com.flow.discovery.service.cut;

import com.flow.discovery.service.graph.DirectlyFollowsGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Loop: a body holding every start and end node, plus redo parts that are
 * only entered from end nodes and only left towards start nodes.
 *
 * Redo candidates are the weakly connected components of the graph without
 * the body. A candidate with an edge from a non-end node, or an edge to a
 * non-start node, is merged back into the body. Redo parts are ordered by
 * their smallest label.
 */
public class LoopCutDetector implements CutDetector {

    @Override
    public CutType type() {
        return CutType.LOOP;
    }

    @Override
    public Optional<Cut> detect(DirectlyFollowsGraph graph) {
        if (graph.startNodes().isEmpty() || graph.endNodes().isEmpty()) {
            return Optional.empty();
        }
        var body = new TreeSet<String>(graph.startNodes());
        body.addAll(graph.endNodes());

        var redo = new ArrayList<SortedSet<String>>();
        for (SortedSet<String> candidate : componentsOutside(graph, body)) {
            if (isValidRedo(graph, candidate)) {
                redo.add(candidate);
            } else {
                body.addAll(candidate);
            }
        }
        if (redo.isEmpty()) {
            return Optional.empty();
        }

        var partitions = new ArrayList<SortedSet<String>>(redo.size() + 1);
        partitions.add(body);
        partitions.addAll(redo);
        return Optional.of(new Cut(CutType.LOOP, partitions));
    }

    private static boolean isValidRedo(DirectlyFollowsGraph graph, SortedSet<String> candidate) {
        for (String node : candidate) {
            for (String predecessor : graph.predecessors(node)) {
                if (!candidate.contains(predecessor) && !graph.isEndNode(predecessor)) {
                    return false;
                }
            }
            for (String successor : graph.successors(node)) {
                if (!candidate.contains(successor) && !graph.isStartNode(successor)) {
                    return false;
                }
            }
        }
        return true;
    }

    // Undirected components outside the body, ordered by their smallest node.
    private static List<SortedSet<String>> componentsOutside(DirectlyFollowsGraph graph, SortedSet<String> body) {
        var components = new ArrayList<SortedSet<String>>();
        var visited = new TreeSet<String>(body);
        for (String start : graph.nodes()) {
            if (visited.contains(start)) {
                continue;
            }
            var component = new TreeSet<String>();
            var queue = new ArrayDeque<String>();
            queue.add(start);
            visited.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                component.add(node);
                var neighbours = new TreeSet<String>(graph.successors(node));
                neighbours.addAll(graph.predecessors(node));
                for (String neighbour : neighbours) {
                    if (visited.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }
}
