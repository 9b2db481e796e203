package com.flow.discovery.service.cut;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A partitioning of graph nodes into at least two disjoint, non-empty parts.
 *
 * For {@link CutType#LOOP} the first part is the body and the remaining parts
 * are redo parts.
 */
public record Cut(CutType type, List<SortedSet<String>> partitions) {

    public Cut {
        Objects.requireNonNull(type, "type");
        if (partitions == null || partitions.size() < 2) {
            throw new IllegalArgumentException("A cut needs at least two partitions");
        }
        var seen = new HashSet<String>();
        partitions = partitions.stream()
                .map(part -> {
                    if (part.isEmpty()) {
                        throw new IllegalArgumentException("Cut partitions must not be empty");
                    }
                    for (String node : part) {
                        if (!seen.add(node)) {
                            throw new IllegalArgumentException("Node " + node + " appears in two partitions");
                        }
                    }
                    return Collections.unmodifiableSortedSet(new TreeSet<>(part));
                })
                .toList();
    }

    public static Cut of(CutType type, List<? extends Set<String>> partitions) {
        return new Cut(type, partitions.stream()
                .map(part -> (SortedSet<String>) new TreeSet<String>(part))
                .toList());
    }

    public int size() {
        return partitions.size();
    }

    public SortedSet<String> partition(int index) {
        return partitions.get(index);
    }

    /**
     * Index of the partition holding the activity.
     */
    public Optional<Integer> partitionOf(String activity) {
        for (int i = 0; i < partitions.size(); i++) {
            if (partitions.get(i).contains(activity)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    public SortedSet<String> nodes() {
        var nodes = new TreeSet<String>();
        partitions.forEach(nodes::addAll);
        return nodes;
    }

    @Override
    public String toString() {
        return type + partitions.toString();
    }
}
