package com.flow.discovery.service.graph;

/**
 * An ordered pair of activities: {@code target} directly follows {@code source}.
 */
public record DirectedPair(String source, String target) implements Comparable<DirectedPair> {

    @Override
    public int compareTo(DirectedPair other) {
        int bySource = source.compareTo(other.source);
        return bySource != 0 ? bySource : target.compareTo(other.target);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
