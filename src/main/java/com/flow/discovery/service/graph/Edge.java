package com.flow.discovery.service.graph;

/**
 * A weighted directly-follows edge.
 */
public record Edge(String source, String target, long weight) {

    public DirectedPair pair() {
        return new DirectedPair(source, target);
    }
}
