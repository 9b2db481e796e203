package com.flow.discovery.service.tree;

/**
 * Node kinds of a process tree.
 */
public enum Operator {
    SEQUENCE,
    XOR,
    PARALLEL,
    LOOP,
    ACTIVITY,
    TAU;

    public boolean isLeaf() {
        return this == ACTIVITY || this == TAU;
    }
}
