package com.flow.discovery.service.cut;

import com.flow.discovery.service.tree.Operator;

/**
 * Kinds of cut, in the priority order in which they are searched.
 */
public enum CutType {
    EXCLUSIVE(Operator.XOR),
    SEQUENCE(Operator.SEQUENCE),
    PARALLEL(Operator.PARALLEL),
    LOOP(Operator.LOOP);

    private final Operator operator;

    CutType(Operator operator) {
        this.operator = operator;
    }

    /**
     * The tree operator that wraps the sub-trees mined from this cut's sub-logs.
     */
    public Operator operator() {
        return operator;
    }
}
