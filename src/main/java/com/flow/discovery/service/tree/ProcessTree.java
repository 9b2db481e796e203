package com.flow.discovery.service.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable process tree node.
 *
 * Leaves are {@link Operator#ACTIVITY} (with a label) or {@link Operator#TAU};
 * they have no children. A {@link Operator#LOOP} holds its body first followed
 * by one or more redo children. The other operators hold at least one child.
 */
public record ProcessTree(Operator operator, String label, List<ProcessTree> children) {

    public static final String TAU_LABEL = "tau";

    private static final ProcessTree TAU = new ProcessTree(Operator.TAU, null, List.of());

    public ProcessTree {
        Objects.requireNonNull(operator, "operator");
        children = children == null ? List.of() : List.copyOf(children);
        if (operator.isLeaf() && !children.isEmpty()) {
            throw new IllegalArgumentException(operator + " leaf cannot have children");
        }
        if (operator == Operator.ACTIVITY && (label == null || label.isBlank())) {
            throw new IllegalArgumentException("Activity leaf needs a label");
        }
        if (operator != Operator.ACTIVITY && label != null) {
            throw new IllegalArgumentException(operator + " node cannot carry a label");
        }
        if (operator == Operator.LOOP && children.size() < 2) {
            throw new IllegalArgumentException("LOOP needs a body and at least one redo child");
        }
        if (!operator.isLeaf() && children.isEmpty()) {
            throw new IllegalArgumentException(operator + " needs at least one child");
        }
    }

    // ==================== Factories ====================

    public static ProcessTree tau() {
        return TAU;
    }

    public static ProcessTree activity(String label) {
        return new ProcessTree(Operator.ACTIVITY, label, List.of());
    }

    public static ProcessTree of(Operator operator, List<ProcessTree> children) {
        return new ProcessTree(operator, null, children);
    }

    public static ProcessTree sequence(ProcessTree... children) {
        return of(Operator.SEQUENCE, List.of(children));
    }

    public static ProcessTree xor(ProcessTree... children) {
        return of(Operator.XOR, List.of(children));
    }

    public static ProcessTree parallel(ProcessTree... children) {
        return of(Operator.PARALLEL, List.of(children));
    }

    public static ProcessTree loop(ProcessTree body, ProcessTree... redo) {
        var children = new ArrayList<ProcessTree>(redo.length + 1);
        children.add(body);
        children.addAll(List.of(redo));
        return of(Operator.LOOP, children);
    }

    /**
     * LOOP(tau, a1, ..., an) over the sorted activities: any behaviour over them.
     */
    public static ProcessTree flower(Collection<String> activities) {
        if (activities.isEmpty()) {
            return TAU;
        }
        var children = new ArrayList<ProcessTree>();
        children.add(TAU);
        new TreeSet<>(activities).forEach(activity -> children.add(activity(activity)));
        return of(Operator.LOOP, children);
    }

    // ==================== Queries ====================

    public boolean isLeaf() {
        return operator.isLeaf();
    }

    public boolean isTau() {
        return operator == Operator.TAU;
    }

    public SortedSet<String> activities() {
        var activities = new TreeSet<String>();
        collectActivities(activities);
        return activities;
    }

    private void collectActivities(SortedSet<String> activities) {
        if (operator == Operator.ACTIVITY) {
            activities.add(label);
        }
        children.forEach(child -> child.collectActivities(activities));
    }

    public int depth() {
        return 1 + children.stream().mapToInt(ProcessTree::depth).max().orElse(0);
    }

    public int nodeCount() {
        return 1 + children.stream().mapToInt(ProcessTree::nodeCount).sum();
    }

    /**
     * Structural equality that ignores child order where it carries no meaning:
     * the children of XOR and PARALLEL and the redo children of LOOP.
     */
    public boolean equivalentTo(ProcessTree other) {
        if (other == null || operator != other.operator || children.size() != other.children.size()) {
            return false;
        }
        switch (operator) {
            case ACTIVITY:
                return label.equals(other.label);
            case TAU:
                return true;
            case SEQUENCE:
                for (int i = 0; i < children.size(); i++) {
                    if (!children.get(i).equivalentTo(other.children.get(i))) {
                        return false;
                    }
                }
                return true;
            case LOOP:
                return children.get(0).equivalentTo(other.children.get(0))
                        && sameChildrenInAnyOrder(children.subList(1, children.size()),
                        other.children.subList(1, other.children.size()));
            default:
                return sameChildrenInAnyOrder(children, other.children);
        }
    }

    private static boolean sameChildrenInAnyOrder(List<ProcessTree> left, List<ProcessTree> right) {
        boolean[] matched = new boolean[right.size()];
        for (ProcessTree candidate : left) {
            boolean found = false;
            for (int j = 0; j < right.size(); j++) {
                if (!matched[j] && candidate.equivalentTo(right.get(j))) {
                    matched[j] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compact rendering, e.g. {@code SEQUENCE(A, XOR(tau, B))}.
     */
    @Override
    public String toString() {
        if (operator == Operator.ACTIVITY) {
            return label;
        }
        if (operator == Operator.TAU) {
            return TAU_LABEL;
        }
        return children.stream()
                .map(ProcessTree::toString)
                .collect(Collectors.joining(", ", operator + "(", ")"));
    }
}
