package com.flow.discovery.service.engine;

import com.flow.discovery.service.cut.Cut;
import com.flow.discovery.service.log.EventLog;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Judges whether a cut found on an approximated graph describes the log well
 * enough to recurse on.
 *
 * A cut passes when every sub-log is non-empty and makes progress, the
 * heuristic of its type holds within the tolerance, and the share of trace
 * frequency consistent with the cut reaches the preservation threshold.
 */
@Slf4j
@Getter
public class CutQualityValidator {

    static final double MAX_LOOP_REDO_SHARE = 0.6;
    static final double MAX_PROGRESS_SHARE = 0.9;

    private final String name;
    private final double tolerance;
    private final double preservationThreshold;

    public CutQualityValidator(String name, double tolerance, double preservationThreshold) {
        this.name = name;
        this.tolerance = tolerance;
        this.preservationThreshold = preservationThreshold;
    }

    public boolean accept(EventLog eventLog, Cut cut, List<EventLog> subLogs) {
        if (!makesProgress(eventLog, subLogs)) {
            log.debug("[{}] rejected {}: a sub-log makes no progress", name, cut);
            return false;
        }
        if (!heuristicHolds(eventLog, cut)) {
            log.debug("[{}] rejected {}: {} heuristic failed", name, cut, cut.type());
            return false;
        }
        double preserved = preservedShare(eventLog, cut);
        if (preserved < preservationThreshold) {
            log.debug("[{}] rejected {}: preserves {} of trace frequency", name, cut, preserved);
            return false;
        }
        return true;
    }

    // ==================== Progress ====================

    boolean makesProgress(EventLog eventLog, List<EventLog> subLogs) {
        var alphabet = eventLog.alphabet();
        for (EventLog subLog : subLogs) {
            if (subLog.isEmpty()) {
                return false;
            }
            if (subLog.alphabet().equals(alphabet) && subLog.size() > MAX_PROGRESS_SHARE * eventLog.size()) {
                return false;
            }
        }
        return true;
    }

    // ==================== Type Heuristics ====================

    boolean heuristicHolds(EventLog eventLog, Cut cut) {
        switch (cut.type()) {
            case EXCLUSIVE:
                return exclusiveOverlap(eventLog, cut) <= tolerance;
            case SEQUENCE:
                return orderedShare(eventLog, cut) >= 1.0 - tolerance;
            case PARALLEL:
                return parallelRepetitionsBounded(eventLog, cut);
            case LOOP:
                return loopRedoShare(cut) <= MAX_LOOP_REDO_SHARE;
            default:
                return false;
        }
    }

    /**
     * Average pairwise Jaccard overlap between the activity sets of the traces
     * routed to each partition.
     */
    double exclusiveOverlap(EventLog eventLog, Cut cut) {
        var routed = new ArrayList<Set<String>>();
        for (int i = 0; i < cut.size(); i++) {
            routed.add(new HashSet<>());
        }
        eventLog.traces().keySet().forEach(trace -> {
            if (!trace.isEmpty()) {
                routed.get(dominantPartition(trace, cut)).addAll(trace);
            }
        });
        double overlap = 0.0;
        int pairs = 0;
        for (int i = 0; i < routed.size(); i++) {
            for (int j = i + 1; j < routed.size(); j++) {
                overlap += jaccard(routed.get(i), routed.get(j));
                pairs++;
            }
        }
        return pairs == 0 ? 0.0 : overlap / pairs;
    }

    /**
     * Share of trace frequency whose activities never step back to an earlier partition.
     */
    double orderedShare(EventLog eventLog, Cut cut) {
        return share(eventLog, trace -> respectsOrder(trace, cut));
    }

    boolean parallelRepetitionsBounded(EventLog eventLog, Cut cut) {
        for (SortedSet<String> partition : cut.partitions()) {
            long repeated = partition.stream().filter(eventLog::hasRepeatedActivity).count();
            if (repeated > tolerance * partition.size()) {
                return false;
            }
        }
        return true;
    }

    double loopRedoShare(Cut cut) {
        int redo = 0;
        for (int i = 1; i < cut.size(); i++) {
            redo += cut.partition(i).size();
        }
        return (double) redo / (redo + cut.partition(0).size());
    }

    // ==================== Preservation ====================

    /**
     * Share of trace frequency whose traces fit the cut as they are.
     */
    double preservedShare(EventLog eventLog, Cut cut) {
        switch (cut.type()) {
            case EXCLUSIVE:
                return share(eventLog, trace -> cut.partitions().stream().anyMatch(p -> p.containsAll(trace)));
            case SEQUENCE:
                return orderedShare(eventLog, cut);
            case PARALLEL:
                return share(eventLog, trace -> cut.partitions().stream()
                        .allMatch(p -> trace.stream().anyMatch(p::contains)));
            case LOOP:
                return share(eventLog, trace -> trace.isEmpty()
                        || (cut.partition(0).contains(trace.get(0))
                        && cut.partition(0).contains(trace.get(trace.size() - 1))));
            default:
                return 0.0;
        }
    }

    // ==================== Helpers ====================

    private static double share(EventLog eventLog, Predicate<List<String>> fits) {
        long total = eventLog.totalFrequency();
        if (total == 0) {
            return 1.0;
        }
        long fitting = 0;
        for (var entry : eventLog.traces().entrySet()) {
            if (fits.test(entry.getKey())) {
                fitting += entry.getValue();
            }
        }
        return (double) fitting / total;
    }

    private static boolean respectsOrder(List<String> trace, Cut cut) {
        int current = 0;
        for (String activity : trace) {
            int index = cut.partitionOf(activity).orElse(current);
            if (index < current) {
                return false;
            }
            current = index;
        }
        return true;
    }

    private static int dominantPartition(List<String> trace, Cut cut) {
        int best = 0;
        long bestOverlap = -1;
        for (int i = 0; i < cut.size(); i++) {
            var partition = cut.partition(i);
            long overlap = trace.stream().filter(partition::contains).count();
            if (overlap > bestOverlap) {
                best = i;
                bestOverlap = overlap;
            }
        }
        return best;
    }

    private static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        var union = new TreeSet<>(left);
        union.addAll(right);
        var intersection = new TreeSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size();
    }
}
