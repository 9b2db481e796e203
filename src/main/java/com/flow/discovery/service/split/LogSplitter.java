package com.flow.discovery.service.split;

import com.flow.discovery.service.cut.Cut;
import com.flow.discovery.service.log.EventLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * Splits a log into one sub-log per partition of a cut.
 *
 * <ul>
 *   <li>Exclusive: each trace goes to the partition holding all of its
 *       activities, or else to the partition it overlaps most, projected onto
 *       it. Empty traces are skipped.</li>
 *   <li>Sequence: every partition receives the projection of every trace,
 *       which is empty when the case skips the partition.</li>
 *   <li>Parallel: every non-empty trace is projected onto every partition.</li>
 *   <li>Loop: each maximal run of activities from one partition becomes one
 *       sub-trace of that partition.</li>
 * </ul>
 */
public class LogSplitter {

    public List<EventLog> split(EventLog eventLog, Cut cut) {
        switch (cut.type()) {
            case EXCLUSIVE:
                return exclusiveSplit(eventLog, cut.partitions());
            case SEQUENCE:
                return sequenceSplit(eventLog, cut.partitions());
            case PARALLEL:
                return parallelSplit(eventLog, cut.partitions());
            case LOOP:
                return loopSplit(eventLog, cut.partitions());
            default:
                throw new IllegalArgumentException("Unsupported cut type: " + cut.type());
        }
    }

    // ==================== Split Rules ====================

    public List<EventLog> exclusiveSplit(EventLog eventLog, List<SortedSet<String>> partitions) {
        var builders = builders(partitions.size());
        eventLog.traces().forEach((trace, frequency) -> {
            if (trace.isEmpty()) {
                return;
            }
            int target = bestPartition(trace, partitions);
            var projection = project(trace, partitions.get(target));
            if (!projection.isEmpty()) {
                builders.get(target).add(projection, frequency);
            }
        });
        return build(builders);
    }

    public List<EventLog> sequenceSplit(EventLog eventLog, List<SortedSet<String>> partitions) {
        var builders = builders(partitions.size());
        eventLog.traces().forEach((trace, frequency) -> {
            for (int i = 0; i < partitions.size(); i++) {
                builders.get(i).add(project(trace, partitions.get(i)), frequency);
            }
        });
        return build(builders);
    }

    public List<EventLog> parallelSplit(EventLog eventLog, List<SortedSet<String>> partitions) {
        var builders = builders(partitions.size());
        eventLog.traces().forEach((trace, frequency) -> {
            if (trace.isEmpty()) {
                return;
            }
            for (int i = 0; i < partitions.size(); i++) {
                builders.get(i).add(project(trace, partitions.get(i)), frequency);
            }
        });
        return build(builders);
    }

    public List<EventLog> loopSplit(EventLog eventLog, List<SortedSet<String>> partitions) {
        var builders = builders(partitions.size());
        eventLog.traces().forEach((trace, frequency) -> {
            int current = -1;
            var run = new ArrayList<String>();
            for (String activity : trace) {
                int owner = indexOf(activity, partitions);
                if (owner < 0) {
                    continue;
                }
                if (owner != current && !run.isEmpty()) {
                    builders.get(current).add(run, frequency);
                    run = new ArrayList<>();
                }
                current = owner;
                run.add(activity);
            }
            if (!run.isEmpty()) {
                builders.get(current).add(run, frequency);
            }
        });
        return build(builders);
    }

    // ==================== Helpers ====================

    static List<String> project(List<String> trace, Set<String> partition) {
        var projection = new ArrayList<String>(trace.size());
        for (String activity : trace) {
            if (partition.contains(activity)) {
                projection.add(activity);
            }
        }
        return projection;
    }

    // The partition sharing the most activities with the trace; ties go to the lower index.
    private static int bestPartition(List<String> trace, List<SortedSet<String>> partitions) {
        int best = 0;
        long bestOverlap = -1;
        for (int i = 0; i < partitions.size(); i++) {
            var partition = partitions.get(i);
            long overlap = trace.stream().filter(partition::contains).count();
            if (overlap == trace.size()) {
                return i;
            }
            if (overlap > bestOverlap) {
                best = i;
                bestOverlap = overlap;
            }
        }
        return best;
    }

    private static int indexOf(String activity, List<SortedSet<String>> partitions) {
        for (int i = 0; i < partitions.size(); i++) {
            if (partitions.get(i).contains(activity)) {
                return i;
            }
        }
        return -1;
    }

    private static List<EventLog.Builder> builders(int count) {
        var builders = new ArrayList<EventLog.Builder>(count);
        for (int i = 0; i < count; i++) {
            builders.add(EventLog.builder());
        }
        return builders;
    }

    private static List<EventLog> build(List<EventLog.Builder> builders) {
        return builders.stream().map(EventLog.Builder::build).toList();
    }
}
