package com.flow.discovery.service.log;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Relative-frequency filtering of an input log.
 *
 * Trace filtering runs first; the activities to drop are computed on the
 * unfiltered log. Thresholds are clamped to [0, 1]; minimum frequencies are
 * rounded half to even.
 */
@Slf4j
public final class LogFilter {

    private LogFilter() {
    }

    public static EventLog apply(EventLog eventLog, double activityThreshold, double tracesThreshold) {
        SortedSet<String> infrequent = activitiesToRemove(eventLog, activityThreshold);
        EventLog filtered = removeActivities(filterTraces(eventLog, tracesThreshold), infrequent);
        log.debug("Filtered log from {} to {} variants (activity threshold {}, traces threshold {})",
                eventLog.size(), filtered.size(), activityThreshold, tracesThreshold);
        return filtered;
    }

    /**
     * Activities whose appearance frequency is below
     * {@code round(threshold * maxActivityFrequency)}, ties to even.
     */
    public static SortedSet<String> activitiesToRemove(EventLog eventLog, double threshold) {
        var frequencies = eventLog.activityFrequencies();
        if (frequencies.isEmpty()) {
            return Collections.emptySortedSet();
        }
        long max = Collections.max(frequencies.values());
        long minimum = roundHalfEven(clamp(threshold) * max);
        var removed = new TreeSet<String>();
        frequencies.forEach((activity, frequency) -> {
            if (frequency < minimum) {
                removed.add(activity);
            }
        });
        return removed;
    }

    public static long minimumTraceFrequency(EventLog eventLog, double threshold) {
        long max = eventLog.traces().values().stream().mapToLong(Long::longValue).max().orElse(0L);
        return roundHalfEven(clamp(threshold) * max);
    }

    /**
     * Keeps the traces whose frequency reaches the minimum trace frequency.
     */
    public static EventLog filterTraces(EventLog eventLog, double threshold) {
        long minimum = minimumTraceFrequency(eventLog, threshold);
        if (minimum <= 1) {
            return eventLog;
        }
        var builder = EventLog.builder();
        eventLog.traces().forEach((trace, frequency) -> {
            if (frequency >= minimum) {
                builder.add(trace, frequency);
            }
        });
        return builder.build();
    }

    /**
     * Drops the given activities from every trace. Traces emptied by the removal
     * disappear; traces that were already empty stay.
     */
    public static EventLog removeActivities(EventLog eventLog, Set<String> activities) {
        if (activities.isEmpty()) {
            return eventLog;
        }
        var builder = EventLog.builder();
        eventLog.traces().forEach((trace, frequency) -> {
            if (trace.isEmpty()) {
                builder.add(trace, frequency);
                return;
            }
            var kept = new ArrayList<String>(trace.size());
            for (String activity : trace) {
                if (!activities.contains(activity)) {
                    kept.add(activity);
                }
            }
            if (!kept.isEmpty()) {
                builder.add(kept, frequency);
            }
        });
        log.debug("Removed {} infrequent activities: {}", activities.size(), activities);
        return builder.build();
    }

    // Ties go to the even neighbour: 2.5 -> 2, 3.5 -> 4.
    static long roundHalfEven(double value) {
        return (long) Math.rint(value);
    }

    static double clamp(double threshold) {
        return Math.max(0.0, Math.min(1.0, threshold));
    }
}
