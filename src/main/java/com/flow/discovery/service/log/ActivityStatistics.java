package com.flow.discovery.service.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes {@link ActivityMetrics} for every activity of a log.
 *
 * Frequencies are bucketed by quartile: values up to Q1, Q2 and Q3 get the
 * scales 1.0, 1.5 and 2.0, values above Q3 get 2.5 and the maximum gets 3.0.
 */
public final class ActivityStatistics {

    static final double MIN_NODE_WIDTH = 1.5;

    private ActivityStatistics() {
    }

    public static Map<String, ActivityMetrics> of(EventLog eventLog) {
        var frequencies = eventLog.activityFrequencies();
        if (frequencies.isEmpty()) {
            return Collections.emptyMap();
        }
        long[] sorted = frequencies.values().stream().mapToLong(Long::longValue).sorted().toArray();
        double q1 = percentile(sorted, 0.25);
        double q2 = percentile(sorted, 0.50);
        double q3 = percentile(sorted, 0.75);
        long max = sorted[sorted.length - 1];

        var metrics = new LinkedHashMap<String, ActivityMetrics>();
        frequencies.forEach((activity, frequency) -> {
            double scale = scale(frequency, q1, q2, q3, max);
            double width = scale / 2 + MIN_NODE_WIDTH;
            metrics.put(activity, new ActivityMetrics(frequency, scale, width, width / 3));
        });
        return Collections.unmodifiableMap(metrics);
    }

    static double scale(long frequency, double q1, double q2, double q3, long max) {
        if (frequency <= q1) {
            return 1.0;
        }
        if (frequency <= q2) {
            return 1.5;
        }
        if (frequency <= q3) {
            return 2.0;
        }
        return frequency < max ? 2.5 : 3.0;
    }

    // Linear interpolation between closest ranks.
    static double percentile(long[] sorted, double fraction) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
