package com.flow.discovery.service.graph;

import com.flow.discovery.service.log.EventLog;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Counts directly-follows pairs of a log, weighted by trace frequency.
 */
public final class EdgeFrequencies {

    private EdgeFrequencies() {
    }

    public static SortedMap<DirectedPair, Long> count(EventLog eventLog) {
        var counts = new TreeMap<DirectedPair, Long>();
        eventLog.traces().forEach((trace, frequency) -> countTrace(trace, frequency, counts));
        return Collections.unmodifiableSortedMap(counts);
    }

    private static void countTrace(List<String> trace, long frequency, SortedMap<DirectedPair, Long> counts) {
        for (int i = 0; i + 1 < trace.size(); i++) {
            counts.merge(new DirectedPair(trace.get(i), trace.get(i + 1)), frequency, Long::sum);
        }
    }
}
