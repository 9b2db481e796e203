package com.flow.discovery.service.engine;

import com.flow.discovery.service.log.EventLog;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of binning a log: the rewritten log, the representative of every
 * retained activity and the activities whose bins were dropped.
 */
public record ActivityBinning(EventLog log, Map<String, String> representativeOf, SortedSet<String> dropped) {

    public ActivityBinning {
        representativeOf = Collections.unmodifiableMap(new TreeMap<>(representativeOf));
        dropped = Collections.unmodifiableSortedSet(new TreeSet<>(dropped));
    }

    public static ActivityBinning identity(EventLog eventLog) {
        var identity = new TreeMap<String, String>();
        eventLog.alphabet().forEach(activity -> identity.put(activity, activity));
        return new ActivityBinning(eventLog, identity, Collections.emptySortedSet());
    }

    /**
     * Bins holding more than one activity, keyed by representative.
     */
    public SortedMap<String, SortedSet<String>> bins() {
        var bins = new TreeMap<String, SortedSet<String>>();
        representativeOf.forEach((activity, representative) ->
                bins.computeIfAbsent(representative, k -> new TreeSet<>()).add(activity));
        bins.values().removeIf(members -> members.size() < 2);
        return bins;
    }

    public SortedSet<String> retainedActivities() {
        return new TreeSet<>(representativeOf.values());
    }

    public boolean isIdentity() {
        return dropped.isEmpty() && bins().isEmpty();
    }
}
