package com.flow.discovery.service.engine;

import com.flow.discovery.service.graph.DirectedPair;
import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.log.EventLog;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges rare activities into the bin of the frequent activity whose
 * behavioural profile they resemble most, then drops bins that stay too rare.
 *
 * A profile holds the predecessor and successor sets, the mean relative
 * position of the activity in its traces and its context variety (distinct
 * predecessor/successor pairs around it). Bin membership depends only on
 * {@code minBinFreq}; the simplification threshold only decides which bins
 * are dropped, so raising it never retains more activities.
 */
@Slf4j
public class ActivityBinner {

    static final int MIN_ALPHABET_SIZE = 5;

    // Context marker for trace boundaries; labels are never blank.
    private static final String BOUNDARY = "";

    private final double similarityThreshold;

    public ActivityBinner(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public ActivityBinning bin(EventLog eventLog, double minBinFreq, double simplificationThreshold) {
        var frequencies = eventLog.activityFrequencies();
        if (frequencies.size() <= MIN_ALPHABET_SIZE) {
            return ActivityBinning.identity(eventLog);
        }
        long total = frequencies.values().stream().mapToLong(Long::longValue).sum();
        Map<String, Profile> profiles = profiles(eventLog);

        var frequent = new ArrayList<String>();
        var rare = new ArrayList<String>();
        frequencies.forEach((activity, frequency) -> {
            if ((double) frequency / total >= minBinFreq) {
                frequent.add(activity);
            } else {
                rare.add(activity);
            }
        });

        var representativeOf = new TreeMap<String, String>();
        frequent.forEach(activity -> representativeOf.put(activity, activity));
        for (String activity : rare) {
            representativeOf.put(activity, closestFrequent(activity, frequent, profiles));
        }

        var binFrequency = new TreeMap<String, Long>();
        representativeOf.forEach((activity, representative) ->
                binFrequency.merge(representative, frequencies.get(activity), Long::sum));
        long largestBin = binFrequency.values().stream().mapToLong(Long::longValue).max().orElse(0L);
        double cutoff = simplificationThreshold * largestBin;

        var dropped = new TreeSet<String>();
        representativeOf.forEach((activity, representative) -> {
            if (binFrequency.get(representative) < cutoff) {
                dropped.add(activity);
            }
        });
        dropped.forEach(representativeOf::remove);

        EventLog binned = rewrite(eventLog, representativeOf);
        log.debug("Binned {} activities into {} (dropped {})",
                frequencies.size(), new TreeSet<>(representativeOf.values()).size(), dropped.size());
        return new ActivityBinning(binned, representativeOf, dropped);
    }

    private String closestFrequent(String activity, List<String> frequent, Map<String, Profile> profiles) {
        String best = activity;
        double bestSimilarity = -1.0;
        Profile profile = profiles.get(activity);
        for (String candidate : frequent) {
            double similarity = profile.similarity(profiles.get(candidate));
            if (similarity > bestSimilarity) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }
        return bestSimilarity >= similarityThreshold ? best : activity;
    }

    // Traces emptied by dropped bins disappear, as with activity filtering.
    private static EventLog rewrite(EventLog eventLog, Map<String, String> representativeOf) {
        var builder = EventLog.builder();
        eventLog.traces().forEach((trace, frequency) -> {
            if (trace.isEmpty()) {
                builder.add(trace, frequency);
                return;
            }
            var rewritten = new ArrayList<String>(trace.size());
            for (String activity : trace) {
                String representative = representativeOf.get(activity);
                if (representative != null) {
                    rewritten.add(representative);
                }
            }
            if (!rewritten.isEmpty()) {
                builder.add(rewritten, frequency);
            }
        });
        return builder.build();
    }

    // ==================== Profiles ====================

    static Map<String, Profile> profiles(EventLog eventLog) {
        var graph = DirectlyFollowsGraph.fromLog(eventLog);
        var positionSums = new HashMap<String, Double>();
        var occurrences = new HashMap<String, Long>();
        var contexts = new HashMap<String, Set<DirectedPair>>();

        eventLog.traces().forEach((trace, frequency) -> {
            int length = trace.size();
            for (int i = 0; i < length; i++) {
                String activity = trace.get(i);
                double position = length == 1 ? 0.5 : (double) i / (length - 1);
                positionSums.merge(activity, position * frequency, Double::sum);
                occurrences.merge(activity, frequency, Long::sum);
                String before = i > 0 ? trace.get(i - 1) : BOUNDARY;
                String after = i + 1 < length ? trace.get(i + 1) : BOUNDARY;
                contexts.computeIfAbsent(activity, k -> new HashSet<>()).add(new DirectedPair(before, after));
            }
        });

        var profiles = new HashMap<String, Profile>();
        for (String activity : graph.nodes()) {
            profiles.put(activity, new Profile(
                    graph.predecessors(activity),
                    graph.successors(activity),
                    positionSums.get(activity) / occurrences.get(activity),
                    contexts.get(activity).size()));
        }
        return profiles;
    }

    record Profile(Set<String> predecessors, Set<String> successors, double meanPosition, int contextVariety) {

        /**
         * Mean of predecessor overlap, successor overlap, position closeness
         * and context-variety ratio; 1.0 for identical profiles.
         */
        double similarity(Profile other) {
            double predecessorOverlap = jaccard(predecessors, other.predecessors);
            double successorOverlap = jaccard(successors, other.successors);
            double positionCloseness = 1.0 - Math.abs(meanPosition - other.meanPosition);
            int maxVariety = Math.max(contextVariety, other.contextVariety);
            double varietyRatio = maxVariety == 0 ? 1.0
                    : (double) Math.min(contextVariety, other.contextVariety) / maxVariety;
            return (predecessorOverlap + successorOverlap + positionCloseness + varietyRatio) / 4.0;
        }

        private static double jaccard(Set<String> left, Set<String> right) {
            if (left.isEmpty() && right.isEmpty()) {
                return 1.0;
            }
            var union = new HashSet<>(left);
            union.addAll(right);
            var intersection = new HashSet<>(left);
            intersection.retainAll(right);
            return (double) intersection.size() / union.size();
        }
    }
}
