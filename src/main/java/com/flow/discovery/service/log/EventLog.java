package com.flow.discovery.service.log;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable event log: a multiset of traces, stored as trace -> frequency.
 *
 * Traces are ordered lists of activity labels and may be empty. Every
 * frequency is positive and every trace key is unique. The content hash is
 * computed once, so a log can be used directly as a cache key.
 */
public final class EventLog {

    private static final EventLog EMPTY = new EventLog(Map.of());

    private final Map<List<String>, Long> traces;
    private final int hash;

    private EventLog(Map<List<String>, Long> traces) {
        this.traces = Collections.unmodifiableMap(traces);
        this.hash = traces.hashCode();
    }

    // ==================== Factories ====================

    public static EventLog empty() {
        return EMPTY;
    }

    /**
     * Builds a log from an ordered list of traces; duplicate traces aggregate.
     */
    public static EventLog fromTraces(Collection<? extends List<String>> traces) {
        if (traces == null) {
            throw new InvalidLogException("Trace list must not be null");
        }
        var builder = builder();
        traces.forEach(trace -> builder.add(trace, 1));
        return builder.build();
    }

    /**
     * Builds a log from pre-aggregated trace frequencies.
     */
    public static EventLog of(Map<? extends List<String>, ? extends Number> frequencies) {
        if (frequencies == null) {
            throw new InvalidLogException("Trace frequencies must not be null");
        }
        var builder = builder();
        frequencies.forEach((trace, frequency) -> {
            if (frequency == null) {
                throw new InvalidLogException("Frequency of trace " + trace + " must not be null");
            }
            builder.add(trace, frequency.longValue());
        });
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Queries ====================

    public Map<List<String>, Long> traces() {
        return traces;
    }

    /**
     * Number of distinct traces (variants).
     */
    public int size() {
        return traces.size();
    }

    public boolean isEmpty() {
        return traces.isEmpty();
    }

    public long frequency(List<String> trace) {
        return traces.getOrDefault(trace, 0L);
    }

    public long totalFrequency() {
        return traces.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean containsEmptyTrace() {
        return traces.containsKey(List.of());
    }

    public SortedSet<String> alphabet() {
        var alphabet = new TreeSet<String>();
        traces.keySet().forEach(alphabet::addAll);
        return alphabet;
    }

    /**
     * Appearance frequency of every activity, summed over trace frequencies.
     */
    public SortedMap<String, Long> activityFrequencies() {
        var counts = new TreeMap<String, Long>();
        traces.forEach((trace, frequency) ->
                trace.forEach(activity -> counts.merge(activity, frequency, Long::sum)));
        return counts;
    }

    /**
     * Sum of {@code trace length * frequency} over all traces.
     */
    public long eventCount() {
        return traces.entrySet().stream()
                .mapToLong(e -> e.getKey().size() * e.getValue())
                .sum();
    }

    /**
     * Whether some trace holds the given activity more than once.
     */
    public boolean hasRepeatedActivity(String activity) {
        return traces.keySet().stream()
                .anyMatch(trace -> Collections.frequency(trace, activity) > 1);
    }

    // ==================== Derivations ====================

    public EventLog withoutEmptyTrace() {
        if (!containsEmptyTrace()) {
            return this;
        }
        var builder = builder();
        traces.forEach((trace, frequency) -> {
            if (!trace.isEmpty()) {
                builder.add(trace, frequency);
            }
        });
        return builder.build();
    }

    // ==================== Object ====================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventLog other)) return false;
        return hash == other.hash && traces.equals(other.traces);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "EventLog" + traces;
    }

    // ==================== Builder ====================

    /**
     * Accumulates traces; adding an existing trace increases its frequency.
     */
    public static final class Builder {

        private final Map<List<String>, Long> traces = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(List<String> trace, long frequency) {
            validate(trace, frequency);
            traces.merge(List.copyOf(trace), frequency, Long::sum);
            return this;
        }

        public Builder add(List<String> trace) {
            return add(trace, 1);
        }

        public boolean isEmpty() {
            return traces.isEmpty();
        }

        public EventLog build() {
            if (traces.isEmpty()) {
                return EMPTY;
            }
            return new EventLog(new LinkedHashMap<>(traces));
        }

        private static void validate(List<String> trace, long frequency) {
            if (trace == null) {
                throw new InvalidLogException("Trace must not be null");
            }
            if (frequency <= 0) {
                throw new InvalidLogException(
                        "Frequency of trace " + trace + " must be positive, was " + frequency);
            }
            for (String activity : trace) {
                if (Objects.isNull(activity) || activity.isBlank()) {
                    throw new InvalidLogException("Trace " + trace + " contains a blank activity label");
                }
            }
        }
    }
}
