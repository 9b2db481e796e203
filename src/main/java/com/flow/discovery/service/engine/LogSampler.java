package com.flow.discovery.service.engine;

import com.flow.discovery.service.log.EventLog;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Frequency-weighted sampling of cases, drawn with replacement.
 *
 * Every call starts from the same seed, so sampling one log twice yields the
 * same sample.
 */
@Slf4j
public class LogSampler {

    private final long seed;

    public LogSampler(long seed) {
        this.seed = seed;
    }

    /**
     * Target number of cases: {@code sampleRatio * total} (at least one) when
     * the ratio is positive, otherwise {@code sampleSize}.
     */
    public static long targetSize(EventLog eventLog, int sampleSize, double sampleRatio) {
        long total = eventLog.totalFrequency();
        if (sampleRatio > 0) {
            return Math.max((long) Math.floor(total * sampleRatio), 1L);
        }
        return sampleSize;
    }

    public EventLog sample(EventLog eventLog, int sampleSize, double sampleRatio) {
        long total = eventLog.totalFrequency();
        long target = targetSize(eventLog, sampleSize, sampleRatio);
        if (total <= target) {
            return eventLog;
        }

        List<List<String>> traces = new ArrayList<>(eventLog.traces().keySet());
        long[] cumulative = new long[traces.size()];
        long running = 0;
        for (int i = 0; i < traces.size(); i++) {
            running += eventLog.frequency(traces.get(i));
            cumulative[i] = running;
        }

        var random = new Random(seed);
        var builder = EventLog.builder();
        for (long drawn = 0; drawn < target; drawn++) {
            long ticket = (long) (random.nextDouble() * total);
            int index = Arrays.binarySearch(cumulative, ticket + 1);
            if (index < 0) {
                index = -index - 1;
            }
            builder.add(traces.get(index), 1);
        }
        EventLog sampled = builder.build();
        log.info("Sampled {} of {} cases ({} of {} variants)", target, total, sampled.size(), eventLog.size());
        return sampled;
    }
}
