package com.flow.discovery.service.engine;

import lombok.Builder;

/**
 * Resolved parameters of one discovery call.
 *
 * @param activityThreshold activities below this share of the most frequent activity are removed
 * @param tracesThreshold traces below this share of the most frequent trace are removed
 * @param noiseThreshold edges below this share of the heaviest edge are ignored during cut search
 * @param simplificationThreshold edge share dropped by graph simplification; also the bin cutoff
 * @param minBinFreq relative frequency under which an activity is binned
 * @param sampleSize maximum number of cases mined by the approximate miner
 * @param sampleRatio when positive, the share of cases to sample instead of {@code sampleSize}
 * @param maxRecursionDepth recursion ceiling; deeper branches become flower models
 */
@Builder(toBuilder = true)
public record MiningParameters(
        double activityThreshold,
        double tracesThreshold,
        double noiseThreshold,
        double simplificationThreshold,
        double minBinFreq,
        int sampleSize,
        double sampleRatio,
        int maxRecursionDepth
) {

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 200;

    public static MiningParameters defaults() {
        return new MiningParameters(0.0, 0.2, 0.2, 0.1, 0.2, 1000, 0.0, DEFAULT_MAX_RECURSION_DEPTH);
    }

    /**
     * @throws IllegalArgumentException when a threshold lies outside [0, 1] or a bound is not positive
     */
    public MiningParameters validate() {
        requireFraction("activityThreshold", activityThreshold);
        requireFraction("tracesThreshold", tracesThreshold);
        requireFraction("noiseThreshold", noiseThreshold);
        requireFraction("simplificationThreshold", simplificationThreshold);
        requireFraction("minBinFreq", minBinFreq);
        requireFraction("sampleRatio", sampleRatio);
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be at least 1, was " + sampleSize);
        }
        if (maxRecursionDepth < 1) {
            throw new IllegalArgumentException("maxRecursionDepth must be at least 1, was " + maxRecursionDepth);
        }
        return this;
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], was " + value);
        }
    }
}
