package com.flow.discovery.service.config;

import com.flow.discovery.service.engine.MiningParameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for process discovery.
 *
 * Holds the parameter defaults a request may override, the switches of the
 * approximate miner and the cache bounds.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryConfig {

    /**
     * Parameter defaults shared by all algorithms.
     */
    private Defaults defaults = new Defaults();

    /**
     * Infrequent miner settings.
     */
    private Infrequent infrequent = new Infrequent();

    /**
     * Approximate miner settings.
     */
    private Approximate approximate = new Approximate();

    /**
     * Mining cache settings.
     */
    private Cache cache = new Cache();

    /**
     * Parameters used when a request does not override them.
     */
    public MiningParameters defaultParameters() {
        return MiningParameters.builder()
                .activityThreshold(defaults.getActivityThreshold())
                .tracesThreshold(defaults.getTracesThreshold())
                .maxRecursionDepth(defaults.getMaxRecursionDepth())
                .noiseThreshold(infrequent.getNoiseThreshold())
                .simplificationThreshold(approximate.getSimplificationThreshold())
                .minBinFreq(approximate.getMinBinFreq())
                .sampleSize(approximate.getSampleSize())
                .sampleRatio(approximate.getSampleRatio())
                .build();
    }

    @Getter
    @Setter
    public static class Defaults {

        /**
         * Activities below this share of the most frequent activity are removed.
         */
        private double activityThreshold = 0.0;

        /**
         * Traces below this share of the most frequent trace are removed.
         */
        private double tracesThreshold = 0.2;

        /**
         * Recursion ceiling; deeper branches become flower models.
         */
        private int maxRecursionDepth = MiningParameters.DEFAULT_MAX_RECURSION_DEPTH;
    }

    @Getter
    @Setter
    public static class Infrequent {

        /**
         * Edges below this share of the heaviest edge are ignored during cut search.
         */
        private double noiseThreshold = 0.2;
    }

    @Getter
    @Setter
    public static class Approximate {

        private double simplificationThreshold = 0.1;

        private double minBinFreq = 0.2;

        /**
         * Minimum profile similarity for a rare activity to join a bin.
         */
        private double similarityThreshold = 0.6;

        private int sampleSize = 1000;

        /**
         * When positive, sample this share of the cases instead of sampleSize.
         */
        private double sampleRatio = 0.0;

        private long sampleSeed = 42L;

        private boolean binningEnabled = true;

        private boolean simplificationEnabled = true;

        private boolean validationEnabled = true;

        private Validation strict = new Validation(0.1, 0.9);

        private Validation relaxed = new Validation(0.3, 0.75);
    }

    @Getter
    @Setter
    public static class Validation {

        /**
         * Allowed deviation for the per-cut-type heuristics.
         */
        private double tolerance;

        /**
         * Minimum share of trace frequency a cut must keep consistent.
         */
        private double preservationThreshold;

        public Validation() {
        }

        public Validation(double tolerance, double preservationThreshold) {
            this.tolerance = tolerance;
            this.preservationThreshold = preservationThreshold;
        }
    }

    @Getter
    @Setter
    public static class Cache {

        /**
         * Maximum entries per cache region.
         */
        private int maxEntries = 256;
    }
}
