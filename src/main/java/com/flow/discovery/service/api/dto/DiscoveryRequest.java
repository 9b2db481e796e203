package com.flow.discovery.service.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flow.discovery.service.engine.Algorithm;
import com.flow.discovery.service.engine.MiningParameters;
import com.flow.discovery.service.log.EventLog;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for discovery requests.
 *
 * Carries an already parsed event log, either as plain traces (one case
 * each) or as variants with frequencies, plus optional parameter overrides.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryRequest {

    /**
     * Miner to run.
     */
    @Builder.Default
    private Algorithm algorithm = Algorithm.INDUCTIVE;

    /**
     * Traces as activity label sequences; duplicates aggregate.
     */
    private List<List<String>> traces;

    /**
     * Trace variants with their frequencies.
     */
    @Valid
    private List<VariantDto> variants;

    /**
     * Overrides of the configured parameter defaults.
     */
    @Valid
    private ParametersDto parameters;

    @JsonIgnore
    @AssertTrue(message = "traces or variants are required")
    public boolean isLogPresent() {
        return (traces != null && !traces.isEmpty()) || (variants != null && !variants.isEmpty());
    }

    /**
     * Builds the event log; label and frequency checks happen here.
     */
    public EventLog toEventLog() {
        var builder = EventLog.builder();
        if (traces != null) {
            traces.forEach(trace -> builder.add(trace, 1));
        }
        if (variants != null) {
            variants.forEach(variant -> builder.add(variant.getActivities(), variant.getFrequency()));
        }
        return builder.build();
    }

    /**
     * The defaults with every non-null override applied.
     */
    public MiningParameters resolveParameters(MiningParameters defaults) {
        return parameters == null ? defaults : parameters.applyTo(defaults);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VariantDto {

        @NotNull(message = "activities are required")
        private List<String> activities;

        @Builder.Default
        @Positive(message = "frequency must be positive")
        private long frequency = 1;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParametersDto {

        @DecimalMin(value = "0.0", message = "activityThreshold must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "activityThreshold must be within [0, 1]")
        private Double activityThreshold;

        @DecimalMin(value = "0.0", message = "tracesThreshold must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "tracesThreshold must be within [0, 1]")
        private Double tracesThreshold;

        @DecimalMin(value = "0.0", message = "noiseThreshold must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "noiseThreshold must be within [0, 1]")
        private Double noiseThreshold;

        @DecimalMin(value = "0.0", message = "simplificationThreshold must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "simplificationThreshold must be within [0, 1]")
        private Double simplificationThreshold;

        @DecimalMin(value = "0.0", message = "minBinFreq must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "minBinFreq must be within [0, 1]")
        private Double minBinFreq;

        @Min(value = 1, message = "sampleSize must be at least 1")
        private Integer sampleSize;

        @DecimalMin(value = "0.0", message = "sampleRatio must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "sampleRatio must be within [0, 1]")
        private Double sampleRatio;

        @Min(value = 1, message = "maxRecursionDepth must be at least 1")
        private Integer maxRecursionDepth;

        public MiningParameters applyTo(MiningParameters defaults) {
            var builder = defaults.toBuilder();
            if (activityThreshold != null) builder.activityThreshold(activityThreshold);
            if (tracesThreshold != null) builder.tracesThreshold(tracesThreshold);
            if (noiseThreshold != null) builder.noiseThreshold(noiseThreshold);
            if (simplificationThreshold != null) builder.simplificationThreshold(simplificationThreshold);
            if (minBinFreq != null) builder.minBinFreq(minBinFreq);
            if (sampleSize != null) builder.sampleSize(sampleSize);
            if (sampleRatio != null) builder.sampleRatio(sampleRatio);
            if (maxRecursionDepth != null) builder.maxRecursionDepth(maxRecursionDepth);
            return builder.build();
        }
    }
}
