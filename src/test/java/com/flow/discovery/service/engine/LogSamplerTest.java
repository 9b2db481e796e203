package com.flow.discovery.service.engine;

import com.flow.discovery.service.log.EventLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flow.discovery.service.engine.InductiveMinerTest.log;
import static org.assertj.core.api.Assertions.assertThat;

class LogSamplerTest {

    private final LogSampler sampler = new LogSampler(42L);

    @Test
    @DisplayName("Logs within the sample size are returned unchanged")
    void smallLogUnchanged() {
        EventLog eventLog = log("AB", 5, "AC", 5);

        assertThat(sampler.sample(eventLog, 10, 0.0)).isSameAs(eventLog);
    }

    @Test
    @DisplayName("Sampling draws exactly the target number of cases from existing variants")
    void samplesTargetSize() {
        EventLog eventLog = log("AB", 500, "AC", 300, "AD", 200);

        EventLog sampled = sampler.sample(eventLog, 100, 0.0);

        assertThat(sampled.totalFrequency()).isEqualTo(100);
        assertThat(eventLog.traces().keySet()).containsAll(sampled.traces().keySet());
    }

    @Test
    @DisplayName("A positive ratio overrides the sample size")
    void ratio() {
        EventLog eventLog = log("AB", 500, "AC", 500);

        assertThat(LogSampler.targetSize(eventLog, 10, 0.25)).isEqualTo(250);
        assertThat(LogSampler.targetSize(eventLog, 10, 0.0)).isEqualTo(10);
        assertThat(LogSampler.targetSize(log("AB", 1), 10, 0.1)).isEqualTo(1);
        assertThat(sampler.sample(eventLog, 10, 0.25).totalFrequency()).isEqualTo(250);
    }

    @Test
    @DisplayName("The same seed yields the same sample")
    void deterministic() {
        EventLog eventLog = log("AB", 500, "AC", 300, "AD", 200);

        assertThat(sampler.sample(eventLog, 50, 0.0)).isEqualTo(sampler.sample(eventLog, 50, 0.0));
        assertThat(new LogSampler(42L).sample(eventLog, 50, 0.0)).isEqualTo(sampler.sample(eventLog, 50, 0.0));
    }

    @Test
    @DisplayName("Frequent variants dominate the sample")
    void frequencyWeighted() {
        EventLog eventLog = log("AB", 990, "AC", 10);

        EventLog sampled = sampler.sample(eventLog, 200, 0.0);

        assertThat(sampled.frequency(java.util.List.of("A", "B"))).isGreaterThan(150);
    }
}
