package com.creativeforge.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tunables of the pipeline, bound from {@code creativeforge.*}.
 *
 * The AI gateway URL and the Anthropic settings are read directly by their
 * clients and are not part of this record.
 */
@ConfigurationProperties(prefix = "creativeforge")
public record CreativeForgeProperties(
        @DefaultValue("jpa") String     jobStore,
        @DefaultValue        Admission  admission,
        @DefaultValue        Retry      retry,
        @DefaultValue        Stages     stages,
        @DefaultValue        Analysis   analysis,
        @DefaultValue        Caption    caption,
        @DefaultValue        Dispatcher dispatcher) {

    public record Admission(
            @DefaultValue("5")   int perOwnerLimit,
            @DefaultValue("200") int globalCeiling) {}

    public record Retry(
            @DefaultValue("3")    int      maxAttempts,
            @DefaultValue("1s")   Duration baseDelay,
            @DefaultValue("0.25") double   jitterRatio) {}

    public record Stages(
            @DefaultValue("30s") Duration analysisTimeout,
            @DefaultValue("90s") Duration backgroundTimeout,
            @DefaultValue("30s") Duration captionTimeout,
            @DefaultValue("20s") Duration safetyTimeout) {}

    public record Analysis(
            @DefaultValue("0.6") double confidenceFloor) {}

    public record Caption(
            @DefaultValue("50")  int minLength,
            @DefaultValue("150") int maxLength) {}

    /**
     * @param workers       threads running orchestrator units
     * @param callPoolSize  threads blocked on external calls (each unit waits on one)
     * @param stallTimeout  admitted jobs untouched for this long are dispatched again;
     *                      must exceed the longest stage timeout plus retry delay
     */
    public record Dispatcher(
            @DefaultValue("8")   int      workers,
            @DefaultValue("16")  int      callPoolSize,
            @DefaultValue("10m") Duration stallTimeout) {}
}
