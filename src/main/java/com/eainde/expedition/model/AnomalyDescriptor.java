package com.eainde.expedition.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable description of one metric deviation on one channel.
 *
 * @param channel        channel identifier, e.g. {@code google_search}
 * @param metric         metric name, e.g. {@code cpa}
 * @param observedValue  latest observation
 * @param expectedValue  baseline mean of the detection window
 * @param zScore         (observed - mean) / standard deviation
 * @param deviationPct   relative deviation from the baseline, in percent
 * @param direction      spike or drop
 * @param severity       tier derived from |zScore|
 * @param detectedAt     timestamp of the observation that crossed the threshold
 * @param evaluationDate the "as of" date the analysis was run for
 */
public record AnomalyDescriptor(
        String channel,
        String metric,
        double observedValue,
        double expectedValue,
        double zScore,
        double deviationPct,
        Direction direction,
        Severity severity,
        Instant detectedAt,
        LocalDate evaluationDate
) implements Serializable {

    public AnomalyDescriptor {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(evaluationDate, "evaluationDate");
    }

    public String summary() {
        return String.format(Locale.ROOT, "%s %s %s %.1f%% (observed %.2f vs expected %.2f, z=%.2f)",
                channel, metric, direction.name().toLowerCase(Locale.ROOT), deviationPct, observedValue, expectedValue,
                zScore);
    }
}
