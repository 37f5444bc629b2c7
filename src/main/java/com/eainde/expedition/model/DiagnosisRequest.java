package com.eainde.expedition.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of one pipeline run.
 *
 * @param presetAnomaly a caller-selected anomaly; when present the detector adopts it instead of scanning
 */
public record DiagnosisRequest(
        String channel,
        String metric,
        LocalDate evaluationDate,
        AnomalyDescriptor presetAnomaly
) implements Serializable {

    public DiagnosisRequest {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(evaluationDate, "evaluationDate");
    }

    public static DiagnosisRequest of(String channel, String metric, LocalDate evaluationDate) {
        return new DiagnosisRequest(channel, metric, evaluationDate, null);
    }

    public static DiagnosisRequest forAnomaly(AnomalyDescriptor anomaly) {
        return new DiagnosisRequest(anomaly.channel(), anomaly.metric(), anomaly.evaluationDate(), anomaly);
    }

    public Optional<AnomalyDescriptor> preset() {
        return Optional.ofNullable(presetAnomaly);
    }
}
