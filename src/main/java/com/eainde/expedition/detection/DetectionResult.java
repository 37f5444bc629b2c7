package com.eainde.expedition.detection;

import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.model.AnomalyDescriptor;

import java.util.Optional;

/**
 * Detector outcome: an anomaly, or "no anomaly" with the reason.
 *
 * @param reason {@link ErrorCode#INSUFFICIENT_DATA} when the window was too short, null when simply below threshold
 */
public record DetectionResult(AnomalyDescriptor anomaly, ErrorCode reason, String detail) {

    public static DetectionResult anomaly(AnomalyDescriptor descriptor) {
        return new DetectionResult(descriptor, null, descriptor.summary());
    }

    public static DetectionResult insufficientData(String detail) {
        return new DetectionResult(null, ErrorCode.INSUFFICIENT_DATA, detail);
    }

    public static DetectionResult belowThreshold(String detail) {
        return new DetectionResult(null, null, detail);
    }

    public boolean isAnomaly() {
        return anomaly != null;
    }

    public Optional<AnomalyDescriptor> descriptor() {
        return Optional.ofNullable(anomaly);
    }
}
