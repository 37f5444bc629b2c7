package com.eainde.expedition.detection;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.Direction;
import com.eainde.expedition.model.MetricPoint;
import com.eainde.expedition.model.Severity;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Z-score scan of the latest observation against the rest of the window.
 * <p>
 * The baseline is every point before the latest one; its standard deviation is the sample deviation (n - 1).
 * A flat baseline is floored to a tiny deviation, so any move away from it counts as critical.
 */
@Log4j2
@Component
public class AnomalyDetector {

    private static final double MIN_STD = 1e-9;

    private final ExpeditionProperties.Detector settings;

    public AnomalyDetector(ExpeditionProperties properties) {
        this.settings = properties.getDetector();
    }

    public DetectionResult detect(String channel, String metric, LocalDate evaluationDate, List<MetricPoint> series) {
        List<MetricPoint> usable = series == null ? List.of() : series.stream()
                .filter(p -> p != null && p.timestamp() != null && Double.isFinite(p.value()))
                .toList();

        int baselineSize = usable.size() - 1;
        if (baselineSize < settings.getMinSamples()) {
            return DetectionResult.insufficientData(String.format(Locale.ROOT,
                    "%s/%s has %d baseline samples, need %d", channel, metric, Math.max(0, baselineSize),
                    settings.getMinSamples()));
        }

        List<MetricPoint> baseline = usable.subList(0, baselineSize);
        MetricPoint latest = usable.get(baselineSize);

        double mean = baseline.stream().mapToDouble(MetricPoint::value).average().orElse(0.0);
        double variance = baseline.stream()
                .mapToDouble(p -> (p.value() - mean) * (p.value() - mean))
                .sum() / Math.max(1, baselineSize - 1);
        double std = Math.max(Math.sqrt(variance), MIN_STD);
        double z = (latest.value() - mean) / std;

        Severity severity = Severity.classify(z, settings.getWarningZ(), settings.getCriticalZ());
        if (severity == Severity.NONE) {
            return DetectionResult.belowThreshold(String.format(Locale.ROOT, "%s/%s z=%.2f below %.1f",
                    channel, metric, z, settings.getWarningZ()));
        }

        double deviationPct = mean == 0.0 ? 0.0 : (latest.value() - mean) / Math.abs(mean) * 100.0;
        AnomalyDescriptor descriptor = new AnomalyDescriptor(
                channel,
                metric,
                latest.value(),
                mean,
                z,
                deviationPct,
                Direction.of(latest.value(), mean),
                severity,
                latest.timestamp(),
                evaluationDate);
        log.info("Detected {} anomaly: {}", severity, descriptor.summary());
        return DetectionResult.anomaly(descriptor);
    }
}
