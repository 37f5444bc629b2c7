package com.eainde.expedition.nodes;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.data.MetricsDataSource;
import com.eainde.expedition.detection.AnomalyDetector;
import com.eainde.expedition.detection.DetectionResult;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageExecutor;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.model.MetricPoint;
import com.eainde.expedition.model.Severity;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.DiagnosisStatus;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Log4j2
@Component
public class DetectorNode extends AbstractDiagnosisNode {

    public static final String STAGE = "detector";

    private final MetricsDataSource dataSource;
    private final AnomalyDetector detector;
    private final StageExecutor stageExecutor;
    private final int windowLength;

    public DetectorNode(MetricsDataSource dataSource, AnomalyDetector detector, StageExecutor stageExecutor,
                        ExpeditionProperties properties) {
        this.dataSource = dataSource;
        this.detector = detector;
        this.stageExecutor = stageExecutor;
        this.windowLength = properties.getDetector().getWindowLength();
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        DiagnosisRequest request = state.request();

        if (request.preset().isPresent()) {
            AnomalyDescriptor preset = request.presetAnomaly();
            if (preset.severity() == Severity.NONE) {
                log.info("Caller-selected anomaly is below the warning threshold: {}", preset.summary());
                return Map.of(DiagnosisState.STATUS, DiagnosisStatus.NO_ANOMALY);
            }
            log.info("Adopting caller-selected anomaly: {}", preset.summary());
            return Map.of(DiagnosisState.DESCRIPTOR, preset);
        }

        // the latest point is scored against the full window before it
        List<MetricPoint> series = stageExecutor.call("fetchMetricSeries", journal, ctx, () ->
                dataSource.fetchMetricSeries(request.channel(), request.metric(), request.evaluationDate(),
                        windowLength + 1));

        DetectionResult result = detector.detect(request.channel(), request.metric(), request.evaluationDate(), series);
        if (result.isAnomaly()) {
            return Map.of(DiagnosisState.DESCRIPTOR, result.anomaly());
        }

        if (result.reason() == ErrorCode.INSUFFICIENT_DATA) {
            journal.markSkipped(ErrorCode.INSUFFICIENT_DATA, result.detail());
        }
        log.info("No anomaly: {}", result.detail());
        return Map.of(DiagnosisState.STATUS, DiagnosisStatus.NO_ANOMALY);
    }
}
