package com.eainde.expedition.state;

import com.eainde.expedition.model.ActionPayload;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.model.ValidationVerdict;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Terminal, read-only view of a diagnosis run as returned to callers. Fields a run never reached are null;
 * use the optional accessors.
 */
public record DiagnosisRecord(
        String recordId,
        DiagnosisRequest request,
        DiagnosisStatus status,
        AnomalyDescriptor descriptor,
        ChannelFamily family,
        InvestigationFinding finding,
        List<RetrievedIncident> incidents,
        SynthesizedDiagnosis diagnosis,
        ValidationVerdict verdict,
        List<ActionPayload> actions,
        List<StepLogEntry> stepLog,
        String failedStage,
        String blockReason,
        String failureReason
) implements Serializable {

    public DiagnosisRecord {
        incidents = List.copyOf(incidents);
        actions = List.copyOf(actions);
        stepLog = List.copyOf(stepLog);
    }

    public static DiagnosisRecord from(DiagnosisState state) {
        return new DiagnosisRecord(
                state.recordId(),
                state.request(),
                state.status(),
                state.descriptor().orElse(null),
                state.family().orElse(null),
                state.finding().orElse(null),
                state.incidents(),
                state.diagnosis().orElse(null),
                state.verdict().orElse(null),
                state.actions(),
                state.stepLog(),
                state.failedStage().orElse(null),
                state.blockReason().orElse(null),
                state.failureReason().orElse(null));
    }

    /** Record for a run that never produced a graph state, e.g. the runtime itself failed. */
    public static DiagnosisRecord failed(String recordId, DiagnosisRequest request, List<StepLogEntry> stepLog,
                                         String failedStage, String reason) {
        return new DiagnosisRecord(recordId, request, DiagnosisStatus.FAILED, null, null, null, List.of(), null,
                null, List.of(), stepLog, failedStage, null, reason);
    }

    public Optional<AnomalyDescriptor> anomaly() {
        return Optional.ofNullable(descriptor);
    }

    public Optional<InvestigationFinding> investigation() {
        return Optional.ofNullable(finding);
    }

    public Optional<SynthesizedDiagnosis> synthesis() {
        return Optional.ofNullable(diagnosis);
    }

    public Optional<ValidationVerdict> validation() {
        return Optional.ofNullable(verdict);
    }

    public List<StepLogEntry> entriesFor(String stage) {
        return stepLog.stream().filter(e -> e.stage().equals(stage)).toList();
    }
}
