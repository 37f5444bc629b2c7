package com.eainde.expedition.state;

import com.eainde.expedition.model.ActionPayload;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.model.SupplementaryData;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.model.ValidationVerdict;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one diagnosis run. Every value stored here is immutable and serializable; nodes return
 * partial updates and never write a key owned by a later stage.
 */
public class DiagnosisState extends AgentState {

    public static final String REQUEST = "request";
    public static final String RECORD_ID = "recordId";
    public static final String STATUS = "status";
    public static final String STEP_LOG = "stepLog";
    public static final String DESCRIPTOR = "descriptor";
    public static final String FAMILY = "family";
    public static final String SUPPLEMENTARY_DATA = "supplementaryData";
    public static final String FINDING = "finding";
    public static final String INCIDENTS = "incidents";
    public static final String DIAGNOSIS = "diagnosis";
    public static final String VERDICT = "verdict";
    public static final String ACTIONS = "actions";
    public static final String FAILED_STAGE = "failedStage";
    public static final String BLOCK_REASON = "blockReason";
    public static final String FAILURE_REASON = "failureReason";

    public DiagnosisState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> initial(DiagnosisRequest request, String recordId) {
        return Map.of(
                REQUEST, request,
                RECORD_ID, recordId,
                STATUS, DiagnosisStatus.RUNNING,
                STEP_LOG, List.of()
        );
    }

    public DiagnosisRequest request() {
        return this.<DiagnosisRequest>value(REQUEST)
                .orElseThrow(() -> new IllegalStateException("diagnosis state has no request"));
    }

    public String recordId() {
        return this.<String>value(RECORD_ID).orElse("");
    }

    public DiagnosisStatus status() {
        return this.<DiagnosisStatus>value(STATUS).orElse(DiagnosisStatus.RUNNING);
    }

    public List<StepLogEntry> stepLog() {
        return this.<List<StepLogEntry>>value(STEP_LOG).orElse(List.of());
    }

    public Optional<AnomalyDescriptor> descriptor() {
        return value(DESCRIPTOR);
    }

    public Optional<ChannelFamily> family() {
        return value(FAMILY);
    }

    public Optional<SupplementaryData> supplementaryData() {
        return value(SUPPLEMENTARY_DATA);
    }

    public Optional<InvestigationFinding> finding() {
        return value(FINDING);
    }

    public List<RetrievedIncident> incidents() {
        return this.<List<RetrievedIncident>>value(INCIDENTS).orElse(List.of());
    }

    public Optional<SynthesizedDiagnosis> diagnosis() {
        return value(DIAGNOSIS);
    }

    public Optional<ValidationVerdict> verdict() {
        return value(VERDICT);
    }

    public List<ActionPayload> actions() {
        return this.<List<ActionPayload>>value(ACTIONS).orElse(List.of());
    }

    public Optional<String> failedStage() {
        return value(FAILED_STAGE);
    }

    public Optional<String> blockReason() {
        return value(BLOCK_REASON);
    }

    public Optional<String> failureReason() {
        return value(FAILURE_REASON);
    }

    public boolean isTerminal() {
        return status().isTerminal();
    }

    /** The step log with {@code entries} appended; the stored log itself is never modified. */
    public List<StepLogEntry> stepLogWith(List<StepLogEntry> entries) {
        List<StepLogEntry> log = new ArrayList<>(stepLog());
        log.addAll(entries);
        return List.copyOf(log);
    }
}
