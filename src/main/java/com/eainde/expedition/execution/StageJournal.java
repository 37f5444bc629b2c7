package com.eainde.expedition.execution;

import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.state.StepLogEntry;
import com.eainde.expedition.state.StepStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the step-log entries of one stage execution: retry entries as they happen, then one final entry.
 */
public final class StageJournal {

    private final String stage;
    private final long startNanos;
    private final List<StepLogEntry> entries = new ArrayList<>();

    private StepStatus outcome = StepStatus.SUCCEEDED;
    private ErrorCode outcomeCode;
    private String outcomeDetail;
    private int attempts = 1;

    public StageJournal(String stage) {
        this.stage = stage;
        this.startNanos = System.nanoTime();
    }

    public String stage() {
        return stage;
    }

    void retried(int attempt, Duration attemptDuration, ErrorCode code, String error) {
        entries.add(new StepLogEntry(stage, StepStatus.RETRIED, attemptDuration, code, error, attempt));
        attempts = Math.max(attempts, attempt + 1);
    }

    void attempts(int attempts) {
        this.attempts = Math.max(1, attempts);
    }

    public void markSkipped(ErrorCode code, String detail) {
        mark(StepStatus.SKIPPED, code, detail);
    }

    public void markDegraded(ErrorCode code, String detail) {
        mark(StepStatus.DEGRADED, code, detail);
    }

    public void markBlocked(String reason) {
        mark(StepStatus.BLOCKED, ErrorCode.SAFETY_BLOCKED, reason);
    }

    private void mark(StepStatus status, ErrorCode code, String detail) {
        this.outcome = status;
        this.outcomeCode = code;
        this.outcomeDetail = detail;
    }

    public StepStatus outcome() {
        return outcome;
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /** Retry entries followed by the final entry for the recorded outcome. */
    public List<StepLogEntry> complete() {
        List<StepLogEntry> all = new ArrayList<>(entries);
        all.add(new StepLogEntry(stage, outcome, elapsed(), outcomeCode, outcomeDetail, attempts));
        return List.copyOf(all);
    }

    /** Retry entries followed by a FAILED entry. */
    public List<StepLogEntry> fail(ErrorCode code, String error, int failedAttempts) {
        List<StepLogEntry> all = new ArrayList<>(entries);
        all.add(new StepLogEntry(stage, StepStatus.FAILED, elapsed(), code, error, Math.max(attempts, failedAttempts)));
        return List.copyOf(all);
    }
}
