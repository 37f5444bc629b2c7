package com.eainde.expedition.nodes;

import com.eainde.expedition.error.DiagnosisException;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.error.StageFailedException;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.DiagnosisStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for every pipeline stage.
 * <p>
 * Subclasses implement {@link #process} and return only the state keys they own. This class appends the
 * stage's step-log entries and turns any failure into a terminal {@code FAILED} update, so no exception ever
 * reaches the graph runtime.
 */
@Log4j2
public abstract class AbstractDiagnosisNode {

    public abstract String stageName();

    protected abstract Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal);

    /** Graph action for one run; the context is fixed for the lifetime of the compiled graph. */
    public AsyncNodeAction<DiagnosisState> bind(RunContext ctx) {
        return state -> CompletableFuture.completedFuture(execute(state, ctx));
    }

    public Map<String, Object> execute(DiagnosisState state, RunContext ctx) {
        StageJournal journal = new StageJournal(stageName());
        log.debug("{} started", stageName());
        try {
            ctx.cancellation().throwIfCancelled(stageName());
            Map<String, Object> update = new HashMap<>(process(state, ctx, journal));
            update.put(DiagnosisState.STEP_LOG, state.stepLogWith(journal.complete()));
            log.info("{} {} in {}ms", stageName(), journal.outcome(), journal.elapsed().toMillis());
            return update;
        } catch (StageFailedException e) {
            return failed(state, journal, e.getErrorCode(), e.getMessage(), e.getAttempts(), e);
        } catch (DiagnosisException e) {
            return failed(state, journal, e.getErrorCode(), e.getMessage(), 1, e);
        } catch (RuntimeException e) {
            return failed(state, journal, ErrorCode.UNEXPECTED_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), 1, e);
        }
    }

    private Map<String, Object> failed(DiagnosisState state, StageJournal journal, ErrorCode code,
                                       String message, int attempts, Exception cause) {
        if (code == ErrorCode.UNEXPECTED_ERROR) {
            log.error("{} failed unexpectedly", stageName(), cause);
        } else {
            log.warn("{} failed [{}]: {}", stageName(), code, message);
        }
        return Map.of(
                DiagnosisState.STATUS, DiagnosisStatus.FAILED,
                DiagnosisState.FAILED_STAGE, stageName(),
                DiagnosisState.FAILURE_REASON, "[" + code + "] " + message,
                DiagnosisState.STEP_LOG, state.stepLogWith(journal.fail(code, message, attempts)));
    }

    /** Input a previous stage must have written; its absence means the graph ran out of order. */
    protected <T> T require(Optional<T> value, String key) {
        return value.orElseThrow(() -> new IllegalStateException(stageName() + " requires '" + key + "' in state"));
    }
}
