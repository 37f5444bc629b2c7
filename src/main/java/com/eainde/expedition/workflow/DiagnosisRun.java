package com.eainde.expedition.workflow;

import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.execution.CancellationToken;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.state.DiagnosisRecord;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one submitted diagnosis. Cancelling it stops only this run: a queued run never starts, a running one
 * has its in-flight call interrupted and ends as {@code FAILED} with {@code CANCELLED}.
 */
public final class DiagnosisRun {

    private final DiagnosisRequest request;
    private final CancellationToken cancellation;
    private final AtomicBoolean started;
    private final Future<DiagnosisRecord> future;

    /**
     * @param started claimed by whichever comes first: the worker starting the run, or a cancel of a queued run
     */
    DiagnosisRun(DiagnosisRequest request, CancellationToken cancellation, AtomicBoolean started,
                 Future<DiagnosisRecord> future) {
        this.request = request;
        this.cancellation = cancellation;
        this.started = started;
        this.future = future;
    }

    public DiagnosisRequest request() {
        return request;
    }

    public void cancel() {
        cancellation.cancel();
        // a running run is left to finish with its own CANCELLED record
        if (started.compareAndSet(false, true)) {
            future.cancel(false);
        }
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Waits for the terminal record. Never throws. A run that started returns the engine's own record, a cancelled
     * one included; only a run cancelled while queued, or one whose worker died, gets a synthetic FAILED record.
     */
    public DiagnosisRecord await() {
        try {
            return future.get();
        } catch (CancellationException e) {
            return failed(ErrorCode.CANCELLED, "run cancelled before it started");
        } catch (ExecutionException e) {
            return failed(ErrorCode.UNEXPECTED_ERROR, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(ErrorCode.CANCELLED, "interrupted while waiting for the run");
        }
    }

    private DiagnosisRecord failed(ErrorCode code, String message) {
        return DiagnosisRecord.failed(DiagnosisEngine.recordIdFor(request), request, List.of(), "batch",
                "[" + code + "] " + message);
    }
}
