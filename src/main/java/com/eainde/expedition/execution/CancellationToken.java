package com.eainde.expedition.execution;

import com.eainde.expedition.error.DiagnosisCancelledException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run cancellation signal. Cancelling interrupts the run's in-flight external call and stops the run at the
 * next stage boundary; other runs are unaffected.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(future -> future.cancel(true));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new DiagnosisCancelledException("Run cancelled before " + stage);
        }
    }

    void track(Future<?> future) {
        inFlight.add(future);
        // cancel() may have run between submit and track
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    void release(Future<?> future) {
        inFlight.remove(future);
    }
}
