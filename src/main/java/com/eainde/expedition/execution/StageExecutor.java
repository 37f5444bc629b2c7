package com.eainde.expedition.execution;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.error.DiagnosisCancelledException;
import com.eainde.expedition.error.DiagnosisException;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.error.InferenceTimeoutException;
import com.eainde.expedition.error.StageFailedException;
import com.eainde.expedition.error.TransientBackendException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a stage's external calls with a deadline per attempt and bounded exponential backoff between attempts.
 * <p>
 * Only errors whose {@link ErrorCode} is retryable are retried. Every retry is written to the stage journal as a
 * {@code RETRIED} entry. When the call still fails the error surfaces as a {@link StageFailedException} carrying
 * the last cause; cancellation surfaces as a {@link DiagnosisCancelledException} and is never retried.
 */
@Log4j2
@Component
public class StageExecutor {

    private final ExpeditionProperties.Stage policy;
    private final ExecutorService callExecutor;

    public StageExecutor(ExpeditionProperties properties,
                         @Qualifier("stageCallExecutor") ExecutorService callExecutor) {
        this.policy = properties.getStage();
        this.callExecutor = callExecutor;
    }

    public <T> T call(String operation, StageJournal journal, RunContext ctx, Callable<T> callable) {
        CancellationToken token = ctx.cancellation();
        token.throwIfCancelled(journal.stage());

        AtomicInteger attempts = new AtomicInteger();
        AtomicLong attemptStart = new AtomicLong();

        Retry retry = Retry.of(journal.stage() + ":" + operation, RetryConfig.custom()
                .maxAttempts(Math.max(1, policy.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.getInitialBackoff(), policy.getBackoffMultiplier()))
                .retryOnException(e -> !token.isCancelled() && isRetryable(e))
                .build());

        retry.getEventPublisher().onRetry(event -> {
            Throwable last = event.getLastThrowable();
            Duration took = Duration.ofNanos(System.nanoTime() - attemptStart.get());
            journal.retried(event.getNumberOfRetryAttempts(), took, codeOf(last), messageOf(last));
            log.warn("{} {} attempt {} failed ({}), retrying in {}ms",
                    journal.stage(), operation, event.getNumberOfRetryAttempts(), messageOf(last),
                    event.getWaitInterval().toMillis());
        });

        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(policy.getTimeout())
                .cancelRunningFuture(true)
                .build());

        try {
            T result = retry.executeCallable(() -> {
                attempts.incrementAndGet();
                attemptStart.set(System.nanoTime());
                return attempt(operation, journal.stage(), token, timeLimiter, callable);
            });
            journal.attempts(attempts.get());
            return result;
        } catch (DiagnosisCancelledException e) {
            throw e;
        } catch (DiagnosisException e) {
            if (token.isCancelled()) {
                throw new DiagnosisCancelledException(journal.stage() + " cancelled during " + operation, e);
            }
            throw new StageFailedException(journal.stage(), e.getErrorCode(), attempts.get(),
                    operation + " failed after " + attempts.get() + " attempt(s): " + e.getMessage(), e);
        } catch (Exception e) {
            throw new StageFailedException(journal.stage(), ErrorCode.UNEXPECTED_ERROR, attempts.get(),
                    operation + " failed: " + messageOf(e), e);
        }
    }

    private <T> T attempt(String operation, String stage, CancellationToken token,
                          TimeLimiter timeLimiter, Callable<T> callable) throws Exception {
        Future<T> future = callExecutor.submit(callable);
        token.track(future);
        try {
            return timeLimiter.executeFutureSupplier(() -> future);
        } catch (TimeoutException e) {
            throw new InferenceTimeoutException(stage + " " + operation, policy.getTimeout(), e);
        } catch (CancellationException e) {
            throw new DiagnosisCancelledException(stage + " " + operation + " cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DiagnosisCancelledException(stage + " " + operation + " interrupted", e);
        } catch (IOException | UncheckedIOException e) {
            throw new TransientBackendException(stage + " " + operation + " I/O failure: " + e.getMessage(), e);
        } finally {
            token.release(future);
        }
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof DiagnosisException de && de.isRetryable();
    }

    private static ErrorCode codeOf(Throwable e) {
        return e instanceof DiagnosisException de ? de.getErrorCode() : ErrorCode.UNEXPECTED_ERROR;
    }

    private static String messageOf(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
