package com.eainde.expedition.state;

import com.eainde.expedition.error.ErrorCode;

import java.io.Serializable;
import java.time.Duration;
import java.util.Optional;

/**
 * One audit line of the diagnosis step log.
 *
 * @param attempt  1-based attempt number the entry refers to
 * @param errorCode null unless the entry records an error or a fallback
 * @param error     last error message, null on a clean entry
 */
public record StepLogEntry(
        String stage,
        StepStatus status,
        Duration duration,
        ErrorCode errorCode,
        String error,
        int attempt
) implements Serializable {

    public static StepLogEntry succeeded(String stage, Duration duration, int attempt) {
        return new StepLogEntry(stage, StepStatus.SUCCEEDED, duration, null, null, attempt);
    }

    public Optional<ErrorCode> code() {
        return Optional.ofNullable(errorCode);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append(stage).append(' ').append(status)
                .append(" #").append(attempt)
                .append(" (").append(duration.toMillis()).append("ms)");
        if (errorCode != null) {
            sb.append(" [").append(errorCode).append("] ").append(error);
        }
        return sb.toString();
    }
}
