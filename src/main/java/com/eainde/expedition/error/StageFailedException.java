package com.eainde.expedition.error;

/**
 * A stage gave up: either a non-retryable error or retries exhausted. The last underlying error is the cause.
 */
public class StageFailedException extends DiagnosisException {

    private final String stage;
    private final int attempts;

    public StageFailedException(String stage, ErrorCode errorCode, int attempts, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.stage = stage;
        this.attempts = attempts;
    }

    public String getStage() {
        return stage;
    }

    public int getAttempts() {
        return attempts;
    }
}
