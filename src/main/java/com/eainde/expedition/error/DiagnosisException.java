package com.eainde.expedition.error;

/**
 * Root of all diagnosis pipeline failures. Carries the {@link ErrorCode} that ends up in the step log.
 */
public class DiagnosisException extends RuntimeException {

    private final ErrorCode errorCode;

    public DiagnosisException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DiagnosisException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
