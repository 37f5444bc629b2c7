package com.eainde.expedition.error;

/**
 * A backend failure a retry cannot fix. Fails the stage on the first attempt.
 */
public class BackendRejectedException extends DiagnosisException {

    public BackendRejectedException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_REJECTED, message, cause);
    }
}
