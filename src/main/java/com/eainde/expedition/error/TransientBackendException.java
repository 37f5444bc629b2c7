package com.eainde.expedition.error;

public class TransientBackendException extends DiagnosisException {

    public TransientBackendException(String message) {
        super(ErrorCode.TRANSIENT_BACKEND_ERROR, message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_BACKEND_ERROR, message, cause);
    }
}
