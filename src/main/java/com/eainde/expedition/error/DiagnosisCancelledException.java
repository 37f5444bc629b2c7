package com.eainde.expedition.error;

public class DiagnosisCancelledException extends DiagnosisException {

    public DiagnosisCancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }

    public DiagnosisCancelledException(String message, Throwable cause) {
        super(ErrorCode.CANCELLED, message, cause);
    }
}
