package com.eainde.expedition.error;

/**
 * Model output that cannot be parsed into the schema the stage asked for.
 */
public class MalformedResponseException extends DiagnosisException {

    public MalformedResponseException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public MalformedResponseException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static MalformedResponseException findings(String message) {
        return new MalformedResponseException(ErrorCode.MALFORMED_FINDINGS, message);
    }

    public static MalformedResponseException synthesis(String message) {
        return new MalformedResponseException(ErrorCode.MALFORMED_SYNTHESIS, message);
    }
}
