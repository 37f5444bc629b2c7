package com.eainde.expedition.error;

import java.time.Duration;

/**
 * A backend call exceeded its deadline. Distinguishable from a malformed response, retried like any transient error.
 */
public class InferenceTimeoutException extends TransientBackendException {

    private final Duration timeout;

    public InferenceTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public InferenceTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation + " timed out after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
