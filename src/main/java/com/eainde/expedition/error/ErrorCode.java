package com.eainde.expedition.error;

/**
 * Failure taxonomy recorded on step-log entries and terminal diagnosis records.
 */
public enum ErrorCode {

    /** Detector window too short; the run ends as NO_ANOMALY. */
    INSUFFICIENT_DATA(false),

    /** Router could not classify the channel and used the configured fallback family. */
    AMBIGUOUS_ROUTE(false),

    /** Investigator output did not fit the finding schema. */
    MALFORMED_FINDINGS(true),

    /** Explainer output did not fit the synthesis schema. */
    MALFORMED_SYNTHESIS(true),

    /** Critic or router output did not fit its schema. */
    MALFORMED_RESPONSE(true),

    /** Similarity search failed; treated as zero retrieved incidents. */
    RETRIEVAL_UNAVAILABLE(false),

    /** Timeout or network failure talking to a backend. */
    TRANSIENT_BACKEND_ERROR(true),

    /** Backend refused the call: authentication, invalid request or unknown model. Retrying cannot help. */
    BACKEND_REJECTED(false),

    /** Critic verdict. A reported outcome, never an exception path. */
    SAFETY_BLOCKED(false),

    /** Pre-flight found the data source stale or unhealthy. */
    STALE_DATA(false),

    CANCELLED(false),

    UNEXPECTED_ERROR(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
