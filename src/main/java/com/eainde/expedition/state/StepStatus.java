package com.eainde.expedition.state;

/**
 * Outcome of one step-log entry. A stage writes zero or more {@code RETRIED} entries followed by exactly one final entry.
 */
public enum StepStatus {
    SUCCEEDED,
    /** An attempt failed and the call was retried. */
    RETRIED,
    /** The stage decided there was nothing to do, e.g. insufficient data. */
    SKIPPED,
    /** The stage completed on a fallback path: default route, empty retrieval. */
    DEGRADED,
    FAILED,
    BLOCKED
}
