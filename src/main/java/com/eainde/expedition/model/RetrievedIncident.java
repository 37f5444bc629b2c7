package com.eainde.expedition.model;

import java.io.Serializable;

/**
 * A historical incident returned by similarity search.
 *
 * @param similarity similarity score in [0,1], higher is closer
 */
public record RetrievedIncident(
        String incidentId,
        double similarity,
        String resolutionSummary,
        String rootCause,
        String channel
) implements Serializable {

    public static final String EVIDENCE_PREFIX = "incident:";

    public String evidenceId() {
        return EVIDENCE_PREFIX + incidentId;
    }
}
