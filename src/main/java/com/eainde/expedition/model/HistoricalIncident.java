package com.eainde.expedition.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A post-mortem record as ingested into the incident memory.
 */
public record HistoricalIncident(
        @JsonProperty("incidentId")   String incidentId,
        @JsonProperty("date")         String date,
        @JsonProperty("channel")      String channel,
        @JsonProperty("anomalyType")  String anomalyType,
        @JsonProperty("rootCause")    String rootCause,
        @JsonProperty("resolution")   String resolution
) {

    public String toDocument() {
        return String.format(Locale.ROOT, "%s %s. Cause: %s. Fix: %s", channel, anomalyType, rootCause, resolution);
    }
}
