package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Family-specific evidence fetched for an investigation: campaign breakdowns, creator performance, offline ledgers.
 * Keys are stable field ids the investigator cites, values are their rendered readings.
 */
public record SupplementaryData(ChannelFamily family, Map<String, String> fields) implements Serializable {

    public SupplementaryData {
        fields = Map.copyOf(fields);
    }

    public static SupplementaryData empty(ChannelFamily family) {
        return new SupplementaryData(family, Map.of());
    }
}
