package com.eainde.expedition.catalog;

import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.RiskTier;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Set;

/**
 * One permissible action: which families may use it, what it does, and how its parameters are bounded.
 */
public record ActionCatalogEntry(
        @JsonProperty("type")        ActionType type,
        @JsonProperty("families")    Set<ChannelFamily> families,
        @JsonProperty("operation")   String operation,
        @JsonProperty("riskTier")    RiskTier riskTier,
        @JsonProperty("parameters")  Map<String, ParameterSpec> parameters,
        @JsonProperty("attributes")  Map<String, String> attributes,
        @JsonProperty("description") String description
) {

    public ActionCatalogEntry {
        families = families == null ? Set.of() : Set.copyOf(families);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean allows(ChannelFamily family) {
        return families.contains(family);
    }
}
