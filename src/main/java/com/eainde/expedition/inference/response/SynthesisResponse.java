package com.eainde.expedition.inference.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SynthesisResponse(
        @JsonProperty("rootCause")    String rootCause,
        @JsonProperty("confidence")   Double confidence,
        @JsonProperty("claims")       List<Claim> claims,
        @JsonProperty("explanations") Explanations explanations,
        @JsonProperty("actions")      List<Action> actions
) {

    public record Claim(
            @JsonProperty("text")      String text,
            @JsonProperty("citations") List<String> citations
    ) {
    }

    public record Explanations(
            @JsonProperty("executive")    String executive,
            @JsonProperty("director")     String director,
            @JsonProperty("practitioner") String practitioner,
            @JsonProperty("analyst")      String analyst
    ) {
    }

    public record Action(
            @JsonProperty("actionType")       String actionType,
            @JsonProperty("targetChannel")    String targetChannel,
            @JsonProperty("parameterChanges") List<ParameterChange> parameterChanges,
            @JsonProperty("rationale")        String rationale,
            @JsonProperty("citations")        List<String> citations,
            @JsonProperty("impactLow")        Double impactLow,
            @JsonProperty("impactHigh")       Double impactHigh
    ) {
    }

    public record ParameterChange(
            @JsonProperty("name")  String name,
            @JsonProperty("value") Double value
    ) {
    }
}
