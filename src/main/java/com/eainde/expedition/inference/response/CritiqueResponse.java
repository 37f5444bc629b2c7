package com.eainde.expedition.inference.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CritiqueResponse(
        @JsonProperty("actionAssessments")   List<ActionAssessment> actionAssessments,
        @JsonProperty("unsupportedFraction") Double unsupportedFraction,
        @JsonProperty("issues")              List<String> issues
) {

    /**
     * @param index      1-based rank of the assessed candidate action
     * @param consistent whether the rationale follows from the cited evidence in direction and substance
     */
    public record ActionAssessment(
            @JsonProperty("index")      Integer index,
            @JsonProperty("consistent") Boolean consistent,
            @JsonProperty("reason")     String reason
    ) {
    }
}
