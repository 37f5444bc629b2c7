package com.eainde.expedition.inference.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FindingResponse(
        @JsonProperty("hypothesis") String hypothesis,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("factors")    List<Factor> factors,
        @JsonProperty("citations")  List<String> citations
) {

    public record Factor(
            @JsonProperty("name")      String name,
            @JsonProperty("magnitude") Double magnitude,
            @JsonProperty("citations") List<String> citations
    ) {
    }
}
