package com.eainde.expedition.inference.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RouteResponse(
        @JsonProperty("family") String family,
        @JsonProperty("reason") String reason
) {
}
