package com.eainde.expedition.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Numeric bounds for one action parameter.
 */
public record ParameterSpec(
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("default") double defaultValue
) {

    public ParameterSpec {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
        if (defaultValue < min || defaultValue > max) {
            throw new IllegalArgumentException("default " + defaultValue + " outside [" + min + ", " + max + "]");
        }
    }

    public double clamp(double value) {
        if (Double.isNaN(value)) {
            return defaultValue;
        }
        return Math.max(min, Math.min(max, value));
    }
}
