package com.eainde.expedition.model;

import java.util.Locale;

/**
 * Tone variants of the same diagnosis. Facts never differ between levels.
 */
public enum AudienceLevel {
    EXECUTIVE,
    DIRECTOR,
    PRACTITIONER,
    ANALYST;

    public String jsonKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
