package com.eainde.expedition.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of investigation families. The router always resolves an anomaly to exactly one of these.
 */
public enum ChannelFamily {
    PAID_MEDIA("paid-media"),
    INFLUENCER("influencer"),
    OFFLINE("offline");

    private final String label;

    ChannelFamily(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts the enum name or the hyphen/underscore label in any case ("PAID_MEDIA", "paid-media", "paid_media").
     */
    public static Optional<ChannelFamily> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(family -> family.name().equals(normalized))
                .findFirst();
    }
}
