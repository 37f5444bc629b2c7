package com.eainde.expedition.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of remediation action types. Which of them a channel family may use is decided by the
 * loaded {@link ActionCatalog}, not by this enum.
 */
public enum ActionType {
    BUDGET_INCREASE,
    BUDGET_DECREASE,
    BID_INCREASE,
    BID_DECREASE,
    PAUSE_CAMPAIGN,
    ENABLE_CAMPAIGN,
    CREATIVE_FATIGUE,
    TRACKING_ISSUE,
    PLATFORM_ISSUE,
    MANUAL_REVIEW,
    BOT_TRAFFIC,
    INFLUENCER_FRAUD,
    MAKE_GOOD,
    PARTNER_ISSUE,
    VENDOR_DELIVERY,
    MEASUREMENT_AUDIT;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ActionType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
    }

    @JsonCreator
    static ActionType fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + id));
    }
}
