package com.eainde.expedition.inference;

public enum InferenceTier {
    /** Low-latency classification model. */
    TIER_1,
    /** Reasoning model for investigation, synthesis and critique. */
    TIER_2
}
