package com.eainde.expedition.model;

public enum CheckOutcome {
    PASS,
    FAIL,
    /** Not evaluated because an earlier check already blocked the diagnosis. */
    SKIPPED
}
