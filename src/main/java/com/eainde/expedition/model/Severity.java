package com.eainde.expedition.model;

/**
 * Severity tiers for a metric deviation, ordered from least to most severe.
 */
public enum Severity {
    NONE,
    WARNING,
    CRITICAL;

    public static Severity classify(double zScore, double warningZ, double criticalZ) {
        double magnitude = Math.abs(zScore);
        if (magnitude >= criticalZ) {
            return CRITICAL;
        }
        if (magnitude >= warningZ) {
            return WARNING;
        }
        return NONE;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
