package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * Estimated relative change of the anomalous metric if the action is applied, e.g. 0.05..0.15 for +5% to +15%.
 */
public record ImpactRange(double low, double high) implements Serializable {

    public static ImpactRange of(double a, double b) {
        return new ImpactRange(Math.min(a, b), Math.max(a, b));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%+.0f%%..%+.0f%%", low * 100, high * 100);
    }
}
