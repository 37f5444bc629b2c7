package com.eainde.expedition.model;

public enum Direction {
    SPIKE,
    DROP;

    public static Direction of(double observed, double expected) {
        return observed >= expected ? SPIKE : DROP;
    }
}
