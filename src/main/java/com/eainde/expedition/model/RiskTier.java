package com.eainde.expedition.model;

public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH;

    public boolean requiresApproval() {
        return this != LOW;
    }
}
