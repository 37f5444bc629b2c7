package com.eainde.expedition.state;

public enum DiagnosisStatus {
    RUNNING,
    NO_ANOMALY,
    BLOCKED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
