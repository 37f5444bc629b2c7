package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one Triple-Lock check.
 *
 * @param score    in [0,1], 1 is best
 * @param findings human-readable problems found, empty on a clean pass
 */
public record CheckResult(String name, CheckOutcome outcome, double score, List<String> findings) implements Serializable {

    public CheckResult {
        findings = List.copyOf(findings);
    }

    public static CheckResult pass(String name, double score) {
        return new CheckResult(name, CheckOutcome.PASS, score, List.of());
    }

    public static CheckResult fail(String name, double score, List<String> findings) {
        return new CheckResult(name, CheckOutcome.FAIL, score, findings);
    }

    public static CheckResult skipped(String name, String reason) {
        return new CheckResult(name, CheckOutcome.SKIPPED, 0.0, List.of(reason));
    }

    public boolean passed() {
        return outcome == CheckOutcome.PASS;
    }

    public boolean failed() {
        return outcome == CheckOutcome.FAIL;
    }
}
