package com.eainde.expedition.model;

import java.io.Serializable;

/**
 * Aggregate Triple-Lock verdict.
 *
 * @param hallucinationRisk fraction of diagnosis content not traceable to evidence, in [0,1]
 * @param blocked           true when no action may reach the proposer
 * @param blockReason       human-readable reason, present iff blocked
 */
public record ValidationVerdict(
        CheckResult dataGrounding,
        CheckResult evidenceVerification,
        CheckResult hallucinationCheck,
        double hallucinationRisk,
        boolean blocked,
        String blockReason
) implements Serializable {

    public ValidationVerdict {
        if (blocked && (blockReason == null || blockReason.isBlank())) {
            throw new IllegalArgumentException("a blocked verdict needs a block reason");
        }
    }
}
