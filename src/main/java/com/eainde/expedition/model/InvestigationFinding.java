package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Structured output of an investigator.
 *
 * @param family     the strategy that produced it
 * @param hypothesis root-cause hypothesis
 * @param confidence self-reported confidence in [0,1]
 * @param factors    contributing factors, ranked by |magnitude| descending
 * @param citations  every evidence id the finding relies on; each is a key of {@code evidence}
 * @param evidence   the cited evidence readings, id to value
 */
public record InvestigationFinding(
        ChannelFamily family,
        String hypothesis,
        double confidence,
        List<ContributingFactor> factors,
        List<String> citations,
        Map<String, String> evidence
) implements Serializable {

    public InvestigationFinding {
        factors = List.copyOf(factors);
        citations = List.copyOf(citations);
        evidence = Map.copyOf(evidence);
    }

    public boolean cites(String evidenceId) {
        return evidence.containsKey(evidenceId);
    }
}
