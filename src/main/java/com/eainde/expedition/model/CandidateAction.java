package com.eainde.expedition.model;

import com.eainde.expedition.catalog.ActionType;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A remediation proposed by the explainer, before validation.
 *
 * @param rank            1-based priority
 * @param actionType      catalog entry
 * @param targetChannel   channel the action applies to
 * @param parameterChange proposed numeric parameters, e.g. {@code adjustment_pct -> 20}
 * @param rationale       why the diagnosis implies this action
 * @param citations       evidence ids from the finding or retrieved incidents; never empty once accepted
 * @param impact          estimated impact range
 */
public record CandidateAction(
        int rank,
        ActionType actionType,
        String targetChannel,
        Map<String, Double> parameterChange,
        String rationale,
        List<String> citations,
        ImpactRange impact
) implements Serializable {

    public CandidateAction {
        parameterChange = Map.copyOf(parameterChange);
        citations = List.copyOf(citations);
    }
}
