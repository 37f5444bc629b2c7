package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Explainer output. Diagnosis text, explanations and candidate actions all come from one structured response.
 *
 * @param rootCause       headline root cause
 * @param confidence      confidence in [0,1]
 * @param claims          factual claims with citations
 * @param explanations    one explanation per audience level
 * @param actions         accepted candidate actions, ranked
 * @param rejectedActions audit notes for actions dropped because none of their citations resolved
 */
public record SynthesizedDiagnosis(
        String rootCause,
        double confidence,
        List<DiagnosisClaim> claims,
        Map<AudienceLevel, String> explanations,
        List<CandidateAction> actions,
        List<String> rejectedActions
) implements Serializable {

    public SynthesizedDiagnosis {
        claims = List.copyOf(claims);
        explanations = Map.copyOf(explanations);
        actions = List.copyOf(actions);
        rejectedActions = List.copyOf(rejectedActions);
    }

    public String explanationFor(AudienceLevel level) {
        return explanations.get(level);
    }
}
