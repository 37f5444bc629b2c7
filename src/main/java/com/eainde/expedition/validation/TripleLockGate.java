package com.eainde.expedition.validation;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.evidence.EvidenceIndex;
import com.eainde.expedition.inference.response.CritiqueResponse;
import com.eainde.expedition.model.CandidateAction;
import com.eainde.expedition.model.CheckResult;
import com.eainde.expedition.model.DiagnosisClaim;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.model.ValidationVerdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The three release checks and the aggregate verdict.
 * <ol>
 *   <li>Data grounding: every claim cites at least one id and every id it cites exists in the record.</li>
 *   <li>Evidence verification: every action cites existing evidence and was judged consistent with it.</li>
 *   <li>Hallucination: share of content not traceable to evidence, at most the configured limit.</li>
 * </ol>
 * The verdict blocks when the hallucination risk exceeds the limit or either of the first two checks fails.
 */
@Component
public class TripleLockGate {

    public static final String DATA_GROUNDING = "data_grounding";
    public static final String EVIDENCE_VERIFICATION = "evidence_verification";
    public static final String HALLUCINATION = "hallucination_check";

    private final double maxHallucinationRisk;

    public TripleLockGate(ExpeditionProperties properties) {
        this.maxHallucinationRisk = properties.getCritic().getMaxHallucinationRisk();
    }

    public CheckResult dataGrounding(SynthesizedDiagnosis diagnosis, EvidenceIndex evidence) {
        List<DiagnosisClaim> claims = diagnosis.claims();
        if (claims.isEmpty()) {
            return CheckResult.fail(DATA_GROUNDING, 0.0, List.of("diagnosis makes no citable claim"));
        }
        List<String> findings = new ArrayList<>();
        int grounded = 0;
        for (DiagnosisClaim claim : claims) {
            List<String> unresolved = claim.citations().stream().filter(id -> !evidence.contains(id)).toList();
            if (claim.citations().isEmpty()) {
                findings.add("ungrounded claim \"" + claim.text() + "\" cites no evidence");
            } else if (!unresolved.isEmpty()) {
                findings.add("ungrounded claim \"" + claim.text() + "\" cites unknown evidence " + unresolved);
            } else {
                grounded++;
            }
        }
        double score = (double) grounded / claims.size();
        return findings.isEmpty()
                ? CheckResult.pass(DATA_GROUNDING, score)
                : CheckResult.fail(DATA_GROUNDING, score, findings);
    }

    public CheckResult evidenceVerification(List<CandidateAction> actions, CritiqueResponse critique,
                                            EvidenceIndex evidence) {
        if (actions.isEmpty()) {
            return CheckResult.pass(EVIDENCE_VERIFICATION, 1.0);
        }
        Map<Integer, CritiqueResponse.ActionAssessment> assessments = new HashMap<>();
        if (critique.actionAssessments() != null) {
            critique.actionAssessments().stream()
                    .filter(Objects::nonNull)
                    .filter(a -> a.index() != null)
                    .forEach(a -> assessments.putIfAbsent(a.index(), a));
        }

        List<String> findings = new ArrayList<>();
        int verified = 0;
        for (CandidateAction action : actions) {
            String label = "action #" + action.rank() + " " + action.actionType().id();
            if (evidence.resolve(action.citations()).isEmpty()) {
                findings.add(label + " has no evidence in the record");
                continue;
            }
            CritiqueResponse.ActionAssessment assessment = assessments.get(action.rank());
            if (assessment == null) {
                findings.add(label + " was not assessed");
            } else if (!Boolean.TRUE.equals(assessment.consistent())) {
                findings.add(label + " contradicts its evidence: " + assessment.reason());
            } else {
                verified++;
            }
        }
        double score = (double) verified / actions.size();
        return findings.isEmpty()
                ? CheckResult.pass(EVIDENCE_VERIFICATION, score)
                : CheckResult.fail(EVIDENCE_VERIFICATION, score, findings);
    }

    public CheckResult hallucination(double risk) {
        return risk > maxHallucinationRisk
                ? CheckResult.fail(HALLUCINATION, 1.0 - risk, List.of(String.format(Locale.ROOT,
                        "hallucination risk %.2f exceeds %.2f", risk, maxHallucinationRisk)))
                : CheckResult.pass(HALLUCINATION, 1.0 - risk);
    }

    /** Verdict when grounding already failed; the evidence check is not run and the risk is the ungrounded share. */
    public ValidationVerdict blockedOnGrounding(CheckResult grounding) {
        double risk = clamp(1.0 - grounding.score());
        CheckResult evidence = CheckResult.skipped(EVIDENCE_VERIFICATION, "data grounding failed");
        return verdict(grounding, evidence, hallucination(risk), risk);
    }

    public ValidationVerdict verdict(CheckResult grounding, CheckResult evidence, CritiqueResponse critique) {
        double reported = critique.unsupportedFraction() == null ? 0.0 : critique.unsupportedFraction();
        double risk = clamp(Math.max(reported, 1.0 - grounding.score()));
        return verdict(grounding, evidence, hallucination(risk), risk);
    }

    private ValidationVerdict verdict(CheckResult grounding, CheckResult evidence, CheckResult hallucination,
                                      double risk) {
        List<String> reasons = new ArrayList<>();
        if (grounding.failed()) {
            reasons.add("Data grounding failed: " + String.join("; ", grounding.findings()));
        }
        if (evidence.failed()) {
            reasons.add("Evidence verification failed: " + String.join("; ", evidence.findings()));
        }
        if (hallucination.failed()) {
            reasons.add("Hallucination check failed: " + String.join("; ", hallucination.findings()));
        }
        boolean blocked = !reasons.isEmpty();
        return new ValidationVerdict(grounding, evidence, hallucination, risk, blocked,
                blocked ? String.join(" | ", reasons) : null);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
