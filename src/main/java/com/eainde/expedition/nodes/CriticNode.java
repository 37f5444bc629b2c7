package com.eainde.expedition.nodes;

import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.error.MalformedResponseException;
import com.eainde.expedition.evidence.EvidenceIndex;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageExecutor;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.inference.InferenceClient;
import com.eainde.expedition.inference.InferenceRequest;
import com.eainde.expedition.inference.InferenceTier;
import com.eainde.expedition.inference.PromptLibrary;
import com.eainde.expedition.inference.RenderedPrompt;
import com.eainde.expedition.inference.ResponseSchemas;
import com.eainde.expedition.inference.response.CritiqueResponse;
import com.eainde.expedition.model.AudienceLevel;
import com.eainde.expedition.model.CandidateAction;
import com.eainde.expedition.model.CheckResult;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.model.ValidationVerdict;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.DiagnosisStatus;
import com.eainde.expedition.validation.TripleLockGate;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Triple-Lock gate. Grounding is checked deterministically first; an ungrounded diagnosis is blocked without a
 * model call. Otherwise a tier-2 critique judges each action against its evidence and estimates the unsupported
 * share of the text, audience explanations included.
 * <p>
 * A blocked verdict ends the run as {@code BLOCKED} with an empty action list. If the critique itself cannot be
 * obtained the stage fails; nothing is released unvalidated.
 */
@Log4j2
@Component
public class CriticNode extends AbstractDiagnosisNode {

    public static final String STAGE = "critic";
    static final String PROMPT = "critic";

    private final InferenceClient inferenceClient;
    private final PromptLibrary prompts;
    private final ResponseSchemas schemas;
    private final StageExecutor stageExecutor;
    private final TripleLockGate gate;

    public CriticNode(InferenceClient inferenceClient, PromptLibrary prompts, ResponseSchemas schemas,
                      StageExecutor stageExecutor, TripleLockGate gate) {
        this.inferenceClient = inferenceClient;
        this.prompts = prompts;
        this.schemas = schemas;
        this.stageExecutor = stageExecutor;
        this.gate = gate;
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        SynthesizedDiagnosis diagnosis = require(state.diagnosis(), DiagnosisState.DIAGNOSIS);
        InvestigationFinding finding = require(state.finding(), DiagnosisState.FINDING);
        EvidenceIndex evidence = EvidenceIndex.forDiagnosis(finding, state.incidents());

        CheckResult grounding = gate.dataGrounding(diagnosis, evidence);
        ValidationVerdict verdict;
        if (grounding.failed()) {
            verdict = gate.blockedOnGrounding(grounding);
        } else {
            CritiqueResponse critique = critique(diagnosis, evidence, ctx, journal);
            CheckResult verification = gate.evidenceVerification(diagnosis.actions(), critique, evidence);
            verdict = gate.verdict(grounding, verification, critique);
        }

        if (verdict.blocked()) {
            log.warn("Diagnosis blocked (risk {}): {}", verdict.hallucinationRisk(), verdict.blockReason());
            journal.markBlocked(verdict.blockReason());
            return Map.of(
                    DiagnosisState.VERDICT, verdict,
                    DiagnosisState.STATUS, DiagnosisStatus.BLOCKED,
                    DiagnosisState.BLOCK_REASON, verdict.blockReason(),
                    DiagnosisState.ACTIONS, List.of());
        }
        log.info("Diagnosis passed validation (risk {})", verdict.hallucinationRisk());
        return Map.of(DiagnosisState.VERDICT, verdict);
    }

    private CritiqueResponse critique(SynthesizedDiagnosis diagnosis, EvidenceIndex evidence,
                                      RunContext ctx, StageJournal journal) {
        RenderedPrompt prompt = prompts.render(PROMPT, Map.of(
                "rootCause", diagnosis.rootCause(),
                "claims", diagnosis.claims().stream()
                        .map(c -> "- " + c.text() + " " + c.citations())
                        .collect(Collectors.joining("\n")),
                "explanations", describeExplanations(diagnosis),
                "actions", diagnosis.actions().isEmpty() ? "none" : describeActions(diagnosis.actions()),
                "evidence", evidence.describe()));
        InferenceRequest request = InferenceRequest.of(InferenceTier.TIER_2, prompt,
                schemas.schema(ResponseSchemas.CRITIQUE), ErrorCode.MALFORMED_RESPONSE);

        return stageExecutor.call("critique", journal, ctx, () -> {
            CritiqueResponse response = inferenceClient.invoke(request, CritiqueResponse.class);
            if (response == null || response.unsupportedFraction() == null) {
                throw new MalformedResponseException(ErrorCode.MALFORMED_RESPONSE,
                        "critique has no unsupported fraction");
            }
            return response;
        });
    }

    /** Every audience text, since each one is diagnosis content the critique must trace. */
    static String describeExplanations(SynthesizedDiagnosis diagnosis) {
        return Arrays.stream(AudienceLevel.values())
                .map(level -> "- " + level.jsonKey() + ": " + diagnosis.explanationFor(level))
                .collect(Collectors.joining("\n"));
    }

    private static String describeActions(List<CandidateAction> actions) {
        return actions.stream()
                .map(a -> String.format(Locale.ROOT, "%d. %s on %s %s: %s (evidence %s)",
                        a.rank(), a.actionType().id(), a.targetChannel(), a.parameterChange(), a.rationale(),
                        a.citations()))
                .collect(Collectors.joining("\n"));
    }
}
