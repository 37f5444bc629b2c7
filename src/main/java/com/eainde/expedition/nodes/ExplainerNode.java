package com.eainde.expedition.nodes;

import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ActionType;
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
import com.eainde.expedition.inference.response.SynthesisResponse;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.AudienceLevel;
import com.eainde.expedition.model.CandidateAction;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.DiagnosisClaim;
import com.eainde.expedition.model.ImpactRange;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.state.DiagnosisState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes the diagnosis, its four audience explanations and the candidate actions in a single structured call.
 * <p>
 * Actions come out of the same response as the diagnosis they follow from, restricted to the catalog entries of
 * the investigated family. Claim citations are kept as returned so the critic can judge them; an action whose
 * citations resolve to nothing in the record is moved to {@code rejectedActions}.
 */
@Log4j2
@Component
public class ExplainerNode extends AbstractDiagnosisNode {

    public static final String STAGE = "explainer";
    static final String PROMPT = "explainer";

    private final InferenceClient inferenceClient;
    private final PromptLibrary prompts;
    private final ResponseSchemas schemas;
    private final StageExecutor stageExecutor;

    public ExplainerNode(InferenceClient inferenceClient, PromptLibrary prompts, ResponseSchemas schemas,
                         StageExecutor stageExecutor) {
        this.inferenceClient = inferenceClient;
        this.prompts = prompts;
        this.schemas = schemas;
        this.stageExecutor = stageExecutor;
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        AnomalyDescriptor anomaly = require(state.descriptor(), DiagnosisState.DESCRIPTOR);
        ChannelFamily family = require(state.family(), DiagnosisState.FAMILY);
        InvestigationFinding finding = require(state.finding(), DiagnosisState.FINDING);
        List<RetrievedIncident> incidents = state.incidents();

        EvidenceIndex evidence = EvidenceIndex.forDiagnosis(finding, incidents);
        ActionCatalog catalog = ctx.actionCatalog();
        List<ActionType> permitted = catalog.permittedFor(family);

        RenderedPrompt prompt = prompts.render(PROMPT, Map.of(
                "anomaly", anomaly.summary(),
                "channel", anomaly.channel(),
                "hypothesis", finding.hypothesis(),
                "factors", describeFactors(finding),
                "evidence", evidence.describe(),
                "incidents", incidents.isEmpty() ? "none" : describeIncidents(incidents),
                "actions", permitted.stream()
                        .map(type -> "- " + type.id() + ": " + catalog.require(type).description())
                        .collect(Collectors.joining("\n"))));
        InferenceRequest request = InferenceRequest.of(InferenceTier.TIER_2, prompt,
                schemas.synthesis(permitted.stream().map(ActionType::id).toList(), evidence.ids()),
                ErrorCode.MALFORMED_SYNTHESIS);

        SynthesizedDiagnosis diagnosis = stageExecutor.call("synthesize", journal, ctx, () -> toDiagnosis(
                inferenceClient.invoke(request, SynthesisResponse.class), evidence, catalog, family, anomaly.channel()));

        if (!diagnosis.rejectedActions().isEmpty()) {
            log.warn("Rejected {} action(s) without resolvable evidence: {}",
                    diagnosis.rejectedActions().size(), diagnosis.rejectedActions());
        }
        log.info("Root cause: {} ({} claim(s), {} action(s))",
                diagnosis.rootCause(), diagnosis.claims().size(), diagnosis.actions().size());
        return Map.of(DiagnosisState.DIAGNOSIS, diagnosis);
    }

    SynthesizedDiagnosis toDiagnosis(SynthesisResponse response, EvidenceIndex evidence, ActionCatalog catalog,
                                     ChannelFamily family, String defaultChannel) {
        if (response == null || isBlank(response.rootCause())) {
            throw MalformedResponseException.synthesis("synthesis has no root cause");
        }
        if (response.claims() == null) {
            throw MalformedResponseException.synthesis("synthesis has no claims list");
        }

        List<DiagnosisClaim> claims = new ArrayList<>();
        for (SynthesisResponse.Claim claim : response.claims()) {
            if (claim == null || isBlank(claim.text())) {
                throw MalformedResponseException.synthesis("claim without text");
            }
            claims.add(new DiagnosisClaim(claim.text().trim(),
                    claim.citations() == null ? List.of()
                            : claim.citations().stream().filter(Objects::nonNull).map(String::trim).toList()));
        }

        Map<AudienceLevel, String> explanations = explanations(response.explanations());

        List<CandidateAction> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        List<SynthesisResponse.Action> proposed = response.actions() == null ? List.of() : response.actions();
        for (int i = 0; i < proposed.size(); i++) {
            SynthesisResponse.Action action = proposed.get(i);
            if (action == null) {
                continue;
            }
            ActionType type = ActionType.fromId(action.actionType())
                    .filter(t -> catalog.isPermitted(t, family))
                    .orElseThrow(() -> MalformedResponseException.synthesis(
                            "action type '" + action.actionType() + "' is not in the catalog for " + family));

            List<String> citations = evidence.resolve(action.citations());
            if (citations.isEmpty()) {
                rejected.add(String.format(Locale.ROOT, "#%d %s: no citation resolves to evidence (cited %s)",
                        i + 1, type.id(), action.citations()));
                continue;
            }
            accepted.add(new CandidateAction(
                    accepted.size() + 1,
                    type,
                    isBlank(action.targetChannel()) ? defaultChannel : action.targetChannel().trim(),
                    parameters(action.parameterChanges()),
                    action.rationale() == null ? "" : action.rationale().trim(),
                    citations,
                    ImpactRange.of(orZero(action.impactLow()), orZero(action.impactHigh()))));
        }

        return new SynthesizedDiagnosis(
                response.rootCause().trim(),
                response.confidence() == null ? 0.0 : Math.max(0.0, Math.min(1.0, response.confidence())),
                claims,
                explanations,
                accepted,
                rejected);
    }

    private static Map<AudienceLevel, String> explanations(SynthesisResponse.Explanations raw) {
        if (raw == null) {
            throw MalformedResponseException.synthesis("synthesis has no explanations");
        }
        Map<AudienceLevel, String> explanations = new EnumMap<>(AudienceLevel.class);
        explanations.put(AudienceLevel.EXECUTIVE, raw.executive());
        explanations.put(AudienceLevel.DIRECTOR, raw.director());
        explanations.put(AudienceLevel.PRACTITIONER, raw.practitioner());
        explanations.put(AudienceLevel.ANALYST, raw.analyst());
        for (Map.Entry<AudienceLevel, String> entry : explanations.entrySet()) {
            if (isBlank(entry.getValue())) {
                throw MalformedResponseException.synthesis("missing " + entry.getKey().jsonKey() + " explanation");
            }
            entry.setValue(entry.getValue().trim());
        }
        return explanations;
    }

    private static Map<String, Double> parameters(List<SynthesisResponse.ParameterChange> changes) {
        Map<String, Double> parameters = new LinkedHashMap<>();
        if (changes != null) {
            for (SynthesisResponse.ParameterChange change : changes) {
                if (change != null && !isBlank(change.name()) && change.value() != null) {
                    parameters.put(change.name().trim(), change.value());
                }
            }
        }
        return parameters;
    }

    private static String describeFactors(InvestigationFinding finding) {
        if (finding.factors().isEmpty()) {
            return "none";
        }
        return finding.factors().stream()
                .map(f -> String.format(Locale.ROOT, "- %s (magnitude %.2f, evidence %s)",
                        f.name(), f.magnitude(), f.citations()))
                .collect(Collectors.joining("\n"));
    }

    private static String describeIncidents(List<RetrievedIncident> incidents) {
        return incidents.stream()
                .map(i -> String.format(Locale.ROOT, "- %s on %s (similarity %.2f): cause %s; resolved by %s",
                        i.evidenceId(), i.channel(), i.similarity(), i.rootCause(), i.resolutionSummary()))
                .collect(Collectors.joining("\n"));
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
