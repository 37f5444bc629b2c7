package com.eainde.expedition.nodes;

import com.eainde.expedition.data.MetricsDataSource;
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
import com.eainde.expedition.inference.response.FindingResponse;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.ContributingFactor;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.SupplementaryData;
import com.eainde.expedition.state.DiagnosisState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Deep-dive investigation. One implementation serves all families; the family chosen by the router selects the
 * {@link InvestigationStrategy}.
 * <p>
 * A response without a hypothesis, or whose citations do not resolve to any supplied evidence field, is a
 * malformed finding and the call is retried.
 */
@Log4j2
@Component
public class InvestigatorNode extends AbstractDiagnosisNode {

    public static final String STAGE = "investigator";

    private final MetricsDataSource dataSource;
    private final InferenceClient inferenceClient;
    private final PromptLibrary prompts;
    private final ResponseSchemas schemas;
    private final StageExecutor stageExecutor;
    private final Map<ChannelFamily, InvestigationStrategy> strategies;

    public InvestigatorNode(MetricsDataSource dataSource, InferenceClient inferenceClient, PromptLibrary prompts,
                            ResponseSchemas schemas, StageExecutor stageExecutor) {
        this.dataSource = dataSource;
        this.inferenceClient = inferenceClient;
        this.prompts = prompts;
        this.schemas = schemas;
        this.stageExecutor = stageExecutor;
        this.strategies = InvestigationStrategy.defaults();
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        AnomalyDescriptor anomaly = require(state.descriptor(), DiagnosisState.DESCRIPTOR);
        ChannelFamily family = require(state.family(), DiagnosisState.FAMILY);
        InvestigationStrategy strategy = strategies.get(family);

        Optional<SupplementaryData> fetched = stageExecutor.call("fetchSupplementaryData", journal, ctx,
                () -> dataSource.fetchSupplementaryData(anomaly.channel(), family, anomaly));
        SupplementaryData data = fetched == null ? SupplementaryData.empty(family) : fetched.orElse(SupplementaryData.empty(family));
        if (data.fields().isEmpty()) {
            log.info("No supplementary {} data for {}", family, anomaly.channel());
        }

        EvidenceIndex evidence = EvidenceIndex.forInvestigation(anomaly, data);
        RenderedPrompt prompt = prompts.render(strategy.promptName(), Map.of(
                "channel", anomaly.channel(),
                "metric", anomaly.metric(),
                "anomaly", anomaly.summary(),
                "focus", strategy.focus(),
                "evidence", evidence.describe()));
        InferenceRequest request = InferenceRequest.of(InferenceTier.TIER_2, prompt,
                schemas.schema(ResponseSchemas.FINDING), ErrorCode.MALFORMED_FINDINGS);

        InvestigationFinding finding = stageExecutor.call("investigate", journal, ctx,
                () -> toFinding(family, inferenceClient.invoke(request, FindingResponse.class), evidence));

        log.info("{} hypothesis (confidence {}): {}", family, finding.confidence(), finding.hypothesis());
        return Map.of(
                DiagnosisState.SUPPLEMENTARY_DATA, data,
                DiagnosisState.FINDING, finding);
    }

    InvestigationFinding toFinding(ChannelFamily family, FindingResponse response, EvidenceIndex evidence) {
        if (response == null || isBlank(response.hypothesis())) {
            throw MalformedResponseException.findings("finding has no hypothesis");
        }
        if (response.confidence() == null) {
            throw MalformedResponseException.findings("finding has no confidence");
        }

        List<ContributingFactor> factors = new ArrayList<>();
        Set<String> cited = new LinkedHashSet<>(evidence.resolve(response.citations()));
        if (response.factors() != null) {
            for (FindingResponse.Factor factor : response.factors()) {
                if (factor == null || isBlank(factor.name())) {
                    throw MalformedResponseException.findings("contributing factor without a name");
                }
                List<String> factorCitations = evidence.resolve(factor.citations());
                cited.addAll(factorCitations);
                factors.add(new ContributingFactor(factor.name().trim(),
                        factor.magnitude() == null ? 0.0 : factor.magnitude(), factorCitations));
            }
        }
        if (cited.isEmpty()) {
            throw MalformedResponseException.findings("no citation resolves to a supplied evidence field");
        }
        factors.sort(Comparator.comparingDouble((ContributingFactor f) -> Math.abs(f.magnitude())).reversed());

        return new InvestigationFinding(
                family,
                response.hypothesis().trim(),
                clamp(response.confidence()),
                factors,
                List.copyOf(cited),
                evidence.readings(cited));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
