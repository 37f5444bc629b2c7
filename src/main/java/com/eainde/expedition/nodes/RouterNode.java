package com.eainde.expedition.nodes;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.error.DiagnosisCancelledException;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageExecutor;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.inference.InferenceClient;
import com.eainde.expedition.inference.InferenceRequest;
import com.eainde.expedition.inference.InferenceTier;
import com.eainde.expedition.inference.PromptLibrary;
import com.eainde.expedition.inference.RenderedPrompt;
import com.eainde.expedition.inference.ResponseSchemas;
import com.eainde.expedition.inference.response.RouteResponse;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.state.DiagnosisState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the investigation family. Mapped channels resolve from the routing table without a model call; the
 * rest go to the tier-1 classifier. Any classifier problem resolves to the configured fallback family, so the
 * run always has exactly one investigator.
 */
@Log4j2
@Component
public class RouterNode extends AbstractDiagnosisNode {

    public static final String STAGE = "router";
    static final String PROMPT = "router";

    private final InferenceClient inferenceClient;
    private final PromptLibrary prompts;
    private final ResponseSchemas schemas;
    private final StageExecutor stageExecutor;
    private final ChannelFamily fallbackFamily;

    public RouterNode(InferenceClient inferenceClient, PromptLibrary prompts, ResponseSchemas schemas,
                      StageExecutor stageExecutor, ExpeditionProperties properties) {
        this.inferenceClient = inferenceClient;
        this.prompts = prompts;
        this.schemas = schemas;
        this.stageExecutor = stageExecutor;
        this.fallbackFamily = properties.getRouter().getFallbackFamily();
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        AnomalyDescriptor anomaly = require(state.descriptor(), DiagnosisState.DESCRIPTOR);

        Optional<ChannelFamily> mapped = ctx.routingTable().familyOf(anomaly.channel());
        if (mapped.isPresent()) {
            log.debug("Channel {} mapped to {}", anomaly.channel(), mapped.get());
            return Map.of(DiagnosisState.FAMILY, mapped.get());
        }

        ChannelFamily family;
        try {
            family = classify(anomaly, ctx, journal).orElse(null);
            if (family == null) {
                journal.markDegraded(ErrorCode.AMBIGUOUS_ROUTE, String.format(Locale.ROOT,
                        "classifier returned no valid family for '%s', using %s", anomaly.channel(), fallbackFamily));
                family = fallbackFamily;
            }
        } catch (DiagnosisCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            journal.markDegraded(ErrorCode.AMBIGUOUS_ROUTE, String.format(Locale.ROOT,
                    "classification of '%s' failed (%s), using %s", anomaly.channel(), e.getMessage(), fallbackFamily));
            family = fallbackFamily;
        }
        log.info("Channel {} routed to {}", anomaly.channel(), family);
        return Map.of(DiagnosisState.FAMILY, family);
    }

    private Optional<ChannelFamily> classify(AnomalyDescriptor anomaly, RunContext ctx, StageJournal journal) {
        RenderedPrompt prompt = prompts.render(PROMPT, Map.of(
                "channel", anomaly.channel(),
                "metric", anomaly.metric(),
                "anomaly", anomaly.summary(),
                "families", Arrays.stream(ChannelFamily.values()).map(Enum::name).collect(Collectors.joining(", "))));
        InferenceRequest request = InferenceRequest.of(InferenceTier.TIER_1, prompt,
                schemas.schema(ResponseSchemas.ROUTE), ErrorCode.MALFORMED_RESPONSE);

        RouteResponse response = stageExecutor.call("classify", journal, ctx,
                () -> inferenceClient.invoke(request, RouteResponse.class));
        return Optional.ofNullable(response).flatMap(r -> ChannelFamily.fromLabel(r.family()));
    }
}
