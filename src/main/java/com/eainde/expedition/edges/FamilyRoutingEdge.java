package com.eainde.expedition.edges;

import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.state.DiagnosisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Sends the run to the investigator of the routed family.
 */
@Component
public class FamilyRoutingEdge implements AsyncEdgeAction<DiagnosisState> {

    @Override
    public CompletableFuture<String> apply(DiagnosisState state) {
        if (state.isTerminal() || state.family().isEmpty()) {
            return CompletableFuture.completedFuture(StageOutcomeEdge.HALT);
        }
        return CompletableFuture.completedFuture(routeFor(state.family().get()));
    }

    public static String routeFor(ChannelFamily family) {
        return family.name().toLowerCase(Locale.ROOT);
    }
}
