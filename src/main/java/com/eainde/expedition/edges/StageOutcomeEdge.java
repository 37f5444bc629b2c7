package com.eainde.expedition.edges;

import com.eainde.expedition.state.DiagnosisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Stops the run as soon as a stage has set a terminal status.
 */
@Component
public class StageOutcomeEdge implements AsyncEdgeAction<DiagnosisState> {

    public static final String CONTINUE = "continue";
    public static final String HALT = "halt";

    @Override
    public CompletableFuture<String> apply(DiagnosisState state) {
        return CompletableFuture.completedFuture(state.isTerminal() ? HALT : CONTINUE);
    }
}
