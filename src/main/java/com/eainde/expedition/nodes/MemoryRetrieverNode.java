package com.eainde.expedition.nodes;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.error.StageFailedException;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageExecutor;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.memory.IncidentMemory;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.state.DiagnosisState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Advisory lookup of similar past incidents. Never blocks the run: an unavailable memory yields no incidents.
 */
@Log4j2
@Component
public class MemoryRetrieverNode extends AbstractDiagnosisNode {

    public static final String STAGE = "memory_retriever";

    private final IncidentMemory memory;
    private final StageExecutor stageExecutor;
    private final ExpeditionProperties.Retrieval settings;

    public MemoryRetrieverNode(IncidentMemory memory, StageExecutor stageExecutor, ExpeditionProperties properties) {
        this.memory = memory;
        this.stageExecutor = stageExecutor;
        this.settings = properties.getRetrieval();
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        AnomalyDescriptor anomaly = require(state.descriptor(), DiagnosisState.DESCRIPTOR);
        InvestigationFinding finding = require(state.finding(), DiagnosisState.FINDING);
        String query = anomaly.summary() + ". " + finding.hypothesis();
        int k = settings.effectiveTopK();

        List<RetrievedIncident> incidents;
        try {
            incidents = stageExecutor.call("search", journal, ctx,
                    () -> memory.search(query, k, settings.getMinSimilarity()));
        } catch (StageFailedException e) {
            journal.markDegraded(ErrorCode.RETRIEVAL_UNAVAILABLE, e.getMessage());
            incidents = List.of();
        }

        List<RetrievedIncident> kept = incidents == null ? List.of() : incidents.stream()
                .filter(incident -> incident.similarity() >= settings.getMinSimilarity())
                .limit(k)
                .toList();
        log.info("Retrieved {} similar incident(s)", kept.size());
        return Map.of(DiagnosisState.INCIDENTS, kept);
    }
}
