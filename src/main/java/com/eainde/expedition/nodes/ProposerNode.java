package com.eainde.expedition.nodes;

import com.eainde.expedition.action.ActionPayloadMapper;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.model.ActionPayload;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.model.ValidationVerdict;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.DiagnosisStatus;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Log4j2
@Component
public class ProposerNode extends AbstractDiagnosisNode {

    public static final String STAGE = "proposer";

    private final ActionPayloadMapper mapper;

    public ProposerNode(ActionPayloadMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        ValidationVerdict verdict = require(state.verdict(), DiagnosisState.VERDICT);
        if (verdict.blocked()) {
            throw new IllegalStateException("proposer reached with a blocked verdict");
        }
        SynthesizedDiagnosis diagnosis = require(state.diagnosis(), DiagnosisState.DIAGNOSIS);

        List<ActionPayload> payloads = mapper.toPayloads(
                state.recordId(), diagnosis.actions(), ctx.actionCatalog(), ctx.routingTable());
        payloads.forEach(p -> log.info("Proposed {} {} on {} ({} risk{})", p.actionId(), p.actionType().id(),
                p.platform(), p.riskTier(), p.requiresApproval() ? ", needs approval" : ""));
        return Map.of(
                DiagnosisState.ACTIONS, payloads,
                DiagnosisState.STATUS, DiagnosisStatus.COMPLETED);
    }
}
