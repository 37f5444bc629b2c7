package com.eainde.expedition.workflow;

import com.eainde.expedition.action.ActionExecutionGateway;
import com.eainde.expedition.action.ExecutionReceipt;
import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ChannelRoutingTable;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.execution.CancellationToken;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.state.DiagnosisRecord;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.DiagnosisStatus;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point of the pipeline: runs one anomaly end to end and always returns a terminal
 * {@link DiagnosisRecord}.
 * <p>
 * The record id is derived from channel, metric and evaluation date, so replaying the same request produces the
 * same record and action ids. Completed runs with actions are handed to the {@link ActionExecutionGateway} when
 * one is configured.
 */
@Log4j2
@Service
public class DiagnosisEngine {

    static final String MDC_RECORD_ID = "recordId";
    static final String MDC_CHANNEL = "channel";
    static final String MDC_METRIC = "metric";

    private final DiagnosisWorkflowGraph workflowGraph;
    private final ActionCatalog actionCatalog;
    private final ChannelRoutingTable routingTable;
    private final ObjectProvider<ActionExecutionGateway> gateway;

    public DiagnosisEngine(DiagnosisWorkflowGraph workflowGraph,
                           ActionCatalog actionCatalog,
                           ChannelRoutingTable routingTable,
                           ObjectProvider<ActionExecutionGateway> gateway) {
        this.workflowGraph = workflowGraph;
        this.actionCatalog = actionCatalog;
        this.routingTable = routingTable;
        this.gateway = gateway;
    }

    public DiagnosisRecord diagnose(DiagnosisRequest request) {
        return diagnose(request, CancellationToken.create());
    }

    public DiagnosisRecord diagnose(DiagnosisRequest request, CancellationToken cancellation) {
        String recordId = recordIdFor(request);
        MDC.put(MDC_RECORD_ID, recordId);
        MDC.put(MDC_CHANNEL, request.channel());
        MDC.put(MDC_METRIC, request.metric());
        try {
            log.info("Diagnosis started for {}/{} as of {}", request.channel(), request.metric(),
                    request.evaluationDate());
            DiagnosisRecord record = run(request, recordId, cancellation);
            log.info("Diagnosis finished: {} ({} action(s), {} step(s))",
                    record.status(), record.actions().size(), record.stepLog().size());
            handOff(record);
            return record;
        } finally {
            MDC.remove(MDC_RECORD_ID);
            MDC.remove(MDC_CHANNEL);
            MDC.remove(MDC_METRIC);
        }
    }

    public static String recordIdFor(DiagnosisRequest request) {
        String key = request.channel() + "|" + request.metric() + "|" + request.evaluationDate();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private DiagnosisRecord run(DiagnosisRequest request, String recordId, CancellationToken cancellation) {
        RunContext ctx = new RunContext(recordId, actionCatalog, routingTable, cancellation);
        Optional<DiagnosisState> finalState;
        try {
            CompiledGraph<DiagnosisState> graph = workflowGraph.compile(ctx);
            finalState = graph.invoke(DiagnosisState.initial(request, recordId),
                    RunnableConfig.builder().threadId(recordId).build());
        } catch (Exception e) {
            log.error("Workflow runtime failed", e);
            return DiagnosisRecord.failed(recordId, request, List.of(), "workflow",
                    "[" + ErrorCode.UNEXPECTED_ERROR + "] " + e.getMessage());
        }

        if (finalState.isEmpty()) {
            return DiagnosisRecord.failed(recordId, request, List.of(), "workflow",
                    "[" + ErrorCode.UNEXPECTED_ERROR + "] workflow produced no final state");
        }
        DiagnosisRecord record = DiagnosisRecord.from(finalState.get());
        if (record.status() == DiagnosisStatus.RUNNING) {
            return DiagnosisRecord.failed(recordId, request, record.stepLog(), "workflow",
                    "[" + ErrorCode.UNEXPECTED_ERROR + "] workflow ended without a terminal status");
        }
        return record;
    }

    private void handOff(DiagnosisRecord record) {
        if (record.status() != DiagnosisStatus.COMPLETED || record.actions().isEmpty()) {
            return;
        }
        ActionExecutionGateway target = gateway.getIfAvailable();
        if (target == null) {
            log.debug("No action execution gateway configured, {} action(s) not handed off", record.actions().size());
            return;
        }
        try {
            ExecutionReceipt receipt = target.submit(record.recordId(), record.actions());
            log.info("Actions handed off: receipt {} ({} accepted, {} pending approval)",
                    receipt.receiptId(), receipt.accepted(), receipt.pendingApproval());
        } catch (RuntimeException e) {
            // hand-off failures never change the record
            log.error("Action hand-off failed for record {}", record.recordId(), e);
        }
    }
}
