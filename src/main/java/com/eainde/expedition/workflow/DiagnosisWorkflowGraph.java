package com.eainde.expedition.workflow;

import com.eainde.expedition.edges.FamilyRoutingEdge;
import com.eainde.expedition.edges.StageOutcomeEdge;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.nodes.CriticNode;
import com.eainde.expedition.nodes.DetectorNode;
import com.eainde.expedition.nodes.ExplainerNode;
import com.eainde.expedition.nodes.InvestigatorNode;
import com.eainde.expedition.nodes.MemoryRetrieverNode;
import com.eainde.expedition.nodes.PreflightNode;
import com.eainde.expedition.nodes.ProposerNode;
import com.eainde.expedition.nodes.RouterNode;
import com.eainde.expedition.state.DiagnosisState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The diagnosis pipeline:
 * <pre>
 * preflight -> detector -> router -> investigator_{family} -> memory_retriever -> explainer -> critic -> proposer
 * </pre>
 * Every stage edge halts on a terminal status. The graph is compiled per run so that the run's context is bound
 * into the nodes instead of being looked up from shared state.
 */
@Component
public class DiagnosisWorkflowGraph {

    public static final String INVESTIGATOR_PREFIX = "investigator_";

    private final PreflightNode preflightNode;
    private final DetectorNode detectorNode;
    private final RouterNode routerNode;
    private final InvestigatorNode investigatorNode;
    private final MemoryRetrieverNode memoryRetrieverNode;
    private final ExplainerNode explainerNode;
    private final CriticNode criticNode;
    private final ProposerNode proposerNode;
    private final FamilyRoutingEdge familyRoutingEdge;
    private final StageOutcomeEdge stageOutcomeEdge;

    public DiagnosisWorkflowGraph(PreflightNode preflightNode,
                                  DetectorNode detectorNode,
                                  RouterNode routerNode,
                                  InvestigatorNode investigatorNode,
                                  MemoryRetrieverNode memoryRetrieverNode,
                                  ExplainerNode explainerNode,
                                  CriticNode criticNode,
                                  ProposerNode proposerNode,
                                  FamilyRoutingEdge familyRoutingEdge,
                                  StageOutcomeEdge stageOutcomeEdge) {
        this.preflightNode = preflightNode;
        this.detectorNode = detectorNode;
        this.routerNode = routerNode;
        this.investigatorNode = investigatorNode;
        this.memoryRetrieverNode = memoryRetrieverNode;
        this.explainerNode = explainerNode;
        this.criticNode = criticNode;
        this.proposerNode = proposerNode;
        this.familyRoutingEdge = familyRoutingEdge;
        this.stageOutcomeEdge = stageOutcomeEdge;
    }

    public CompiledGraph<DiagnosisState> compile(RunContext ctx) throws GraphStateException {
        StateGraph<DiagnosisState> workflow = new StateGraph<>(DiagnosisState::new);

        AsyncNodeAction<DiagnosisState> preflight = preflightNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> detect = detectorNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> route = routerNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> investigate = investigatorNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> retrieve = memoryRetrieverNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> explain = explainerNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> critique = criticNode.bind(ctx);
        AsyncNodeAction<DiagnosisState> propose = proposerNode.bind(ctx);

        workflow.addNode(PreflightNode.STAGE, preflight);
        workflow.addNode(DetectorNode.STAGE, detect);
        workflow.addNode(RouterNode.STAGE, route);
        for (ChannelFamily family : ChannelFamily.values()) {
            workflow.addNode(investigatorNodeId(family), investigate);
        }
        workflow.addNode(MemoryRetrieverNode.STAGE, retrieve);
        workflow.addNode(ExplainerNode.STAGE, explain);
        workflow.addNode(CriticNode.STAGE, critique);
        workflow.addNode(ProposerNode.STAGE, propose);

        workflow.addEdge(START, PreflightNode.STAGE);
        continueOrHalt(workflow, PreflightNode.STAGE, DetectorNode.STAGE);
        continueOrHalt(workflow, DetectorNode.STAGE, RouterNode.STAGE);

        Map<String, String> branches = new HashMap<>();
        for (ChannelFamily family : ChannelFamily.values()) {
            branches.put(FamilyRoutingEdge.routeFor(family), investigatorNodeId(family));
            continueOrHalt(workflow, investigatorNodeId(family), MemoryRetrieverNode.STAGE);
        }
        branches.put(StageOutcomeEdge.HALT, END);
        workflow.addConditionalEdges(RouterNode.STAGE, familyRoutingEdge, branches);

        continueOrHalt(workflow, MemoryRetrieverNode.STAGE, ExplainerNode.STAGE);
        continueOrHalt(workflow, ExplainerNode.STAGE, CriticNode.STAGE);
        continueOrHalt(workflow, CriticNode.STAGE, ProposerNode.STAGE);
        workflow.addEdge(ProposerNode.STAGE, END);

        return workflow.compile();
    }

    public static String investigatorNodeId(ChannelFamily family) {
        return INVESTIGATOR_PREFIX + FamilyRoutingEdge.routeFor(family);
    }

    private void continueOrHalt(StateGraph<DiagnosisState> workflow, String from, String next)
            throws GraphStateException {
        workflow.addConditionalEdges(from, stageOutcomeEdge, Map.of(
                StageOutcomeEdge.CONTINUE, next,
                StageOutcomeEdge.HALT, END));
    }
}
