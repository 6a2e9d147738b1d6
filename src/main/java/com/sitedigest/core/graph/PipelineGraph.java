package com.sitedigest.core.graph;

import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.metrics.PipelineMetrics;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.nodes.CompleteNode;
import com.sitedigest.core.nodes.ErrorRecoveryNode;
import com.sitedigest.core.nodes.InitializeNode;
import com.sitedigest.core.nodes.StepNode;
import com.sitedigest.core.state.WorkflowState;
import com.sitedigest.core.steps.DiscoveryStep;
import com.sitedigest.core.steps.PersistenceStep;
import com.sitedigest.core.steps.RetrievalStep;
import com.sitedigest.core.steps.TransformationStep;
import com.sitedigest.core.steps.WorkflowStep;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives
 * the content pipeline.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> initialize -> discovery -> [route] -> retrieval -> [route] -> transformation
 *         -> [route] -> persistence -> [route] -> complete -> END
 *
 *   [route] after a working node: next working node | error_recovery | complete
 *   error_recovery -> [route] -> the working node that failed
 * </pre>
 * Every conditional edge follows the {@code nextNode} channel, which nodes fill
 * in from {@link WorkflowRouter}.
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private final CompiledGraph<WorkflowState> compiledGraph;

    public PipelineGraph(
            InitializeNode initializeNode,
            DiscoveryStep discoveryStep,
            RetrievalStep retrievalStep,
            TransformationStep transformationStep,
            PersistenceStep persistenceStep,
            ErrorRecoveryNode errorRecoveryNode,
            CompleteNode completeNode,
            WorkflowRouter router,
            EventBus eventBus,
            PipelineMetrics metrics) throws Exception {

        List<WorkflowStep> steps = List.of(discoveryStep, retrievalStep, transformationStep, persistenceStep);

        var graph = new StateGraph<>(WorkflowState.SCHEMA, WorkflowState::new)
                .addNode(WorkflowNode.INITIALIZE.graphId(), node_async(initializeNode::apply))
                .addNode(WorkflowNode.ERROR_RECOVERY.graphId(), node_async(errorRecoveryNode::apply))
                .addNode(WorkflowNode.COMPLETE.graphId(), node_async(completeNode::apply))
                .addEdge(START, WorkflowNode.INITIALIZE.graphId())
                .addEdge(WorkflowNode.INITIALIZE.graphId(), WorkflowNode.DISCOVERY.graphId())
                .addEdge(WorkflowNode.COMPLETE.graphId(), END);

        for (WorkflowStep step : steps) {
            var stepNode = new StepNode(step, router, eventBus, metrics);
            WorkflowNode node = step.node();
            graph.addNode(node.graphId(), node_async(stepNode::apply));
            graph.addConditionalEdges(node.graphId(),
                    edge_async(PipelineGraph::route),
                    routes(router.next(node, StepOutcome.SUCCESS, 0),
                            WorkflowNode.ERROR_RECOVERY,
                            WorkflowNode.COMPLETE));
        }

        graph.addConditionalEdges(WorkflowNode.ERROR_RECOVERY.graphId(),
                edge_async(PipelineGraph::route),
                routes(WorkflowNode.DISCOVERY, WorkflowNode.RETRIEVAL,
                        WorkflowNode.TRANSFORMATION, WorkflowNode.PERSISTENCE));

        int maxIterations = Math.max(100, router.maxNodeExecutions() + 5);
        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        // The library default (25) is below what a run that retries in every step needs.
        compiledGraph.setMaxIterations(maxIterations);
        log.info("Pipeline graph compiled (maxRetries={}, maxIterations={})",
                router.maxRetries(), maxIterations);
    }

    /**
     * Conditional edge: follow the routing decision the last node wrote.
     */
    static String route(WorkflowState state) {
        return state.nextNode().graphId();
    }

    private static Map<String, String> routes(WorkflowNode... targets) {
        var routes = new HashMap<String, String>();
        for (WorkflowNode target : targets) {
            routes.put(target.graphId(), target.graphId());
        }
        return routes;
    }

    public CompiledGraph<WorkflowState> getCompiledGraph() {
        return compiledGraph;
    }
}
