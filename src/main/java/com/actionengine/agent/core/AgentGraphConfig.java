package com.actionengine.agent.core;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.graph.GraphBuilder;
import com.actionengine.agent.graph.GraphDefinition;
import com.actionengine.agent.graph.NodeId;
import com.actionengine.agent.node.ExecutorNode;
import com.actionengine.agent.node.HumanApprovalNode;
import com.actionengine.agent.node.PlanningNode;
import com.actionengine.agent.node.ThinkingNode;
import com.actionengine.agent.node.ToolGeneratorNode;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.actionengine.agent.graph.NodeId.END;
import static com.actionengine.agent.graph.NodeId.EXECUTOR;
import static com.actionengine.agent.graph.NodeId.HUMAN_APPROVAL;
import static com.actionengine.agent.graph.NodeId.PLANNING;
import static com.actionengine.agent.graph.NodeId.THINKING;
import static com.actionengine.agent.graph.NodeId.TOOL_GENERATOR;

/**
 * The automation agent's workflow:
 *
 * <pre>
 * planning ──► tool_generator ──► human_approval ──► executor ──► thinking ──► planning ...
 *                                        │                                   ▲
 *                                        └──────────── (rejected) ───────────┘
 * </pre>
 *
 * Every node except the tool generator leaves for END once the state is
 * marked exiting.
 */
@Configuration
@Slf4j
public class AgentGraphConfig {

    static final String EXITING = "exiting";
    static final String APPROVED = "approved";

    @Bean
    public GraphDefinition agentGraph(PlanningNode planning,
                                      ToolGeneratorNode toolGenerator,
                                      HumanApprovalNode humanApproval,
                                      ExecutorNode executor,
                                      ThinkingNode thinking,
                                      EngineProperties engineProperties) {
        GraphBuilder builder = GraphBuilder.create()
                .node(PLANNING, planning)
                .node(TOOL_GENERATOR, toolGenerator)
                .node(HUMAN_APPROVAL, humanApproval)
                .node(EXECUTOR, executor)
                .node(THINKING, thinking)
                .entry(PLANNING)

                .when(PLANNING, EXITING, WorkflowState::isExiting, END)
                .otherwise(PLANNING, TOOL_GENERATOR)

                .edge(TOOL_GENERATOR, HUMAN_APPROVAL)

                .when(HUMAN_APPROVAL, EXITING, WorkflowState::isExiting, END)
                .when(HUMAN_APPROVAL, APPROVED, AgentGraphConfig::isApproved, EXECUTOR)
                .otherwise(HUMAN_APPROVAL, THINKING)

                .when(EXECUTOR, EXITING, WorkflowState::isExiting, END)
                .otherwise(EXECUTOR, THINKING)

                .when(THINKING, EXITING, WorkflowState::isExiting, END)
                .otherwise(THINKING, PLANNING);

        String errorNode = engineProperties.getErrorNode();
        if (errorNode != null && !errorNode.isBlank()) {
            builder.errorNode(NodeId.fromKey(errorNode.trim()));
        }

        GraphDefinition graph = builder.build();
        log.info("Agent graph built [entry={}, errorNode={}]", graph.entry(),
                graph.errorNode().map(NodeId::key).orElse("none"));
        return graph;
    }

    static boolean isApproved(WorkflowState state) {
        PendingApproval pending = state.getPendingApproval();
        return pending != null && pending.isGranted();
    }
}
