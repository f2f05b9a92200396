package com.actionengine.agent.node;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.graph.Node;
import com.actionengine.agent.graph.NodeContext;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.graph.ResumeDecision;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.tool.impl.TerminalTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Gates the selected tool call. Calls to tools listed in
 * {@code engine.approval.required-tools} suspend the run until a human
 * decides; other calls are approved on the spot.
 */
@Component
@Slf4j
public class HumanApprovalNode implements Node {

    public static final String NOT_REQUIRED = "approval not required";
    public static final String NO_TOOL_CALL = "no tool call generated";
    public static final String AWAITING = "awaiting approval";

    private final Set<String> requiredTools;

    public HumanApprovalNode(EngineProperties engineProperties) {
        this.requiredTools = Set.copyOf(engineProperties.getApproval().getRequiredTools());
    }

    @Override
    public NodeOutcome invoke(WorkflowState state, NodeContext context) {
        if (context.isResume()) {
            ResumeDecision decision = context.resumeDecision().orElseThrow();
            log.info("Approval decision received [thread={}, approved={}]", context.threadId(), decision.isApproved());
            return NodeOutcome.update(StateUpdate.of().pendingApproval(
                    PendingApproval.builder().approved(decision.isApproved()).build()));
        }

        List<ToolCall> toolCalls = state.getToolCalls();
        if (toolCalls == null || toolCalls.isEmpty()) {
            return NodeOutcome.update(StateUpdate.of().pendingApproval(
                    PendingApproval.builder().approved(false).reason(NO_TOOL_CALL).build()));
        }

        ToolCall call = toolCalls.get(0);
        if (requiredTools.contains(call.getToolName())) {
            String message = approvalMessage(call);
            log.info("Approval required [thread={}, tool={}]", context.threadId(), call.getToolName());
            return NodeOutcome.suspend(InterruptPayload.approvalRequest(call, message),
                    StateUpdate.of().pendingApproval(new PendingApproval(call, false, AWAITING)));
        }

        return NodeOutcome.update(StateUpdate.of().pendingApproval(
                new PendingApproval(call, true, NOT_REQUIRED)));
    }

    static String approvalMessage(ToolCall call) {
        if (TerminalTool.NAME.equals(call.getToolName())) {
            return "Do you approve executing: " + call.stringArgument(TerminalTool.SCRIPT_ARG) + "?";
        }
        return "Do you approve executing tool " + call.getToolName() + " with " + call.getArguments() + "?";
    }
}
