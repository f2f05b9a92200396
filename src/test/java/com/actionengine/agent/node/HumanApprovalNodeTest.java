package com.actionengine.agent.node;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.graph.NodeContext;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.graph.ResumeDecision;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateMerger;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.support.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HumanApprovalNodeTest {

    private final HumanApprovalNode node = new HumanApprovalNode(new EngineProperties());

    private static NodeContext context(ResumeDecision decision) {
        return new NodeContext("t1", () -> {
            throw new IllegalStateException("environment not expected");
        }, decision);
    }

    private static WorkflowState stateWith(ToolCall... calls) {
        WorkflowState state = WorkflowState.initial("task");
        state.setToolCalls(List.of(calls));
        return state;
    }

    private static PendingApproval approvalAfter(WorkflowState state, NodeOutcome outcome) {
        return StateMerger.merge(state, outcome.getUpdate()).getPendingApproval();
    }

    @Test
    void terminalCall_suspendsWithApprovalRequest() {
        ToolCall rm = ScriptedLlmClient.toolCall("call_1", "terminal", Map.of("script", "rm x"));
        WorkflowState state = stateWith(rm);

        NodeOutcome outcome = node.invoke(state, context(null));

        assertThat(outcome.getKind()).isEqualTo(NodeOutcome.Kind.SUSPEND);
        assertThat(outcome.getInterrupt().getMessage()).isEqualTo("Do you approve executing: rm x?");
        assertThat(outcome.getInterrupt().getToolCall()).isEqualTo(rm);
        PendingApproval pending = approvalAfter(state, outcome);
        assertThat(pending.isGranted()).isFalse();
        assertThat(pending.getReason()).isEqualTo(HumanApprovalNode.AWAITING);
    }

    @Test
    void toolOutsideApprovalList_isApprovedImmediately() {
        ToolCall terminate = ScriptedLlmClient.toolCall("call_2", "terminate",
                Map.of("status", "success", "reason", "done"));
        WorkflowState state = stateWith(terminate);

        NodeOutcome outcome = node.invoke(state, context(null));

        assertThat(outcome.getKind()).isEqualTo(NodeOutcome.Kind.CONTINUE);
        PendingApproval pending = approvalAfter(state, outcome);
        assertThat(pending.isGranted()).isTrue();
        assertThat(pending.getToolCall()).isEqualTo(terminate);
        assertThat(pending.getReason()).isEqualTo(HumanApprovalNode.NOT_REQUIRED);
    }

    @Test
    void onlyFirstCallIsGated() {
        ToolCall navigate = ScriptedLlmClient.toolCall("call_3", "browser", Map.of("action", "go_to_url"));
        ToolCall rm = ScriptedLlmClient.toolCall("call_4", "terminal", Map.of("script", "rm x"));

        NodeOutcome outcome = node.invoke(stateWith(navigate, rm), context(null));

        assertThat(outcome.getKind()).isEqualTo(NodeOutcome.Kind.CONTINUE);
    }

    @Test
    void noToolCall_isNotGranted() {
        WorkflowState state = WorkflowState.initial("task");

        NodeOutcome outcome = node.invoke(state, context(null));

        PendingApproval pending = approvalAfter(state, outcome);
        assertThat(pending.isGranted()).isFalse();
        assertThat(pending.getReason()).isEqualTo(HumanApprovalNode.NO_TOOL_CALL);
    }

    @Test
    void resume_appliesDecisionToPendingCall() {
        ToolCall rm = ScriptedLlmClient.toolCall("call_1", "terminal", Map.of("script", "rm x"));
        WorkflowState state = stateWith(rm);
        state.setPendingApproval(new PendingApproval(rm, true, "approved by user"));

        NodeOutcome outcome = node.invoke(state, context(ResumeDecision.approve()));

        assertThat(outcome.getKind()).isEqualTo(NodeOutcome.Kind.CONTINUE);
        PendingApproval pending = approvalAfter(state, outcome);
        assertThat(pending.isGranted()).isTrue();
        assertThat(pending.getToolCall()).isEqualTo(rm);
    }

    @Test
    void approvalList_isConfigurable() {
        EngineProperties properties = new EngineProperties();
        properties.getApproval().setRequiredTools(List.of("browser"));
        HumanApprovalNode browserGate = new HumanApprovalNode(properties);

        ToolCall rm = ScriptedLlmClient.toolCall("call_1", "terminal", Map.of("script", "rm x"));
        ToolCall navigate = ScriptedLlmClient.toolCall("call_2", "browser", Map.of("action", "go_to_url"));

        assertThat(browserGate.invoke(stateWith(rm), context(null)).getKind()).isEqualTo(NodeOutcome.Kind.CONTINUE);
        assertThat(browserGate.invoke(stateWith(navigate), context(null)).getInterrupt().getMessage())
                .startsWith("Do you approve executing tool browser with");
    }
}
