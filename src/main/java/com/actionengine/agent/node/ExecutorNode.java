package com.actionengine.agent.node;

import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.graph.Node;
import com.actionengine.agent.graph.NodeContext;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.tool.ToolCollection;
import com.actionengine.agent.tool.ToolResult;
import com.actionengine.agent.tool.impl.TerminateTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the approved tool call and records its result. A successful
 * {@code terminate} call ends the workflow.
 */
@Component
@Slf4j
public class ExecutorNode implements Node {

    private final ToolCollection tools;

    public ExecutorNode(ToolCollection toolCollection) {
        this.tools = toolCollection;
    }

    @Override
    public NodeOutcome invoke(WorkflowState state, NodeContext context) {
        PendingApproval approval = state.getPendingApproval();
        if (approval == null || !approval.isGranted()) {
            log.info("No approved tool call to execute [thread={}]", context.threadId());
            return NodeOutcome.update(StateUpdate.of());
        }

        ToolCall call = approval.getToolCall();
        ThreadEnvironment environment = context.environment();
        ToolResult result = tools.execute(call, environment);

        List<Message> messages = new ArrayList<>(state.getMessages());
        messages.add(Message.toolResult(call, result.observation()));

        StateUpdate update = StateUpdate.of()
                .messages(messages)
                .toolsUsed(List.of(call))
                .toolCalls(new ArrayList<>());

        if (TerminateTool.NAME.equals(call.getToolName()) && result.isSuccess()) {
            log.info("Terminate executed [thread={}]: {}", context.threadId(), result.getSystem());
            update.exiting(true).thought(call.stringArgument("reason"));
        }
        return NodeOutcome.update(update);
    }
}
