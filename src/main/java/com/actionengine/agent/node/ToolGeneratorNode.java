package com.actionengine.agent.node;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.graph.Node;
import com.actionengine.agent.graph.NodeContext;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.resilience.ToolCallRetryPolicy;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.tool.ToolCollection;
import com.actionengine.agent.tool.impl.BrowserTool;
import com.actionengine.agent.tool.impl.TerminalTool;
import com.actionengine.agent.tool.impl.TerminateTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the model for the next action. Tool calls are only selected here;
 * approval and execution happen in the following nodes.
 */
@Component
@Slf4j
public class ToolGeneratorNode implements Node {

    private final ToolCollection tools;
    private final ToolCallRetryPolicy retryPolicy;
    private final int messageWindow;

    public ToolGeneratorNode(ToolCollection toolCollection, ToolCallRetryPolicy retryPolicy,
                             EngineProperties engineProperties) {
        this.tools = toolCollection.subset(List.of(TerminalTool.NAME, BrowserTool.NAME, TerminateTool.NAME));
        this.retryPolicy = retryPolicy;
        this.messageWindow = engineProperties.getMessageWindow();
    }

    @Override
    public NodeOutcome invoke(WorkflowState state, NodeContext context) {
        ThreadEnvironment environment = context.environment();

        List<Message> prompt = new ArrayList<>();
        prompt.add(Message.system(Prompts.executor(
                environment.getPlanningStore().formatCurrent(), state.getBrain())));
        prompt.addAll(MessagePruner.prune(state.getMessages(), messageWindow));
        prompt.add(Message.user(state.getTask()));

        LlmResponse response = retryPolicy.invokeWithValidatedTools(environment.getModelClient(), prompt, tools);
        List<Message> messages = new ArrayList<>(state.getMessages());

        if (response.isNoUsableToolCall()) {
            log.warn("Tool generator produced no usable tool call [thread={}]", context.threadId());
            messages.add(Message.assistant("[Tool Generator] " + response.getContent()));
            return NodeOutcome.update(StateUpdate.of().messages(messages).toolCalls(new ArrayList<>()));
        }

        // Only the first call goes through approval and execution, so only
        // that one is recorded as requested in the conversation.
        messages.add(Message.builder()
                .role(Message.Role.assistant)
                .content(response.getContent())
                .toolCalls(List.of(response.getToolCalls().get(0)))
                .build());
        log.info("Tool selected [thread={}, tool={}, offered={}]", context.threadId(),
                response.getToolCalls().get(0).getToolName(), response.getToolCalls().size());

        return NodeOutcome.update(StateUpdate.of()
                .messages(messages)
                .toolCalls(new ArrayList<>(response.getToolCalls())));
    }
}
