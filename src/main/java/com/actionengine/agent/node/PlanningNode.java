package com.actionengine.agent.node;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.PlanningStore;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.graph.Node;
import com.actionengine.agent.graph.NodeContext;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.resilience.ToolCallRetryPolicy;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.tool.ToolCollection;
import com.actionengine.agent.tool.ToolResult;
import com.actionengine.agent.tool.impl.PlanningTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the plan current. The model may only call the planning tool, whose
 * calls run immediately; the resulting plan is snapshotted into the state.
 */
@Component
@Slf4j
public class PlanningNode implements Node {

    private final ToolCollection tools;
    private final ToolCallRetryPolicy retryPolicy;
    private final int messageWindow;

    public PlanningNode(ToolCollection toolCollection, ToolCallRetryPolicy retryPolicy,
                        EngineProperties engineProperties) {
        this.tools = toolCollection.subset(List.of(PlanningTool.NAME));
        this.retryPolicy = retryPolicy;
        this.messageWindow = engineProperties.getMessageWindow();
    }

    @Override
    public NodeOutcome invoke(WorkflowState state, NodeContext context) {
        ThreadEnvironment environment = context.environment();
        PlanningStore planningStore = environment.getPlanningStore();

        List<Message> prompt = new ArrayList<>();
        prompt.add(Message.system(Prompts.PLANNER));
        prompt.addAll(MessagePruner.prune(state.getMessages(), messageWindow));
        prompt.add(Message.user(state.getTask()));
        planningStore.current().ifPresent(plan -> prompt.add(Message.user(planningStore.formatCurrent())));

        LlmResponse response = retryPolicy.invokeWithValidatedTools(environment.getModelClient(), prompt, tools);
        List<Message> messages = new ArrayList<>(state.getMessages());

        if (response.isNoUsableToolCall()) {
            log.warn("Planner produced no usable tool call [thread={}]", context.threadId());
            messages.add(Message.assistant("[Planning Node] Plan left unchanged: " + response.getContent()));
            return NodeOutcome.update(StateUpdate.of().messages(messages));
        }

        messages.add(Message.builder()
                .role(Message.Role.assistant)
                .content("[Planning Node] Based on the current state, I am updating the plan:\n"
                        + (response.getContent() != null ? response.getContent() : ""))
                .toolCalls(response.getToolCalls())
                .build());
        for (ToolCall call : response.getToolCalls()) {
            ToolResult result = tools.execute(call, environment);
            messages.add(Message.toolResult(call, result.observation()));
        }

        return NodeOutcome.update(StateUpdate.of()
                .messages(messages)
                .plan(planningStore.current().orElse(null)));
    }
}
