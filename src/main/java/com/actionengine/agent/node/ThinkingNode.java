package com.actionengine.agent.node;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.graph.Node;
import com.actionengine.agent.graph.NodeContext;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reflects on the last action and updates the agent's assessment
 * ("brain"), thought and summary. A declined tool call is recorded here:
 * the conversation gets a result for it and the previous action is
 * evaluated as not approved.
 */
@Component
@Slf4j
public class ThinkingNode implements Node {

    public static final String NOT_APPROVED = "command not approved";

    private static final List<String> BRAIN_KEYS = List.of(
            WorkflowState.BRAIN_PREV_ACTION_EVALUATION,
            WorkflowState.BRAIN_IMPORTANT_CONTENTS,
            WorkflowState.BRAIN_TASK_PROGRESS,
            WorkflowState.BRAIN_FUTURE_PLANS,
            WorkflowState.BRAIN_THOUGHT,
            WorkflowState.BRAIN_SUMMARY);

    private final ObjectMapper objectMapper;
    private final int messageWindow;

    public ThinkingNode(ObjectMapper objectMapper, EngineProperties engineProperties) {
        this.objectMapper = objectMapper;
        this.messageWindow = engineProperties.getMessageWindow();
    }

    @Override
    public NodeOutcome invoke(WorkflowState state, NodeContext context) {
        List<Message> messages = new ArrayList<>(state.getMessages());
        PendingApproval approval = state.getPendingApproval();
        boolean rejected = wasRejected(approval);
        if (rejected) {
            ToolCall declined = approval.getToolCall();
            log.info("Recording declined tool call [thread={}, tool={}]", context.threadId(), declined.getToolName());
            if (!hasResultFor(messages, declined)) {
                messages.add(Message.toolResult(declined, "Command not approved by the user: " + approval.getReason()));
            }
        }

        ThreadEnvironment environment = context.environment();
        List<Message> prompt = new ArrayList<>();
        prompt.add(Message.system(Prompts.thinking(state.getBrain())));
        prompt.addAll(MessagePruner.prune(messages, messageWindow));
        prompt.add(Message.user(state.getTask()));
        prompt.add(Message.user(environment.getPlanningStore().formatCurrent()));

        LlmResponse response = environment.getModelClient().chat(prompt, List.of());
        Map<String, String> brain = parseBrain(response.getContent());
        if (rejected) {
            brain.put(WorkflowState.BRAIN_PREV_ACTION_EVALUATION, NOT_APPROVED);
        }

        String thought = brain.get(WorkflowState.BRAIN_THOUGHT);
        String summary = brain.get(WorkflowState.BRAIN_SUMMARY);
        messages.add(Message.assistant("[Thinking Node] Based on my analysis of the current system state:\n"
                + "Thought: " + thought + "\n"
                + "Summary: " + summary));

        return NodeOutcome.update(StateUpdate.of()
                .brain(brain)
                .thought(thought)
                .summary(summary)
                .messages(messages));
    }

    static boolean wasRejected(PendingApproval approval) {
        return approval != null
                && approval.getToolCall() != null
                && Boolean.FALSE.equals(approval.getApproved())
                && !HumanApprovalNode.NO_TOOL_CALL.equals(approval.getReason())
                && !HumanApprovalNode.AWAITING.equals(approval.getReason());
    }

    private static boolean hasResultFor(List<Message> messages, ToolCall call) {
        return messages.stream().anyMatch(m -> m.getRole() == Message.Role.tool
                && call.getId() != null && call.getId().equals(m.getToolCallId()));
    }

    /**
     * Reads the JSON object in the model's answer. Text around the object is
     * ignored; when no object can be read the whole answer becomes the thought.
     */
    Map<String, String> parseBrain(String content) {
        Map<String, String> brain = new LinkedHashMap<>();
        BRAIN_KEYS.forEach(key -> brain.put(key, ""));
        if (content == null || content.isBlank()) {
            return brain;
        }

        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            try {
                JsonNode node = objectMapper.readTree(content.substring(start, end + 1));
                for (String key : BRAIN_KEYS) {
                    JsonNode value = node.get(key);
                    if (value != null && !value.isNull()) {
                        brain.put(key, value.isTextual() ? value.asText() : value.toString());
                    }
                }
                return brain;
            } catch (JsonProcessingException e) {
                log.warn("Thinking output is not valid JSON, using raw text: {}", e.getOriginalMessage());
            }
        }
        brain.put(WorkflowState.BRAIN_THOUGHT, content.trim());
        return brain;
    }
}
