package com.actionengine.agent.support;

import com.actionengine.agent.llm.LlmClient;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.tool.ToolDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Model client that answers from a queue of canned responses and records
 * every request it receives.
 */
public class ScriptedLlmClient implements LlmClient {

    private final Deque<Supplier<LlmResponse>> script = new ArrayDeque<>();
    private final List<List<Message>> requests = new ArrayList<>();
    private final List<List<String>> offeredTools = new ArrayList<>();

    public ScriptedLlmClient reply(LlmResponse response) {
        script.add(() -> response);
        return this;
    }

    public ScriptedLlmClient replyText(String content) {
        return reply(LlmResponse.builder().content(content).build());
    }

    public ScriptedLlmClient replyToolCall(String id, String toolName, Map<String, Object> arguments) {
        return reply(LlmResponse.builder()
                .toolCalls(List.of(toolCall(id, toolName, arguments)))
                .build());
    }

    public ScriptedLlmClient fail(RuntimeException error) {
        script.add(() -> {
            throw error;
        });
        return this;
    }

    @Override
    public synchronized LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        requests.add(List.copyOf(messages));
        offeredTools.add(tools.stream().map(ToolDefinition::getName).toList());
        if (script.isEmpty()) {
            throw new IllegalStateException("Scripted model client ran out of responses");
        }
        return script.poll().get();
    }

    public List<List<Message>> requests() {
        return requests;
    }

    public List<List<String>> offeredTools() {
        return offeredTools;
    }

    public int remaining() {
        return script.size();
    }

    public static ToolCall toolCall(String id, String toolName, Map<String, Object> arguments) {
        return ToolCall.builder().id(id).toolName(toolName).arguments(arguments).build();
    }
}
