package com.actionengine.agent.resilience;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.exception.ModelUnavailableException;
import com.actionengine.agent.llm.LlmClient;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.tool.ToolCollection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the model for tool calls until it produces a usable answer.
 *
 * A response is retried when it carries no tool call, names a tool outside
 * the offered collection, or the model is unavailable. Before each retry a
 * corrective user message is appended. Once the attempts are spent the
 * {@link LlmResponse#noUsableToolCall(String)} sentinel is returned instead
 * of an exception. Content policy errors propagate untouched.
 */
@Component
@Slf4j
public class ToolCallRetryPolicy {

    private final int maxAttempts;

    @Autowired
    public ToolCallRetryPolicy(EngineProperties engineProperties) {
        this(engineProperties.getToolCallRetry().getMaxAttempts());
    }

    public ToolCallRetryPolicy(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
    }

    public LlmResponse invokeWithValidatedTools(LlmClient modelClient, List<Message> messages, ToolCollection tools) {
        List<Message> conversation = new ArrayList<>(messages);
        String lastProblem = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (lastProblem != null) {
                conversation.add(Message.user(correction(lastProblem, tools)));
            }
            try {
                LlmResponse response = modelClient.chat(conversation, tools.definitions());
                lastProblem = problemWith(response, tools);
                if (lastProblem == null) {
                    if (attempt > 1) {
                        log.info("Usable tool call obtained on attempt {}/{}", attempt, maxAttempts);
                    }
                    return response;
                }
            } catch (ModelUnavailableException e) {
                lastProblem = "the model was unavailable (" + e.getMessage() + ")";
            }
            log.warn("Tool call attempt {}/{} rejected: {}", attempt, maxAttempts, lastProblem);
        }

        log.error("No usable tool call after {} attempts: {}", maxAttempts, lastProblem);
        return LlmResponse.noUsableToolCall("No usable tool call after " + maxAttempts + " attempts: " + lastProblem);
    }

    private static String problemWith(LlmResponse response, ToolCollection tools) {
        if (response == null || !response.hasToolCalls()) {
            return "the response contained no tool call";
        }
        for (ToolCall call : response.getToolCalls()) {
            if (call.getToolName() == null || !tools.hasTool(call.getToolName())) {
                return "unknown tool '" + call.getToolName() + "'";
            }
        }
        return null;
    }

    private static String correction(String problem, ToolCollection tools) {
        return "Your previous answer could not be used: " + problem
                + ". Respond with a call to one of these tools: " + tools.names() + ".";
    }
}
