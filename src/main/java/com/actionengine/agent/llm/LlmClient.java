package com.actionengine.agent.llm;

import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.tool.ToolDefinition;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation and the available tool schemas to the model.
     *
     * @param messages conversation so far (system + user + assistant + tool results)
     * @param tools    tool definitions the model may invoke; empty for a plain completion
     * @return the assistant text and any tool calls, in emission order
     * @throws com.actionengine.agent.exception.ModelUnavailableException on transient provider failures
     * @throws com.actionengine.agent.exception.ContentPolicyException when the provider refuses the content
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);
}
