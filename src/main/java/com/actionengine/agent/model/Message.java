package com.actionengine.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One serialized conversation turn. Stored inside {@code WorkflowState.messages}
 * and therefore inside every checkpoint, so it must stay plain data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool_call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back verbatim in later requests so the model can correlate
     * tool results with its original requests.
     */
    private List<ToolCall> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message toolResult(ToolCall call, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(call.getId())
                .name(call.getToolName())
                .content(content)
                .build();
    }
}
