package com.actionengine.agent.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class LlmResponse {

    /** Assistant text, possibly null when the model only emitted tool calls */
    private String content;

    /** Tool calls requested by the model, in the order it emitted them */
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    /**
     * Set on the sentinel returned after the tool-call retry policy gave up.
     * Nodes treat it as a valid, degenerate outcome.
     */
    private boolean noUsableToolCall;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static LlmResponse noUsableToolCall(String content) {
        return LlmResponse.builder()
                .content(content)
                .noUsableToolCall(true)
                .build();
    }
}
