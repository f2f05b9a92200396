package com.actionengine.agent.graph;

import com.actionengine.agent.model.ToolCall;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a suspended node asks the human. Persisted with the checkpoint and
 * sent to clients as the approval request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterruptPayload {

    public static final String APPROVAL_REQUEST = "approval_request";

    @Builder.Default
    private String type = APPROVAL_REQUEST;

    private ToolCall toolCall;

    private String message;

    public static InterruptPayload approvalRequest(ToolCall toolCall, String message) {
        return InterruptPayload.builder().toolCall(toolCall).message(message).build();
    }
}
