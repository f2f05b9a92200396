package com.actionengine.agent.model;

import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.state.WorkflowState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One item of the caller-facing stream: either a state update after a node
 * completed, or an approval interrupt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunEvent {

    public enum Type { state_update, approval_request }

    private Type type;
    private String threadId;

    /** Node that produced the update; null for interrupts */
    private String node;

    private WorkflowState state;
    private InterruptPayload interrupt;

    public static RunEvent stateUpdate(String threadId, String node, WorkflowState state) {
        return RunEvent.builder()
                .type(Type.state_update)
                .threadId(threadId)
                .node(node)
                .state(state)
                .build();
    }

    public static RunEvent interrupt(String threadId, InterruptPayload payload) {
        return RunEvent.builder()
                .type(Type.approval_request)
                .threadId(threadId)
                .interrupt(payload)
                .build();
    }
}
