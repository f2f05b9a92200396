package com.actionengine.agent.model;

import com.actionengine.agent.graph.ThreadStatus;
import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.state.WorkflowState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a blocking submit or resume. A failed run has the same shape as
 * a successful one: callers must check {@code state.error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {

    private String threadId;
    private ThreadStatus status;
    private WorkflowState state;

    /** Non-null when status = SUSPENDED */
    private InterruptPayload interrupt;

    @Builder.Default
    private List<RunEvent> events = new ArrayList<>();

    private int stepsExecuted;
}
