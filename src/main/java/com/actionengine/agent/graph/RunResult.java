package com.actionengine.agent.graph;

import com.actionengine.agent.state.WorkflowState;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one driver run: either a terminal state or an interrupt that
 * leaves the thread suspended.
 */
@Value
@Builder
public class RunResult {

    String threadId;
    WorkflowState state;
    ThreadStatus status;
    InterruptPayload interrupt;
    int stepsExecuted;

    public boolean isInterrupted() {
        return status == ThreadStatus.SUSPENDED;
    }
}
