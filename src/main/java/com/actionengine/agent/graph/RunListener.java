package com.actionengine.agent.graph;

import com.actionengine.agent.state.WorkflowState;

/**
 * Receives run events in the order they happen. Listener failures are
 * logged by the driver and never affect the run.
 */
public interface RunListener {

    RunListener NOOP = new RunListener() {
    };

    default void onStateUpdate(String threadId, NodeId node, WorkflowState state) {
    }

    default void onInterrupt(String threadId, InterruptPayload interrupt) {
    }

    default void onFinished(String threadId, RunResult result) {
    }
}
