package com.actionengine.agent.graph;

import com.actionengine.agent.state.WorkflowState;

/**
 * One step of the workflow. Implementations read the state, do their work
 * through the context's environment, and describe the result as a
 * {@link NodeOutcome}; they never mutate the state they are given.
 */
@FunctionalInterface
public interface Node {

    NodeOutcome invoke(WorkflowState state, NodeContext context);
}
