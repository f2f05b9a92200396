package com.actionengine.agent.graph;

import com.actionengine.agent.state.WorkflowState;

import java.util.function.Predicate;

/**
 * Outgoing edge of a node. A route without condition is either the single
 * unconditional edge or the default branch of a conditional group.
 */
public record Route(NodeId target, String label, Predicate<WorkflowState> condition) {

    public static Route unconditional(NodeId target) {
        return new Route(target, "always", null);
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean matches(WorkflowState state) {
        return condition == null || condition.test(state);
    }
}
