package com.actionengine.agent.graph;

import com.actionengine.agent.state.StateUpdate;
import lombok.Getter;

/**
 * Result of a node invocation: a state update to merge, a request to
 * suspend for human input, or a failure.
 */
@Getter
public final class NodeOutcome {

    public enum Kind {
        CONTINUE,
        SUSPEND,
        FAIL
    }

    private final Kind kind;
    private final StateUpdate update;
    private final InterruptPayload interrupt;
    private final String error;

    private NodeOutcome(Kind kind, StateUpdate update, InterruptPayload interrupt, String error) {
        this.kind = kind;
        this.update = update;
        this.interrupt = interrupt;
        this.error = error;
    }

    public static NodeOutcome update(StateUpdate update) {
        return new NodeOutcome(Kind.CONTINUE, update != null ? update : StateUpdate.of(), null, null);
    }

    /**
     * Suspends the run. {@code update} is merged before the checkpoint is
     * written and may be empty.
     */
    public static NodeOutcome suspend(InterruptPayload interrupt, StateUpdate update) {
        if (interrupt == null) {
            throw new IllegalArgumentException("A suspension needs an interrupt payload");
        }
        return new NodeOutcome(Kind.SUSPEND, update != null ? update : StateUpdate.of(), interrupt, null);
    }

    public static NodeOutcome fail(String error) {
        return new NodeOutcome(Kind.FAIL, StateUpdate.of(), null, error);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CONTINUE -> "CONTINUE" + update;
            case SUSPEND -> "SUSPEND[" + interrupt.getMessage() + "]";
            case FAIL -> "FAIL[" + error + "]";
        };
    }
}
