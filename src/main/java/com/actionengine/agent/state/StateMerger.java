package com.actionengine.agent.state;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies partial updates to a workflow state using each field's declared
 * merge policy. The input state is never modified.
 */
@Slf4j
public final class StateMerger {

    private StateMerger() {
    }

    public static WorkflowState merge(WorkflowState current, StateUpdate... updates) {
        WorkflowState result = current != null ? current.copy() : new WorkflowState();
        for (StateUpdate update : updates) {
            if (update == null) continue;
            for (StateField field : update.fields()) {
                field.applyTo(result, update.get(field));
            }
            log.debug("Merged {}", update);
        }
        return result;
    }
}
