package com.actionengine.agent.state;

import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partial state written by a node. Only the fields a node touches are
 * present; an explicit null is a write, an absent field is not.
 */
public final class StateUpdate {

    private final EnumMap<StateField, Object> values = new EnumMap<>(StateField.class);

    public static StateUpdate of() {
        return new StateUpdate();
    }

    public StateUpdate task(String task) { return put(StateField.TASK, task); }

    public StateUpdate plan(Plan plan) { return put(StateField.PLAN, plan); }

    public StateUpdate brain(Map<String, String> brain) { return put(StateField.BRAIN, brain); }

    public StateUpdate thought(String thought) { return put(StateField.THOUGHT, thought); }

    public StateUpdate summary(String summary) { return put(StateField.SUMMARY, summary); }

    public StateUpdate messages(List<Message> messages) { return put(StateField.MESSAGES, messages); }

    public StateUpdate toolCalls(List<ToolCall> toolCalls) { return put(StateField.TOOL_CALLS, toolCalls); }

    public StateUpdate toolsUsed(List<ToolCall> toolsUsed) { return put(StateField.TOOLS_USED, toolsUsed); }

    public StateUpdate pendingApproval(PendingApproval approval) { return put(StateField.PENDING_APPROVAL, approval); }

    public StateUpdate error(String error) { return put(StateField.ERROR, error); }

    public StateUpdate nextNode(String nextNode) { return put(StateField.NEXT_NODE, nextNode); }

    public StateUpdate exiting(boolean exiting) { return put(StateField.EXITING, exiting); }

    public StateUpdate put(StateField field, Object value) {
        values.put(field, value);
        return this;
    }

    public boolean contains(StateField field) {
        return values.containsKey(field);
    }

    public Object get(StateField field) {
        return values.get(field);
    }

    public Set<StateField> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Folds {@code next} into this update using each field's policy, so that
     * applying the combined update equals applying both in sequence.
     */
    public StateUpdate andThen(StateUpdate next) {
        StateUpdate combined = new StateUpdate();
        combined.values.putAll(values);
        next.values.forEach((field, value) -> combined.values.put(field,
                combined.values.containsKey(field) ? field.merge(combined.values.get(field), value) : value));
        return combined;
    }

    @Override
    public String toString() {
        return "StateUpdate" + values.keySet();
    }
}
