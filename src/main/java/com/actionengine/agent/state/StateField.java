package com.actionengine.agent.state;

import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;

import java.util.List;
import java.util.Map;

/**
 * Every field of {@link WorkflowState} with its one merge policy.
 *
 * Each constant knows how to read and write its own field, so the merger
 * dispatches per field without reflection.
 */
@SuppressWarnings("unchecked")
public enum StateField {

    TASK("task", MergeStrategies.<String>lastWrite()) {
        Object read(WorkflowState s) { return s.getTask(); }
        void write(WorkflowState s, Object v) { s.setTask((String) v); }
    },
    PLAN("plan", MergeStrategies.<Plan>lastWrite()) {
        Object read(WorkflowState s) { return s.getPlan(); }
        void write(WorkflowState s, Object v) { s.setPlan((Plan) v); }
    },
    BRAIN("brain", MergeStrategies.<String>shallowMerge()) {
        Object read(WorkflowState s) { return s.getBrain(); }
        void write(WorkflowState s, Object v) { s.setBrain((Map<String, String>) v); }
    },
    THOUGHT("thought", MergeStrategies.<String>lastWrite()) {
        Object read(WorkflowState s) { return s.getThought(); }
        void write(WorkflowState s, Object v) { s.setThought((String) v); }
    },
    SUMMARY("summary", MergeStrategies.<String>lastWrite()) {
        Object read(WorkflowState s) { return s.getSummary(); }
        void write(WorkflowState s, Object v) { s.setSummary((String) v); }
    },
    MESSAGES("messages", MergeStrategies.<List<Message>>lastWrite()) {
        Object read(WorkflowState s) { return s.getMessages(); }
        void write(WorkflowState s, Object v) { s.setMessages((List<Message>) v); }
    },
    TOOL_CALLS("tool_calls", MergeStrategies.<List<ToolCall>>lastWrite()) {
        Object read(WorkflowState s) { return s.getToolCalls(); }
        void write(WorkflowState s, Object v) { s.setToolCalls((List<ToolCall>) v); }
    },
    TOOLS_USED("tools_used", MergeStrategies.<ToolCall>appendUnique(ToolCall::getId)) {
        Object read(WorkflowState s) { return s.getToolsUsed(); }
        void write(WorkflowState s, Object v) { s.setToolsUsed((List<ToolCall>) v); }
    },
    PENDING_APPROVAL("pending_approval", MergeStrategies.shallowMergeApproval()) {
        Object read(WorkflowState s) { return s.getPendingApproval(); }
        void write(WorkflowState s, Object v) { s.setPendingApproval((PendingApproval) v); }
    },
    ERROR("error", MergeStrategies.<String>lastWrite()) {
        Object read(WorkflowState s) { return s.getError(); }
        void write(WorkflowState s, Object v) { s.setError((String) v); }
    },
    NEXT_NODE("next_node", MergeStrategies.<String>lastWrite()) {
        Object read(WorkflowState s) { return s.getNextNode(); }
        void write(WorkflowState s, Object v) { s.setNextNode((String) v); }
    },
    EXITING("exiting", MergeStrategies.<Boolean>lastWrite()) {
        Object read(WorkflowState s) { return s.isExiting(); }
        void write(WorkflowState s, Object v) { s.setExiting(Boolean.TRUE.equals(v)); }
    };

    private final String key;
    private final MergeStrategy<Object> strategy;

    StateField(String key, MergeStrategy<?> strategy) {
        this.key = key;
        this.strategy = (MergeStrategy<Object>) strategy;
    }

    abstract Object read(WorkflowState state);

    abstract void write(WorkflowState state, Object value);

    /** Snake-case name used in checkpoints and logs */
    public String key() {
        return key;
    }

    public Object merge(Object current, Object update) {
        return strategy.merge(current, update);
    }

    void applyTo(WorkflowState target, Object update) {
        write(target, merge(read(target), update));
    }
}
