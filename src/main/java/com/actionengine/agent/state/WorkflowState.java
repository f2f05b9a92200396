package com.actionengine.agent.state;

import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logical state of one workflow run. Holds plain data only: live handles
 * (browser, terminal, model client) live in the thread environment and are
 * never reachable from here, which keeps every checkpoint serializable.
 *
 * Nodes never mutate this object. They return a {@link StateUpdate} and the
 * driver merges it through {@link StateMerger} using the policy declared by
 * each {@link StateField}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowState {

    public static final String BRAIN_PREV_ACTION_EVALUATION = "prev_action_evaluation";
    public static final String BRAIN_IMPORTANT_CONTENTS = "important_contents";
    public static final String BRAIN_TASK_PROGRESS = "task_progress";
    public static final String BRAIN_FUTURE_PLANS = "future_plans";
    public static final String BRAIN_THOUGHT = "thought";
    public static final String BRAIN_SUMMARY = "summary";

    private String task;
    private Plan plan;

    @Builder.Default
    private Map<String, String> brain = new LinkedHashMap<>();

    private String thought;
    private String summary;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private List<ToolCall> toolsUsed = new ArrayList<>();

    @Builder.Default
    private PendingApproval pendingApproval = new PendingApproval();

    private String error;
    private String nextNode;
    private boolean exiting;

    public static WorkflowState initial(String task) {
        return WorkflowState.builder().task(task).build();
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    /**
     * Copy with fresh top-level collections, so merging into the copy never
     * changes a state that was already published or checkpointed.
     */
    public WorkflowState copy() {
        return WorkflowState.builder()
                .task(task)
                .plan(plan != null ? plan.copy() : null)
                .brain(brain != null ? new LinkedHashMap<>(brain) : new LinkedHashMap<>())
                .thought(thought)
                .summary(summary)
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .toolCalls(toolCalls != null ? new ArrayList<>(toolCalls) : new ArrayList<>())
                .toolsUsed(toolsUsed != null ? new ArrayList<>(toolsUsed) : new ArrayList<>())
                .pendingApproval(pendingApproval != null ? pendingApproval.copy() : new PendingApproval())
                .error(error)
                .nextNode(nextNode)
                .exiting(exiting)
                .build();
    }
}
