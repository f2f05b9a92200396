package com.actionengine.agent.state;

import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StateMergerTest {

    private static ToolCall call(String id, String tool) {
        return ToolCall.builder().id(id).toolName(tool).arguments(Map.of()).build();
    }

    @Test
    void merge_doesNotModifyInputState() {
        WorkflowState original = WorkflowState.initial("task");

        WorkflowState merged = StateMerger.merge(original, StateUpdate.of()
                .messages(List.of(Message.assistant("hi")))
                .brain(Map.of("thought", "x")));

        assertThat(original.getMessages()).isEmpty();
        assertThat(original.getBrain()).isEmpty();
        assertThat(merged.getMessages()).hasSize(1);
        assertThat(merged.getTask()).isEqualTo("task");
    }

    @Test
    void brain_isShallowMerged() {
        WorkflowState state = StateMerger.merge(new WorkflowState(),
                StateUpdate.of().brain(Map.of("thought", "a", "summary", "s")));

        WorkflowState merged = StateMerger.merge(state, StateUpdate.of().brain(Map.of("thought", "b")));

        assertThat(merged.getBrain()).containsEntry("thought", "b").containsEntry("summary", "s");
    }

    @Test
    void toolsUsed_appendsAndReplacesById() {
        WorkflowState state = StateMerger.merge(new WorkflowState(),
                StateUpdate.of().toolsUsed(List.of(call("1", "terminal"))));

        WorkflowState merged = StateMerger.merge(state,
                StateUpdate.of().toolsUsed(List.of(call("2", "browser"), call("1", "terminate"))));

        assertThat(merged.getToolsUsed()).extracting(ToolCall::getId).containsExactly("1", "2");
        assertThat(merged.getToolsUsed().get(0).getToolName()).isEqualTo("terminate");
    }

    @Test
    void pendingApproval_overlaysOnlyNonNullFields() {
        ToolCall pending = call("c1", "terminal");
        WorkflowState state = StateMerger.merge(new WorkflowState(),
                StateUpdate.of().pendingApproval(new PendingApproval(pending, false, "awaiting")));

        WorkflowState merged = StateMerger.merge(state,
                StateUpdate.of().pendingApproval(PendingApproval.builder().approved(true).build()));

        assertThat(merged.getPendingApproval().getToolCall()).isEqualTo(pending);
        assertThat(merged.getPendingApproval().getApproved()).isTrue();
        assertThat(merged.getPendingApproval().getReason()).isEqualTo("awaiting");
        assertThat(merged.getPendingApproval().isGranted()).isTrue();
    }

    @Test
    void lastWrite_replacesIncludingNull() {
        WorkflowState state = StateMerger.merge(new WorkflowState(), StateUpdate.of().error("boom"));

        WorkflowState cleared = StateMerger.merge(state, StateUpdate.of().error(null));

        assertThat(cleared.getError()).isNull();
    }

    @Test
    void sequentialMerges_equalMergingCombinedUpdatesInOrder() {
        WorkflowState base = WorkflowState.initial("task");
        StateUpdate first = StateUpdate.of()
                .brain(Map.of("thought", "a"))
                .toolsUsed(List.of(call("1", "terminal")))
                .thought("first");
        StateUpdate second = StateUpdate.of()
                .brain(Map.of("summary", "s"))
                .toolsUsed(List.of(call("2", "browser")))
                .exiting(true);

        WorkflowState stepwise = StateMerger.merge(StateMerger.merge(base, first), second);
        WorkflowState together = StateMerger.merge(base, first, second);

        assertThat(together).isEqualTo(stepwise);
        assertThat(StateMerger.merge(base, first.andThen(second))).isEqualTo(stepwise);
        assertThat(together.getBrain()).containsOnlyKeys("thought", "summary");
        assertThat(together.isExiting()).isTrue();
    }

    @Test
    void andThen_keepsLaterValueForSameField() {
        StateUpdate combined = StateUpdate.of().thought("a").andThen(StateUpdate.of().thought("b"));

        WorkflowState merged = StateMerger.merge(new WorkflowState(), combined);

        assertThat(merged.getThought()).isEqualTo("b");
    }
}
