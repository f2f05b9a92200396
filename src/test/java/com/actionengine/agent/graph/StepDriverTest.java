package com.actionengine.agent.graph;

import com.actionengine.agent.checkpoint.Checkpoint;
import com.actionengine.agent.checkpoint.InMemoryCheckpointStore;
import com.actionengine.agent.environment.EnvironmentConfig;
import com.actionengine.agent.environment.EnvironmentManager;
import com.actionengine.agent.exception.StaleResumeException;
import com.actionengine.agent.exception.ThreadNotFoundException;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.support.RecordingTerminalSession;
import com.actionengine.agent.support.ScriptedLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.actionengine.agent.graph.NodeId.END;
import static com.actionengine.agent.graph.NodeId.EXECUTOR;
import static com.actionengine.agent.graph.NodeId.HUMAN_APPROVAL;
import static com.actionengine.agent.graph.NodeId.PLANNING;
import static com.actionengine.agent.graph.NodeId.THINKING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepDriverTest {

    private static final ToolCall CALL = ToolCall.builder()
            .id("call-1").toolName("terminal").arguments(Map.of("script", "rm x")).build();

    private InMemoryCheckpointStore store;
    private StepDriver driver;
    private List<String> visited;

    @BeforeEach
    void setUp() {
        EnvironmentManager environments = new EnvironmentManager(
                config -> new ScriptedLlmClient(),
                (threadId, config) -> {
                    throw new IllegalStateException("browser not expected");
                },
                (threadId, config) -> new RecordingTerminalSession());
        store = new InMemoryCheckpointStore(environments);
        driver = new StepDriver(store, environments, 20);
        visited = new ArrayList<>();
    }

    private Node recording(NodeId id, StateUpdate update) {
        return (state, context) -> {
            visited.add(id.key());
            return NodeOutcome.update(update);
        };
    }

    /** planning -> human_approval -> (approved) executor -> END, (rejected) END */
    private GraphDefinition approvalGraph() {
        Node approval = (state, context) -> {
            visited.add(HUMAN_APPROVAL.key() + (context.isResume() ? ":resume" : ""));
            if (context.isResume()) {
                return NodeOutcome.update(StateUpdate.of().pendingApproval(PendingApproval.builder()
                        .approved(context.resumeDecision().orElseThrow().isApproved()).build()));
            }
            return NodeOutcome.suspend(InterruptPayload.approvalRequest(CALL, "Do you approve executing: rm x?"),
                    StateUpdate.of().pendingApproval(new PendingApproval(CALL, false, "awaiting approval")));
        };
        return GraphBuilder.create()
                .node(PLANNING, recording(PLANNING, StateUpdate.of().thought("planned")))
                .node(HUMAN_APPROVAL, approval)
                .node(EXECUTOR, recording(EXECUTOR, StateUpdate.of().toolsUsed(List.of(CALL))))
                .entry(PLANNING)
                .edge(PLANNING, HUMAN_APPROVAL)
                .when(HUMAN_APPROVAL, "approved", s -> s.getPendingApproval().isGranted(), EXECUTOR)
                .otherwise(HUMAN_APPROVAL, END)
                .edge(EXECUTOR, END)
                .build();
    }

    @Test
    void start_runsToEndAndCheckpointsTerminalState() {
        GraphDefinition graph = GraphBuilder.create()
                .node(PLANNING, recording(PLANNING, StateUpdate.of().thought("a")))
                .node(THINKING, recording(THINKING, StateUpdate.of().summary("b")))
                .entry(PLANNING)
                .edge(PLANNING, THINKING)
                .edge(THINKING, END)
                .build();

        RunResult result = driver.run(graph, "t1", WorkflowState.initial("task"), null);

        assertThat(result.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(result.getStepsExecuted()).isEqualTo(2);
        assertThat(result.getState().isExiting()).isTrue();
        assertThat(result.getState().getThought()).isEqualTo("a");
        assertThat(result.getState().getSummary()).isEqualTo("b");
        assertThat(visited).containsExactly("planning", "thinking");

        Checkpoint checkpoint = store.load("t1").orElseThrow().checkpoint();
        assertThat(checkpoint.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(checkpoint.getStep()).isEqualTo(2);
        assertThat(checkpoint.getNextNode()).isEqualTo(END);
        assertThat(checkpoint.getChannelVersions()).containsEntry("thought", 1L).containsEntry("exiting", 1L);
    }

    @Test
    void suspend_checkpointsAndReturnsInterrupt() {
        RunResult result = driver.run(approvalGraph(), "t2", WorkflowState.initial("task"), null);

        assertThat(result.isInterrupted()).isTrue();
        assertThat(result.getInterrupt().getToolCall().getId()).isEqualTo("call-1");
        assertThat(result.getInterrupt().getMessage()).isEqualTo("Do you approve executing: rm x?");
        assertThat(result.getState().isExiting()).isFalse();

        Checkpoint checkpoint = store.load("t2").orElseThrow().checkpoint();
        assertThat(checkpoint.getStatus()).isEqualTo(ThreadStatus.SUSPENDED);
        assertThat(checkpoint.getNextNode()).isEqualTo(HUMAN_APPROVAL);
        assertThat(checkpoint.getPendingWrites()).containsExactly("pending_approval");
        assertThat(checkpoint.getInterrupt()).isNotNull();
    }

    @Test
    void resume_approved_reinvokesSuspendedNodeAndContinues() {
        GraphDefinition graph = approvalGraph();
        driver.run(graph, "t3", WorkflowState.initial("task"), null);

        RunResult result = driver.run(graph, "t3", null, ResumeDecision.approve());

        assertThat(visited).containsExactly("planning", "human_approval", "human_approval:resume", "executor");
        assertThat(result.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(result.getStepsExecuted()).isEqualTo(2);
        assertThat(result.getState().getPendingApproval().getToolCall()).isEqualTo(CALL);
        assertThat(result.getState().getPendingApproval().getReason()).isEqualTo(StepDriver.APPROVED_REASON);
        assertThat(result.getState().getToolsUsed()).extracting(ToolCall::getId).containsExactly("call-1");
        assertThat(store.load("t3").orElseThrow().checkpoint().getStep()).isEqualTo(4);
    }

    @Test
    void resume_rejected_skipsExecution() {
        GraphDefinition graph = approvalGraph();
        driver.run(graph, "t4", WorkflowState.initial("task"), null);

        RunResult result = driver.run(graph, "t4", null, ResumeDecision.reject("too risky"));

        assertThat(visited).doesNotContain("executor");
        assertThat(result.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(result.getState().getPendingApproval().getApproved()).isFalse();
        assertThat(result.getState().getPendingApproval().getReason()).isEqualTo("too risky");
    }

    @Test
    void resume_withMismatchedToolCallId_isStaleAndLeavesThreadSuspended() {
        GraphDefinition graph = approvalGraph();
        driver.run(graph, "t5", WorkflowState.initial("task"), null);

        ResumeDecision wrong = ResumeDecision.builder().approved(true).toolCallId("other").build();

        assertThatThrownBy(() -> driver.run(graph, "t5", null, wrong))
                .isInstanceOf(StaleResumeException.class);
        assertThat(store.load("t5").orElseThrow().checkpoint().getStatus()).isEqualTo(ThreadStatus.SUSPENDED);
    }

    @Test
    void resume_twice_secondIsStale() {
        GraphDefinition graph = approvalGraph();
        driver.run(graph, "t6", WorkflowState.initial("task"), null);
        driver.run(graph, "t6", null, ResumeDecision.approve());

        assertThatThrownBy(() -> driver.run(graph, "t6", null, ResumeDecision.approve()))
                .isInstanceOf(StaleResumeException.class);
    }

    @Test
    void resume_unknownThread_throwsThreadNotFound() {
        assertThatThrownBy(() -> driver.run(approvalGraph(), "missing", null, ResumeDecision.approve()))
                .isInstanceOf(ThreadNotFoundException.class);
    }

    @Test
    void nodeException_isFoldedIntoStateAndEndsRun() {
        GraphDefinition graph = GraphBuilder.create()
                .node(PLANNING, (state, context) -> {
                    throw new IllegalStateException("model exploded");
                })
                .node(THINKING, recording(THINKING, StateUpdate.of()))
                .entry(PLANNING)
                .edge(PLANNING, THINKING)
                .edge(THINKING, END)
                .build();

        RunResult result = driver.run(graph, "t7", WorkflowState.initial("task"), null);

        assertThat(result.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(result.getState().getError()).contains("model exploded");
        assertThat(visited).isEmpty();
    }

    @Test
    void failure_goesToErrorNodeWhenConfigured() {
        GraphDefinition graph = GraphBuilder.create()
                .node(PLANNING, (state, context) -> NodeOutcome.fail("planner failed"))
                .node(THINKING, recording(THINKING, StateUpdate.of().summary("recovered")))
                .entry(PLANNING)
                .errorNode(THINKING)
                .edge(PLANNING, END)
                .edge(THINKING, END)
                .build();

        RunResult result = driver.run(graph, "t8", WorkflowState.initial("task"), null);

        assertThat(visited).containsExactly("thinking");
        assertThat(result.getState().getError()).isEqualTo("planner failed");
        assertThat(result.getState().getSummary()).isEqualTo("recovered");
    }

    @Test
    void stepLimit_endsRunWithError() {
        GraphDefinition graph = GraphBuilder.create()
                .node(PLANNING, recording(PLANNING, StateUpdate.of()))
                .node(THINKING, recording(THINKING, StateUpdate.of()))
                .entry(PLANNING)
                .when(PLANNING, "exiting", WorkflowState::isExiting, END)
                .otherwise(PLANNING, THINKING)
                .edge(THINKING, PLANNING)
                .build();

        RunResult result = new StepDriver(store, null, 5).run(graph, "t9", WorkflowState.initial("task"), null);

        assertThat(result.getStepsExecuted()).isEqualTo(5);
        assertThat(result.getState().getError()).isEqualTo("Step limit of 5 exceeded");
        assertThat(result.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
    }

    @Test
    void cancelledBeforeStart_runsNoNode() {
        CancellationFlag cancellation = new CancellationFlag();
        cancellation.cancel();

        RunResult result = driver.start(approvalGraph(), "t10", WorkflowState.initial("task"),
                EnvironmentConfig.defaults(), RunListener.NOOP, cancellation);

        assertThat(visited).isEmpty();
        assertThat(result.getStatus()).isEqualTo(ThreadStatus.CANCELLED);
        assertThat(result.getState().getError()).isEqualTo(StepDriver.CANCELLED_ERROR);
    }

    @Test
    void cancelSuspended_endsThreadAndLaterResumeIsStale() {
        GraphDefinition graph = approvalGraph();
        driver.run(graph, "t11", WorkflowState.initial("task"), null);

        RunResult cancelled = driver.cancelSuspended("t11").orElseThrow();

        assertThat(cancelled.getStatus()).isEqualTo(ThreadStatus.CANCELLED);
        assertThat(store.load("t11").orElseThrow().checkpoint().getStatus()).isEqualTo(ThreadStatus.CANCELLED);
        assertThat(driver.cancelSuspended("t11")).isEmpty();
        assertThatThrownBy(() -> driver.run(graph, "t11", null, ResumeDecision.approve()))
                .isInstanceOf(StaleResumeException.class);
    }

    @Test
    void listener_receivesUpdatesInterruptAndFinish() {
        List<String> events = new ArrayList<>();
        RunListener listener = new RunListener() {
            @Override
            public void onStateUpdate(String threadId, NodeId node, WorkflowState state) {
                events.add("update:" + node.key());
            }

            @Override
            public void onInterrupt(String threadId, InterruptPayload interrupt) {
                events.add("interrupt:" + interrupt.getToolCall().getId());
            }

            @Override
            public void onFinished(String threadId, RunResult result) {
                events.add("finished:" + result.getStatus());
            }
        };

        driver.start(approvalGraph(), "t12", WorkflowState.initial("task"), EnvironmentConfig.defaults(),
                listener, new CancellationFlag());

        assertThat(events).containsExactly(
                "update:planning", "update:human_approval", "interrupt:call-1", "finished:SUSPENDED");
    }

    @Test
    void failingListener_doesNotAffectRun() {
        RunListener broken = new RunListener() {
            @Override
            public void onStateUpdate(String threadId, NodeId node, WorkflowState state) {
                throw new IllegalStateException("client went away");
            }
        };

        RunResult result = driver.start(approvalGraph(), "t13", WorkflowState.initial("task"),
                EnvironmentConfig.defaults(), broken, new CancellationFlag());

        assertThat(result.isInterrupted()).isTrue();
    }

    @Test
    void start_onExistingThread_continuesStepNumbering() {
        GraphDefinition graph = GraphBuilder.create()
                .node(PLANNING, recording(PLANNING, StateUpdate.of()))
                .entry(PLANNING)
                .edge(PLANNING, END)
                .build();

        driver.run(graph, "t14", WorkflowState.initial("first"), null);
        driver.run(graph, "t14", WorkflowState.initial("second"), null);

        Checkpoint checkpoint = store.load("t14").orElseThrow().checkpoint();
        assertThat(checkpoint.getStep()).isEqualTo(2);
        assertThat(checkpoint.getState().getTask()).isEqualTo("second");
    }
}
