package com.actionengine.agent.core;

import com.actionengine.agent.checkpoint.Checkpoint;
import com.actionengine.agent.checkpoint.InMemoryCheckpointStore;
import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.EnvironmentConfig;
import com.actionengine.agent.environment.EnvironmentManager;
import com.actionengine.agent.exception.StaleResumeException;
import com.actionengine.agent.exception.ThreadNotFoundException;
import com.actionengine.agent.graph.GraphBuilder;
import com.actionengine.agent.graph.GraphDefinition;
import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.graph.Node;
import com.actionengine.agent.graph.NodeOutcome;
import com.actionengine.agent.graph.StepDriver;
import com.actionengine.agent.graph.ThreadStatus;
import com.actionengine.agent.model.ResumeRequest;
import com.actionengine.agent.model.RunResponse;
import com.actionengine.agent.model.TaskRequest;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.observability.TraceService;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.support.RecordingTerminalSession;
import com.actionengine.agent.support.ScriptedLlmClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.actionengine.agent.graph.NodeId.END;
import static com.actionengine.agent.graph.NodeId.EXECUTOR;
import static com.actionengine.agent.graph.NodeId.HUMAN_APPROVAL;
import static com.actionengine.agent.graph.NodeId.PLANNING;
import static com.actionengine.agent.graph.NodeId.THINKING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class WorkflowServiceTest {

    private static final ToolCall CALL = ScriptedLlmClient.toolCall("call_1", "terminal", Map.of("script", "rm x"));

    private final List<String> visited = new CopyOnWriteArrayList<>();
    private final ExecutorService pool = Executors.newSingleThreadExecutor();

    private EngineProperties properties;
    private EnvironmentManager environments;
    private InMemoryCheckpointStore store;
    private ThreadRecordService threadRecords;
    private TraceService traces;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        environments = new EnvironmentManager(config -> new ScriptedLlmClient(),
                (threadId, config) -> null,
                (threadId, config) -> new RecordingTerminalSession());
        store = new InMemoryCheckpointStore(environments);
        threadRecords = mock(ThreadRecordService.class);
        traces = mock(TraceService.class);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private WorkflowService service(GraphDefinition graph) {
        return new WorkflowService(graph, new StepDriver(store, environments, properties), store, environments,
                threadRecords, traces, properties);
    }

    private Node visiting(String name) {
        return (state, context) -> {
            context.environment();
            visited.add(name);
            return NodeOutcome.update(StateUpdate.of().thought(name));
        };
    }

    /** planning -> human_approval (suspends) -> executor -> END */
    private GraphDefinition approvalGraph() {
        Node approval = (state, context) -> {
            if (context.isResume()) {
                return NodeOutcome.update(StateUpdate.of().pendingApproval(PendingApproval.builder()
                        .approved(context.resumeDecision().orElseThrow().isApproved()).build()));
            }
            return NodeOutcome.suspend(InterruptPayload.approvalRequest(CALL, "Do you approve executing: rm x?"),
                    StateUpdate.of().pendingApproval(new PendingApproval(CALL, false, "awaiting approval")));
        };
        return GraphBuilder.create()
                .node(PLANNING, visiting("planning"))
                .node(HUMAN_APPROVAL, approval)
                .node(EXECUTOR, visiting("executor"))
                .entry(PLANNING)
                .edge(PLANNING, HUMAN_APPROVAL)
                .when(HUMAN_APPROVAL, "approved", s -> s.getPendingApproval().isGranted(), EXECUTOR)
                .otherwise(HUMAN_APPROVAL, END)
                .edge(EXECUTOR, END)
                .build();
    }

    private static TaskRequest task(String threadId) {
        TaskRequest request = new TaskRequest();
        request.setTask("delete x");
        request.setThreadId(threadId);
        request.setConfig(EnvironmentConfig.builder().useBrowser(false).build());
        return request;
    }

    private static ResumeRequest approve(String toolCallId) {
        ResumeRequest request = new ResumeRequest();
        request.setApproved(true);
        request.setToolCallId(toolCallId);
        return request;
    }

    @Test
    void submit_withoutThreadId_createsThread() {
        RunResponse response = service(approvalGraph()).submit(task(null));

        assertThat(response.getThreadId()).isNotBlank();
        assertThat(response.getStatus()).isEqualTo(ThreadStatus.SUSPENDED);
        assertThat(response.getEvents()).hasSize(3);
        verify(threadRecords).recordRunStarted(response.getThreadId(), "delete x");
        verify(traces).persistTrace(any(), any(), isNull());
    }

    @Test
    void submit_onWarmThread_keepsEnvironmentConfig() {
        WorkflowService service = service(approvalGraph());
        service.submit(task("t1"));
        service.resume("t1", approve("call_1"));

        TaskRequest second = task("t1");
        second.setConfig(EnvironmentConfig.builder().useBrowser(false).useTerminal(false).build());
        service.submit(second);

        assertThat(environments.find("t1").orElseThrow().getConfig().isUseTerminal()).isTrue();
    }

    @Test
    void staleResume_isRejectedAndThreadStaysSuspended() {
        WorkflowService service = service(approvalGraph());
        service.submit(task("t2"));

        assertThatThrownBy(() -> service.resume("t2", approve("call_other")))
                .isInstanceOf(StaleResumeException.class);

        assertThat(service.getState("t2").getStatus()).isEqualTo(ThreadStatus.SUSPENDED);
        assertThat(service.isInUse("t2")).isTrue();
        verify(traces).persistTrace(any(), isNull(), any(StaleResumeException.class));
    }

    @Test
    void cancel_suspendedThread_endsItAndClosesEnvironment() {
        WorkflowService service = service(approvalGraph());
        service.submit(task("t3"));

        assertThat(service.cancel("t3")).isEqualTo(ThreadStatus.CANCELLED);

        assertThat(service.getState("t3").getStatus()).isEqualTo(ThreadStatus.CANCELLED);
        assertThat(service.getState("t3").getState().getError()).isEqualTo(StepDriver.CANCELLED_ERROR);
        assertThat(environments.find("t3")).isEmpty();
        verify(threadRecords).recordStatus("t3", ThreadStatus.CANCELLED, StepDriver.CANCELLED_ERROR);
        assertThatThrownBy(() -> service.resume("t3", approve(null))).isInstanceOf(StaleResumeException.class);
    }

    @Test
    void cancel_finishedThread_reportsCurrentStatus() {
        WorkflowService service = service(approvalGraph());
        service.submit(task("t4"));
        service.resume("t4", approve(null));

        assertThat(service.cancel("t4")).isEqualTo(ThreadStatus.TERMINATED);
    }

    @Test
    void cancel_unknownThread_throwsNotFound() {
        assertThatThrownBy(() -> service(approvalGraph()).cancel("missing"))
                .isInstanceOf(ThreadNotFoundException.class);
    }

    @Test
    void cancel_runningThread_stopsBeforeNextNode() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Node blocking = (state, context) -> {
            context.environment();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return NodeOutcome.update(StateUpdate.of());
        };
        GraphDefinition graph = GraphBuilder.create()
                .node(PLANNING, blocking)
                .node(THINKING, visiting("thinking"))
                .entry(PLANNING)
                .edge(PLANNING, THINKING)
                .edge(THINKING, END)
                .build();
        WorkflowService service = service(graph);

        Future<RunResponse> run = pool.submit(() -> service.submit(task("t5")));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.cancel("t5")).isEqualTo(ThreadStatus.RUNNING);
        release.countDown();

        RunResponse response = run.get(5, TimeUnit.SECONDS);
        assertThat(response.getStatus()).isEqualTo(ThreadStatus.CANCELLED);
        assertThat(visited).doesNotContain("thinking");
        assertThat(environments.find("t5")).isEmpty();
    }

    @Test
    void cleanup_forgetsThread() {
        WorkflowService service = service(approvalGraph());
        service.submit(task("t6"));

        service.cleanup("t6");

        assertThatThrownBy(() -> service.getState("t6")).isInstanceOf(ThreadNotFoundException.class);
        assertThat(environments.find("t6")).isEmpty();
        assertThat(service.isInUse("t6")).isFalse();
        verify(threadRecords).delete("t6");
    }

    @Test
    void evictIdleEnvironments_keepsSuspendedThreads() throws InterruptedException {
        properties.getEnvironment().setIdleTtlMinutes(0);
        WorkflowService service = service(approvalGraph());
        service.submit(task("suspended"));
        service.submit(task("finished"));
        service.resume("finished", approve(null));
        Thread.sleep(20);

        service.evictIdleEnvironments();

        assertThat(environments.find("suspended")).isPresent();
        assertThat(environments.find("finished")).isEmpty();
    }

    @Test
    void submitMetadata_isCheckpointedWhileSuspendedAndAfterResume() {
        WorkflowService service = service(approvalGraph());
        TaskRequest request = task("meta");
        request.setMetadata(Map.of(
                "source", "cli",
                "tags", List.of("demo"),
                "handles", Map.of("terminal", new RecordingTerminalSession(), "user", "sam")));

        service.submit(request);

        Checkpoint suspended = store.load("meta").orElseThrow().checkpoint();
        assertThat(suspended.getStatus()).isEqualTo(ThreadStatus.SUSPENDED);
        assertThat(suspended.getMetadata())
                .containsEntry("source", "cli")
                .containsEntry("tags", List.of("demo"))
                .containsEntry("handles", Map.of("user", "sam"));

        service.resume("meta", approve("call_1"));

        Checkpoint finished = store.load("meta").orElseThrow().checkpoint();
        assertThat(finished.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(finished.getStep()).isGreaterThan(suspended.getStep());
        assertThat(finished.getMetadata()).isEqualTo(suspended.getMetadata());
    }
}
