package com.actionengine.agent.core;

import com.actionengine.agent.checkpoint.Checkpoint;
import com.actionengine.agent.checkpoint.CheckpointStore;
import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.EnvironmentConfig;
import com.actionengine.agent.environment.EnvironmentManager;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.exception.ThreadNotFoundException;
import com.actionengine.agent.graph.CancellationFlag;
import com.actionengine.agent.graph.GraphDefinition;
import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.graph.NodeId;
import com.actionengine.agent.graph.ResumeDecision;
import com.actionengine.agent.graph.RunListener;
import com.actionengine.agent.graph.RunResult;
import com.actionengine.agent.graph.StepDriver;
import com.actionengine.agent.graph.ThreadStatus;
import com.actionengine.agent.model.ResumeRequest;
import com.actionengine.agent.model.RunEvent;
import com.actionengine.agent.model.RunResponse;
import com.actionengine.agent.model.TaskRequest;
import com.actionengine.agent.observability.AgentRunTrace;
import com.actionengine.agent.observability.RunTraceRecorder;
import com.actionengine.agent.observability.TraceService;
import com.actionengine.agent.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Caller-facing entry point of the engine.
 *
 * Flow per submission:
 *  1. Resolve the thread id (new UUID when absent)
 *  2. Take the thread's run lock, so runs of one thread never overlap
 *  3. Run the agent graph through the step driver
 *  4. Book the resulting status, tear down the environment when the run
 *     was cancelled or the thread asked not to keep its browser open
 *  5. Persist a run trace (async)
 *
 * Runs of unrelated threads share no lock. Statuses kept here only cover
 * this process; the checkpoint remains the source of truth for
 * {@link #getState}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkflowService {

    private final GraphDefinition agentGraph;
    private final StepDriver stepDriver;
    private final CheckpointStore checkpointStore;
    private final EnvironmentManager environmentManager;
    private final ThreadRecordService threadRecordService;
    private final TraceService traceService;
    private final EngineProperties engineProperties;

    private final Map<String, ReentrantLock> runLocks = new ConcurrentHashMap<>();
    private final Map<String, ThreadStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, CancellationFlag> cancellations = new ConcurrentHashMap<>();

    public RunResponse submit(TaskRequest request) {
        return submit(request, event -> { });
    }

    /**
     * Starts the task on a new or existing thread and blocks until the run
     * terminates or suspends for approval. Each event is also handed to
     * {@code eventSink} as it happens.
     */
    public RunResponse submit(TaskRequest request, Consumer<RunEvent> eventSink) {
        String threadId = request.getThreadId() != null && !request.getThreadId().isBlank()
                ? request.getThreadId()
                : UUID.randomUUID().toString();
        // A warm thread keeps the config its environment was created with
        EnvironmentConfig config = environmentManager.find(threadId)
                .map(ThreadEnvironment::getConfig)
                .orElse(request.getConfig() != null ? request.getConfig() : EnvironmentConfig.defaults());
        Map<String, Object> metadata = request.getMetadata() != null ? request.getMetadata() : Map.of();

        log.info("Task submitted [thread={}, task={}]", threadId, preview(request.getTask()));

        EventCollector events = new EventCollector(eventSink);
        RunTraceRecorder recorder = new RunTraceRecorder(threadId, request.getTask(), AgentRunTrace.Kind.START, events);
        return execute(threadId, recorder, events, cancellation -> {
            threadRecordService.recordRunStarted(threadId, request.getTask());
            return stepDriver.start(agentGraph, threadId, WorkflowState.initial(request.getTask()),
                    config, metadata, recorder, cancellation);
        });
    }

    public RunResponse resume(String threadId, ResumeRequest request) {
        return resume(threadId, request, event -> { });
    }

    /**
     * Answers the pending approval of a suspended thread and continues the run.
     *
     * @throws ThreadNotFoundException unknown thread
     * @throws com.actionengine.agent.exception.StaleResumeException thread not
     *         suspended, or the decision names another tool call
     */
    public RunResponse resume(String threadId, ResumeRequest request, Consumer<RunEvent> eventSink) {
        ResumeDecision decision = ResumeDecision.builder()
                .approved(Boolean.TRUE.equals(request.getApproved()))
                .reason(request.getReason())
                .toolCallId(request.getToolCallId())
                .build();
        log.info("Resume requested [thread={}, approved={}]", threadId, decision.isApproved());

        EventCollector events = new EventCollector(eventSink);
        RunTraceRecorder recorder = new RunTraceRecorder(threadId, null, AgentRunTrace.Kind.RESUME, events);
        return execute(threadId, recorder, events,
                cancellation -> stepDriver.resume(agentGraph, threadId, decision, recorder, cancellation));
    }

    /**
     * Requests cancellation. A running thread stops before its next node;
     * a suspended thread is cancelled at once.
     *
     * @return RUNNING when the stop was signalled to a live run, otherwise
     *         the thread's status after the call
     */
    public ThreadStatus cancel(String threadId) {
        if (signalCancellation(threadId)) {
            return ThreadStatus.RUNNING;
        }

        ReentrantLock lock = runLock(threadId);
        if (!lock.tryLock()) {
            // A run took the lock in between
            signalCancellation(threadId);
            return ThreadStatus.RUNNING;
        }
        try {
            Optional<RunResult> cancelled = stepDriver.cancelSuspended(threadId);
            if (cancelled.isEmpty()) {
                ThreadStatus current = currentStatus(threadId);
                log.info("Nothing to cancel [thread={}, status={}]", threadId, current);
                return current;
            }
            afterRun(threadId, cancelled.get());
            return ThreadStatus.CANCELLED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the thread: stops a live run, tears down its environment and
     * deletes its checkpoint and thread record. Run traces are kept.
     * Safe on unknown threads.
     */
    public void cleanup(String threadId) {
        signalCancellation(threadId);
        ReentrantLock lock = runLock(threadId);
        // Wait for a live run to reach its next node boundary
        lock.lock();
        try {
            environmentManager.cleanup(threadId);
            checkpointStore.delete(threadId);
            threadRecordService.delete(threadId);
            statuses.remove(threadId);
            log.info("Thread cleaned up [thread={}]", threadId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest checkpointed view of the thread.
     *
     * @throws ThreadNotFoundException when the thread has no checkpoint
     */
    public RunResponse getState(String threadId) {
        Checkpoint checkpoint = checkpointStore.load(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId))
                .checkpoint();
        return RunResponse.builder()
                .threadId(threadId)
                .status(checkpoint.getStatus())
                .state(checkpoint.getState())
                .interrupt(checkpoint.getInterrupt())
                .stepsExecuted((int) checkpoint.getStep())
                .build();
    }

    public List<ThreadRecord> recentThreads() {
        return threadRecordService.recentThreads();
    }

    /**
     * Tears down environments idle for longer than the configured TTL. Each
     * eviction holds the thread's run lock; threads that are running or
     * awaiting approval keep their environment.
     */
    @Scheduled(fixedDelayString = "${engine.environment.eviction-interval-ms:60000}")
    public void evictIdleEnvironments() {
        Duration ttl = Duration.ofMinutes(engineProperties.getEnvironment().getIdleTtlMinutes());
        List<String> evicted = environmentManager.evictIdle(ttl, this::runLock, this::hasActiveStatus);
        evicted.forEach(threadId -> log.debug("Idle environment evicted [thread={}]", threadId));
    }

    boolean isInUse(String threadId) {
        ReentrantLock lock = runLocks.get(threadId);
        if (lock != null && lock.isLocked()) {
            return true;
        }
        return hasActiveStatus(threadId);
    }

    private boolean hasActiveStatus(String threadId) {
        ThreadStatus status = statuses.get(threadId);
        return status != null && status.isActive();
    }

    // ─── Run plumbing ────────────────────────────────────────────────────────

    private RunResponse execute(String threadId, RunTraceRecorder recorder, EventCollector events,
                                Function<CancellationFlag, RunResult> run) {
        ReentrantLock lock = runLock(threadId);
        lock.lock();
        CancellationFlag cancellation = new CancellationFlag();
        cancellations.put(threadId, cancellation);
        ThreadStatus previous = statuses.put(threadId, ThreadStatus.RUNNING);
        try {
            RunResult result = run.apply(cancellation);
            afterRun(threadId, result);
            traceService.persistTrace(recorder, result, null);
            return RunResponse.builder()
                    .threadId(threadId)
                    .status(result.getStatus())
                    .state(result.getState())
                    .interrupt(result.getInterrupt())
                    .events(events.events())
                    .stepsExecuted(result.getStepsExecuted())
                    .build();
        } catch (RuntimeException e) {
            // The run never started: e.g. a stale resume leaves the thread as it was
            if (previous != null) {
                statuses.put(threadId, previous);
            } else {
                statuses.remove(threadId);
            }
            traceService.persistTrace(recorder, null, e);
            throw e;
        } finally {
            cancellations.remove(threadId);
            lock.unlock();
        }
    }

    private void afterRun(String threadId, RunResult result) {
        statuses.put(threadId, result.getStatus());
        threadRecordService.recordStatus(threadId, result.getStatus(),
                result.getState() != null ? result.getState().getError() : null);

        if (result.getStatus() == ThreadStatus.CANCELLED) {
            environmentManager.cleanup(threadId);
        } else if (result.getStatus() == ThreadStatus.TERMINATED) {
            boolean keepOpen = environmentManager.find(threadId)
                    .map(env -> env.getConfig().isKeepBrowserOpen())
                    .orElse(true);
            if (!keepOpen) {
                log.info("Closing environment after run [thread={}, keepBrowserOpen=false]", threadId);
                environmentManager.cleanup(threadId);
            }
        }
    }

    private boolean signalCancellation(String threadId) {
        CancellationFlag flag = cancellations.get(threadId);
        if (flag == null) {
            return false;
        }
        flag.cancel();
        log.info("Cancellation signalled [thread={}]", threadId);
        return true;
    }

    private ThreadStatus currentStatus(String threadId) {
        return checkpointStore.load(threadId)
                .map(loaded -> loaded.checkpoint().getStatus())
                .orElseGet(() -> statuses.getOrDefault(threadId, ThreadStatus.TERMINATED));
    }

    private ReentrantLock runLock(String threadId) {
        return runLocks.computeIfAbsent(threadId, id -> new ReentrantLock());
    }

    private static String preview(String text) {
        if (text == null) return "";
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }

    /**
     * Turns driver callbacks into caller-facing {@link RunEvent}s, keeping
     * them for the blocking response.
     */
    private static final class EventCollector implements RunListener {

        private final List<RunEvent> events = new ArrayList<>();
        private final Consumer<RunEvent> sink;

        EventCollector(Consumer<RunEvent> sink) {
            this.sink = sink;
        }

        @Override
        public void onStateUpdate(String threadId, NodeId node, WorkflowState state) {
            publish(RunEvent.stateUpdate(threadId, node.key(), state));
        }

        @Override
        public void onInterrupt(String threadId, InterruptPayload interrupt) {
            publish(RunEvent.interrupt(threadId, interrupt));
        }

        private void publish(RunEvent event) {
            events.add(event);
            sink.accept(event);
        }

        List<RunEvent> events() {
            return List.copyOf(events);
        }
    }
}
