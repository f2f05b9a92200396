package com.actionengine.agent.graph;

import com.actionengine.agent.checkpoint.Checkpoint;
import com.actionengine.agent.checkpoint.CheckpointStore;
import com.actionengine.agent.checkpoint.LoadedCheckpoint;
import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.EnvironmentConfig;
import com.actionengine.agent.environment.EnvironmentManager;
import com.actionengine.agent.exception.RoutingException;
import com.actionengine.agent.exception.StaleResumeException;
import com.actionengine.agent.exception.ThreadNotFoundException;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.PendingApproval;
import com.actionengine.agent.state.StateField;
import com.actionengine.agent.state.StateMerger;
import com.actionengine.agent.state.StateUpdate;
import com.actionengine.agent.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a {@link GraphDefinition} for one thread.
 *
 * Nodes run one at a time. After each node the outcome is merged into the
 * state, the next node is chosen from the merged state, and a checkpoint is
 * written. A suspending node ends the run with an interrupt; a later
 * {@link #resume} re-invokes that node with the human decision.
 *
 * Failures never escape to the caller: node exceptions, failed outcomes,
 * routing errors and the step limit all end up in {@code state.error}, and
 * the run continues at the error node when one is configured.
 */
@Component
@Slf4j
public class StepDriver {

    public static final String CANCELLED_ERROR = "cancelled";
    public static final String APPROVED_REASON = "approved by user";
    public static final String REJECTED_REASON = "not approved by user";

    private final CheckpointStore checkpointStore;
    private final EnvironmentManager environmentManager;
    private final int maxSteps;

    @Autowired
    public StepDriver(CheckpointStore checkpointStore, EnvironmentManager environmentManager,
                      EngineProperties engineProperties) {
        this(checkpointStore, environmentManager, engineProperties.getMaxSteps());
    }

    public StepDriver(CheckpointStore checkpointStore, EnvironmentManager environmentManager, int maxSteps) {
        this.checkpointStore = checkpointStore;
        this.environmentManager = environmentManager;
        this.maxSteps = maxSteps;
    }

    /**
     * Runs from the start, or resumes when {@code resumeDecision} is given.
     */
    public RunResult run(GraphDefinition graph, String threadId, WorkflowState initialState,
                         ResumeDecision resumeDecision) {
        if (resumeDecision != null) {
            return resume(graph, threadId, resumeDecision, RunListener.NOOP, new CancellationFlag());
        }
        return start(graph, threadId, initialState, EnvironmentConfig.defaults(),
                RunListener.NOOP, new CancellationFlag());
    }

    public RunResult start(GraphDefinition graph, String threadId, WorkflowState initialState,
                           EnvironmentConfig config, RunListener listener, CancellationFlag cancellation) {
        return start(graph, threadId, initialState, config, Map.of(), listener, cancellation);
    }

    /**
     * Starts a run at the graph entry. {@code metadata} is copied into every
     * checkpoint the run writes.
     */
    public RunResult start(GraphDefinition graph, String threadId, WorkflowState initialState,
                           EnvironmentConfig config, Map<String, Object> metadata,
                           RunListener listener, CancellationFlag cancellation) {
        // Continue the thread's step sequence so older checkpoints never win
        long baseStep = checkpointStore.load(threadId)
                .map(loaded -> loaded.checkpoint().getStep())
                .orElse(0L);
        log.info("Run started [thread={}, entry={}]", threadId, graph.entry());

        RunCursor cursor = new RunCursor(threadId, config != null ? config : EnvironmentConfig.defaults(),
                metadata, listener, cancellation, baseStep, new LinkedHashMap<>());
        WorkflowState state = initialState != null ? initialState.copy() : new WorkflowState();
        return loop(graph, cursor, state, graph.entry(), null);
    }

    /**
     * Applies a human decision to a suspended thread and continues the run.
     *
     * @throws ThreadNotFoundException when the thread has no checkpoint
     * @throws StaleResumeException    when the thread is not suspended or the
     *                                 decision names another tool call; the
     *                                 thread stays as it was
     */
    public RunResult resume(GraphDefinition graph, String threadId, ResumeDecision decision,
                            RunListener listener, CancellationFlag cancellation) {
        LoadedCheckpoint loaded = checkpointStore.load(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));
        Checkpoint checkpoint = loaded.checkpoint();

        if (checkpoint.getStatus() != ThreadStatus.SUSPENDED || checkpoint.getInterrupt() == null
                || checkpoint.getNextNode() == null) {
            throw new StaleResumeException("Thread " + threadId + " is not awaiting approval (status "
                    + checkpoint.getStatus() + ")");
        }
        ToolCall pending = checkpoint.getInterrupt().getToolCall();
        if (decision.getToolCallId() != null
                && (pending == null || !decision.getToolCallId().equals(pending.getId()))) {
            throw new StaleResumeException("Decision for tool call " + decision.getToolCallId()
                    + " does not match pending call " + (pending != null ? pending.getId() : null));
        }

        log.info("Resuming [thread={}, node={}, approved={}]",
                threadId, checkpoint.getNextNode(), decision.isApproved());

        String reason = decision.getReason() != null && !decision.getReason().isBlank()
                ? decision.getReason()
                : (decision.isApproved() ? APPROVED_REASON : REJECTED_REASON);
        StateUpdate approval = StateUpdate.of().pendingApproval(
                new PendingApproval(pending, decision.isApproved(), reason));
        RunCursor cursor = new RunCursor(threadId, checkpoint.getEnvironmentConfig(), checkpoint.getMetadata(),
                listener, cancellation, checkpoint.getStep(), checkpoint.getChannelVersions());
        WorkflowState state = cursor.merge(checkpoint.getState(), approval);
        return loop(graph, cursor, state, checkpoint.getNextNode(), decision);
    }

    /**
     * Ends a suspended thread as CANCELLED without running any node.
     *
     * @return the final result, or empty when the thread is not suspended
     * @throws ThreadNotFoundException when the thread has no checkpoint
     */
    public Optional<RunResult> cancelSuspended(String threadId) {
        Checkpoint checkpoint = checkpointStore.load(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId))
                .checkpoint();
        if (checkpoint.getStatus() != ThreadStatus.SUSPENDED) {
            return Optional.empty();
        }
        log.info("Cancelling suspended thread [thread={}, node={}]", threadId, checkpoint.getNextNode());
        RunCursor cursor = new RunCursor(threadId, checkpoint.getEnvironmentConfig(), checkpoint.getMetadata(),
                RunListener.NOOP, new CancellationFlag(), checkpoint.getStep() + 1, checkpoint.getChannelVersions());
        WorkflowState cancelled = cursor.merge(checkpoint.getState(), StateUpdate.of().error(CANCELLED_ERROR));
        return Optional.of(finish(cursor, cancelled, ThreadStatus.CANCELLED, 0));
    }

    private RunResult loop(GraphDefinition graph, RunCursor cursor, WorkflowState state,
                           NodeId current, ResumeDecision decision) {
        String threadId = cursor.threadId;
        int runSteps = 0;

        while (true) {
            if (current == NodeId.END) {
                return finish(cursor, state, ThreadStatus.TERMINATED, runSteps);
            }
            if (cursor.cancellation.isCancelled()) {
                log.info("Run cancelled [thread={}, before={}]", threadId, current);
                WorkflowState cancelled = cursor.merge(state, StateUpdate.of().error(CANCELLED_ERROR));
                return finish(cursor, cancelled, ThreadStatus.CANCELLED, runSteps);
            }
            if (runSteps >= maxSteps) {
                log.warn("Step limit reached [thread={}, limit={}]", threadId, maxSteps);
                WorkflowState limited = cursor.merge(state,
                        StateUpdate.of().error("Step limit of " + maxSteps + " exceeded"));
                return finish(cursor, limited, ThreadStatus.TERMINATED, runSteps);
            }

            NodeOutcome outcome = invoke(graph, cursor, state, current, decision);
            decision = null;
            runSteps++;
            cursor.step++;
            log.info("Node finished [thread={}, node={}, outcome={}]", threadId, current, outcome.getKind());

            NodeId next;
            switch (outcome.getKind()) {
                case SUSPEND -> {
                    state = cursor.merge(state, outcome.getUpdate());
                    save(cursor, state, current, current, ThreadStatus.SUSPENDED, outcome.getInterrupt(),
                            List.of(StateField.PENDING_APPROVAL.key()));
                    cursor.notifyUpdate(current, state);
                    cursor.notifyInterrupt(outcome.getInterrupt());
                    log.info("Run suspended [thread={}, node={}]: {}",
                            threadId, current, outcome.getInterrupt().getMessage());
                    RunResult result = RunResult.builder()
                            .threadId(threadId)
                            .state(state)
                            .status(ThreadStatus.SUSPENDED)
                            .interrupt(outcome.getInterrupt())
                            .stepsExecuted(runSteps)
                            .build();
                    cursor.notifyFinished(result);
                    return result;
                }
                case FAIL -> {
                    state = cursor.merge(state, StateUpdate.of().error(outcome.getError()));
                    cursor.notifyUpdate(current, state);
                    next = failureTarget(graph, current);
                }
                default -> {
                    state = cursor.merge(state, outcome.getUpdate());
                    cursor.notifyUpdate(current, state);
                    try {
                        next = graph.next(current, state);
                    } catch (RoutingException e) {
                        log.error("Routing failed [thread={}, from={}]: {}", threadId, current, e.getMessage());
                        state = cursor.merge(state, StateUpdate.of().error(e.getMessage()));
                        next = failureTarget(graph, current);
                    }
                }
            }

            save(cursor, state, current, next, ThreadStatus.RUNNING, null, List.of());
            current = next;
        }
    }

    private NodeOutcome invoke(GraphDefinition graph, RunCursor cursor, WorkflowState state,
                               NodeId current, ResumeDecision decision) {
        NodeContext context = new NodeContext(cursor.threadId,
                () -> environmentManager.getOrCreate(cursor.threadId, cursor.config), decision);
        try {
            NodeOutcome outcome = graph.node(current).invoke(state, context);
            return outcome != null ? outcome : NodeOutcome.fail("Node " + current + " returned no outcome");
        } catch (RuntimeException e) {
            log.error("Node failed [thread={}, node={}]", cursor.threadId, current, e);
            return NodeOutcome.fail(current + " failed: " + e.getMessage());
        }
    }

    private NodeId failureTarget(GraphDefinition graph, NodeId failed) {
        Optional<NodeId> errorNode = graph.errorNode();
        if (errorNode.isPresent() && errorNode.get() != failed) {
            return errorNode.get();
        }
        return NodeId.END;
    }

    private RunResult finish(RunCursor cursor, WorkflowState state, ThreadStatus status, int runSteps) {
        WorkflowState last = cursor.merge(state, StateUpdate.of().exiting(true));
        save(cursor, last, NodeId.END, NodeId.END, status, null, List.of());
        log.info("Run finished [thread={}, status={}, steps={}, error={}]",
                cursor.threadId, status, runSteps, last.getError());

        RunResult result = RunResult.builder()
                .threadId(cursor.threadId)
                .state(last)
                .status(status)
                .stepsExecuted(runSteps)
                .build();
        cursor.notifyFinished(result);
        return result;
    }

    private void save(RunCursor cursor, WorkflowState state, NodeId lastNode, NodeId nextNode,
                      ThreadStatus status, InterruptPayload interrupt, List<String> pendingWrites) {
        checkpointStore.save(cursor.threadId, Checkpoint.builder()
                .threadId(cursor.threadId)
                .step(cursor.step)
                .lastNode(lastNode)
                .nextNode(nextNode)
                .status(status)
                .state(state)
                .interrupt(interrupt)
                .environmentConfig(cursor.config)
                .pendingWrites(pendingWrites)
                .channelVersions(new LinkedHashMap<>(cursor.channelVersions))
                .metadata(new LinkedHashMap<>(cursor.metadata))
                .createdAt(Instant.now())
                .build());
    }

    /**
     * Mutable bookkeeping of one run.
     */
    private static final class RunCursor {

        private final String threadId;
        private final EnvironmentConfig config;
        private final Map<String, Object> metadata;
        private final RunListener listener;
        private final CancellationFlag cancellation;
        private final Map<String, Long> channelVersions;
        private long step;

        RunCursor(String threadId, EnvironmentConfig config, Map<String, Object> metadata, RunListener listener,
                  CancellationFlag cancellation, long step, Map<String, Long> channelVersions) {
            this.threadId = threadId;
            this.config = config;
            this.metadata = metadata != null ? metadata : Map.of();
            this.listener = listener != null ? listener : RunListener.NOOP;
            this.cancellation = cancellation != null ? cancellation : new CancellationFlag();
            this.step = step;
            this.channelVersions = new LinkedHashMap<>(channelVersions != null ? channelVersions : Map.of());
        }

        WorkflowState merge(WorkflowState state, StateUpdate update) {
            update.fields().forEach(field -> channelVersions.merge(field.key(), 1L, Long::sum));
            return StateMerger.merge(state, update);
        }

        void notifyUpdate(NodeId node, WorkflowState state) {
            try {
                listener.onStateUpdate(threadId, node, state);
            } catch (RuntimeException e) {
                log.warn("Run listener failed on state update [thread={}]", threadId, e);
            }
        }

        void notifyInterrupt(InterruptPayload interrupt) {
            try {
                listener.onInterrupt(threadId, interrupt);
            } catch (RuntimeException e) {
                log.warn("Run listener failed on interrupt [thread={}]", threadId, e);
            }
        }

        void notifyFinished(RunResult result) {
            try {
                listener.onFinished(threadId, result);
            } catch (RuntimeException e) {
                log.warn("Run listener failed on finish [thread={}]", threadId, e);
            }
        }
    }
}
