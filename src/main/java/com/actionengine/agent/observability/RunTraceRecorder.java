package com.actionengine.agent.observability;

import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.graph.NodeId;
import com.actionengine.agent.graph.RunListener;
import com.actionengine.agent.graph.RunResult;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.state.WorkflowState;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects observability data for one run while forwarding every event to
 * the caller's listener. Flushed to an {@link AgentRunTrace} when the run
 * ends.
 *
 * Kept out of the workflow state so tracing never reaches a checkpoint.
 */
@Getter
public class RunTraceRecorder implements RunListener {

    private final String threadId;
    private final String task;
    private final AgentRunTrace.Kind kind;
    private final RunListener delegate;

    private final long startTimeMs = System.currentTimeMillis();
    private final List<NodeVisit> nodeVisits = new ArrayList<>();
    private final List<String> toolsExecuted = new ArrayList<>();
    private long lastEventMs = startTimeMs;
    private int toolsSeen = -1;
    private String interruptMessage;

    public RunTraceRecorder(String threadId, String task, AgentRunTrace.Kind kind, RunListener delegate) {
        this.threadId = threadId;
        this.task = task;
        this.kind = kind;
        this.delegate = delegate != null ? delegate : RunListener.NOOP;
    }

    @Override
    public void onStateUpdate(String threadId, NodeId node, WorkflowState state) {
        long now = System.currentTimeMillis();
        nodeVisits.add(new NodeVisit(node.key(), now - lastEventMs));
        lastEventMs = now;
        List<ToolCall> used = state.getToolsUsed() != null ? state.getToolsUsed() : List.of();
        if (toolsSeen >= 0 && used.size() > toolsSeen) {
            used.subList(toolsSeen, used.size()).forEach(call -> toolsExecuted.add(call.getToolName()));
        }
        toolsSeen = used.size();
        delegate.onStateUpdate(threadId, node, state);
    }

    @Override
    public void onInterrupt(String threadId, InterruptPayload interrupt) {
        interruptMessage = interrupt.getMessage();
        delegate.onInterrupt(threadId, interrupt);
    }

    @Override
    public void onFinished(String threadId, RunResult result) {
        delegate.onFinished(threadId, result);
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public record NodeVisit(String node, long latencyMs) {}
}
