package com.actionengine.agent.graph;

import com.actionengine.agent.environment.ThreadEnvironment;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-invocation context handed to a node: the thread id, its live
 * environment (resolved on first access) and, when the node is being
 * resumed, the human decision.
 */
public class NodeContext {

    private final String threadId;
    private final Supplier<ThreadEnvironment> environmentSupplier;
    private final ResumeDecision resumeDecision;
    private ThreadEnvironment environment;

    public NodeContext(String threadId, Supplier<ThreadEnvironment> environmentSupplier, ResumeDecision resumeDecision) {
        this.threadId = threadId;
        this.environmentSupplier = environmentSupplier;
        this.resumeDecision = resumeDecision;
    }

    public String threadId() {
        return threadId;
    }

    public ThreadEnvironment environment() {
        if (environment == null) {
            environment = environmentSupplier.get();
        }
        return environment;
    }

    public Optional<ResumeDecision> resumeDecision() {
        return Optional.ofNullable(resumeDecision);
    }

    public boolean isResume() {
        return resumeDecision != null;
    }
}
