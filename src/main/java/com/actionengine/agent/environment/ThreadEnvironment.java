package com.actionengine.agent.environment;

import com.actionengine.agent.llm.LlmClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Live, non-serializable resources of one thread: the model client, the
 * browser and terminal sessions, and the planning store. Only reachable
 * through {@link EnvironmentManager}; never stored in a checkpoint.
 */
@Slf4j
public class ThreadEnvironment {

    @Getter
    private final String threadId;
    @Getter
    private final EnvironmentConfig config;
    @Getter
    private final LlmClient modelClient;
    @Getter
    private final PlanningStore planningStore;
    private final BrowserSession browserSession;
    private final TerminalSession terminalSession;
    @Getter
    private final Instant createdAt = Instant.now();
    private volatile Instant lastUsedAt = createdAt;
    private volatile boolean closed;

    public ThreadEnvironment(String threadId, EnvironmentConfig config, LlmClient modelClient,
                             BrowserSession browserSession, TerminalSession terminalSession,
                             PlanningStore planningStore) {
        this.threadId = threadId;
        this.config = config;
        this.modelClient = modelClient;
        this.browserSession = browserSession;
        this.terminalSession = terminalSession;
        this.planningStore = planningStore;
    }

    /** Empty when the browser is disabled for this thread */
    public Optional<BrowserSession> browserSession() {
        return Optional.ofNullable(browserSession);
    }

    /** Empty when the terminal is disabled for this thread */
    public Optional<TerminalSession> terminalSession() {
        return Optional.ofNullable(terminalSession);
    }

    public void touch() {
        lastUsedAt = Instant.now();
    }

    public Duration idleFor(Instant now) {
        return Duration.between(lastUsedAt, now);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes every handle, continuing past failures. Safe to call twice.
     *
     * @return the failures raised while closing, empty when all went well
     */
    public synchronized List<Exception> close() {
        List<Exception> failures = new ArrayList<>();
        if (closed) return failures;
        closed = true;
        closeQuietly(browserSession, failures);
        closeQuietly(terminalSession, failures);
        closeQuietly(planningStore, failures);
        return failures;
    }

    private static void closeQuietly(LiveResource resource, List<Exception> failures) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            failures.add(e);
        }
    }
}
