package com.actionengine.agent.environment;

import com.actionengine.agent.exception.ResourceInitializationException;
import com.actionengine.agent.llm.LlmClient;
import com.actionengine.agent.llm.ModelClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Owns the {@link ThreadEnvironment} of every active thread.
 *
 * Creation is guarded by a lock object per thread id, so two concurrent
 * callers for the same thread get the same environment while unrelated
 * threads never wait on each other. Lock objects are kept for the life of
 * the manager; removing them would let a waiter and a newcomer hold
 * different locks for the same id.
 */
@Component
@Slf4j
public class EnvironmentManager {

    private final Map<String, ThreadEnvironment> environments = new ConcurrentHashMap<>();
    private final Map<String, Object> creationLocks = new ConcurrentHashMap<>();

    private final ModelClientFactory modelClientFactory;
    private final BrowserSessionFactory browserSessionFactory;
    private final TerminalSessionFactory terminalSessionFactory;

    public EnvironmentManager(ModelClientFactory modelClientFactory,
                              BrowserSessionFactory browserSessionFactory,
                              TerminalSessionFactory terminalSessionFactory) {
        this.modelClientFactory = modelClientFactory;
        this.browserSessionFactory = browserSessionFactory;
        this.terminalSessionFactory = terminalSessionFactory;
    }

    /**
     * Returns the thread's environment, creating it on first use. The
     * {@code config} is only consulted on creation.
     *
     * @throws ResourceInitializationException if a handle cannot be created;
     *         handles created before the failure are closed first
     */
    public ThreadEnvironment getOrCreate(String threadId, EnvironmentConfig config) {
        ThreadEnvironment existing = environments.get(threadId);
        if (existing != null) {
            existing.touch();
            return existing;
        }

        Object lock = creationLocks.computeIfAbsent(threadId, id -> new Object());
        synchronized (lock) {
            existing = environments.get(threadId);
            if (existing != null) {
                existing.touch();
                return existing;
            }
            ThreadEnvironment created = create(threadId, config != null ? config : EnvironmentConfig.defaults());
            environments.put(threadId, created);
            log.info("Environment created [thread={}, browser={}, terminal={}]", threadId,
                    created.browserSession().isPresent(), created.terminalSession().isPresent());
            return created;
        }
    }

    public Optional<ThreadEnvironment> find(String threadId) {
        return Optional.ofNullable(environments.get(threadId));
    }

    /**
     * Tears down the thread's environment. Close failures are logged and
     * never rethrown; unknown thread ids are a no-op.
     */
    public void cleanup(String threadId) {
        Object lock = creationLocks.computeIfAbsent(threadId, id -> new Object());
        ThreadEnvironment environment;
        synchronized (lock) {
            environment = environments.remove(threadId);
        }
        if (environment == null) {
            log.debug("No environment to clean up [thread={}]", threadId);
            return;
        }
        List<Exception> failures = environment.close();
        failures.forEach(e -> log.error("Error while closing resource [thread={}]", threadId, e));
        log.info("Environment cleaned up [thread={}, failures={}]", threadId, failures.size());
    }

    /**
     * Cleans up environments idle for longer than {@code ttl}. Each candidate
     * is evicted while holding the thread's run lock from {@code runLock}, so
     * a run never loses its handles mid-node: a thread whose lock is taken is
     * skipped until the next sweep. Idleness and {@code inUse} are checked
     * again once the lock is held.
     *
     * @return the evicted thread ids
     */
    public List<String> evictIdle(Duration ttl, Function<String, Lock> runLock, Predicate<String> inUse) {
        List<String> evicted = new ArrayList<>();
        for (ThreadEnvironment environment : List.copyOf(environments.values())) {
            String threadId = environment.getThreadId();
            if (!isIdle(environment, ttl)) {
                continue;
            }
            Lock lock = runLock.apply(threadId);
            if (!lock.tryLock()) {
                log.debug("Skipping eviction of busy thread [thread={}]", threadId);
                continue;
            }
            try {
                if (environments.get(threadId) == environment
                        && !inUse.test(threadId)
                        && isIdle(environment, ttl)) {
                    cleanup(threadId);
                    evicted.add(threadId);
                }
            } finally {
                lock.unlock();
            }
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted {} idle environment(s): {}", evicted.size(), evicted);
        }
        return evicted;
    }

    private static boolean isIdle(ThreadEnvironment environment, Duration ttl) {
        return environment.idleFor(Instant.now()).compareTo(ttl) > 0;
    }

    public Set<String> activeThreadIds() {
        return Set.copyOf(environments.keySet());
    }

    private ThreadEnvironment create(String threadId, EnvironmentConfig config) {
        List<LiveResource> created = new ArrayList<>();
        try {
            LlmClient modelClient = modelClientFactory.create(config);

            TerminalSession terminal = null;
            if (config.isUseTerminal()) {
                terminal = terminalSessionFactory.open(threadId, config);
                created.add(terminal);
            }
            BrowserSession browser = null;
            if (config.isUseBrowser()) {
                browser = browserSessionFactory.open(threadId, config);
                created.add(browser);
            }
            PlanningStore planningStore = new PlanningStore();
            return new ThreadEnvironment(threadId, config, modelClient, browser, terminal, planningStore);
        } catch (RuntimeException e) {
            for (LiveResource resource : created) {
                try {
                    resource.close();
                } catch (RuntimeException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            log.error("Environment creation failed [thread={}]", threadId, e);
            throw new ResourceInitializationException("Failed to initialize environment for thread " + threadId, e);
        }
    }
}
