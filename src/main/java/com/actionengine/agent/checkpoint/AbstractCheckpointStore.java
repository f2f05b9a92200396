package com.actionengine.agent.checkpoint;

import com.actionengine.agent.environment.EnvironmentManager;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared save/load rules: sanitize and normalize on the way in, normalize
 * and attach the live environment on the way out, and keep the writes of a
 * thread ordered by step.
 */
@Slf4j
public abstract class AbstractCheckpointStore implements CheckpointStore {

    private final EnvironmentManager environmentManager;
    private final Map<String, Object> writeLocks = new ConcurrentHashMap<>();

    protected AbstractCheckpointStore(EnvironmentManager environmentManager) {
        this.environmentManager = environmentManager;
    }

    @Override
    public final boolean save(String threadId, Checkpoint checkpoint) {
        Checkpoint prepared = checkpoint.normalized();
        prepared.setThreadId(threadId);
        prepared.setMetadata(CheckpointSanitizer.stripLiveResources(prepared.getMetadata()));

        synchronized (writeLocks.computeIfAbsent(threadId, id -> new Object())) {
            Optional<Checkpoint> stored = read(threadId);
            if (stored.isPresent() && stored.get().getStep() > prepared.getStep()) {
                log.warn("Dropping out-of-order checkpoint [thread={}, step={}, stored={}]",
                        threadId, prepared.getStep(), stored.get().getStep());
                return false;
            }
            write(threadId, prepared);
        }
        log.debug("Checkpoint saved [thread={}, step={}, status={}, next={}]",
                threadId, prepared.getStep(), prepared.getStatus(), prepared.getNextNode());
        return true;
    }

    @Override
    public final Optional<LoadedCheckpoint> load(String threadId) {
        return read(threadId)
                .map(Checkpoint::normalized)
                .map(cp -> {
                    cp.setThreadId(threadId);
                    return new LoadedCheckpoint(cp, environmentManager.find(threadId));
                });
    }

    @Override
    public final void delete(String threadId) {
        synchronized (writeLocks.computeIfAbsent(threadId, id -> new Object())) {
            remove(threadId);
        }
        log.info("Checkpoint deleted [thread={}]", threadId);
    }

    protected abstract Optional<Checkpoint> read(String threadId);

    protected abstract void write(String threadId, Checkpoint checkpoint);

    protected abstract void remove(String threadId);
}
