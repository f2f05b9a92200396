package com.actionengine.agent.checkpoint;

import com.actionengine.agent.environment.EnvironmentManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store, selected with {@code engine.checkpoint.store=memory}.
 * Holds normalized copies so later changes to a saved object are not seen.
 */
@Component
@ConditionalOnProperty(name = "engine.checkpoint.store", havingValue = "memory")
public class InMemoryCheckpointStore extends AbstractCheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    public InMemoryCheckpointStore(EnvironmentManager environmentManager) {
        super(environmentManager);
    }

    @Override
    protected Optional<Checkpoint> read(String threadId) {
        return Optional.ofNullable(checkpoints.get(threadId)).map(Checkpoint::normalized);
    }

    @Override
    protected void write(String threadId, Checkpoint checkpoint) {
        checkpoints.put(threadId, checkpoint.normalized());
    }

    @Override
    protected void remove(String threadId) {
        checkpoints.remove(threadId);
    }
}
