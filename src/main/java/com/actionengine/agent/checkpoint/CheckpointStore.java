package com.actionengine.agent.checkpoint;

import java.util.Optional;

public interface CheckpointStore {

    /**
     * Persists the checkpoint after stripping live handles from its metadata.
     *
     * @return false when the write was dropped because a newer step is stored
     */
    boolean save(String threadId, Checkpoint checkpoint);

    Optional<LoadedCheckpoint> load(String threadId);

    void delete(String threadId);
}
