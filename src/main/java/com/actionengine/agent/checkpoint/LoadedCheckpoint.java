package com.actionengine.agent.checkpoint;

import com.actionengine.agent.environment.ThreadEnvironment;

import java.util.Optional;

/**
 * A checkpoint read back from the store, with the thread's live environment
 * attached when one is still running in this process.
 */
public record LoadedCheckpoint(Checkpoint checkpoint, Optional<ThreadEnvironment> environment) {
}
