package com.actionengine.agent.graph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal, checked by the driver between nodes.
 */
public class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
