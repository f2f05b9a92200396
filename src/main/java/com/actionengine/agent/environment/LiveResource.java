package com.actionengine.agent.environment;

/**
 * Marker for handles that are bound to a running process or connection and
 * can never be serialized: browser sessions, terminal sessions, in-memory
 * per-thread stores. The checkpoint store strips any value of this type.
 */
public interface LiveResource extends AutoCloseable {

    @Override
    void close();
}
