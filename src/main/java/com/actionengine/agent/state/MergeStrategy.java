package com.actionengine.agent.state;

/**
 * Combines the current value of a state field with the value a node wrote.
 * Implementations must be associative:
 * {@code merge(merge(a, b), c) == merge(a, merge(b, c))}.
 */
@FunctionalInterface
public interface MergeStrategy<T> {

    T merge(T current, T update);
}
