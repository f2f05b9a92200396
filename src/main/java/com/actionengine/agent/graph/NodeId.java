package com.actionengine.agent.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of workflow nodes. {@link #END} is the terminal marker and has
 * no implementation.
 */
public enum NodeId {

    PLANNING("planning"),
    TOOL_GENERATOR("tool_generator"),
    HUMAN_APPROVAL("human_approval"),
    EXECUTOR("executor"),
    THINKING("thinking"),
    END("__end__");

    private final String key;

    NodeId(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static NodeId fromKey(String key) {
        return Arrays.stream(values())
                .filter(id -> id.key.equals(key) || id.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + key));
    }

    @Override
    public String toString() {
        return key;
    }
}
