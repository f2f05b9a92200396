package com.actionengine.agent.tool;

import com.actionengine.agent.environment.ThreadEnvironment;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows how to invoke the tool.
 *
 * Tools operate on the live handles of the calling thread's
 * {@link ThreadEnvironment} and report problems through
 * {@link ToolResult#failure(String)}; an exception that escapes is still
 * captured by {@link ToolCollection}.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Description sent to the model. This is the primary signal it uses to
     * decide when to call this tool.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters */
    Map<String, Object> getInputSchema();

    ToolResult execute(Map<String, Object> arguments, ThreadEnvironment environment);
}
