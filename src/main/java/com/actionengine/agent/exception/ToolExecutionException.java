package com.actionengine.agent.exception;

/**
 * Raised inside a tool implementation. The tool collection always captures it
 * into {@code ToolResult.error}; it never reaches the step driver.
 */
public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
