package com.actionengine.agent.exception;

/**
 * Base unchecked exception for the action engine.
 *
 * Subclasses describe where in the workflow the failure happened so the
 * step driver and the REST layer can decide whether to fold it into state,
 * retry it, or reject the request.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
