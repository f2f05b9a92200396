package com.actionengine.agent.exception;

/**
 * Transient model failure (5xx, rate limit, network). Retried by resilience4j
 * and then by the tool-call retry policy.
 */
public class ModelUnavailableException extends AgentException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
