package com.actionengine.agent.exception;

public class ResourceInitializationException extends AgentException {

    public ResourceInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
