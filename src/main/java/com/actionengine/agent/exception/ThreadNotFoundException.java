package com.actionengine.agent.exception;

public class ThreadNotFoundException extends AgentException {

    public ThreadNotFoundException(String threadId) {
        super("No checkpoint found for thread " + threadId);
    }
}
