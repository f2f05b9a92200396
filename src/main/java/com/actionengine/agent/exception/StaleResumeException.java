package com.actionengine.agent.exception;

/**
 * A resume decision that does not match the thread's pending interrupt.
 * Rejected at the resume boundary; the thread stays suspended.
 */
public class StaleResumeException extends AgentException {

    public StaleResumeException(String message) {
        super(message);
    }
}
