package com.actionengine.agent.exception;

/**
 * The model refused the request on content-policy grounds. Not retryable.
 */
public class ContentPolicyException extends AgentException {

    public ContentPolicyException(String message) {
        super(message);
    }
}
