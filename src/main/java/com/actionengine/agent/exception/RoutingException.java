package com.actionengine.agent.exception;

/**
 * No outgoing edge matched the merged state of a node. Fatal to the thread,
 * never to the process.
 */
public class RoutingException extends AgentException {

    public RoutingException(String message) {
        super(message);
    }
}
