package com.actionengine.agent.exception;

/**
 * Invalid graph definition or engine configuration. Fatal at startup.
 */
public class ConfigurationException extends AgentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
