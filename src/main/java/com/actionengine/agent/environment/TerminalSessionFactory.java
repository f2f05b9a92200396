package com.actionengine.agent.environment;

@FunctionalInterface
public interface TerminalSessionFactory {

    TerminalSession open(String threadId, EnvironmentConfig config);
}
