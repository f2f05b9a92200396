package com.actionengine.agent.environment;

@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession open(String threadId, EnvironmentConfig config);
}
