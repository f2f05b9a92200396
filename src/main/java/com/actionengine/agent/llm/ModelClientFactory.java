package com.actionengine.agent.llm;

import com.actionengine.agent.environment.EnvironmentConfig;

/**
 * Builds the model client of one thread from its environment settings.
 */
@FunctionalInterface
public interface ModelClientFactory {

    LlmClient create(EnvironmentConfig config);
}
