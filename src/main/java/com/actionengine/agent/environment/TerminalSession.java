package com.actionengine.agent.environment;

/**
 * Terminal handle exclusively owned by one thread.
 */
public interface TerminalSession extends LiveResource {

    TerminalOutput execute(String script, int timeoutSeconds);
}
