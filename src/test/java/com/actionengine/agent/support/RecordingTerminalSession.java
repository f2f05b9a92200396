package com.actionengine.agent.support;

import com.actionengine.agent.environment.TerminalOutput;
import com.actionengine.agent.environment.TerminalSession;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Terminal that records scripts instead of running them and answers with
 * exit code 0.
 */
public class RecordingTerminalSession implements TerminalSession {

    private final List<String> scripts = new CopyOnWriteArrayList<>();
    private volatile boolean closed;
    private RuntimeException closeFailure;

    @Override
    public TerminalOutput execute(String script, int timeoutSeconds) {
        scripts.add(script);
        return new TerminalOutput(0, "ok: " + script, false);
    }

    public RecordingTerminalSession failOnClose(RuntimeException failure) {
        this.closeFailure = failure;
        return this;
    }

    @Override
    public void close() {
        closed = true;
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    public List<String> scripts() {
        return scripts;
    }

    public boolean isClosed() {
        return closed;
    }
}
