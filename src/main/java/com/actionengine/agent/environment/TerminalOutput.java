package com.actionengine.agent.environment;

public record TerminalOutput(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
