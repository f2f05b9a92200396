package com.actionengine.agent.graph;

public enum ThreadStatus {
    RUNNING,
    SUSPENDED,
    TERMINATED,
    CANCELLED;

    /** True while the thread still owns a live run or an outstanding approval */
    public boolean isActive() {
        return this == RUNNING || this == SUSPENDED;
    }
}
