package com.stitchwork.core.model;

/**
 * Lifecycle status of an agent node within a single run.
 */
public enum NodeStatus {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
