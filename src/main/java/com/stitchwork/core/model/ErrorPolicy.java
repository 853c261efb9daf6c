package com.stitchwork.core.model;

/**
 * What the executor does with the rest of the graph when a node fails.
 */
public enum ErrorPolicy {
    /** Halt the run: running nodes finish, nothing new starts. */
    STOP_GRAPH,
    /** Skip the failed node's transitive downstream; unrelated branches proceed. */
    SKIP_DOWNSTREAM,
    /** Record the failure and let downstream nodes proceed without its output. */
    CONTINUE
}
