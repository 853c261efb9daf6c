package com.stitchwork.core.model;

/**
 * Overall outcome of a graph run.
 */
public enum RunStatus {
    SUCCEEDED,
    PARTIAL,
    FAILED,
    CANCELLED
}
