package com.stitchwork.core.executor;

import com.stitchwork.core.EngineException;

import java.time.Duration;

/**
 * A node exceeded its execution deadline and was cancelled.
 */
public class NodeTimeoutException extends EngineException {

    private final String nodeId;

    public NodeTimeoutException(String nodeId, Duration timeout) {
        super("Node " + nodeId + " timed out after " + timeout.toMillis() + " ms");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
