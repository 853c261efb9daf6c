package com.stitchwork.core.graph;

import com.stitchwork.core.EngineException;

/**
 * Thrown when node descriptors cannot be turned into a valid dependency graph.
 */
public class GraphBuildException extends EngineException {
    public GraphBuildException(String message) {
        super(message);
    }
}
