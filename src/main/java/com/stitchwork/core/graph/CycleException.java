package com.stitchwork.core.graph;

import java.util.List;

/**
 * Thrown when the declared dependencies contain a cycle.
 */
public class CycleException extends GraphBuildException {

    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * The node ids on the cycle, first id repeated at the end.
     */
    public List<String> cycle() {
        return cycle;
    }
}
