package com.stitchwork.core.agent;

import com.stitchwork.core.model.NodeOutput;

/**
 * Executes the work for one graph node.
 *
 * <p>Implementations run on executor worker threads and may be interrupted on timeout or
 * cancellation. Any exception is treated as a node-level failure and may be retried.
 */
@FunctionalInterface
public interface NodeAgent {

    NodeOutput execute(NodeContext context) throws Exception;
}
