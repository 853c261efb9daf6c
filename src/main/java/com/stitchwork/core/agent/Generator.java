package com.stitchwork.core.agent;

/**
 * Produces replacement text or artifact content for a node.
 */
@FunctionalInterface
public interface Generator {

    String generate(String intent, NodeContext context) throws Exception;
}
