package com.stitchwork.core.agent;

/**
 * Decides whether a node is worth running for the current intent.
 */
@FunctionalInterface
public interface RelevanceOracle {

    boolean isRelevant(String intent, NodeContext context) throws Exception;

    static RelevanceOracle always() {
        return (intent, context) -> true;
    }
}
