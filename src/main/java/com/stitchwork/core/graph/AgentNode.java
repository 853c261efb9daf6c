package com.stitchwork.core.graph;

import com.stitchwork.core.model.NodeDescriptor;

import java.util.List;
import java.util.Set;

/**
 * One schedulable node in the graph arena. Pure topology: neighbours are referenced by id,
 * never by object, so the arena can be serialized as-is.
 *
 * @param id         node id (same as the descriptor's)
 * @param descriptor the work unit this node represents
 * @param upstream   ids that must reach a terminal state first, in declaration order
 * @param downstream ids that depend on this node
 * @param children   ids of nodes whose span this node encloses
 */
public record AgentNode(
    String id,
    NodeDescriptor descriptor,
    List<String> upstream,
    Set<String> downstream,
    List<String> children
) {

    public AgentNode {
        upstream = List.copyOf(upstream);
        downstream = Set.copyOf(downstream);
        children = List.copyOf(children);
    }

    public int priority() {
        return descriptor.priority();
    }

    public String name() {
        return descriptor.nodeType() + ":" + descriptor.name();
    }

    @Override
    public String toString() {
        return "AgentNode(" + name() + ", upstream=" + upstream.size() + ", downstream=" + downstream.size() + ")";
    }
}
