package com.stitchwork.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Immutable, validated dependency topology: an arena of {@link AgentNode}s indexed by id.
 * <p>
 * Instances are produced by {@link NodeGraphBuilder#build}. All query methods are pure
 * and safe to call concurrently.
 */
public final class NodeGraph {

    private final Map<String, AgentNode> nodes;
    private final List<String> topologicalOrder;
    private final Map<String, Integer> topoIndex;

    NodeGraph(Map<String, AgentNode> nodes, List<String> topologicalOrder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.topologicalOrder = List.copyOf(topologicalOrder);
        var index = new HashMap<String, Integer>();
        for (int i = 0; i < this.topologicalOrder.size(); i++) {
            index.put(this.topologicalOrder.get(i), i);
        }
        this.topoIndex = index;
    }

    public AgentNode node(String id) {
        AgentNode node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("Unknown node: " + id);
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public Collection<AgentNode> nodes() {
        return nodes.values();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Node ids ordered so every node comes after all of its upstream nodes.
     */
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public List<String> children(String id) {
        return node(id).children();
    }

    /**
     * Nodes with no upstream dependencies.
     */
    public List<String> roots() {
        var roots = new ArrayList<String>();
        for (String id : topologicalOrder) {
            if (nodes.get(id).upstream().isEmpty()) {
                roots.add(id);
            }
        }
        return roots;
    }

    /**
     * Computes the nodes eligible to start: every upstream id is in {@code completedIds} and the
     * node itself is neither completed nor already scheduled. Higher priority first, ties broken
     * by topological position.
     *
     * @param completedIds ids of nodes that reached a state which releases their dependents
     * @param scheduledIds ids already handed to the executor (running or finished)
     * @return ready ids in dispatch order
     */
    public Set<String> readySet(Set<String> completedIds, Set<String> scheduledIds) {
        var ready = new ArrayList<AgentNode>();
        for (AgentNode node : nodes.values()) {
            if (completedIds.contains(node.id()) || scheduledIds.contains(node.id())) {
                continue;
            }
            if (completedIds.containsAll(node.upstream())) {
                ready.add(node);
            }
        }
        ready.sort(Comparator.comparingInt(AgentNode::priority).reversed()
                .thenComparingInt(n -> topoIndex.get(n.id())));
        var result = new LinkedHashSet<String>();
        for (AgentNode node : ready) {
            result.add(node.id());
        }
        return result;
    }

    /**
     * Every node reachable by following downstream edges from {@code id}, excluding {@code id}.
     */
    public Set<String> transitiveDownstream(String id) {
        var seen = new LinkedHashSet<String>();
        Deque<String> stack = new ArrayDeque<>(node(id).downstream());
        while (!stack.isEmpty()) {
            String next = stack.pop();
            if (seen.add(next)) {
                stack.addAll(nodes.get(next).downstream());
            }
        }
        return seen;
    }

    /**
     * Groups nodes into layers that can run in parallel: every node's upstream lies in earlier layers.
     */
    public List<List<String>> executionBatches() {
        var batches = new ArrayList<List<String>>();
        var completed = new HashSet<String>();
        while (completed.size() < nodes.size()) {
            var batch = new ArrayList<>(readySet(completed, Set.of()));
            // acyclic by construction, so every round makes progress
            batches.add(List.copyOf(batch));
            completed.addAll(batch);
        }
        return batches;
    }
}
