package com.stitchwork.core.graph;

import com.stitchwork.core.model.NodeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link NodeGraph} from discovery descriptors.
 * <p>
 * Edges come from two sources: a child span is upstream of its enclosing parent so results
 * aggregate bottom-up, and every id in {@link NodeDescriptor#dependsOn()} is upstream of the
 * declaring node. A parent id that is not part of the batch is ignored and the node becomes a
 * top-level span; an unknown {@code dependsOn} id is an error. A child must lie inside its
 * parent's byte range and in the same source file. Overlapping siblings are accepted here and
 * rejected when their patches are stitched.
 */
public final class NodeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(NodeGraphBuilder.class);

    private enum Colour { WHITE, GREY, BLACK }

    private NodeGraphBuilder() {}

    public static NodeGraph build(List<NodeDescriptor> descriptors) {
        var byId = new LinkedHashMap<String, NodeDescriptor>();
        for (NodeDescriptor d : descriptors) {
            if (byId.putIfAbsent(d.id(), d) != null) {
                throw new GraphBuildException("Duplicate node id: " + d.id());
            }
        }

        var upstream = new LinkedHashMap<String, LinkedHashSet<String>>();
        var children = new LinkedHashMap<String, List<String>>();
        for (String id : byId.keySet()) {
            upstream.put(id, new LinkedHashSet<>());
            children.put(id, new ArrayList<>());
        }

        for (NodeDescriptor d : byId.values()) {
            if (d.parentId() != null && byId.containsKey(d.parentId())) {
                if (d.parentId().equals(d.id())) {
                    throw new CycleException(List.of(d.id(), d.id()));
                }
                checkContainment(byId.get(d.parentId()), d);
                upstream.get(d.parentId()).add(d.id());
                children.get(d.parentId()).add(d.id());
            }
        }
        for (NodeDescriptor d : byId.values()) {
            for (String dep : d.dependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new GraphBuildException("Node " + d.id() + " depends on unknown node " + dep);
                }
                upstream.get(d.id()).add(dep);
            }
        }

        var downstream = new HashMap<String, Set<String>>();
        for (String id : byId.keySet()) {
            downstream.put(id, new LinkedHashSet<>());
        }
        upstream.forEach((id, ups) -> ups.forEach(up -> downstream.get(up).add(id)));

        List<String> order = topologicalSort(byId.keySet(), upstream);

        var nodes = new LinkedHashMap<String, AgentNode>();
        for (NodeDescriptor d : byId.values()) {
            nodes.put(d.id(), new AgentNode(d.id(), d,
                    new ArrayList<>(upstream.get(d.id())),
                    downstream.get(d.id()),
                    children.get(d.id())));
        }
        log.debug("Built graph with {} nodes", nodes.size());
        return new NodeGraph(nodes, order);
    }

    private static void checkContainment(NodeDescriptor parent, NodeDescriptor child) {
        if (!Objects.equals(parent.sourcePath(), child.sourcePath())) {
            throw new GraphBuildException("Node " + child.id() + " in " + child.sourcePath()
                    + " cannot nest inside " + parent.id() + " in " + parent.sourcePath());
        }
        if (child.startByte() < parent.startByte() || child.endByte() > parent.endByte()) {
            throw new GraphBuildException("Span [" + child.startByte() + ", " + child.endByte() + ") of "
                    + child.id() + " lies outside its parent " + parent.id() + " ["
                    + parent.startByte() + ", " + parent.endByte() + ")");
        }
    }

    /**
     * Depth-first post-order over upstream edges with three-colour marking.
     * Reaching a GREY node means the current path closes a cycle.
     */
    private static List<String> topologicalSort(Set<String> ids, Map<String, LinkedHashSet<String>> upstream) {
        var colour = new HashMap<String, Colour>();
        ids.forEach(id -> colour.put(id, Colour.WHITE));
        var order = new ArrayList<String>(ids.size());
        var path = new ArrayList<String>();

        for (String id : ids) {
            if (colour.get(id) == Colour.WHITE) {
                visit(id, upstream, colour, order, path);
            }
        }
        return Collections.unmodifiableList(order);
    }

    private static void visit(String id, Map<String, LinkedHashSet<String>> upstream,
                              Map<String, Colour> colour, List<String> order, List<String> path) {
        colour.put(id, Colour.GREY);
        path.add(id);
        for (String up : upstream.get(id)) {
            Colour c = colour.get(up);
            if (c == Colour.GREY) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(up), path.size()));
                cycle.add(up);
                throw new CycleException(cycle);
            }
            if (c == Colour.WHITE) {
                visit(up, upstream, colour, order, path);
            }
        }
        path.remove(path.size() - 1);
        colour.put(id, Colour.BLACK);
        order.add(id);
    }
}
