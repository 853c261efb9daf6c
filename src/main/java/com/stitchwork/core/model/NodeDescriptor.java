package com.stitchwork.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A work unit supplied by the discovery collaborator: one parsed span
 * (file, class, function, ...) of a source file.
 *
 * @param id          stable node identifier
 * @param nodeType    kind of span, e.g. "file", "class", "function"
 * @param name        display name
 * @param sourcePath  path of the source file the span belongs to
 * @param startByte   start of the span (inclusive)
 * @param endByte     end of the span (exclusive)
 * @param text        raw text of the span
 * @param parentId    id of the enclosing span, or null for a top-level span
 * @param dependsOn   extra upstream ids declared by discovery
 * @param priority    scheduling hint, higher runs first among ready nodes
 * @param errorPolicy per-node override of the run's error policy (nullable)
 */
public record NodeDescriptor(
    String id,
    String nodeType,
    String name,
    String sourcePath,
    int startByte,
    int endByte,
    String text,
    String parentId,
    List<String> dependsOn,
    int priority,
    ErrorPolicy errorPolicy
) implements Serializable {

    public NodeDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException(
                    "Invalid span [" + startByte + ", " + endByte + ") for node " + id);
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        text = text == null ? "" : text;
    }

    /**
     * Convenience factory for a span with no explicit dependencies or policy override.
     */
    public static NodeDescriptor span(String id, String nodeType, String sourcePath,
                                      int startByte, int endByte, String text, String parentId) {
        return new NodeDescriptor(id, nodeType, id, sourcePath, startByte, endByte, text,
                parentId, List.of(), 0, null);
    }

    public NodeDescriptor withDependsOn(List<String> deps) {
        return new NodeDescriptor(id, nodeType, name, sourcePath, startByte, endByte, text,
                parentId, deps, priority, errorPolicy);
    }

    public NodeDescriptor withPriority(int newPriority) {
        return new NodeDescriptor(id, nodeType, name, sourcePath, startByte, endByte, text,
                parentId, dependsOn, newPriority, errorPolicy);
    }

    public NodeDescriptor withErrorPolicy(ErrorPolicy policy) {
        return new NodeDescriptor(id, nodeType, name, sourcePath, startByte, endByte, text,
                parentId, dependsOn, priority, policy);
    }
}
