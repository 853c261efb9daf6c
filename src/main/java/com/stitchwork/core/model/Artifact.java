package com.stitchwork.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A derived file produced by a node (generated tests, docs, reports).
 */
public record Artifact(String path, String content, String nodeId) implements Serializable {

    public Artifact {
        Objects.requireNonNull(path, "path must not be null");
        content = content == null ? "" : content;
    }
}
