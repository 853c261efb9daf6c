package com.stitchwork.core.model;

import java.util.List;

/**
 * What an agent returns for one node: patches against its span, artifacts, and a short message.
 */
public record NodeOutput(List<Patch> patches, List<Artifact> artifacts, String message) {

    public NodeOutput {
        patches = patches == null ? List.of() : List.copyOf(patches);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static NodeOutput empty(String message) {
        return new NodeOutput(List.of(), List.of(), message);
    }

    public static NodeOutput ofPatch(Patch patch) {
        return new NodeOutput(List.of(patch), List.of(), null);
    }

    public static NodeOutput ofArtifact(Artifact artifact) {
        return new NodeOutput(List.of(), List.of(artifact), null);
    }

    public boolean isEmpty() {
        return patches.isEmpty() && artifacts.isEmpty();
    }
}
