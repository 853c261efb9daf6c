package com.stitchwork.core.agent;

import com.stitchwork.core.model.Artifact;
import com.stitchwork.core.model.NodeOutput;
import com.stitchwork.core.model.Patch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Agent built from a relevance oracle and a generator.
 *
 * <p>A node the oracle rejects succeeds with no output. Otherwise the generated text either
 * replaces the node's whole working text ({@link Mode#PATCH}) or is written as an artifact
 * ({@link Mode#ARTIFACT}).
 */
public class CapabilityNodeAgent implements NodeAgent {

    private static final Logger log = LoggerFactory.getLogger(CapabilityNodeAgent.class);

    public static final String NOT_RELEVANT = "not relevant";

    public enum Mode {
        PATCH,
        ARTIFACT
    }

    private final RelevanceOracle oracle;
    private final Generator generator;
    private final Mode mode;
    private final Function<NodeContext, String> artifactPath;

    public CapabilityNodeAgent(RelevanceOracle oracle, Generator generator) {
        this(oracle, generator, Mode.PATCH, CapabilityNodeAgent::defaultArtifactPath);
    }

    public CapabilityNodeAgent(RelevanceOracle oracle, Generator generator, Mode mode,
                               Function<NodeContext, String> artifactPath) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.artifactPath = Objects.requireNonNull(artifactPath, "artifactPath must not be null");
    }

    @Override
    public NodeOutput execute(NodeContext context) throws Exception {
        String nodeId = context.node().id();
        boolean relevant;
        try {
            relevant = oracle.isRelevant(context.intent(), context);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new CapabilityException("Relevance check failed for " + nodeId + ": " + e.getMessage(), e);
        }
        if (!relevant) {
            log.debug("Node {} not relevant to intent", nodeId);
            return NodeOutput.empty(NOT_RELEVANT);
        }

        String generated;
        try {
            generated = generator.generate(context.intent(), context);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new CapabilityException("Generation failed for " + nodeId + ": " + e.getMessage(), e);
        }
        if (generated == null || generated.isBlank()) {
            throw new CapabilityException("Generator returned empty output for " + nodeId);
        }

        if (mode == Mode.ARTIFACT) {
            String path = artifactPath.apply(context);
            return new NodeOutput(List.of(), List.of(new Artifact(path, generated, nodeId)),
                    "generated " + path);
        }
        int start = context.descriptor().startByte();
        var patch = new Patch(start, context.workingEnd(), generated, nodeId);
        return new NodeOutput(List.of(patch), List.of(), "rewrote " + context.node().name());
    }

    static String defaultArtifactPath(NodeContext context) {
        return ".stitchwork/artifacts/" + context.node().id() + ".txt";
    }
}
