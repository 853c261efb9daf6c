package com.stitchwork.core.result;

import com.stitchwork.core.graph.AgentNode;
import com.stitchwork.core.model.Artifact;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.model.NodeOutput;
import com.stitchwork.core.model.NodeStatus;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.stitch.MergeConflictException;
import com.stitchwork.core.stitch.SpanMerger;
import com.stitchwork.core.validation.ValidationException;
import com.stitchwork.core.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates a node's output and persists it into the node's workspace.
 *
 * <p>Patches must stay inside the node's working span and must leave the span structurally
 * valid. Accepted output is written to the overlay: the source file with the node's final span
 * in place, plus one file per artifact. Nothing reaches the shared base.
 */
public class ResultHandler {

    private static final Logger log = LoggerFactory.getLogger(ResultHandler.class);

    private final SpanMerger merger;

    public ResultHandler(SpanMerger merger) {
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
    }

    /**
     * Accepts {@code output} for {@code node}.
     *
     * @param working the node's working text, as handed to the agent
     * @throws ValidationException if a patch is out of range, patches overlap, or the patched
     *                             span fails validation
     */
    public ResultSummary handle(AgentNode node, NodeOutput output, byte[] working, Workspace workspace,
                                int attempts, long elapsedMs) {
        NodeDescriptor d = node.descriptor();
        List<Patch> patches = stamp(node.id(), output.patches());
        checkRanges(node, patches, working.length);

        byte[] finalText;
        try {
            finalText = merger.finalText(node, working, patches);
        } catch (MergeConflictException e) {
            throw new ValidationException("Patches from " + node.id() + " conflict", List.of(e.getMessage()));
        }

        var written = new ArrayList<String>();
        if (!patches.isEmpty()) {
            persistSpan(node, workspace, finalText).ifPresent(written::add);
        }
        var artifacts = new ArrayList<Artifact>();
        for (Artifact artifact : output.artifacts()) {
            var stamped = artifact.nodeId() == null
                    ? new Artifact(artifact.path(), artifact.content(), node.id()) : artifact;
            workspace.write(stamped.path(), stamped.content());
            written.add(stamped.path());
            artifacts.add(stamped);
        }

        log.debug("Accepted {} patch(es) and {} artifact(s) from {} ({})",
                patches.size(), artifacts.size(), node.id(), d.sourcePath());
        return new ResultSummary(node.id(), NodeStatus.SUCCEEDED, patches, artifacts, written,
                output.message(), null, attempts, elapsedMs);
    }

    private Optional<String> persistSpan(AgentNode node, Workspace workspace, byte[] finalText) {
        String path = node.descriptor().sourcePath();
        Optional<byte[]> file = workspace.read(path);
        if (file.isEmpty()) {
            log.debug("Source {} not in workspace, span of {} kept in summary only", path, node.id());
            return Optional.empty();
        }
        Optional<byte[]> patched = merger.replaceSpan(file.get(), node, finalText);
        if (patched.isEmpty()) {
            log.warn("Span of {} does not fit {} ({} bytes)", node.id(), path, file.get().length);
            return Optional.empty();
        }
        workspace.write(path, patched.get());
        return Optional.of(path);
    }

    private static List<Patch> stamp(String nodeId, List<Patch> patches) {
        return patches.stream()
                .map(p -> p.nodeId() == null ? new Patch(p.start(), p.end(), p.replacement(), nodeId) : p)
                .toList();
    }

    private static void checkRanges(AgentNode node, List<Patch> patches, int workingLength) {
        int start = node.descriptor().startByte();
        int end = start + workingLength;
        var outside = new ArrayList<String>();
        for (Patch p : patches) {
            if (p.start() < start || p.end() > end) {
                outside.add("[" + p.start() + ", " + p.end() + ") outside span [" + start + ", " + end + ")");
            }
        }
        if (!outside.isEmpty()) {
            throw new ValidationException("Patches from " + node.id() + " leave the node span", outside);
        }
    }
}
