package com.stitchwork.core.stitch;

import com.stitchwork.core.graph.AgentNode;
import com.stitchwork.core.graph.NodeGraph;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.validation.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds node results up the containment tree.
 *
 * <p>Every node has three texts for its span:
 * <ul>
 *   <li>original: the descriptor text</li>
 *   <li>working: the original with each child's final text stitched over the child's range</li>
 *   <li>final: the working text with the node's own patches applied</li>
 * </ul>
 * A node's own patches are addressed in source-file offsets measured against its working text,
 * so a patch ranges over {@code [startByte, startByte + working.length]}. A node whose final
 * text differs from its original contributes one whole-span patch to its parent, and roots
 * contribute the same way to their source file.
 */
public class SpanMerger {

    private final PatchStitcher stitcher;

    public SpanMerger(PatchStitcher stitcher) {
        this.stitcher = Objects.requireNonNull(stitcher, "stitcher must not be null");
    }

    public static byte[] originalText(AgentNode node) {
        return node.descriptor().text().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Builds the working text of {@code node} from the final texts of its children.
     * Children without a final text, or whose final text equals their original, contribute nothing.
     *
     * @throws MergeConflictException if child spans overlap or fall outside the parent span
     */
    public StitchResult workingText(NodeGraph graph, AgentNode node, Map<String, byte[]> finalTexts) {
        NodeDescriptor d = node.descriptor();
        var patches = new ArrayList<Patch>();
        for (String childId : graph.children(node.id())) {
            AgentNode child = graph.node(childId);
            Optional<Patch> patch = effectivePatch(child, finalTexts.get(childId));
            if (patch.isEmpty()) {
                continue;
            }
            Patch p = patch.get();
            if (p.start() < d.startByte() || p.end() > d.endByte()
                    || !Objects.equals(child.descriptor().sourcePath(), d.sourcePath())) {
                throw new MergeConflictException("Child " + childId + " does not lie inside the span of "
                        + node.id(), List.of(p));
            }
            patches.add(p.shift(-d.startByte()));
        }
        return stitcher.stitch(originalText(node), patches);
    }

    /**
     * Applies the node's own patches to its working text.
     *
     * @throws MergeConflictException if the patches overlap or exceed the working text
     * @throws ValidationException    if the patched text fails structural validation
     */
    public byte[] finalText(AgentNode node, byte[] working, List<Patch> ownPatches) {
        if (ownPatches.isEmpty()) {
            return working.clone();
        }
        int offset = node.descriptor().startByte();
        var relative = ownPatches.stream().map(p -> p.shift(-offset)).toList();
        StitchResult result = stitcher.stitch(working, relative);
        if (!result.accepted()) {
            throw new ValidationException("Patches from " + node.id() + " produce invalid content",
                    result.diagnostics());
        }
        return result.buffer();
    }

    /**
     * The whole-span patch a node hands to its parent, or empty if its span is unchanged.
     */
    public Optional<Patch> effectivePatch(AgentNode node, byte[] finalText) {
        if (finalText == null || Arrays.equals(finalText, originalText(node))) {
            return Optional.empty();
        }
        NodeDescriptor d = node.descriptor();
        return Optional.of(new Patch(d.startByte(), d.endByte(),
                new String(finalText, StandardCharsets.UTF_8), node.id()));
    }

    /**
     * Stitches root-level span patches into a whole source file.
     */
    public StitchResult mergeFile(byte[] fileContent, List<Patch> rootPatches) {
        return stitcher.stitch(fileContent, rootPatches);
    }

    /**
     * Replaces the node's original span in {@code fileContent} with {@code text}, without validation.
     * Returns empty when the span does not fit the file.
     */
    public Optional<byte[]> replaceSpan(byte[] fileContent, AgentNode node, byte[] text) {
        NodeDescriptor d = node.descriptor();
        if (d.endByte() > fileContent.length) {
            return Optional.empty();
        }
        var patch = new Patch(d.startByte(), d.endByte(), new String(text, StandardCharsets.UTF_8), node.id());
        return Optional.of(PatchStitcher.splice(fileContent, patch));
    }
}
