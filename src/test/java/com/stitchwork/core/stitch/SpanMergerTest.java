package com.stitchwork.core.stitch;

import com.stitchwork.core.graph.AgentNode;
import com.stitchwork.core.graph.NodeGraph;
import com.stitchwork.core.graph.NodeGraphBuilder;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.validation.BalancedDelimiterValidator;
import com.stitchwork.core.validation.StructuralValidator;
import com.stitchwork.core.validation.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpanMergerTest {

    private static final String FILE = "a = 1\n{[x][y]}\n";

    private final SpanMerger merger = new SpanMerger(new PatchStitcher(StructuralValidator.permissive()));

    private final NodeGraph graph = NodeGraphBuilder.build(List.of(
            NodeDescriptor.span("blk", "block", "m.txt", 6, 14, "{[x][y]}", null),
            NodeDescriptor.span("x", "item", "m.txt", 7, 10, "[x]", "blk"),
            NodeDescriptor.span("y", "item", "m.txt", 10, 13, "[y]", "blk")));

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("a node's own patches use file offsets against its working text")
    void finalTextFromOwnPatches() {
        var x = graph.node("x");
        byte[] result = merger.finalText(x, SpanMerger.originalText(x), List.of(Patch.of(8, 9, "xx")));
        assertEquals("[xx]", text(result));
    }

    @Test
    @DisplayName("a patch reaching past the working text conflicts")
    void ownPatchOutOfRange() {
        var x = graph.node("x");
        assertThrows(MergeConflictException.class,
                () -> merger.finalText(x, SpanMerger.originalText(x), List.of(Patch.of(8, 11, "?"))));
    }

    @Test
    @DisplayName("invalid own patches are reported as a validation failure")
    void ownPatchInvalid() {
        var strict = new SpanMerger(new PatchStitcher(new BalancedDelimiterValidator()));
        var x = graph.node("x");
        assertThrows(ValidationException.class,
                () -> strict.finalText(x, SpanMerger.originalText(x), List.of(Patch.of(9, 10, ""))));
    }

    @Test
    @DisplayName("children's final texts are stitched into the parent's working text")
    void workingTextFromChildren() {
        var finals = new HashMap<String, byte[]>();
        finals.put("x", bytes("[xx]"));
        finals.put("y", bytes("[yyy]"));

        StitchResult working = merger.workingText(graph, graph.node("blk"), finals);

        assertTrue(working.accepted());
        assertEquals("{[xx][yyy]}", working.text());
    }

    @Test
    @DisplayName("unchanged or missing children leave the parent's original text")
    void unchangedChildren() {
        StitchResult working = merger.workingText(graph, graph.node("blk"), Map.of("x", bytes("[x]")));
        assertEquals("{[x][y]}", working.text());
        assertEquals(0, working.applied());
    }

    @Test
    @DisplayName("the effective patch covers the node's whole original span")
    void effectivePatch() {
        var blk = graph.node("blk");
        Patch patch = merger.effectivePatch(blk, bytes("{[xx][yy]}")).orElseThrow();

        assertEquals(new Patch(6, 14, "{[xx][yy]}", "blk"), patch);
        assertTrue(merger.effectivePatch(blk, bytes("{[x][y]}")).isEmpty());
        assertTrue(merger.effectivePatch(blk, null).isEmpty());
    }

    @Test
    @DisplayName("root patches are merged into the source file")
    void mergeFile() {
        var patch = merger.effectivePatch(graph.node("blk"), bytes("{[xx][yy]}")).orElseThrow();
        StitchResult merged = merger.mergeFile(bytes(FILE), List.of(patch));
        assertEquals("a = 1\n{[xx][yy]}\n", merged.text());
    }

    @Test
    @DisplayName("replaceSpan swaps the span and refuses files that are too short")
    void replaceSpan() {
        var x = graph.node("x");
        assertEquals("a = 1\n{[z][y]}\n", text(merger.replaceSpan(bytes(FILE), x, bytes("[z]")).orElseThrow()));
        assertTrue(merger.replaceSpan(bytes("short"), x, bytes("[z]")).isEmpty());
    }

    @Test
    @DisplayName("a child outside its parent's span conflicts instead of producing a negative offset")
    void childOutsideParentConflicts() {
        var parent = new AgentNode("p", NodeDescriptor.span("p", "block", "m.txt", 2, 7, "[abc]", null),
                List.of("c"), Set.of(), List.of("c"));
        var child = new AgentNode("c", NodeDescriptor.span("c", "item", "m.txt", 0, 2, "ab", "p"),
                List.of(), Set.of("p"), List.of());
        NodeGraph loose = mock(NodeGraph.class);
        when(loose.children("p")).thenReturn(List.of("c"));
        when(loose.node("c")).thenReturn(child);

        var ex = assertThrows(MergeConflictException.class,
                () -> merger.workingText(loose, parent, Map.of("c", bytes("zz"))));
        assertEquals("c", ex.conflicting().get(0).nodeId());
    }
}
