package com.stitchwork.core.result;

import com.stitchwork.core.graph.NodeGraph;
import com.stitchwork.core.graph.NodeGraphBuilder;
import com.stitchwork.core.model.Artifact;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.model.NodeOutput;
import com.stitchwork.core.model.NodeStatus;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.stitch.PatchStitcher;
import com.stitchwork.core.stitch.SpanMerger;
import com.stitchwork.core.validation.BalancedDelimiterValidator;
import com.stitchwork.core.validation.ValidationException;
import com.stitchwork.core.workspace.BaseLayer;
import com.stitchwork.core.workspace.Workspace;
import com.stitchwork.core.workspace.WorkspaceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultHandlerTest {

    private static final String FILE = "a = 1\n{[x][y]}\n";

    private final NodeGraph graph = NodeGraphBuilder.build(List.of(
            NodeDescriptor.span("blk", "block", "m.txt", 6, 14, "{[x][y]}", null),
            NodeDescriptor.span("x", "item", "m.txt", 7, 10, "[x]", "blk"),
            NodeDescriptor.span("y", "item", "m.txt", 10, 13, "[y]", "blk"),
            NodeDescriptor.span("ghost", "item", "gone.txt", 0, 3, "[g]", null)));

    private ResultHandler handler;
    private WorkspaceManager workspaces;
    private String baseRef;

    @BeforeEach
    void setUp() {
        handler = new ResultHandler(new SpanMerger(new PatchStitcher(new BalancedDelimiterValidator())));
        workspaces = new WorkspaceManager(Duration.ofMinutes(5));
        baseRef = workspaces.registerBase(BaseLayer.ofStrings(Map.of("m.txt", FILE)));
    }

    private Workspace workspaceFor(String nodeId) {
        return workspaces.reopen(workspaces.create(baseRef, nodeId), nodeId);
    }

    private byte[] original(String nodeId) {
        return SpanMerger.originalText(graph.node(nodeId));
    }

    // -- Accepted output -------------------------------------------------------

    @Nested
    @DisplayName("accepted output")
    class Accepted {

        @Test
        @DisplayName("patches are stamped and the patched span is written to the overlay")
        void patchPersisted() {
            Workspace ws = workspaceFor("x");
            ResultSummary summary = handler.handle(graph.node("x"), NodeOutput.ofPatch(Patch.of(8, 9, "xx")),
                    original("x"), ws, 1, 12L);

            assertEquals(NodeStatus.SUCCEEDED, summary.status());
            assertEquals("x", summary.patches().get(0).nodeId());
            assertEquals(List.of("m.txt"), summary.writtenPaths());
            assertEquals("a = 1\n{[xx][y]}\n", ws.readString("m.txt").orElseThrow());
            assertEquals(1, summary.attempts());
            assertEquals(12L, summary.elapsedMs());
        }

        @Test
        @DisplayName("a parent's patch may address its grown working text")
        void parentPatchOnWorkingText() {
            Workspace ws = workspaceFor("blk");
            byte[] working = "{[xx][yy]}".getBytes();
            ResultSummary summary = handler.handle(graph.node("blk"),
                    NodeOutput.ofPatch(Patch.of(15, 16, "}\n# done")), working, ws, 1, 0L);

            assertTrue(summary.succeeded());
            assertEquals("a = 1\n{[xx][yy]}\n# done\n", ws.readString("m.txt").orElseThrow());
        }

        @Test
        @DisplayName("artifacts are written and attributed to the node")
        void artifactsWritten() {
            Workspace ws = workspaceFor("y");
            var output = NodeOutput.ofArtifact(new Artifact("docs/y.md", "# y", null));

            ResultSummary summary = handler.handle(graph.node("y"), output, original("y"), ws, 2, 0L);

            assertEquals("y", summary.artifacts().get(0).nodeId());
            assertEquals(List.of("docs/y.md"), summary.writtenPaths());
            assertEquals("# y", ws.readString("docs/y.md").orElseThrow());
            assertEquals(FILE, ws.readString("m.txt").orElseThrow());
        }

        @Test
        @DisplayName("a span whose file is not in the workspace is kept in the summary only")
        void missingSourceFile() {
            Workspace ws = workspaceFor("ghost");
            ResultSummary summary = handler.handle(graph.node("ghost"), NodeOutput.ofPatch(Patch.of(1, 2, "G")),
                    original("ghost"), ws, 1, 0L);

            assertTrue(summary.writtenPaths().isEmpty());
            assertEquals(1, summary.patches().size());
            assertFalse(ws.exists("gone.txt"));
        }

        @Test
        @DisplayName("an empty output succeeds without writes")
        void emptyOutput() {
            Workspace ws = workspaceFor("x");
            ResultSummary summary = handler.handle(graph.node("x"), NodeOutput.empty("not relevant"),
                    original("x"), ws, 1, 0L);

            assertTrue(summary.succeeded());
            assertEquals("not relevant", summary.message());
            assertTrue(ws.writtenPaths().isEmpty());
        }
    }

    // -- Rejected output -------------------------------------------------------

    @Nested
    @DisplayName("rejected output")
    class Rejected {

        @Test
        @DisplayName("patches outside the node span are rejected")
        void outsideSpan() {
            Workspace ws = workspaceFor("x");
            var ex = assertThrows(ValidationException.class, () -> handler.handle(graph.node("x"),
                    NodeOutput.ofPatch(Patch.of(5, 8, "?")), original("x"), ws, 1, 0L));
            assertTrue(ex.getMessage().contains("leave the node span"));
            assertTrue(ws.writtenPaths().isEmpty());
        }

        @Test
        @DisplayName("overlapping patches from one node are rejected")
        void overlapping() {
            Workspace ws = workspaceFor("x");
            var output = new NodeOutput(List.of(Patch.of(7, 9, "a"), Patch.of(8, 10, "b")), List.of(), null);
            assertThrows(ValidationException.class,
                    () -> handler.handle(graph.node("x"), output, original("x"), ws, 1, 0L));
        }

        @Test
        @DisplayName("patches breaking the span's structure are rejected")
        void structurallyInvalid() {
            Workspace ws = workspaceFor("x");
            var ex = assertThrows(ValidationException.class, () -> handler.handle(graph.node("x"),
                    NodeOutput.ofPatch(Patch.of(9, 10, "")), original("x"), ws, 1, 0L));
            assertFalse(ex.diagnostics().isEmpty());
            assertEquals(FILE, ws.readString("m.txt").orElseThrow());
        }
    }
}
