package com.stitchwork.core.agent;

import com.stitchwork.core.graph.NodeGraph;
import com.stitchwork.core.graph.NodeGraphBuilder;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.model.NodeOutput;
import com.stitchwork.core.model.Patch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CapabilityNodeAgentTest {

    @Mock
    private RelevanceOracle oracle;

    @Mock
    private Generator generator;

    private NodeContext context;

    @BeforeEach
    void setUp() {
        NodeGraph graph = NodeGraphBuilder.build(List.of(
                NodeDescriptor.span("fn", "function", "app.py", 10, 25, "def f():\n  pass", null)));
        // working text already longer than the original span
        byte[] working = "def f():\n  return 1".getBytes(StandardCharsets.UTF_8);
        context = new NodeContext("run-1", graph.node("fn"), "add return values", working,
                Map.of(), null, null, null, 1);
    }

    @Test
    @DisplayName("a relevant node gets one patch over its whole working text")
    void patchMode() throws Exception {
        when(oracle.isRelevant("add return values", context)).thenReturn(true);
        when(generator.generate("add return values", context)).thenReturn("def f():\n  return 2");

        NodeOutput output = new CapabilityNodeAgent(oracle, generator).execute(context);

        assertEquals(List.of(new Patch(10, 29, "def f():\n  return 2", "fn")), output.patches());
        assertTrue(output.message().startsWith("rewrote"));
    }

    @Test
    @DisplayName("an irrelevant node succeeds empty and the generator is never called")
    void notRelevant() throws Exception {
        when(oracle.isRelevant(anyString(), any())).thenReturn(false);

        NodeOutput output = new CapabilityNodeAgent(oracle, generator).execute(context);

        assertTrue(output.isEmpty());
        assertEquals(CapabilityNodeAgent.NOT_RELEVANT, output.message());
        verifyNoInteractions(generator);
    }

    @Test
    @DisplayName("artifact mode writes the generated text to the chosen path")
    void artifactMode() throws Exception {
        when(oracle.isRelevant(anyString(), any())).thenReturn(true);
        when(generator.generate(anyString(), any())).thenReturn("def test_f(): ...");

        var agent = new CapabilityNodeAgent(oracle, generator, CapabilityNodeAgent.Mode.ARTIFACT,
                ctx -> "tests/test_" + ctx.node().id() + ".py");
        NodeOutput output = agent.execute(context);

        assertTrue(output.patches().isEmpty());
        assertEquals("tests/test_fn.py", output.artifacts().get(0).path());
        assertEquals("fn", output.artifacts().get(0).nodeId());
    }

    @Test
    @DisplayName("default artifact path lives under the engine directory")
    void defaultArtifactPath() {
        assertEquals(".stitchwork/artifacts/fn.txt", CapabilityNodeAgent.defaultArtifactPath(context));
    }

    @Test
    @DisplayName("generator failures surface as capability errors")
    void generatorFailure() throws Exception {
        when(oracle.isRelevant(anyString(), any())).thenReturn(true);
        when(generator.generate(anyString(), any())).thenThrow(new IOException("model unavailable"));

        var ex = assertThrows(CapabilityException.class,
                () -> new CapabilityNodeAgent(oracle, generator).execute(context));
        assertInstanceOf(IOException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("fn"));
    }

    @Test
    @DisplayName("oracle failures surface as capability errors")
    void oracleFailure() throws Exception {
        when(oracle.isRelevant(anyString(), any())).thenThrow(new IllegalStateException("no index"));

        assertThrows(CapabilityException.class, () -> new CapabilityNodeAgent(oracle, generator).execute(context));
        verify(generator, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("blank generator output is an error")
    void blankOutput() throws Exception {
        when(oracle.isRelevant(anyString(), any())).thenReturn(true);
        when(generator.generate(eq("add return values"), any())).thenReturn("  ");

        assertThrows(CapabilityException.class, () -> new CapabilityNodeAgent(oracle, generator).execute(context));
    }

    @Test
    @DisplayName("interruption is passed through unwrapped")
    void interruptionPropagates() throws Exception {
        when(oracle.isRelevant(anyString(), any())).thenThrow(new InterruptedException());

        assertThrows(InterruptedException.class, () -> new CapabilityNodeAgent(oracle, generator).execute(context));
    }
}
