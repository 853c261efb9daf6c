package com.stitchwork.core.agent;

import com.stitchwork.core.events.HumanInputBroker;
import com.stitchwork.core.executor.FanOut;
import com.stitchwork.core.graph.AgentNode;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.workspace.Workspace;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Everything a {@link NodeAgent} may see while executing one node.
 *
 * <p>The workspace is the node's private overlay; nothing written there is visible to other
 * nodes. Upstream summaries are those of the node's direct upstream nodes that have finished.
 */
public final class NodeContext {

    private final String runId;
    private final AgentNode node;
    private final String intent;
    private final byte[] workingText;
    private final Map<String, ResultSummary> upstream;
    private final Workspace workspace;
    private final HumanInputBroker humanInput;
    private final FanOut fanOut;
    private final int attempt;

    public NodeContext(String runId, AgentNode node, String intent, byte[] workingText,
                       Map<String, ResultSummary> upstream, Workspace workspace,
                       HumanInputBroker humanInput, FanOut fanOut, int attempt) {
        this.runId = runId;
        this.node = node;
        this.intent = intent;
        this.workingText = workingText.clone();
        this.upstream = Map.copyOf(upstream);
        this.workspace = workspace;
        this.humanInput = humanInput;
        this.fanOut = fanOut;
        this.attempt = attempt;
    }

    public String runId() {
        return runId;
    }

    public AgentNode node() {
        return node;
    }

    public NodeDescriptor descriptor() {
        return node.descriptor();
    }

    public String intent() {
        return intent;
    }

    /**
     * The node's span with its children's results already stitched in.
     */
    public String workingText() {
        return new String(workingText, StandardCharsets.UTF_8);
    }

    public byte[] workingBytes() {
        return workingText.clone();
    }

    /**
     * First byte after the working text, in source-file offsets.
     */
    public int workingEnd() {
        return node.descriptor().startByte() + workingText.length;
    }

    public Map<String, ResultSummary> upstream() {
        return upstream;
    }

    public Workspace workspace() {
        return workspace;
    }

    public FanOut fanOut() {
        return fanOut;
    }

    public int attempt() {
        return attempt;
    }

    /**
     * Blocks until a human answers, or the timeout passes.
     *
     * @throws IllegalStateException if the run has no human input channel
     */
    public String askHuman(String question, List<String> options, Duration timeout)
            throws TimeoutException, InterruptedException {
        if (humanInput == null) {
            throw new IllegalStateException("Human input is not available for run " + runId);
        }
        return humanInput.ask(node.id(), question, options, timeout);
    }
}
