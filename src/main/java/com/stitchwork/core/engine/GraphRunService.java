package com.stitchwork.core.engine;

import com.stitchwork.core.agent.NodeAgent;
import com.stitchwork.core.events.EventBus;
import com.stitchwork.core.executor.ExecutorState;
import com.stitchwork.core.executor.GraphExecutor;
import com.stitchwork.core.executor.GraphRunResult;
import com.stitchwork.core.graph.NodeGraph;
import com.stitchwork.core.graph.NodeGraphBuilder;
import com.stitchwork.core.logging.MdcContext;
import com.stitchwork.core.metrics.EngineMetrics;
import com.stitchwork.core.model.NodeDescriptor;
import com.stitchwork.core.persistence.CheckpointManager;
import com.stitchwork.core.workspace.BaseLayer;
import com.stitchwork.core.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point for running a set of node descriptors over a base layer.
 * <p>
 * Each run gets its own {@link EventBus}; callers observe it through the {@code onStart}
 * callback, which runs before the first event is emitted. Resuming rebuilds the graph,
 * restores the checkpoint's workspaces and continues the run under its original id.
 */
public class GraphRunService {

    private static final Logger log = LoggerFactory.getLogger(GraphRunService.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final GraphExecutor executor;
    private final WorkspaceManager workspaces;
    private final CheckpointManager checkpoints;
    private final int subscriberCapacity;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final Map<String, EventBus> activeBuses = new ConcurrentHashMap<>();

    public GraphRunService(GraphExecutor executor, WorkspaceManager workspaces, CheckpointManager checkpoints,
                           int subscriberCapacity, EngineMetrics metrics) {
        this(executor, workspaces, checkpoints, subscriberCapacity, metrics, Clock.systemUTC());
    }

    GraphRunService(GraphExecutor executor, WorkspaceManager workspaces, CheckpointManager checkpoints,
                    int subscriberCapacity, EngineMetrics metrics, Clock clock) {
        this.executor = executor;
        this.workspaces = workspaces;
        this.checkpoints = checkpoints;
        this.subscriberCapacity = subscriberCapacity;
        this.metrics = metrics;
        this.clock = clock;
    }

    public GraphRunResult run(List<NodeDescriptor> descriptors, BaseLayer base, NodeAgent agent, String intent) {
        return run(generateRunId(), descriptors, base, agent, intent, bus -> {});
    }

    /**
     * Builds the graph and runs it to completion.
     *
     * @param onStart called with the run's event bus before the run starts, e.g. to subscribe
     * @throws com.stitchwork.core.graph.GraphBuildException if the descriptors do not form a valid graph
     */
    public GraphRunResult run(String runId, List<NodeDescriptor> descriptors, BaseLayer base, NodeAgent agent,
                              String intent, Consumer<EventBus> onStart) {
        NodeGraph graph = NodeGraphBuilder.build(descriptors);
        String baseRef = workspaces.registerBase(base);
        EventBus bus = openBus(runId);
        try (bus) {
            onStart.accept(bus);
            return executor.run(graph, baseRef, agent, intent, bus);
        } finally {
            activeBuses.remove(runId, bus);
        }
    }

    /**
     * Resumes the run recorded in {@code checkpointId}. {@code base} must have the same content
     * as the checkpointed run's base layer.
     *
     * @throws com.stitchwork.core.persistence.CheckpointMismatchException if the checkpoint does not
     *         match the base layer or its stored workspace snapshot
     */
    public GraphRunResult resume(String checkpointId, List<NodeDescriptor> descriptors, BaseLayer base,
                                 NodeAgent agent, String intent, Consumer<EventBus> onStart) {
        if (checkpoints == null) {
            throw new IllegalStateException("Checkpointing is not configured");
        }
        NodeGraph graph = NodeGraphBuilder.build(descriptors);
        workspaces.registerBase(base);
        ExecutorState state = checkpoints.resume(checkpointId, workspaces);
        MdcContext.setRun(state.runId());
        log.info("Resuming run {} from {} ({} of {} nodes done)",
                state.runId(), checkpointId, state.completed().size(), graph.size());
        EventBus bus = openBus(state.runId());
        try (bus) {
            bus.continueFrom(state.lastEventSequence());
            onStart.accept(bus);
            return executor.resume(graph, state, agent, intent, bus);
        } finally {
            activeBuses.remove(state.runId(), bus);
            MdcContext.clear();
        }
    }

    public boolean cancel(String runId) {
        return executor.cancel(runId);
    }

    /**
     * Event bus of an active run, e.g. to answer human input requests.
     */
    public Optional<EventBus> eventBus(String runId) {
        return Optional.ofNullable(activeBuses.get(runId));
    }

    public String generateRunId() {
        String time = LocalDateTime.now(clock).format(RUN_ID_TIME);
        return "run-" + time + "-" + String.format("%03d", RUN_COUNTER.incrementAndGet() % 1000);
    }

    private EventBus openBus(String runId) {
        var bus = new EventBus(runId, subscriberCapacity, metrics, clock);
        if (activeBuses.putIfAbsent(runId, bus) != null) {
            bus.close();
            throw new IllegalStateException("Run " + runId + " is already active");
        }
        return bus;
    }
}
