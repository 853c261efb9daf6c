package com.stitchwork.core.executor;

import com.stitchwork.core.EngineException;
import com.stitchwork.core.agent.CapabilityException;
import com.stitchwork.core.agent.NodeAgent;
import com.stitchwork.core.agent.NodeContext;
import com.stitchwork.core.events.EventBus;
import com.stitchwork.core.events.GraphEvents.CheckpointSavedEvent;
import com.stitchwork.core.events.GraphEvents.GraphCompleteEvent;
import com.stitchwork.core.events.GraphEvents.GraphStartEvent;
import com.stitchwork.core.events.GraphEvents.NodeCompleteEvent;
import com.stitchwork.core.events.GraphEvents.NodeErrorEvent;
import com.stitchwork.core.events.GraphEvents.NodeStartEvent;
import com.stitchwork.core.events.GraphEvents.PatchBatchMergedEvent;
import com.stitchwork.core.events.GraphEvents.PatchBatchRejectedEvent;
import com.stitchwork.core.events.HumanInputBroker;
import com.stitchwork.core.graph.AgentNode;
import com.stitchwork.core.graph.NodeGraph;
import com.stitchwork.core.logging.MdcContext;
import com.stitchwork.core.metrics.EngineMetrics;
import com.stitchwork.core.model.ErrorPolicy;
import com.stitchwork.core.model.NodeOutput;
import com.stitchwork.core.model.NodeStatus;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.model.RunStatus;
import com.stitchwork.core.persistence.Checkpoint;
import com.stitchwork.core.persistence.CheckpointManager;
import com.stitchwork.core.result.ResultHandler;
import com.stitchwork.core.stitch.MergeConflictException;
import com.stitchwork.core.stitch.SpanMerger;
import com.stitchwork.core.stitch.StitchResult;
import com.stitchwork.core.validation.ValidationException;
import com.stitchwork.core.workspace.BaseLayer;
import com.stitchwork.core.workspace.Workspace;
import com.stitchwork.core.workspace.WorkspaceException;
import com.stitchwork.core.workspace.WorkspaceManager;
import com.stitchwork.core.workspace.WorkspaceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs a {@link NodeGraph} to completion with bounded concurrency.
 *
 * <p>The calling thread coordinates: it dispatches ready nodes while a concurrency slot is
 * free, and applies completions one at a time, so all run bookkeeping is single-threaded.
 * Agents run on worker threads. Each node gets its own workspace, a deadline covering all of
 * its attempts, and exactly one {@link NodeCompleteEvent}, including nodes that are skipped.
 *
 * <p>When a node fails after its last attempt, its error policy decides what happens next:
 * <ul>
 *   <li>{@link ErrorPolicy#STOP_GRAPH}: running nodes finish, nothing new starts, the run fails</li>
 *   <li>{@link ErrorPolicy#SKIP_DOWNSTREAM}: everything downstream of the node is skipped</li>
 *   <li>{@link ErrorPolicy#CONTINUE}: downstream nodes run without the node's output</li>
 * </ul>
 *
 * <p>After the last node, child results are folded up the containment tree and every root
 * span is stitched into its source file.
 */
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final ExecutorConfig config;
    private final WorkspaceManager workspaces;
    private final ResultHandler resultHandler;
    private final SpanMerger merger;
    private final CheckpointManager checkpoints;
    private final EngineMetrics metrics;

    private final Map<String, Run> activeRuns = new ConcurrentHashMap<>();

    public GraphExecutor(ExecutorConfig config, WorkspaceManager workspaces, ResultHandler resultHandler,
                         SpanMerger merger) {
        this(config, workspaces, resultHandler, merger, null, null);
    }

    public GraphExecutor(ExecutorConfig config, WorkspaceManager workspaces, ResultHandler resultHandler,
                         SpanMerger merger, CheckpointManager checkpoints, EngineMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.workspaces = Objects.requireNonNull(workspaces, "workspaces must not be null");
        this.resultHandler = Objects.requireNonNull(resultHandler, "resultHandler must not be null");
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
        this.checkpoints = checkpoints;
        this.metrics = metrics;
    }

    public ExecutorConfig config() {
        return config;
    }

    /**
     * Runs every node of {@code graph} against the base layer {@code baseRef}. The run id is the
     * event bus's run id. Blocks until the run finishes.
     */
    public GraphRunResult run(NodeGraph graph, String baseRef, NodeAgent agent, String intent, EventBus bus) {
        var initial = new ExecutorState(bus.runId(), baseRef, Map.of(), graph.topologicalOrder(), 0);
        return execute(graph, initial, agent, intent, bus, false);
    }

    /**
     * Continues a run from {@code state}: terminal nodes keep their summaries and only pending
     * nodes execute. Workspaces retained at checkpoint time must already be restored.
     *
     * @throws IllegalArgumentException if the state belongs to another run or names unknown nodes
     */
    public GraphRunResult resume(NodeGraph graph, ExecutorState state, NodeAgent agent, String intent, EventBus bus) {
        if (!state.runId().equals(bus.runId())) {
            throw new IllegalArgumentException("State of run " + state.runId()
                    + " cannot be resumed on the event bus of run " + bus.runId());
        }
        for (String id : state.completed().keySet()) {
            if (!graph.contains(id)) {
                throw new IllegalArgumentException("Checkpointed node " + id + " is not in the graph");
            }
        }
        return execute(graph, state, agent, intent, bus, true);
    }

    /**
     * Requests cancellation: running nodes are interrupted and fail, pending nodes are skipped.
     *
     * @return false if no such run is active
     */
    public boolean cancel(String runId) {
        Run run = activeRuns.get(runId);
        if (run == null) {
            return false;
        }
        log.info("Cancellation requested for run {}", runId);
        run.cancelled = true;
        return true;
    }

    public boolean isRunning(String runId) {
        return activeRuns.containsKey(runId);
    }

    private GraphRunResult execute(NodeGraph graph, ExecutorState state, NodeAgent agent, String intent,
                                   EventBus bus, boolean resumed) {
        workspaces.base(state.baseRef());
        var run = new Run(graph, state.baseRef(), agent, intent, bus);
        if (activeRuns.putIfAbsent(run.runId, run) != null) {
            throw new IllegalStateException("Run " + run.runId + " is already active");
        }
        MdcContext.setRun(run.runId);
        try {
            return run.execute(state, resumed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while running " + run.runId, e);
        } finally {
            run.shutdown();
            activeRuns.remove(run.runId);
            MdcContext.clear();
        }
    }

    private ErrorPolicy policyOf(AgentNode node) {
        ErrorPolicy own = node.descriptor().errorPolicy();
        return own != null ? own : config.errorPolicy();
    }

    private static String describe(Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e instanceof ValidationException v && !v.diagnostics().isEmpty()) {
            return message + " " + v.diagnostics();
        }
        return message;
    }

    private static boolean isRetryable(Exception e) {
        return !(e instanceof WorkspaceException);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Completion handed from a worker (or the deadline) to the coordinator. */
    private record Completion(NodeRun nodeRun, ResultSummary summary) {}

    /**
     * State of one run. Everything except the completion queue, the cancellation flag and the
     * commit lock is touched by the coordinating thread only.
     */
    private final class Run {

        final String runId;
        final NodeGraph graph;
        final String baseRef;
        final NodeAgent agent;
        final String intent;
        final EventBus bus;
        final HumanInputBroker humanInput;

        final Map<String, NodeStatus> statuses = new HashMap<>();
        final Map<String, ResultSummary> results = new LinkedHashMap<>();
        final Map<String, byte[]> finalTexts = new HashMap<>();
        final Set<String> released = new HashSet<>();
        final Set<String> scheduled = new HashSet<>();
        final Map<String, NodeRun> running = new LinkedHashMap<>();
        final Set<String> retainedWorkspaces = new LinkedHashSet<>();
        final List<String> rejectedPaths = new ArrayList<>();

        final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        final Semaphore slots = new Semaphore(config.maxConcurrency());
        final ReadWriteLock commitLock = new ReentrantReadWriteLock();
        final ExecutorService workers;
        final ExecutorService fanOutPool;
        final ScheduledExecutorService deadlines;
        final FanOut fanOut;

        volatile boolean cancelled;
        boolean cancelHandled;
        boolean halted;
        boolean spanRejected;
        int sinceCheckpoint;
        String lastCheckpointId;

        Run(NodeGraph graph, String baseRef, NodeAgent agent, String intent, EventBus bus) {
            this.runId = bus.runId();
            this.graph = graph;
            this.baseRef = baseRef;
            this.agent = agent;
            this.intent = intent;
            this.bus = bus;
            this.humanInput = new HumanInputBroker(bus);
            // cached pools: a worker that ignores interruption must not starve later nodes
            this.workers = Executors.newCachedThreadPool(daemonThreads("stitchwork-" + runId + "-node"));
            this.fanOutPool = Executors.newCachedThreadPool(daemonThreads("stitchwork-" + runId + "-fanout"));
            this.deadlines = Executors.newSingleThreadScheduledExecutor(daemonThreads("stitchwork-" + runId + "-deadline"));
            this.fanOut = new FanOut(fanOutPool, config.maxConcurrency());
        }

        GraphRunResult execute(ExecutorState state, boolean resumed) throws InterruptedException {
            restore(state);
            log.info("{} run {} ({} nodes, {} already terminal, max concurrency {})",
                    resumed ? "Resuming" : "Starting", runId, graph.size(), results.size(), config.maxConcurrency());
            bus.emit(new GraphStartEvent(runId, graph.size(), resumed));

            while (true) {
                if (cancelled && !cancelHandled) {
                    cancelRunning();
                }
                if (!cancelled && !halted) {
                    dispatchReady();
                }
                if (running.isEmpty() && completions.isEmpty()) {
                    break;
                }
                Completion completion = completions.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (completion != null) {
                    onCompletion(completion);
                }
            }

            skipRemaining(cancelled ? "run cancelled" : halted ? "run halted" : "upstream did not complete");
            fillFinalTexts();
            Map<String, byte[]> merged = mergeFiles();
            RunStatus status = overallStatus();
            if (checkpoints != null && config.checkpointInterval() > 0) {
                checkpoint();
            }
            bus.emit(new GraphCompleteEvent(runId, status, results, rejectedPaths));
            if (metrics != null) {
                metrics.recordRunResult(status.name().toLowerCase());
            }
            log.info("Run {} finished: {} ({} nodes, {} rejected path(s))",
                    runId, status, results.size(), rejectedPaths.size());
            return new GraphRunResult(runId, status, results, merged, rejectedPaths, lastCheckpointId);
        }

        void restore(ExecutorState state) {
            for (String id : graph.topologicalOrder()) {
                ResultSummary summary = state.completed().get(id);
                if (summary == null) {
                    statuses.put(id, NodeStatus.PENDING);
                    continue;
                }
                AgentNode node = graph.node(id);
                results.put(id, summary);
                statuses.put(id, summary.status());
                scheduled.add(id);
                Workspace retained = workspaces.findRetained(runId, id);
                if (retained != null) {
                    retainedWorkspaces.add(retained.id());
                }
                if (summary.status() == NodeStatus.SKIPPED) {
                    continue;
                }
                byte[] working = workingText(node, false);
                finalTexts.put(id, summary.succeeded() ? finalTextOrWorking(node, working, summary) : working);
                if (summary.succeeded() || policyOf(node) == ErrorPolicy.CONTINUE) {
                    released.add(id);
                } else if (policyOf(node) == ErrorPolicy.STOP_GRAPH) {
                    halted = true;
                }
            }
        }

        void dispatchReady() {
            for (String id : graph.readySet(released, scheduled)) {
                if (!slots.tryAcquire()) {
                    return;
                }
                dispatch(graph.node(id));
            }
        }

        void dispatch(AgentNode node) {
            String id = node.id();
            scheduled.add(id);
            statuses.put(id, NodeStatus.READY);
            byte[] working = workingText(node, true);

            String workspaceId;
            try {
                workspaceId = workspaces.create(baseRef, id, runId);
            } catch (WorkspaceException e) {
                log.error("Could not create workspace for {}: {}", id, e.getMessage());
                var nodeRun = new NodeRun(this, node, null, working, Map.of());
                nodeRun.complete(ResultSummary.failed(id, describe(e), 0, 0L));
                return;
            }

            var upstream = new LinkedHashMap<String, ResultSummary>();
            for (String up : node.upstream()) {
                ResultSummary s = results.get(up);
                if (s != null) {
                    upstream.put(up, s);
                }
            }
            statuses.put(id, NodeStatus.RUNNING);
            bus.emit(new NodeStartEvent(runId, id, node.name(), 1));

            var nodeRun = new NodeRun(this, node, workspaceId, working, upstream);
            running.put(id, nodeRun);
            nodeRun.future = workers.submit(nodeRun);
            nodeRun.deadline = deadlines.schedule(nodeRun::timeOut,
                    config.nodeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        void onCompletion(Completion completion) {
            NodeRun nodeRun = completion.nodeRun();
            ResultSummary summary = completion.summary();
            AgentNode node = nodeRun.node;
            String id = node.id();

            running.remove(id);
            slots.release();
            nodeRun.cancelDeadline();
            releaseWorkspace(nodeRun.workspaceId, summary.succeeded());

            statuses.put(id, summary.status());
            results.put(id, summary);
            finalTexts.put(id, summary.succeeded()
                    ? finalTextOrWorking(node, nodeRun.working, summary) : nodeRun.working);
            if (metrics != null) {
                metrics.recordNodeExecution(summary.status().name().toLowerCase(), summary.elapsedMs());
            }

            if (summary.succeeded()) {
                log.info("Node {} succeeded: {}", id, summary.brief());
            } else {
                log.warn("Node {} failed after {} attempt(s): {}", id, summary.attempts(), summary.error());
                bus.emit(new NodeErrorEvent(runId, id, summary.error(), summary.attempts(), false));
            }
            bus.emit(new NodeCompleteEvent(runId, id, summary));

            applyPolicy(node, summary);
            if (checkpoints != null && config.checkpointInterval() > 0
                    && ++sinceCheckpoint >= config.checkpointInterval()) {
                checkpoint();
            }
        }

        void releaseWorkspace(String workspaceId, boolean succeeded) {
            if (workspaceId == null) {
                return;
            }
            if (succeeded && config.retainWorkspaces()) {
                try {
                    workspaces.retain(workspaceId);
                    retainedWorkspaces.add(workspaceId);
                    return;
                } catch (WorkspaceException e) {
                    log.warn("Workspace {} vanished before it could be retained: {}", workspaceId, e.getMessage());
                }
            }
            workspaces.dispose(workspaceId);
        }

        void applyPolicy(AgentNode node, ResultSummary summary) {
            if (summary.succeeded()) {
                released.add(node.id());
                return;
            }
            if (cancelled) {
                return;
            }
            switch (policyOf(node)) {
                case CONTINUE -> released.add(node.id());
                case SKIP_DOWNSTREAM -> {
                    Set<String> downstream = graph.transitiveDownstream(node.id());
                    for (String d : graph.topologicalOrder()) {
                        if (downstream.contains(d) && !scheduled.contains(d)) {
                            markSkipped(d, "upstream " + node.id() + " failed");
                        }
                    }
                }
                case STOP_GRAPH -> {
                    if (!halted) {
                        log.warn("Node {} failed under stop_graph, halting run {}", node.id(), runId);
                    }
                    halted = true;
                }
            }
        }

        void markSkipped(String id, String reason) {
            scheduled.add(id);
            var summary = ResultSummary.skipped(id, reason);
            statuses.put(id, NodeStatus.SKIPPED);
            results.put(id, summary);
            if (metrics != null) {
                metrics.recordNodeExecution("skipped", 0L);
            }
            log.debug("Skipping {}: {}", id, reason);
            bus.emit(new NodeCompleteEvent(runId, id, summary));
        }

        void skipRemaining(String reason) {
            for (String id : graph.topologicalOrder()) {
                if (!statuses.get(id).isTerminal()) {
                    markSkipped(id, reason);
                }
            }
        }

        void cancelRunning() {
            cancelHandled = true;
            for (NodeRun nodeRun : new ArrayList<>(running.values())) {
                if (nodeRun.complete(ResultSummary.failed(nodeRun.node.id(), "cancelled",
                        nodeRun.attempt, nodeRun.elapsedMs()))) {
                    nodeRun.interrupt();
                }
            }
        }

        void checkpoint() {
            Checkpoint saved;
            commitLock.writeLock().lock();
            try {
                WorkspaceSnapshot snapshot = workspaces.snapshot(baseRef, retainedWorkspaces);
                saved = checkpoints.snapshot(currentState(), snapshot);
            } catch (EngineException e) {
                log.error("Checkpoint of run {} failed, continuing without it: {}", runId, e.getMessage(), e);
                return;
            } finally {
                commitLock.writeLock().unlock();
            }
            sinceCheckpoint = 0;
            lastCheckpointId = saved.checkpointId();
            bus.emit(new CheckpointSavedEvent(runId, saved.checkpointId(), saved.completedCount()));
        }

        ExecutorState currentState() {
            var pending = new ArrayList<String>();
            for (String id : graph.topologicalOrder()) {
                if (!statuses.get(id).isTerminal()) {
                    pending.add(id);
                }
            }
            return new ExecutorState(runId, baseRef, results, pending, bus.lastSequence());
        }

        /**
         * The node's original span with its children's final texts stitched in. A rejected or
         * conflicting child batch leaves the original span in place.
         */
        byte[] workingText(AgentNode node, boolean emitEvents) {
            byte[] original = SpanMerger.originalText(node);
            if (node.children().isEmpty()) {
                return original;
            }
            String path = node.descriptor().sourcePath();
            try {
                StitchResult result = merger.workingText(graph, node, finalTexts);
                if (!result.accepted()) {
                    spanRejected = true;
                    if (emitEvents) {
                        bus.emit(new PatchBatchRejectedEvent(runId, node.id(), path, "invalid", result.diagnostics()));
                    }
                    return original;
                }
                if (result.applied() > 0 && emitEvents) {
                    bus.emit(new PatchBatchMergedEvent(runId, node.id(), path, result.applied()));
                }
                return result.buffer();
            } catch (MergeConflictException e) {
                spanRejected = true;
                log.warn("Child patches for {} conflict: {}", node.id(), e.getMessage());
                if (emitEvents) {
                    bus.emit(new PatchBatchRejectedEvent(runId, node.id(), path, "conflict", List.of(e.getMessage())));
                }
                return original;
            }
        }

        byte[] finalTextOrWorking(AgentNode node, byte[] working, ResultSummary summary) {
            try {
                return merger.finalText(node, working, summary.patches());
            } catch (MergeConflictException | ValidationException e) {
                log.warn("Patches of {} no longer apply to its span: {}", node.id(), e.getMessage());
                spanRejected = true;
                return working;
            }
        }

        /** Folds child results into nodes that never ran, in dependency order. */
        void fillFinalTexts() {
            for (String id : graph.topologicalOrder()) {
                if (!finalTexts.containsKey(id)) {
                    finalTexts.put(id, workingText(graph.node(id), true));
                }
            }
        }

        Map<String, byte[]> mergeFiles() {
            var childIds = new HashSet<String>();
            var paths = new TreeSet<String>();
            for (AgentNode node : graph.nodes()) {
                childIds.addAll(node.children());
                paths.add(node.descriptor().sourcePath());
            }
            var patchesByPath = new TreeMap<String, List<Patch>>();
            for (String id : graph.topologicalOrder()) {
                if (childIds.contains(id)) {
                    continue;
                }
                AgentNode root = graph.node(id);
                merger.effectivePatch(root, finalTexts.get(id)).ifPresent(p ->
                        patchesByPath.computeIfAbsent(root.descriptor().sourcePath(), k -> new ArrayList<>()).add(p));
            }

            BaseLayer base = workspaces.base(baseRef);
            var merged = new TreeMap<String, byte[]>();
            for (String path : paths) {
                List<Patch> patches = patchesByPath.getOrDefault(path, List.of());
                Optional<byte[]> content = base.read(path);
                if (content.isEmpty()) {
                    if (!patches.isEmpty()) {
                        reject(path, "missing", List.of("No base content for " + path));
                    }
                    continue;
                }
                try {
                    StitchResult result = merger.mergeFile(content.get(), patches);
                    if (!result.accepted()) {
                        reject(path, "invalid", result.diagnostics());
                        continue;
                    }
                    merged.put(path, result.buffer());
                    if (!patches.isEmpty()) {
                        bus.emit(new PatchBatchMergedEvent(runId, null, path, result.applied()));
                    }
                } catch (MergeConflictException e) {
                    reject(path, "conflict", List.of(e.getMessage()));
                }
            }
            return merged;
        }

        void reject(String path, String reason, List<String> diagnostics) {
            log.warn("Rejected stitch of {} ({}): {}", path, reason, diagnostics);
            rejectedPaths.add(path);
            bus.emit(new PatchBatchRejectedEvent(runId, null, path, reason, diagnostics));
        }

        RunStatus overallStatus() {
            if (cancelled) {
                return RunStatus.CANCELLED;
            }
            if (halted) {
                return RunStatus.FAILED;
            }
            boolean allSucceeded = results.values().stream().allMatch(ResultSummary::succeeded);
            if (allSucceeded && rejectedPaths.isEmpty() && !spanRejected) {
                return RunStatus.SUCCEEDED;
            }
            return RunStatus.PARTIAL;
        }

        /**
         * Stops the run's threads and drops its retained workspaces. Checkpoints hold their own
         * copy of the overlays, so resuming later does not need them.
         */
        void shutdown() {
            workers.shutdownNow();
            fanOutPool.shutdownNow();
            deadlines.shutdownNow();
            int disposed = workspaces.disposeAll(retainedWorkspaces);
            retainedWorkspaces.clear();
            if (disposed > 0) {
                log.debug("Disposed {} retained workspace(s) of run {}", disposed, runId);
            }
        }
    }

    /**
     * One node's execution on a worker thread. The first of worker, deadline or cancellation
     * to call {@link #complete} decides the node's outcome; later calls are ignored.
     */
    private final class NodeRun implements Runnable {

        final Run run;
        final AgentNode node;
        final byte[] working;
        final Map<String, ResultSummary> upstream;
        final AtomicBoolean done = new AtomicBoolean();
        final long startedNanos = System.nanoTime();

        volatile String workspaceId;
        volatile int attempt = 1;
        volatile Future<?> future;
        volatile ScheduledFuture<?> deadline;

        NodeRun(Run run, AgentNode node, String workspaceId, byte[] working, Map<String, ResultSummary> upstream) {
            this.run = run;
            this.node = node;
            this.workspaceId = workspaceId;
            this.working = working;
            this.upstream = upstream;
        }

        @Override
        public void run() {
            String id = node.id();
            try {
                for (attempt = 1; attempt <= config.maxAttempts(); attempt++) {
                    MdcContext.setNode(run.runId, id, attempt);
                    try {
                        Workspace workspace = workspaces.reopen(workspaceId, id);
                        var context = new NodeContext(run.runId, node, run.intent, working, upstream,
                                workspace, run.humanInput, run.fanOut, attempt);
                        NodeOutput output = run.agent.execute(context);
                        if (output == null) {
                            throw new CapabilityException("Agent returned no output for " + id);
                        }
                        ResultSummary summary;
                        run.commitLock.readLock().lock();
                        try {
                            if (done.get()) {
                                return;
                            }
                            summary = resultHandler.handle(node, output, working, workspace, attempt, elapsedMs());
                        } finally {
                            run.commitLock.readLock().unlock();
                        }
                        complete(summary);
                        return;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        complete(ResultSummary.failed(id, "interrupted", attempt, elapsedMs()));
                        return;
                    } catch (Exception e) {
                        if (done.get() || Thread.currentThread().isInterrupted()
                                || !isRetryable(e) || attempt >= config.maxAttempts()) {
                            complete(ResultSummary.failed(id, describe(e), attempt, elapsedMs()));
                            return;
                        }
                        log.warn("Attempt {} of {} failed, retrying: {}", attempt, id, describe(e));
                        run.bus.emit(new NodeErrorEvent(run.runId, id, describe(e), attempt, true));
                        if (metrics != null) {
                            metrics.recordNodeRetry();
                        }
                        try {
                            freshWorkspace();
                        } catch (WorkspaceException we) {
                            complete(ResultSummary.failed(id, describe(we), attempt, elapsedMs()));
                            return;
                        }
                    }
                }
            } finally {
                MdcContext.clear();
            }
        }

        /** Gives the next attempt a clean overlay. */
        private void freshWorkspace() {
            String previous = workspaceId;
            workspaceId = workspaces.create(run.baseRef, node.id(), run.runId);
            workspaces.dispose(previous);
        }

        void timeOut() {
            var timeout = new NodeTimeoutException(node.id(), config.nodeTimeout());
            if (complete(ResultSummary.failed(node.id(), timeout.getMessage(), attempt, elapsedMs()))) {
                log.warn(timeout.getMessage());
                interrupt();
            }
        }

        boolean complete(ResultSummary summary) {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            run.completions.add(new Completion(this, summary));
            return true;
        }

        void interrupt() {
            Future<?> f = future;
            if (f != null) {
                f.cancel(true);
            }
        }

        void cancelDeadline() {
            ScheduledFuture<?> d = deadline;
            if (d != null) {
                d.cancel(false);
            }
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        }
    }
}
