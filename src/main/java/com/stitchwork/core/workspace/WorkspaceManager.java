package com.stitchwork.core.workspace;

import com.stitchwork.core.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out isolated copy-on-write workspaces layered over shared base layers.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Run starts: {@link #registerBase} makes the immutable base available by ref</li>
 *   <li>Per node: {@link #create} forks a private overlay, {@link #reopen} returns it to its owner</li>
 *   <li>After execution: {@link #dispose} drops the overlay, or {@link #retain} keeps it for checkpoints</li>
 *   <li>Orphans: {@link #reapExpired} disposes idle, non-retained workspaces past their TTL</li>
 * </ol>
 */
public class WorkspaceManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final Duration defaultTtl;
    private final OverlayCommitPolicy commitPolicy;
    private final EngineMetrics metrics;
    private final Clock clock;

    /** Maps base ref to the registered base layer. */
    private final ConcurrentHashMap<String, BaseLayer> bases = new ConcurrentHashMap<>();

    /** Maps workspace id to the live workspace. */
    private final ConcurrentHashMap<String, Workspace> workspaces = new ConcurrentHashMap<>();

    private final AtomicLong counter = new AtomicLong();
    private ScheduledExecutorService reaper;

    public WorkspaceManager(Duration defaultTtl) {
        this(defaultTtl, new RejectingCommitPolicy(), null, Clock.systemUTC());
    }

    public WorkspaceManager(Duration defaultTtl, OverlayCommitPolicy commitPolicy,
                            EngineMetrics metrics, Clock clock) {
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        this.commitPolicy = Objects.requireNonNull(commitPolicy, "commitPolicy must not be null");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers a base layer and returns its ref. Registering identical content twice is a no-op.
     */
    public String registerBase(BaseLayer base) {
        bases.putIfAbsent(base.ref(), base);
        log.debug("Registered base layer {} ({} files)", shortRef(base.ref()), base.size());
        return base.ref();
    }

    public BaseLayer base(String baseRef) {
        BaseLayer base = bases.get(baseRef);
        if (base == null) {
            throw new WorkspaceException("Unknown base layer: " + baseRef);
        }
        return base;
    }

    public boolean hasBase(String baseRef) {
        return bases.containsKey(baseRef);
    }

    /**
     * Forks a new workspace over {@code baseRef}, exclusively owned by {@code ownerNodeId}.
     *
     * @return the new workspace id
     */
    public String create(String baseRef, String ownerNodeId) {
        return create(baseRef, ownerNodeId, null);
    }

    /**
     * Forks a new workspace for {@code ownerNodeId} within run {@code runId}. The run id becomes
     * part of the workspace id, so runs that reuse node ids never share a workspace.
     *
     * @return the new workspace id
     */
    public String create(String baseRef, String ownerNodeId, String runId) {
        Objects.requireNonNull(ownerNodeId, "ownerNodeId must not be null");
        BaseLayer base = base(baseRef);
        String prefix = runId == null ? "ws-" : "ws-" + runId + "-";
        String id;
        Workspace ws;
        do {
            id = prefix + ownerNodeId + "-" + counter.incrementAndGet();
            ws = new Workspace(id, ownerNodeId, runId, base, clock.instant(), defaultTtl);
        } while (workspaces.putIfAbsent(id, ws) != null);
        log.debug("Created workspace {} for node {}", id, ownerNodeId);
        recordOperation("create");
        return id;
    }

    /**
     * Returns a live workspace to its owner.
     *
     * @throws WorkspaceException if the workspace is unknown or disposed, or the requester is not its owner
     */
    public Workspace reopen(String workspaceId, String requesterNodeId) {
        Workspace ws = workspaces.get(workspaceId);
        if (ws == null || ws.isDisposed()) {
            throw new WorkspaceException("Workspace " + workspaceId + " does not exist or was disposed");
        }
        if (!ws.ownerNodeId().equals(requesterNodeId)) {
            throw new WorkspaceException("Node " + requesterNodeId + " may not open workspace "
                    + workspaceId + " owned by " + ws.ownerNodeId());
        }
        ws.touch(clock.instant());
        return ws;
    }

    /**
     * Drops the workspace and its overlay. Returns false if it was already gone.
     */
    public boolean dispose(String workspaceId) {
        Workspace ws = workspaces.remove(workspaceId);
        if (ws == null) {
            return false;
        }
        ws.markDisposed();
        log.debug("Disposed workspace {}", workspaceId);
        recordOperation("dispose");
        return true;
    }

    /**
     * Disposes each of {@code workspaceIds} that is still alive, retained or not.
     *
     * @return number of workspaces disposed
     */
    public int disposeAll(Collection<String> workspaceIds) {
        int disposed = 0;
        for (String id : workspaceIds) {
            if (dispose(id)) {
                disposed++;
            }
        }
        return disposed;
    }

    /**
     * Keeps the workspace alive past its owner's completion so checkpoints can capture it.
     * Retained workspaces are never reaped.
     */
    public void retain(String workspaceId) {
        Workspace ws = workspaces.get(workspaceId);
        if (ws == null) {
            throw new WorkspaceException("Cannot retain unknown workspace " + workspaceId);
        }
        ws.markRetained();
    }

    /**
     * Asks the configured {@link OverlayCommitPolicy} to promote the overlay.
     */
    public CommitResult commit(String workspaceId) {
        Workspace ws = workspaces.get(workspaceId);
        if (ws == null) {
            throw new WorkspaceException("Cannot commit unknown workspace " + workspaceId);
        }
        return commitPolicy.commit(ws, base(ws.baseRef()));
    }

    /**
     * Disposes every non-retained workspace idle for longer than its TTL.
     *
     * @return ids of the reaped workspaces
     */
    public List<String> reapExpired(Instant now) {
        var reaped = new ArrayList<String>();
        workspaces.forEach((id, ws) -> {
            if (ws.isExpired(now) && workspaces.remove(id, ws)) {
                ws.markDisposed();
                reaped.add(id);
                recordOperation("reap");
            }
        });
        if (!reaped.isEmpty()) {
            log.info("Reaped {} expired workspace(s): {}", reaped.size(), reaped);
        }
        return reaped;
    }

    /**
     * Starts the background reaper.
     */
    public synchronized void start(Duration interval) {
        if (reaper != null) {
            return;
        }
        reaper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "workspace-reaper");
            t.setDaemon(true);
            return t;
        });
        long ms = interval.toMillis();
        reaper.scheduleAtFixedRate(() -> {
            try {
                reapExpired(clock.instant());
            } catch (RuntimeException e) {
                log.warn("Workspace reaper failed: {}", e.getMessage(), e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Workspace reaper started (interval {} ms, ttl {})", ms, defaultTtl);
    }

    /**
     * Captures the overlays of all retained workspaces.
     *
     * @param baseRef base layer the snapshot is tied to
     */
    public WorkspaceSnapshot snapshot(String baseRef) {
        base(baseRef);
        var overlays = new ArrayList<OverlayState>();
        workspaces.values().forEach(ws -> {
            if (ws.isRetained() && ws.baseRef().equals(baseRef)) {
                overlays.add(ws.captureOverlay());
            }
        });
        return WorkspaceSnapshot.of(baseRef, overlays, clock.instant());
    }

    /**
     * Captures the overlays of the given workspaces that are still alive and retained.
     */
    public WorkspaceSnapshot snapshot(String baseRef, Collection<String> workspaceIds) {
        base(baseRef);
        var overlays = new ArrayList<OverlayState>();
        for (String id : workspaceIds) {
            Workspace ws = workspaces.get(id);
            if (ws != null && ws.isRetained() && ws.baseRef().equals(baseRef)) {
                overlays.add(ws.captureOverlay());
            }
        }
        return WorkspaceSnapshot.of(baseRef, overlays, clock.instant());
    }

    /**
     * Recreates the retained workspaces recorded in {@code snapshot}. Existing workspaces with the
     * same ids are replaced.
     */
    public void restore(WorkspaceSnapshot snapshot) {
        restore(snapshot, null);
    }

    /**
     * Like {@link #restore(WorkspaceSnapshot)}, tagging the recreated workspaces with {@code runId}.
     */
    public void restore(WorkspaceSnapshot snapshot, String runId) {
        BaseLayer base = base(snapshot.baseRef());
        for (OverlayState state : snapshot.overlays()) {
            var ws = new Workspace(state.workspaceId(), state.ownerNodeId(), runId, base,
                    clock.instant(), defaultTtl);
            ws.applyOverlay(state.writes(), new HashSet<>(state.deletions()));
            ws.markRetained();
            Workspace previous = workspaces.put(ws.id(), ws);
            if (previous != null) {
                previous.markDisposed();
            }
        }
        log.info("Restored {} workspace(s) from snapshot {}", snapshot.overlays().size(),
                shortRef(snapshot.snapshotRef()));
        recordActive();
    }

    /**
     * Finds the live workspace owned by {@code nodeId}, if any.
     */
    public Workspace findByOwner(String nodeId) {
        for (Workspace ws : workspaces.values()) {
            if (ws.ownerNodeId().equals(nodeId)) {
                return ws;
            }
        }
        return null;
    }

    /**
     * Finds the retained workspace that {@code nodeId} left behind in run {@code runId}, if any.
     */
    public Workspace findRetained(String runId, String nodeId) {
        for (Workspace ws : workspaces.values()) {
            if (ws.isRetained() && ws.ownerNodeId().equals(nodeId) && Objects.equals(ws.runId(), runId)) {
                return ws;
            }
        }
        return null;
    }

    public int activeCount() {
        return workspaces.size();
    }

    @Override
    public synchronized void close() {
        if (reaper != null) {
            reaper.shutdownNow();
            reaper = null;
        }
    }

    private void recordOperation(String operation) {
        if (metrics != null) {
            metrics.recordWorkspaceOperation(operation);
        }
        recordActive();
    }

    private void recordActive() {
        if (metrics != null) {
            metrics.recordActiveWorkspaces(workspaces.size());
        }
    }

    private static String shortRef(String ref) {
        return ref.length() > 12 ? ref.substring(0, 12) : ref;
    }
}
