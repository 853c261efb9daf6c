package com.stitchwork.core.workspace;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Copy-on-write view for a single node: a private overlay over the shared {@link BaseLayer}.
 * <p>
 * Reads resolve overlay first and fall through to the base. Deletes are recorded as
 * tombstones that hide base entries. Listings are the union of base and overlay with the
 * overlay shadowing base entries of the same path. Only the owning node writes to the overlay.
 */
public final class Workspace {

    /** Overlay entry; a null content marks a deletion. */
    private record Entry(byte[] content) {
        boolean isTombstone() {
            return content == null;
        }
    }

    private final String id;
    private final String ownerNodeId;
    private final String runId;
    private final BaseLayer base;
    private final Instant createdAt;
    private final Duration ttl;
    private final ConcurrentHashMap<String, Entry> overlay = new ConcurrentHashMap<>();

    private volatile Instant lastAccess;
    private volatile boolean retained;
    private volatile boolean disposed;

    Workspace(String id, String ownerNodeId, String runId, BaseLayer base, Instant createdAt, Duration ttl) {
        this.id = id;
        this.ownerNodeId = ownerNodeId;
        this.runId = runId;
        this.base = base;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.lastAccess = createdAt;
    }

    public String id() {
        return id;
    }

    public String ownerNodeId() {
        return ownerNodeId;
    }

    /**
     * Run the workspace was created for, or null for a workspace created outside a run.
     */
    public String runId() {
        return runId;
    }

    public String baseRef() {
        return base.ref();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration ttl() {
        return ttl;
    }

    public Instant lastAccess() {
        return lastAccess;
    }

    public boolean isRetained() {
        return retained;
    }

    public boolean isDisposed() {
        return disposed;
    }

    public Optional<byte[]> read(String path) {
        ensureOpen();
        String key = BaseLayer.normalize(path);
        Entry entry = overlay.get(key);
        if (entry != null) {
            return entry.isTombstone() ? Optional.empty() : Optional.of(entry.content().clone());
        }
        return base.read(key);
    }

    public Optional<String> readString(String path) {
        return read(path).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public boolean exists(String path) {
        return read(path).isPresent();
    }

    public void write(String path, byte[] content) {
        ensureOpen();
        overlay.put(BaseLayer.normalize(path), new Entry(content.clone()));
    }

    public void write(String path, String content) {
        write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hides {@code path} in this workspace. Returns false when nothing was visible at that path.
     */
    public boolean delete(String path) {
        ensureOpen();
        boolean existed = exists(path);
        overlay.put(BaseLayer.normalize(path), new Entry(null));
        return existed;
    }

    /**
     * Visible paths starting with {@code prefix}, sorted.
     */
    public SortedSet<String> list(String prefix) {
        ensureOpen();
        String p = BaseLayer.normalize(prefix);
        var result = new TreeSet<String>();
        for (String path : base.paths().tailSet(p, true)) {
            if (!path.startsWith(p)) {
                break;
            }
            result.add(path);
        }
        overlay.forEach((path, entry) -> {
            if (path.startsWith(p)) {
                if (entry.isTombstone()) {
                    result.remove(path);
                } else {
                    result.add(path);
                }
            }
        });
        return result;
    }

    /**
     * Paths written (not deleted) in this overlay.
     */
    public SortedSet<String> writtenPaths() {
        var result = new TreeSet<String>();
        overlay.forEach((path, entry) -> {
            if (!entry.isTombstone()) {
                result.add(path);
            }
        });
        return result;
    }

    /**
     * Paths deleted in this overlay.
     */
    public SortedSet<String> deletedPaths() {
        var result = new TreeSet<String>();
        overlay.forEach((path, entry) -> {
            if (entry.isTombstone()) {
                result.add(path);
            }
        });
        return result;
    }

    boolean isExpired(Instant now) {
        return !retained && lastAccess.plus(ttl).isBefore(now);
    }

    void touch(Instant now) {
        this.lastAccess = now;
    }

    void markRetained() {
        this.retained = true;
    }

    void markDisposed() {
        this.disposed = true;
        overlay.clear();
    }

    OverlayState captureOverlay() {
        var writes = new TreeMap<String, byte[]>();
        var deletions = new TreeSet<String>();
        overlay.forEach((path, entry) -> {
            if (entry.isTombstone()) {
                deletions.add(path);
            } else {
                writes.put(path, entry.content().clone());
            }
        });
        return new OverlayState(id, ownerNodeId, writes, deletions.stream().toList());
    }

    void applyOverlay(Map<String, byte[]> writes, Set<String> deletions) {
        writes.forEach((path, content) -> overlay.put(path, new Entry(content.clone())));
        deletions.forEach(path -> overlay.put(path, new Entry(null)));
    }

    private void ensureOpen() {
        if (disposed) {
            throw new WorkspaceException("Workspace " + id + " has been disposed");
        }
    }
}
