package com.stitchwork.core.workspace;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.TreeMap;

/**
 * Point-in-time copy of the retained overlays of a run, tied to the base layer they sit on.
 *
 * @param snapshotRef content digest of this snapshot, see {@link #computeRef}
 * @param baseRef     ref of the base layer the overlays apply to
 * @param overlays    captured overlays ordered by workspace id
 * @param createdAt   capture time
 */
public record WorkspaceSnapshot(
    String snapshotRef,
    String baseRef,
    List<OverlayState> overlays,
    Instant createdAt
) {

    public WorkspaceSnapshot {
        overlays = overlays == null ? List.of() : List.copyOf(overlays);
    }

    static WorkspaceSnapshot of(String baseRef, List<OverlayState> overlays, Instant createdAt) {
        var sorted = overlays.stream()
                .sorted(Comparator.comparing(OverlayState::workspaceId))
                .toList();
        return new WorkspaceSnapshot(computeRef(baseRef, sorted), baseRef, sorted, createdAt);
    }

    /**
     * Digest over the base ref and every overlay's owner, writes and deletions.
     * Independent of capture time, so two snapshots of identical content share a ref.
     */
    public static String computeRef(String baseRef, List<OverlayState> overlays) {
        MessageDigest md = BaseLayer.sha256();
        update(md, baseRef);
        overlays.stream()
                .sorted(Comparator.comparing(OverlayState::workspaceId))
                .forEach(o -> {
                    update(md, o.workspaceId());
                    update(md, o.ownerNodeId());
                    new TreeMap<>(o.writes()).forEach((path, content) -> {
                        update(md, path);
                        md.update(content);
                        md.update((byte) 0);
                    });
                    o.deletions().stream().sorted().forEach(path -> update(md, "-" + path));
                });
        return HexFormat.of().formatHex(md.digest());
    }

    /**
     * Recomputes the digest from the content and compares it with {@link #snapshotRef}.
     */
    public boolean verifyRef() {
        return computeRef(baseRef, overlays).equals(snapshotRef);
    }

    private static void update(MessageDigest md, String value) {
        md.update(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
        md.update((byte) 0);
    }
}
