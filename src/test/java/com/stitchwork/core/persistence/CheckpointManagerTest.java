package com.stitchwork.core.persistence;

import com.stitchwork.core.executor.ExecutorState;
import com.stitchwork.core.model.NodeStatus;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.workspace.BaseLayer;
import com.stitchwork.core.workspace.WorkspaceManager;
import com.stitchwork.core.workspace.WorkspaceSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointManagerTest {

    private static final BaseLayer BASE = BaseLayer.ofStrings(Map.of("app.py", "def f():\n    pass\n"));

    @TempDir
    Path dir;

    private FileCheckpointStore store;
    private CheckpointManager manager;
    private WorkspaceManager workspaces;
    private String baseRef;

    @BeforeEach
    void setUp() {
        store = new FileCheckpointStore(dir.resolve("checkpoints"));
        manager = new CheckpointManager(store, null, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
        workspaces = new WorkspaceManager(Duration.ofMinutes(5));
        baseRef = workspaces.registerBase(BASE);
    }

    private ExecutorState stateAfterF(long sequence) {
        String wsId = workspaces.create(baseRef, "f");
        workspaces.reopen(wsId, "f").write("app.py", "def f():\n    return 1\n");
        workspaces.retain(wsId);
        var summary = new ResultSummary("f", NodeStatus.SUCCEEDED,
                List.of(new Patch(9, 17, "    return 1", "f")), List.of(), List.of("app.py"),
                "rewrote function:f", null, 1, 42L);
        return new ExecutorState("run-7", baseRef, Map.of("f", summary), List.of("g"), sequence);
    }

    // -- Save and resume -------------------------------------------------------

    @Nested
    @DisplayName("resume")
    class Resume {

        @Test
        @DisplayName("state and workspaces survive a round trip through the file store")
        void roundTrip() {
            ExecutorState state = stateAfterF(12);
            Checkpoint saved = manager.snapshot(state, workspaces.snapshot(baseRef));

            assertEquals("run-7-00000012", saved.checkpointId());
            assertTrue(Files.exists(dir.resolve("checkpoints/run-7-00000012.json")));
            assertTrue(Files.exists(dir.resolve("checkpoints/run-7-00000012.workspace.json")));

            var fresh = new WorkspaceManager(Duration.ofMinutes(5));
            fresh.registerBase(BASE);
            ExecutorState resumed = manager.resume(saved.checkpointId(), fresh);

            assertEquals(state.runId(), resumed.runId());
            assertEquals(state.pending(), resumed.pending());
            assertEquals(12, resumed.lastEventSequence());
            assertEquals(state.completed().get("f"), resumed.completed().get("f"));
            assertEquals("def f():\n    return 1\n",
                    fresh.findByOwner("f").readString("app.py").orElseThrow());
        }

        @Test
        @DisplayName("a tampered workspace snapshot is refused")
        void tamperedSnapshot() throws Exception {
            Checkpoint saved = manager.snapshot(stateAfterF(3), workspaces.snapshot(baseRef));
            Path snapshotFile = dir.resolve("checkpoints/" + saved.checkpointId() + ".workspace.json");
            String json = Files.readString(snapshotFile);
            Files.writeString(snapshotFile, json.replace("\"f\"", "\"evil\""));

            var fresh = new WorkspaceManager(Duration.ofMinutes(5));
            fresh.registerBase(BASE);
            assertThrows(CheckpointMismatchException.class, () -> manager.resume(saved.checkpointId(), fresh));
            assertNull(fresh.findByOwner("evil"));
        }

        @Test
        @DisplayName("a snapshot from another checkpoint is refused")
        void foreignSnapshot() {
            Checkpoint saved = manager.snapshot(stateAfterF(3), workspaces.snapshot(baseRef));
            var other = new WorkspaceManager(Duration.ofMinutes(5));
            other.registerBase(BASE);
            WorkspaceSnapshot empty = other.snapshot(baseRef);

            assertThrows(CheckpointMismatchException.class, () -> manager.resume(saved, empty, workspaces));
        }

        @Test
        @DisplayName("resuming without the base layer is refused")
        void missingBase() {
            Checkpoint saved = manager.snapshot(stateAfterF(3), workspaces.snapshot(baseRef));
            var withoutBase = new WorkspaceManager(Duration.ofMinutes(5));

            assertThrows(CheckpointMismatchException.class, () -> manager.resume(saved.checkpointId(), withoutBase));
        }

        @Test
        @DisplayName("a missing snapshot file is refused")
        void missingSnapshot() throws Exception {
            Checkpoint saved = manager.snapshot(stateAfterF(3), workspaces.snapshot(baseRef));
            Files.delete(dir.resolve("checkpoints/" + saved.checkpointId() + ".workspace.json"));

            assertThrows(CheckpointMismatchException.class, () -> manager.resume(saved.checkpointId(), workspaces));
        }

        @Test
        @DisplayName("an unknown checkpoint id is reported")
        void unknownCheckpoint() {
            assertThrows(NoSuchElementException.class, () -> manager.resume("nope", workspaces));
        }

        @Test
        @DisplayName("a snapshot over a different base cannot be saved")
        void baseMismatchOnSave() {
            String otherRef = workspaces.registerBase(BaseLayer.ofStrings(Map.of("other", "x")));
            assertThrows(IllegalArgumentException.class,
                    () -> manager.snapshot(stateAfterF(1), workspaces.snapshot(otherRef)));
        }
    }

    // -- Listing ---------------------------------------------------------------

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        @DisplayName("list, latest and delete work per run")
        void listLatestDelete() {
            var ticks = new AtomicLong();
            var ticking = new CheckpointManager(store, null, new Clock() {
                @Override
                public ZoneId getZone() {
                    return ZoneOffset.UTC;
                }

                @Override
                public Clock withZone(ZoneId zone) {
                    return this;
                }

                @Override
                public Instant instant() {
                    return Instant.parse("2026-03-01T10:00:00Z").plusSeconds(ticks.incrementAndGet());
                }
            });
            WorkspaceSnapshot snapshot = workspaces.snapshot(baseRef);
            ticking.snapshot(new ExecutorState("run-a", baseRef, Map.of(), List.of("x"), 1), snapshot);
            ticking.snapshot(new ExecutorState("run-b", baseRef, Map.of(), List.of("x"), 1), snapshot);
            ticking.snapshot(new ExecutorState("run-a", baseRef, Map.of(), List.of(), 5), snapshot);

            assertEquals(3, ticking.list().size());
            assertEquals(List.of("run-a-00000001", "run-a-00000005"),
                    ticking.list("run-a").stream().map(Checkpoint::checkpointId).toList());
            assertEquals("run-a-00000005", ticking.latest("run-a").orElseThrow().checkpointId());
            assertTrue(ticking.latest("run-z").isEmpty());

            assertTrue(ticking.delete("run-a-00000005"));
            assertFalse(ticking.delete("run-a-00000005"));
            assertEquals("run-a-00000001", ticking.latest("run-a").orElseThrow().checkpointId());
            assertTrue(ticking.loadSnapshot("run-a-00000005").isEmpty());
        }

        @Test
        @DisplayName("an empty or missing directory lists nothing")
        void emptyDirectory() {
            assertTrue(manager.list().isEmpty());
        }
    }
}
