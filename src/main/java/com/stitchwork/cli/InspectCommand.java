package com.stitchwork.cli;

import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.persistence.Checkpoint;
import com.stitchwork.core.persistence.CheckpointManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.NoSuchElementException;

/**
 * CLI command: stitchwork inspect &lt;checkpoint-id&gt;
 * <p>
 * Shows one checkpoint: per-node outcomes, pending nodes and the workspace overlays it captured.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a checkpoint")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Checkpoint ID")
    private String checkpointId;

    private final CheckpointManager checkpoints;

    public InspectCommand(CheckpointManager checkpoints) {
        this.checkpoints = checkpoints;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Checkpoint cp;
        try {
            cp = checkpoints.load(checkpointId);
        } catch (NoSuchElementException e) {
            ConsoleOutput.error("Checkpoint not found: " + checkpointId);
            return;
        }

        System.out.println();
        System.out.println("CHECKPOINT " + cp.checkpointId());
        System.out.println("──────────────────────────────────");
        System.out.println("  Run:             " + cp.runId());
        System.out.println("  Created:         " + cp.createdAt());
        System.out.println("  Base:            " + shortRef(cp.baseRef()));
        System.out.println("  Snapshot:        " + shortRef(cp.workspaceSnapshotRef()));
        System.out.println("  Last event:      #" + cp.lastEventSequence());
        System.out.println("  Pending:         " + (cp.pending().isEmpty() ? "none" : String.join(", ", cp.pending())));

        if (!cp.completed().isEmpty()) {
            System.out.println();
            System.out.println("  NODES:");
            for (ResultSummary summary : cp.completed().values()) {
                ConsoleOutput.nodeResult(summary);
                summary.writtenPaths().forEach(ConsoleOutput::fileChange);
            }
        }

        checkpoints.loadSnapshot(checkpointId).ifPresent(snapshot -> {
            System.out.println();
            System.out.println("  OVERLAYS: " + snapshot.overlays().size()
                    + (snapshot.verifyRef() ? "" : " (digest mismatch)"));
            snapshot.overlays().forEach(o -> System.out.println("    " + o.workspaceId() + " ("
                    + o.ownerNodeId() + "): " + o.writes().size() + " write(s), "
                    + o.deletions().size() + " deletion(s)"));
        });
    }

    private static String shortRef(String ref) {
        if (ref == null) return "-";
        return ref.length() > 12 ? ref.substring(0, 12) : ref;
    }
}
