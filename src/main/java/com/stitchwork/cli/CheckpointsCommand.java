package com.stitchwork.cli;

import com.stitchwork.core.persistence.Checkpoint;
import com.stitchwork.core.persistence.CheckpointManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: stitchwork checkpoints [--run &lt;run-id&gt;]
 * <p>
 * Lists saved checkpoints, oldest first.
 */
@Command(name = "checkpoints", mixinStandardHelpOptions = true, description = "List saved checkpoints")
@Component
public class CheckpointsCommand implements Runnable {

    @Option(names = {"--run", "-r"}, description = "Only checkpoints of this run")
    private String runId;

    private final CheckpointManager checkpoints;

    public CheckpointsCommand(CheckpointManager checkpoints) {
        this.checkpoints = checkpoints;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Checkpoint> all = runId == null ? checkpoints.list() : checkpoints.list(runId);
        if (all.isEmpty()) {
            ConsoleOutput.info(runId == null ? "No checkpoints found." : "No checkpoints for run " + runId);
            return;
        }

        System.out.println();
        System.out.printf("  %-36s %-24s %9s %7s  %s%n", "CHECKPOINT", "RUN", "COMPLETED", "PENDING", "CREATED");
        for (Checkpoint cp : all) {
            System.out.printf("  %-36s %-24s %9d %7d  %s%n",
                    cp.checkpointId(), cp.runId(), cp.completedCount(), cp.pending().size(), cp.createdAt());
        }
        System.out.println();
        ConsoleOutput.info(all.size() + " checkpoint" + (all.size() != 1 ? "s" : ""));
    }
}
