package com.stitchwork.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for graph runs.
 */
public class EngineMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeWorkspaces = new AtomicInteger();

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("stitchwork.workspaces.active", activeWorkspaces);
    }

    public void recordNodeExecution(String status, long ms) {
        Timer.builder("stitchwork.node.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordNodeRetry() {
        Counter.builder("stitchwork.node.retries")
                .description("Node attempts repeated after a retryable failure")
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("stitchwork.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of stitching one patch batch.
     *
     * @param outcome "merged", "conflict" or "invalid"
     */
    public void recordStitch(String outcome) {
        Counter.builder("stitchwork.stitch.batches")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSubscriberOverrun() {
        Counter.builder("stitchwork.events.subscriber_overruns")
                .description("Subscribers disconnected because their queue filled up")
                .register(registry)
                .increment();
    }

    public void recordCheckpoint() {
        Counter.builder("stitchwork.checkpoints.saved")
                .register(registry)
                .increment();
    }

    /**
     * Records workspace lifecycle operations.
     *
     * @param operation "create", "dispose" or "reap"
     */
    public void recordWorkspaceOperation(String operation) {
        Counter.builder("stitchwork.workspace.operations")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordActiveWorkspaces(int count) {
        activeWorkspaces.set(count);
    }
}
