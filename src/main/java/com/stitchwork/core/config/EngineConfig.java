package com.stitchwork.core.config;

import com.stitchwork.core.engine.GraphRunService;
import com.stitchwork.core.executor.GraphExecutor;
import com.stitchwork.core.metrics.EngineMetrics;
import com.stitchwork.core.persistence.CheckpointManager;
import com.stitchwork.core.persistence.CheckpointStore;
import com.stitchwork.core.persistence.FileCheckpointStore;
import com.stitchwork.core.persistence.InMemoryCheckpointStore;
import com.stitchwork.core.result.ResultHandler;
import com.stitchwork.core.stitch.PatchStitcher;
import com.stitchwork.core.stitch.SpanMerger;
import com.stitchwork.core.validation.StructuralValidator;
import com.stitchwork.core.workspace.OverlayCommitPolicy;
import com.stitchwork.core.workspace.RejectingCommitPolicy;
import com.stitchwork.core.workspace.WorkspaceManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the engine components from {@link EngineProperties}.
 * <p>
 * Collaborators a host application is expected to supply (the structural validator, the
 * overlay commit policy, the checkpoint store) fall back to safe defaults when absent.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry registry) {
        return new EngineMetrics(registry);
    }

    /**
     * Accepts every buffer. Replace with a grammar-aware validator for real source files.
     */
    @Bean
    @ConditionalOnMissingBean(StructuralValidator.class)
    public StructuralValidator structuralValidator() {
        log.info("No StructuralValidator configured; stitched content will not be validated");
        return StructuralValidator.permissive();
    }

    @Bean
    @ConditionalOnMissingBean(OverlayCommitPolicy.class)
    public OverlayCommitPolicy overlayCommitPolicy() {
        return new RejectingCommitPolicy();
    }

    @Bean(destroyMethod = "close")
    public WorkspaceManager workspaceManager(EngineProperties properties, OverlayCommitPolicy commitPolicy,
                                             EngineMetrics metrics) {
        var ws = properties.getWorkspace();
        var manager = new WorkspaceManager(Duration.ofSeconds(ws.getTtlSeconds()), commitPolicy, metrics,
                Clock.systemUTC());
        if (ws.getReaperIntervalSeconds() > 0) {
            manager.start(Duration.ofSeconds(ws.getReaperIntervalSeconds()));
        }
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore checkpointStore(EngineProperties properties) {
        var cp = properties.getCheckpoint();
        if ("memory".equalsIgnoreCase(cp.getStore())) {
            log.info("Using in-memory checkpoint store (checkpoints will not survive a restart)");
            return new InMemoryCheckpointStore();
        }
        log.info("Using file checkpoint store at {}", cp.getDirectory());
        return new FileCheckpointStore(Path.of(cp.getDirectory()));
    }

    @Bean
    public CheckpointManager checkpointManager(CheckpointStore store, EngineMetrics metrics) {
        return new CheckpointManager(store, metrics, Clock.systemUTC());
    }

    @Bean
    public PatchStitcher patchStitcher(StructuralValidator validator, EngineMetrics metrics) {
        return new PatchStitcher(validator, metrics);
    }

    @Bean
    public SpanMerger spanMerger(PatchStitcher stitcher) {
        return new SpanMerger(stitcher);
    }

    @Bean
    public ResultHandler resultHandler(SpanMerger merger) {
        return new ResultHandler(merger);
    }

    @Bean
    public GraphExecutor graphExecutor(EngineProperties properties, WorkspaceManager workspaces,
                                       ResultHandler resultHandler, SpanMerger merger,
                                       CheckpointManager checkpoints, EngineMetrics metrics) {
        return new GraphExecutor(properties.toExecutorConfig(), workspaces, resultHandler, merger,
                checkpoints, metrics);
    }

    @Bean
    public GraphRunService graphRunService(GraphExecutor executor, WorkspaceManager workspaces,
                                           CheckpointManager checkpoints, EngineProperties properties,
                                           EngineMetrics metrics) {
        return new GraphRunService(executor, workspaces, checkpoints,
                properties.getEvents().getSubscriberQueueCapacity(), metrics);
    }
}
