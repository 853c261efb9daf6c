package com.stitchwork.core.config;

import com.stitchwork.core.engine.GraphRunService;
import com.stitchwork.core.executor.ExecutorConfig;
import com.stitchwork.core.executor.GraphExecutor;
import com.stitchwork.core.model.ErrorPolicy;
import com.stitchwork.core.persistence.CheckpointStore;
import com.stitchwork.core.persistence.FileCheckpointStore;
import com.stitchwork.core.persistence.InMemoryCheckpointStore;
import com.stitchwork.core.validation.BalancedDelimiterValidator;
import com.stitchwork.core.validation.StructuralValidator;
import com.stitchwork.core.workspace.WorkspaceManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(EngineProperties.class, EngineConfig.class)
            .withPropertyValues("stitchwork.workspace.reaper-interval-seconds=0");

    // -- Defaults --------------------------------------------------------------

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("defaults are reasonable")
        void defaultsAreReasonable() {
            var props = new EngineProperties();
            assertEquals(4, props.getExecutor().getMaxConcurrency());
            assertEquals(300, props.getExecutor().getNodeTimeoutSeconds());
            assertEquals(ErrorPolicy.STOP_GRAPH, props.getExecutor().getErrorPolicy());
            assertEquals(2, props.getExecutor().getMaxAttempts());
            assertTrue(props.getExecutor().isRetainWorkspaces());
            assertEquals(3600, props.getWorkspace().getTtlSeconds());
            assertEquals(1024, props.getEvents().getSubscriberQueueCapacity());
            assertEquals("file", props.getCheckpoint().getStore());
            assertEquals(1, props.getCheckpoint().getInterval());
        }

        @Test
        @DisplayName("toExecutorConfig carries every executor setting")
        void toExecutorConfig() {
            var props = new EngineProperties();
            props.getExecutor().setMaxConcurrency(8);
            props.getExecutor().setNodeTimeoutSeconds(30);
            props.getExecutor().setErrorPolicy(ErrorPolicy.CONTINUE);
            props.getCheckpoint().setInterval(5);

            ExecutorConfig config = props.toExecutorConfig();

            assertEquals(8, config.maxConcurrency());
            assertEquals(Duration.ofSeconds(30), config.nodeTimeout());
            assertEquals(ErrorPolicy.CONTINUE, config.errorPolicy());
            assertEquals(5, config.checkpointInterval());
        }
    }

    // -- Wiring ----------------------------------------------------------------

    @Nested
    @DisplayName("context")
    class Context {

        @Test
        @DisplayName("wires the engine with defaults")
        void wiresEngine() {
            contextRunner.run(context -> {
                assertNotNull(context.getBean(GraphRunService.class));
                assertNotNull(context.getBean(WorkspaceManager.class));
                assertNotNull(context.getBean(MeterRegistry.class));
                assertInstanceOf(FileCheckpointStore.class, context.getBean(CheckpointStore.class));
                assertEquals(ErrorPolicy.STOP_GRAPH, context.getBean(GraphExecutor.class).config().errorPolicy());
            });
        }

        @Test
        @DisplayName("binds stitchwork.* properties")
        void bindsProperties() {
            contextRunner
                    .withPropertyValues(
                            "stitchwork.executor.max-concurrency=2",
                            "stitchwork.executor.error-policy=SKIP_DOWNSTREAM",
                            "stitchwork.checkpoint.store=memory")
                    .run(context -> {
                        ExecutorConfig config = context.getBean(GraphExecutor.class).config();
                        assertEquals(2, config.maxConcurrency());
                        assertEquals(ErrorPolicy.SKIP_DOWNSTREAM, config.errorPolicy());
                        assertInstanceOf(InMemoryCheckpointStore.class, context.getBean(CheckpointStore.class));
                    });
        }

        @Test
        @DisplayName("checkpoint directory comes from configuration")
        void checkpointDirectory() {
            contextRunner
                    .withPropertyValues("stitchwork.checkpoint.directory=/tmp/stitchwork-test-cp")
                    .run(context -> {
                        var store = (FileCheckpointStore) context.getBean(CheckpointStore.class);
                        assertEquals(Path.of("/tmp/stitchwork-test-cp"), store.directory());
                    });
        }

        @Test
        @DisplayName("a host-supplied validator replaces the permissive default")
        void customValidator() {
            contextRunner
                    .withBean(StructuralValidator.class, BalancedDelimiterValidator::new)
                    .run(context -> assertInstanceOf(BalancedDelimiterValidator.class,
                            context.getBean(StructuralValidator.class)));
        }
    }
}
