package com.stitchwork.core.config;

import com.stitchwork.core.executor.ExecutorConfig;
import com.stitchwork.core.model.ErrorPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "stitchwork")
public class EngineProperties {

    private Executor executor = new Executor();
    private Workspace workspace = new Workspace();
    private Events events = new Events();
    private Checkpoint checkpoint = new Checkpoint();

    /**
     * Builds the executor tuning from the {@code stitchwork.executor.*} properties.
     */
    public ExecutorConfig toExecutorConfig() {
        return new ExecutorConfig(
                executor.maxConcurrency,
                Duration.ofSeconds(executor.nodeTimeoutSeconds),
                executor.errorPolicy,
                executor.maxAttempts,
                checkpoint.interval,
                executor.retainWorkspaces);
    }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }

    public static class Executor {
        private int maxConcurrency = 4;
        private int nodeTimeoutSeconds = 300;
        private ErrorPolicy errorPolicy = ErrorPolicy.STOP_GRAPH;
        private int maxAttempts = 2;
        private boolean retainWorkspaces = true;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public int getNodeTimeoutSeconds() { return nodeTimeoutSeconds; }
        public void setNodeTimeoutSeconds(int nodeTimeoutSeconds) { this.nodeTimeoutSeconds = nodeTimeoutSeconds; }
        public ErrorPolicy getErrorPolicy() { return errorPolicy; }
        public void setErrorPolicy(ErrorPolicy errorPolicy) { this.errorPolicy = errorPolicy; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public boolean isRetainWorkspaces() { return retainWorkspaces; }
        public void setRetainWorkspaces(boolean retainWorkspaces) { this.retainWorkspaces = retainWorkspaces; }
    }

    public static class Workspace {
        private int ttlSeconds = 3600;
        private int reaperIntervalSeconds = 60;

        public int getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(int ttlSeconds) { this.ttlSeconds = ttlSeconds; }
        public int getReaperIntervalSeconds() { return reaperIntervalSeconds; }
        public void setReaperIntervalSeconds(int reaperIntervalSeconds) { this.reaperIntervalSeconds = reaperIntervalSeconds; }
    }

    public static class Events {
        private int subscriberQueueCapacity = 1024;

        public int getSubscriberQueueCapacity() { return subscriberQueueCapacity; }
        public void setSubscriberQueueCapacity(int subscriberQueueCapacity) { this.subscriberQueueCapacity = subscriberQueueCapacity; }
    }

    public static class Checkpoint {
        /** "file" or "memory". */
        private String store = "file";
        private String directory = ".stitchwork/checkpoints";
        private int interval = 1;

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public int getInterval() { return interval; }
        public void setInterval(int interval) { this.interval = interval; }
    }
}
