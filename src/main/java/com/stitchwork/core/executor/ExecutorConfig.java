package com.stitchwork.core.executor;

import com.stitchwork.core.model.ErrorPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for one {@link GraphExecutor}.
 *
 * @param maxConcurrency     nodes allowed to run at once
 * @param nodeTimeout        wall-clock budget per node, covering all attempts
 * @param errorPolicy        default policy for nodes that do not set their own
 * @param maxAttempts        attempts per node before it is marked failed
 * @param checkpointInterval checkpoint after this many node completions; 0 disables
 * @param retainWorkspaces   keep succeeded workspaces alive until the run ends so checkpoints can capture them
 */
public record ExecutorConfig(
    int maxConcurrency,
    Duration nodeTimeout,
    ErrorPolicy errorPolicy,
    int maxAttempts,
    int checkpointInterval,
    boolean retainWorkspaces
) {

    public ExecutorConfig {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        Objects.requireNonNull(nodeTimeout, "nodeTimeout must not be null");
        if (nodeTimeout.isNegative() || nodeTimeout.isZero()) {
            throw new IllegalArgumentException("nodeTimeout must be positive");
        }
        Objects.requireNonNull(errorPolicy, "errorPolicy must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (checkpointInterval < 0) {
            throw new IllegalArgumentException("checkpointInterval must be >= 0");
        }
    }

    public static ExecutorConfig defaults() {
        return new ExecutorConfig(4, Duration.ofMinutes(5), ErrorPolicy.STOP_GRAPH, 2, 1, true);
    }

    public ExecutorConfig withMaxConcurrency(int n) {
        return new ExecutorConfig(n, nodeTimeout, errorPolicy, maxAttempts, checkpointInterval, retainWorkspaces);
    }

    public ExecutorConfig withNodeTimeout(Duration timeout) {
        return new ExecutorConfig(maxConcurrency, timeout, errorPolicy, maxAttempts, checkpointInterval, retainWorkspaces);
    }

    public ExecutorConfig withErrorPolicy(ErrorPolicy policy) {
        return new ExecutorConfig(maxConcurrency, nodeTimeout, policy, maxAttempts, checkpointInterval, retainWorkspaces);
    }

    public ExecutorConfig withMaxAttempts(int attempts) {
        return new ExecutorConfig(maxConcurrency, nodeTimeout, errorPolicy, attempts, checkpointInterval, retainWorkspaces);
    }

    public ExecutorConfig withCheckpointInterval(int interval) {
        return new ExecutorConfig(maxConcurrency, nodeTimeout, errorPolicy, maxAttempts, interval, retainWorkspaces);
    }
}
