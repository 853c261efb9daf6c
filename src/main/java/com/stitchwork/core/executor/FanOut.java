package com.stitchwork.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs sub-tasks of one node in parallel and joins them before returning.
 *
 * <p>At most {@code maxParallel} tasks run at once. The first failure cancels the tasks still
 * running and is rethrown; no task outlives the {@link #joinAll} call.
 */
public final class FanOut {

    private static final Logger log = LoggerFactory.getLogger(FanOut.class);

    private final ExecutorService pool;
    private final int maxParallel;

    public FanOut(ExecutorService pool, int maxParallel) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be >= 1");
        }
        this.pool = pool;
        this.maxParallel = maxParallel;
    }

    /**
     * Runs every task and returns their results in input order.
     *
     * @throws ExecutionException   wrapping the first task failure
     * @throws InterruptedException if the caller is interrupted; running tasks are cancelled
     */
    public <T> List<T> joinAll(List<? extends Callable<T>> tasks) throws ExecutionException, InterruptedException {
        int n = tasks.size();
        var results = new ArrayList<T>(n);
        for (int i = 0; i < n; i++) {
            results.add(null);
        }
        if (n == 0) {
            return results;
        }

        var completion = new ExecutorCompletionService<Indexed<T>>(pool);
        var futures = new ArrayList<Future<Indexed<T>>>(n);
        int next = 0;
        try {
            while (next < n && next < maxParallel) {
                futures.add(submit(completion, tasks, next++));
            }
            for (int done = 0; done < n; done++) {
                Indexed<T> r = completion.take().get();
                results.set(r.index(), r.value());
                if (next < n) {
                    futures.add(submit(completion, tasks, next++));
                }
            }
            return results;
        } catch (ExecutionException | InterruptedException e) {
            log.debug("Fan-out aborted after {} of {} task(s) submitted: {}", next, n, e.getMessage());
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
    }

    private static <T> Future<Indexed<T>> submit(ExecutorCompletionService<Indexed<T>> completion,
                                                 List<? extends Callable<T>> tasks, int index) {
        Callable<T> task = tasks.get(index);
        return completion.submit(() -> new Indexed<>(index, task.call()));
    }

    private record Indexed<T>(int index, T value) {}
}
