package org.normharvest.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Staged fan-out/fan-in over a bounded thread pool.
 *
 * <p>Each call gets its own pool so that a task may itself fan out (for example per-document
 * extraction inside a link discovery stage) without starving the outer stage.</p>
 */
public final class Workers {
    private static final Logger log = LoggerFactory.getLogger(Workers.class);

    private Workers() {
    }

    @FunctionalInterface
    public interface Task<T, R> {
        R apply(T item) throws Exception;
    }

    /**
     * Applies {@code task} to every item using at most {@code maxWorkers} threads and returns the results in the
     * same order as the input. Blocks until every task has finished.
     *
     * @throws ExecutionException if any task failed, carrying the first failure as its cause
     */
    public static <T, R> List<R> fanOut(String name, int maxWorkers, Collection<? extends T> items,
                                        Task<? super T, ? extends R> task)
            throws ExecutionException, InterruptedException {
        if (items.isEmpty()) return List.of();
        int threads = Math.max(1, Math.min(maxWorkers, items.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, new NamedThreadFactory(name));
        try {
            var futures = new ArrayList<Future<R>>(items.size());
            for (T item : items) {
                Callable<R> callable = () -> task.apply(item);
                futures.add(executor.submit(callable));
            }
            var results = new ArrayList<R>(futures.size());
            ExecutionException failure = null;
            for (var future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    if (failure == null) failure = e;
                    else log.debug("Suppressed additional {} failure", name, e.getCause());
                    results.add(null);
                }
            }
            if (failure != null) throw failure;
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
