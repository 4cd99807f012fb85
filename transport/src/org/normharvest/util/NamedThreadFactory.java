package org.normharvest.util;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon threads named {@code {stage}-{n}} so log lines show which stage and worker they came from.
 */
public class NamedThreadFactory implements ThreadFactory {
    private static final Logger log = LoggerFactory.getLogger(NamedThreadFactory.class);
    private final String stage;
    private final AtomicInteger counter = new AtomicInteger();

    public NamedThreadFactory(String stage) {
        this.stage = stage;
    }

    @Override
    public Thread newThread(@NotNull Runnable task) {
        var thread = new Thread(task, stage + "-" + counter.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in {}", t.getName(), e));
        return thread;
    }

    public int threadsCreated() {
        return counter.get();
    }
}
