package org.normharvest.browser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResourcePoolTest {
    @Test
    void neverHandsOutMoreThanPoolSize() throws Exception {
        var created = new AtomicInteger();
        var closed = new CopyOnWriteArrayList<String>();
        var current = new AtomicInteger();
        var peak = new AtomicInteger();
        try (var pool = new ResourcePool<>(3, () -> "driver-" + created.getAndIncrement(), closed::add)) {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                var futures = new ArrayList<Future<?>>();
                for (int i = 0; i < 40; i++) {
                    futures.add(executor.submit(() -> pool.withResource(driver -> {
                        int now = current.incrementAndGet();
                        peak.accumulateAndGet(now, Math::max);
                        Thread.sleep(5);
                        current.decrementAndGet();
                        return driver;
                    })));
                }
                for (var future : futures) future.get(30, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(3, created.get());
            assertTrue(peak.get() <= 3, "peak " + peak.get());
            assertEquals(0, pool.inUse());
        }
        assertEquals(List.of("driver-0", "driver-1", "driver-2"), closed);
    }

    @Test
    void releaseUnblocksWaitingThread() throws Exception {
        try (var pool = new ResourcePool<>(1, Object::new, handle -> {})) {
            Object handle = pool.acquire();
            var waiter = CompletableFuture.supplyAsync(() -> {
                try {
                    return pool.acquire();
                } catch (InterruptedException e) {
                    throw new CompletionException(e);
                }
            });
            Thread.sleep(50);
            assertFalse(waiter.isDone());
            pool.release(handle);
            assertSame(handle, waiter.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void releaseIsIdempotentAndIgnoresStrangers() throws Exception {
        try (var pool = new ResourcePool<>(2, Object::new, handle -> {})) {
            Object first = pool.acquire();
            assertEquals(1, pool.inUse());
            pool.release(first);
            pool.release(first);
            pool.release(new Object());
            assertEquals(0, pool.inUse());
            pool.acquire();
            pool.acquire();
            assertEquals(2, pool.inUse());
        }
    }

    @Test
    void failedFactoryClosesWhatWasCreated() {
        var closed = new ArrayList<String>();
        var count = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> new ResourcePool<String>(3, () -> {
            if (count.get() == 2) throw new IllegalStateException("chrome crashed");
            return "driver-" + count.getAndIncrement();
        }, closed::add));
        assertEquals(List.of("driver-0", "driver-1"), closed);
    }

    @Test
    void acquireAfterCloseFails() {
        var pool = new ResourcePool<>(1, Object::new, handle -> {});
        pool.close();
        assertThrows(IllegalStateException.class, pool::acquire);
    }
}
