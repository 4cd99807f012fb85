package org.normharvest.browser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fixed-size pool of expensive handles (browser sessions) that can only serve one caller at a time.
 *
 * <p>{@link #acquire()} blocks until a slot is free; {@link #release(Object)} gives it back. Releasing a handle
 * the pool doesn't know, or one that is already free, does nothing.</p>
 */
public class ResourcePool<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);
    private final List<Slot<T>> slots;
    private final Semaphore permits;
    private final Consumer<? super T> closer;
    private volatile boolean closed;

    public ResourcePool(int size, Supplier<? extends T> factory, Consumer<? super T> closer) {
        if (size < 1) throw new IllegalArgumentException("pool size must be at least 1");
        this.closer = closer;
        this.permits = new Semaphore(size, true);
        var slots = new ArrayList<Slot<T>>(size);
        try {
            for (int i = 0; i < size; i++) {
                slots.add(new Slot<>(i, factory.get()));
                log.info("Resource {} initialized", i);
            }
        } catch (RuntimeException e) {
            for (var slot : slots) closeQuietly(slot.handle);
            throw e;
        }
        this.slots = List.copyOf(slots);
    }

    /**
     * Blocks until a handle is free and marks it as in use.
     */
    public T acquire() throws InterruptedException {
        if (closed) throw new IllegalStateException("Pool is closed");
        permits.acquire();
        synchronized (slots) {
            for (var slot : slots) {
                if (slot.available) {
                    slot.available = false;
                    return slot.handle;
                }
            }
        }
        // a permit always corresponds to a free slot
        permits.release();
        throw new IllegalStateException("No free slot despite available permit");
    }

    public void release(T handle) {
        synchronized (slots) {
            for (var slot : slots) {
                if (slot.handle == handle) {
                    if (slot.available) return;
                    slot.available = true;
                    permits.release();
                    return;
                }
            }
        }
        log.debug("Ignoring release of unknown handle {}", handle);
    }

    public <R> R withResource(ResourceFunction<? super T, ? extends R> body) throws Exception {
        T handle = acquire();
        try {
            return body.apply(handle);
        } finally {
            release(handle);
        }
    }

    public int size() {
        return slots.size();
    }

    public int inUse() {
        synchronized (slots) {
            int count = 0;
            for (var slot : slots) {
                if (!slot.available) count++;
            }
            return count;
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        for (var slot : slots) {
            closeQuietly(slot.handle);
        }
    }

    private void closeQuietly(T handle) {
        try {
            closer.accept(handle);
        } catch (RuntimeException e) {
            log.warn("Error closing pooled resource", e);
        }
    }

    @FunctionalInterface
    public interface ResourceFunction<T, R> {
        R apply(T handle) throws Exception;
    }

    private static final class Slot<T> {
        final int id;
        final T handle;
        boolean available = true;

        Slot(int id, T handle) {
            this.id = id;
            this.handle = handle;
        }

        @Override
        public String toString() {
            return "Slot{" + id + (available ? ", available" : ", in use") + "}";
        }
    }
}
