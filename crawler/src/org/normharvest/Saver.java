package org.normharvest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.jetbrains.annotations.Nullable;
import org.normharvest.util.OutputPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Background writer that owns the output trees. Workers enqueue records; a single thread writes them as JSON
 * files so no two threads ever touch the same file.
 * <p>
 * On {@link #stop()} the thread finishes its current item, then drains whatever is still queued, successes first,
 * before exiting. A document that fails to write is rerouted to the error tree. Records enqueued after the thread
 * has exited are written by the calling thread.
 */
public class Saver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Saver.class);
    private static final long IDLE_SLEEP_MILLIS = 100;
    private final Path saveDir;
    private final Path errorDir;
    private final int maxPathLength;
    private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private final BlockingQueue<DocumentRecord> successes = new LinkedBlockingQueue<>();
    private final BlockingQueue<ErrorRecord> errors = new LinkedBlockingQueue<>();
    private final @Nullable Integer checkpoint;
    private final Thread thread;
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean running;
    private volatile boolean finished;
    private final AtomicLong saved = new AtomicLong();
    private final AtomicLong errorsSaved = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();

    public Saver(Path saveDir, Path errorDir, int maxPathLength) throws IOException {
        this.saveDir = saveDir;
        this.errorDir = errorDir;
        this.maxPathLength = maxPathLength;
        Files.createDirectories(saveDir);
        this.checkpoint = scanCheckpoint(saveDir);
        this.thread = new Thread(this::run, "saver");
        if (checkpoint != null) log.info("Found previous output in {}, checkpoint year {}", saveDir, checkpoint);
    }

    /**
     * The newest year directory under {@code dir} minus one, since the newest year may have been interrupted
     * part way through.
     */
    static @Nullable Integer scanCheckpoint(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return null;
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.isEmpty() && name.chars().allMatch(Character::isDigit) && name.length() < 10)
                    .map(Integer::parseInt)
                    .max(Integer::compare)
                    .map(year -> year - 1)
                    .orElse(null);
        }
    }

    public @Nullable Integer checkpoint() {
        return checkpoint;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("Saver already started");
        running = true;
        thread.start();
    }

    public void enqueueSuccess(DocumentRecord record) {
        successes.add(record);
        if (finished) writeLate(record.title());
    }

    public void enqueueError(ErrorRecord record) {
        errors.add(record);
        if (finished) writeLate(record.title());
    }

    private void writeLate(String title) {
        log.debug("Saver has stopped, writing {} directly", title);
        synchronized (this) {
            drain();
        }
    }

    private void run() {
        try {
            while (running) {
                DocumentRecord success = successes.poll();
                ErrorRecord error = errors.poll();
                if (success == null && error == null) {
                    Thread.sleep(IDLE_SLEEP_MILLIS);
                    continue;
                }
                if (success != null) writeSuccess(success);
                if (error != null) writeError(error);
            }
        } catch (InterruptedException e) {
            log.warn("Saver interrupted, draining queues");
        }
        drain();
        finish();
        log.info("Saver finished: {} documents saved, {} errors saved, {} failed writes", saved.get(),
                errorsSaved.get(), failedWrites.get());
    }

    /**
     * Hands writing over to the enqueuing threads. Anything added before they could see the flag is drained here.
     */
    private synchronized void finish() {
        finished = true;
        drain();
    }

    private void drain() {
        int pending = successes.size() + errors.size();
        if (pending > 0) log.info("Saving {} queued records", pending);
        DocumentRecord success;
        while ((success = successes.poll()) != null) {
            writeSuccess(success);
        }
        // includes documents rerouted by failed writes above
        ErrorRecord error;
        while ((error = errors.poll()) != null) {
            writeError(error);
        }
    }

    private void writeSuccess(DocumentRecord record) {
        Path file = null;
        try {
            file = pathFor(saveDir, record);
            write(file, record);
            saved.incrementAndGet();
        } catch (IOException | RuntimeException e) {
            failedWrites.incrementAndGet();
            log.atError().addKeyValue("path", file).log("Failed to save {}: {}", record.title(), e.toString());
            errors.add(ErrorRecord.failedWrite(record, e.toString()));
        }
    }

    private void writeError(ErrorRecord record) {
        Path file = null;
        try {
            file = pathFor(errorDir, record);
            write(file, record);
            errorsSaved.incrementAndGet();
        } catch (IOException | RuntimeException e) {
            failedWrites.incrementAndGet();
            log.atError().addKeyValue("path", file).log("Failed to save error record {}: {}", record.title(),
                    e.toString());
        }
    }

    private Path pathFor(Path base, HarvestRecord record) {
        Path directory = OutputPaths.directory(base, record.year(), record.type(), record.situation());
        return OutputPaths.file(directory, record.title(), record.fileUrl(), maxPathLength);
    }

    private void write(Path file, HarvestRecord record) throws IOException {
        Files.createDirectories(file.getParent());
        writer.writeValue(file.toFile(), record.toJson());
        log.debug("Saved {}", file);
    }

    /**
     * Asks the writer thread to finish. Queued records are still written; use {@link #join()} to wait for that.
     */
    public void stop() {
        running = false;
    }

    public void join() throws InterruptedException {
        if (started.get()) thread.join();
    }

    /**
     * Stops the writer and waits until everything queued is on disk. Safe to call more than once and from a
     * shutdown hook.
     */
    @Override
    public void close() {
        stop();
        if (!started.get()) {
            finish();
            return;
        }
        try {
            join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the saver to finish");
        }
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    public int pending() {
        return successes.size() + errors.size();
    }

    public long savedCount() {
        return saved.get();
    }

    public long errorsSavedCount() {
        return errorsSaved.get();
    }

    public long failedWriteCount() {
        return failedWrites.get();
    }

    public Path saveDir() {
        return saveDir;
    }

    public Path errorDir() {
        return errorDir;
    }
}
