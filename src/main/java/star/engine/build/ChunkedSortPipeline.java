package star.engine.build;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import star.engine.catalog.CatalogBuildException;
import star.engine.catalog.CatalogSchema;
import star.engine.catalog.InvalidRecordException;
import star.engine.index.SpatialIndexer;
import star.engine.storage.Record;
import star.engine.storage.RunFileWriter;

/**
 * Turns a single-pass record stream into sorted run files with bounded memory.
 *
 * Each record is validated, filtered, given its pk and spatial index, and buffered.
 * A full buffer (or the end of input) becomes a chunk that a worker sorts and spills
 * to a run file. At most workerThreads + 1 chunks are in flight, and runs are
 * collected strictly in arrival order.
 *
 * Buffers and counters belong to one run of {@link #run}; instances are not reusable.
 */
public class ChunkedSortPipeline {
    static final int MAX_KEPT_ERRORS = 100;
    static final String WORKER_THREAD_PREFIX = "chunk-sorter-";
    private static final long WORKER_SHUTDOWN_SECONDS = 60;
    private static final Logger log = LoggerFactory.getLogger(ChunkedSortPipeline.class);

    private final BuildConfig config;
    private final RecordFilter filter;
    private final BuildObserver observer;
    private final Path runDir;
    private final CatalogSchema schema;
    private final RecordConverter converter;
    private final SortOrder order;

    // State
    private long sequence;
    private long accepted;
    private long rejected;
    private long invalid;
    private final List<String> errors = new ArrayList<>();
    private final List<Path> runs = new ArrayList<>();
    private final Deque<Future<Path>> inFlight = new ArrayDeque<>();
    private final List<Integer> inFlightSizes = new ArrayList<>();
    private int chunkCount;

    public ChunkedSortPipeline(BuildConfig config, RecordFilter filter, BuildObserver observer, Path runDir) {
        this.config = config;
        this.filter = filter;
        this.observer = observer;
        this.runDir = runDir;
        this.schema = config.schema();
        this.converter = new RecordConverter(schema, new SpatialIndexer(config.spatialResolution()));
        this.order = new SortOrder(schema, config.sortingColumns());
    }

    /** Consumes the input to exhaustion and returns run files in arrival order. */
    public List<Path> run(Iterator<SourceRecord> input) {
        ExecutorService workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
        try {
            List<Record> buffer = new ArrayList<>(Math.min(config.chunkSize(), 1 << 16));
            while (input.hasNext()) {
                SourceRecord src = input.next();
                sequence++;
                Record record = offer(src);
                if (record == null) continue;
                buffer.add(record);
                if (buffer.size() >= config.chunkSize()) {
                    submit(workers, buffer);
                    buffer = new ArrayList<>(Math.min(config.chunkSize(), 1 << 16));
                }
            }
            if (!buffer.isEmpty()) submit(workers, buffer);
            while (!inFlight.isEmpty()) collectOldest();
            log.debug("Pipeline done: {} records seen, {} chunks", sequence, chunkCount);
            return Collections.unmodifiableList(runs);
        } catch (RuntimeException e) {
            for (Future<Path> f : inFlight) f.cancel(true);
            throw e;
        } finally {
            workers.shutdownNow();
            awaitWorkers(workers);
        }
    }

    // Cleanup of the run directory must not race a worker that is still writing its run file.
    private void awaitWorkers(ExecutorService workers) {
        try {
            if (!workers.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Chunk sorters did not stop within {}s, run files under {} may still be written",
                    WORKER_SHUTDOWN_SECONDS, runDir);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for chunk sorters to stop", e);
        }
    }

    /** Validates, filters and numbers one record. Returns null when it is not accepted. */
    private Record offer(SourceRecord src) {
        List<Object> validated;
        try {
            validated = converter.validate(src);
        } catch (InvalidRecordException e) {
            invalid++;
            if (errors.size() < MAX_KEPT_ERRORS) errors.add("record #" + sequence + ": " + e.getMessage());
            observer.onRecordInvalid(sequence, e);
            if (config.strict()) {
                throw new CatalogBuildException("Strict build aborted at record #" + sequence + ": " + e.getMessage(), e);
            }
            return null;
        }
        if (!filter.accept(src)) {
            rejected++;
            return null;
        }
        accepted++;
        return converter.accept(validated, accepted);
    }

    private void submit(ExecutorService workers, List<Record> chunk) {
        int index = chunkCount++;
        Path runFile = runDir.resolve(String.format("run-%06d.bin", index));
        inFlight.addLast(workers.submit(() -> {
            chunk.sort(order);
            RunFileWriter.write(runFile, schema.columns(), chunk);
            return runFile;
        }));
        inFlightSizes.add(chunk.size());
        while (inFlight.size() > config.workerThreads()) collectOldest();
    }

    private void collectOldest() {
        Future<Path> oldest = inFlight.removeFirst();
        int size = inFlightSizes.remove(0);
        try {
            runs.add(oldest.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogBuildException("Interrupted while sorting chunk " + runs.size(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw new CatalogBuildException("Failed spilling chunk " + runs.size() + " to " + runDir, io);
            }
            throw new CatalogBuildException("Failed sorting chunk " + runs.size(), cause);
        }
        observer.onChunkSpilled(runs.size() - 1, size);
    }

    public long accepted() { return accepted; }
    public long rejected() { return rejected; }
    public long invalid() { return invalid; }
    public List<String> errors() { return Collections.unmodifiableList(errors); }
    public List<String> sortKeyColumns() { return order.keyColumns(); }
    public SortOrder order() { return order; }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, WORKER_THREAD_PREFIX + pool + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
