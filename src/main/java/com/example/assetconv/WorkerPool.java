package com.example.assetconv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the task queue and a fixed set of worker threads that consume it.
 * <p>
 * Each worker waits on the queue with a bounded timeout, pops one request, asks
 * the {@link DedupLedger} whether the source was already handled under the scope
 * directory and runs the {@link ConversionPipeline} if it was not. Cancellation
 * is cooperative: a running conversion is never interrupted.
 * <p>
 * {@link #drain()} stops intake and waits for the queue to empty before joining
 * the workers. {@link #close()} clears the running flag, joins the workers after
 * their current iteration and drops whatever is still queued.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);
    private static final Logger PROGRESS = LoggerFactory.getLogger(ProgressLog.NAME);
    static final int DEFAULT_WORKER_COUNT = 1;

    private final TaskQueue queue = new TaskQueue();
    private final RequestParser parser;
    private final DedupLedger ledger;
    private final ConversionPipeline pipeline;
    private final Path scopeDirectory;
    private final long pollTimeoutMillis;
    private final ConversionStats stats;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Object intakeLock = new Object();
    private final List<Thread> workers;
    private volatile boolean accepting = true;

    public WorkerPool(int workerCount,
                      Path scopeDirectory,
                      long pollTimeoutMillis,
                      RequestParser parser,
                      DedupLedger ledger,
                      ConversionPipeline pipeline,
                      ConversionStats stats) {
        this.parser = parser;
        this.ledger = ledger;
        this.pipeline = pipeline;
        this.scopeDirectory = scopeDirectory;
        this.pollTimeoutMillis = pollTimeoutMillis;
        this.stats = stats;

        int count = workerCount;
        if (count <= 0) {
            LOGGER.warn("Warning, incorrect number of threads ({}), setting to {}", count, DEFAULT_WORKER_COUNT);
            count = DEFAULT_WORKER_COUNT;
        }
        LOGGER.info("Number of active threads: {}", count);

        List<Thread> started = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Thread worker = new Thread(this::processQueue, "convert-worker-" + (i + 1));
            worker.start();
            started.add(worker);
        }
        this.workers = List.copyOf(started);
    }

    /**
     * Parses one input line and queues it. Returns false if the line was rejected
     * or the pool no longer accepts work.
     */
    public boolean parseAndQueue(String line) {
        Optional<ConversionRequest> request = parser.parse(line);
        if (request.isEmpty()) {
            stats.recordRejected();
            return false;
        }
        if (!enqueue(request.get())) {
            return false;
        }
        PROGRESS.info("Queueing task '{}'.", line);
        return true;
    }

    public boolean enqueue(ConversionRequest request) {
        synchronized (intakeLock) {
            if (!accepting) {
                LOGGER.warn("Pool is shutting down; ignoring request for {}", request.sourcePath());
                return false;
            }
            queue.push(request);
        }
        stats.recordQueued();
        return true;
    }

    /**
     * Converts one request on the calling thread, bypassing the queue and the ledger.
     */
    public ConversionOutcome runNow(ConversionRequest request) {
        ConversionOutcome outcome = pipeline.convert(request);
        stats.record(outcome);
        return outcome;
    }

    public boolean isQueueEmpty() {
        return queue.isEmpty();
    }

    public int workerCount() {
        return workers.size();
    }

    public ConversionStats stats() {
        return stats;
    }

    /**
     * Stops accepting work, lets the workers empty the queue and joins them.
     */
    public void drain() throws InterruptedException {
        synchronized (intakeLock) {
            accepting = false;
        }
        for (Thread worker : workers) {
            worker.join();
        }
    }

    @Override
    public void close() {
        running.set(false);
        synchronized (intakeLock) {
            accepting = false;
        }
        boolean interrupted = false;
        for (Thread worker : workers) {
            while (true) {
                try {
                    worker.join();
                    break;
                } catch (InterruptedException ex) {
                    // Keep joining; the flag is restored once every worker is gone.
                    interrupted = true;
                    LOGGER.warn("Interrupted while waiting for {} to stop; still waiting.", worker.getName());
                }
            }
        }
        int dropped = queue.clear();
        if (dropped > 0) {
            stats.recordDropped(dropped);
            LOGGER.warn("Dropped {} queued request(s) at shutdown.", dropped);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    ConversionOutcome process(ConversionRequest request) {
        ConversionOutcome outcome;
        try {
            if (ledger.seenOrRecord(request.sourceIdentity(), scopeDirectory)) {
                outcome = ConversionOutcome.skipped(request);
            } else {
                outcome = pipeline.convert(request);
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Exception while processing {}: {}", request.sourcePath(), ex.getMessage(), ex);
            outcome = ConversionOutcome.failed(request, String.valueOf(ex.getMessage()));
        }
        stats.record(outcome);
        return outcome;
    }

    private void processQueue() {
        while (running.get()) {
            Optional<ConversionRequest> next;
            try {
                next = queue.poll(pollTimeoutMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warn("{} interrupted; exiting.", Thread.currentThread().getName());
                return;
            }
            if (next.isPresent()) {
                process(next.get());
            } else if (!accepting && queue.isEmpty()) {
                return;
            }
        }
    }
}
