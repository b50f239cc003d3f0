package com.example.assetconv;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for one process; safe to update from any worker.
 */
public final class ConversionStats {
    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong converted = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public void recordQueued() {
        queued.incrementAndGet();
    }

    public void recordRejected() {
        rejected.incrementAndGet();
    }

    public void recordDropped(long count) {
        dropped.addAndGet(count);
    }

    public void record(ConversionOutcome outcome) {
        switch (outcome.getStatus()) {
            case CONVERTED -> converted.incrementAndGet();
            case SKIPPED -> skipped.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
        }
    }

    public long queued() {
        return queued.get();
    }

    public long rejected() {
        return rejected.get();
    }

    public long skipped() {
        return skipped.get();
    }

    public long converted() {
        return converted.get();
    }

    public long failed() {
        return failed.get();
    }

    public long dropped() {
        return dropped.get();
    }
}
