package com.example.assetconv;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded FIFO of pending requests shared by the reader and the workers.
 * {@link #poll(long)} is both the wake-up wait and the atomic pop, so consumers
 * never act on a stale emptiness check.
 */
public final class TaskQueue {
    private final BlockingQueue<ConversionRequest> pending = new LinkedBlockingQueue<>();

    public void push(ConversionRequest request) {
        pending.add(request);
    }

    /**
     * Waits up to {@code timeoutMillis} for a request and removes it from the head.
     */
    public Optional<ConversionRequest> poll(long timeoutMillis) throws InterruptedException {
        return Optional.ofNullable(pending.poll(timeoutMillis, TimeUnit.MILLISECONDS));
    }

    public Optional<ConversionRequest> tryPop() {
        return Optional.ofNullable(pending.poll());
    }

    /**
     * Snapshot only; use it for shutdown polling and diagnostics.
     */
    public boolean isEmpty() {
        return pending.isEmpty();
    }

    int clear() {
        int dropped = 0;
        while (pending.poll() != null) {
            dropped++;
        }
        return dropped;
    }
}
