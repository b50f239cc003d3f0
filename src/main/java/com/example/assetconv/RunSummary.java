package com.example.assetconv;

import java.time.Instant;

/**
 * Serializable totals written at the end of a run.
 */
public record RunSummary(
        Instant startedAt,
        Instant finishedAt,
        int workerCount,
        long queued,
        long rejected,
        long skipped,
        long converted,
        long failed,
        long dropped
) {
    public static RunSummary from(ConversionStats stats, int workerCount, Instant startedAt, Instant finishedAt) {
        return new RunSummary(
                startedAt,
                finishedAt,
                workerCount,
                stats.queued(),
                stats.rejected(),
                stats.skipped(),
                stats.converted(),
                stats.failed(),
                stats.dropped()
        );
    }
}
