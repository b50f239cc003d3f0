package com.example.assetconv;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for the converter.
 */
public record ConverterConfig(
        int workerCount,
        Path scopeDirectory,
        String ledgerFileName,
        float referenceWidth,
        long pollTimeoutMillis,
        boolean memoryCacheEnabled,
        Optional<Path> summaryFile,
        boolean s3PublishEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    public static ConverterConfig defaults() {
        return new ConverterConfig(
                ConfigLoader.DEFAULT_WORKER_COUNT,
                Path.of(ConfigLoader.DEFAULT_SCOPE_DIRECTORY),
                DedupLedger.DEFAULT_FILE_NAME,
                ConfigLoader.DEFAULT_REFERENCE_WIDTH,
                ConfigLoader.DEFAULT_POLL_TIMEOUT_MILLIS,
                false,
                Optional.empty(),
                false,
                Optional.empty(),
                Optional.empty(),
                Optional.empty()
        );
    }

    public ConverterConfig withWorkerCount(int count) {
        return new ConverterConfig(
                count,
                scopeDirectory,
                ledgerFileName,
                referenceWidth,
                pollTimeoutMillis,
                memoryCacheEnabled,
                summaryFile,
                s3PublishEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }
}
