package com.example.assetconv;

import java.nio.file.Path;

/**
 * One unit of work: render {@code sourcePath} into a square PNG of
 * {@code targetSize} pixels at {@code destPath}.
 */
public record ConversionRequest(
        String sourcePath,
        String destPath,
        int targetSize
) {
    public ConversionRequest {
        if (sourcePath == null || destPath == null) {
            throw new IllegalArgumentException("Source and destination paths are required.");
        }
        if (targetSize <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + targetSize);
        }
    }

    /**
     * Base name of the source file without its extension; the key used by the dedup ledger.
     */
    public String sourceIdentity() {
        Path fileName = Path.of(sourcePath).getFileName();
        String name = fileName == null ? sourcePath : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
