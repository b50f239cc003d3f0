package com.example.assetconv;

/**
 * Logger name for per-request progress lines. {@code logback.xml} sends it to
 * standard error together with warnings and errors.
 */
final class ProgressLog {
    static final String NAME = "com.example.assetconv.progress";

    private ProgressLog() {
    }
}
