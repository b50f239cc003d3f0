package com.example.assetconv;

import java.nio.file.Path;

/**
 * Result of handling one request. Failures carry the reason that was logged.
 */
public final class ConversionOutcome {
    public enum Status {
        CONVERTED,
        SKIPPED,
        FAILED
    }

    private final ConversionRequest request;
    private final Status status;
    private final Path output;
    private final String failureReason;

    private ConversionOutcome(ConversionRequest request, Status status, Path output, String failureReason) {
        this.request = request;
        this.status = status;
        this.output = output;
        this.failureReason = failureReason;
    }

    public static ConversionOutcome converted(ConversionRequest request, Path output) {
        return new ConversionOutcome(request, Status.CONVERTED, output, null);
    }

    public static ConversionOutcome skipped(ConversionRequest request) {
        return new ConversionOutcome(request, Status.SKIPPED, null, null);
    }

    public static ConversionOutcome failed(ConversionRequest request, String reason) {
        return new ConversionOutcome(request, Status.FAILED, null, reason);
    }

    public boolean isSuccess() {
        return status == Status.CONVERTED;
    }

    public ConversionRequest getRequest() {
        return request;
    }

    public Status getStatus() {
        return status;
    }

    public Path getOutput() {
        return output;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
