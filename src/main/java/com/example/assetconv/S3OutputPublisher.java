package com.example.assetconv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Uploads produced images to S3. Uploads run one at a time on a dedicated
 * executor; {@link #close()} waits for the backlog before closing the client.
 */
public final class S3OutputPublisher implements OutputPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3OutputPublisher.class);
    private static final String CONTENT_TYPE = "image/png";
    private static final long CLOSE_TIMEOUT_MINUTES = 10;

    private final S3Client s3Client;
    private final ExecutorService uploads;
    private final Path baseDirectory;
    private final String bucket;
    private final String keyPrefix;
    private final AtomicLong failedUploads = new AtomicLong();

    public S3OutputPublisher(String bucket, String prefix, Optional<String> region) {
        this(region.map(Region::of)
                        .map(r -> S3Client.builder().region(r).build())
                        .orElseGet(() -> S3Client.builder().build()),
                Path.of("").toAbsolutePath(),
                bucket,
                prefix);
    }

    S3OutputPublisher(S3Client s3Client, Path baseDirectory, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.bucket = bucket;
        String trimmed = prefix == null ? "" : prefix.replaceAll("/+$", "");
        this.keyPrefix = trimmed.isEmpty() ? "" : trimmed + "/";
        this.uploads = Executors.newSingleThreadExecutor(task -> new Thread(task, "s3-publish"));
    }

    @Override
    public void publish(Path output) {
        String key = keyFor(output);
        try {
            uploads.execute(() -> upload(output, key));
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Publisher closed; {} was not uploaded.", output);
        }
    }

    @Override
    public void close() {
        uploads.shutdown();
        try {
            if (!uploads.awaitTermination(CLOSE_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                LOGGER.warn("Gave up waiting for pending S3 uploads.");
                uploads.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            uploads.shutdownNow();
        } finally {
            s3Client.close();
        }
        if (failedUploads.get() > 0) {
            LOGGER.warn("{} upload(s) to s3://{} failed.", failedUploads.get(), bucket);
        }
    }

    String keyFor(Path output) {
        Path normalized = output.toAbsolutePath().normalize();
        Path relative = normalized.startsWith(baseDirectory)
                ? baseDirectory.relativize(normalized)
                : normalized.getFileName();
        return keyPrefix + relative.toString().replace("\\", "/");
    }

    private void upload(Path output, String key) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(CONTENT_TYPE)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(output));
            LOGGER.info("Uploaded {} to s3://{}/{}", output, bucket, key);
        } catch (RuntimeException ex) {
            failedUploads.incrementAndGet();
            LOGGER.warn("Failed to upload {} to S3", output, ex);
        }
    }
}
