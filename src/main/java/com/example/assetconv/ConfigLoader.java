package com.example.assetconv;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class ConfigLoader {
    static final int DEFAULT_WORKER_COUNT = 1;
    static final String DEFAULT_SCOPE_DIRECTORY = "output";
    static final float DEFAULT_REFERENCE_WIDTH = 48.0f;
    static final long DEFAULT_POLL_TIMEOUT_MILLIS = 100L;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ConverterConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        int workerCount = raw.workerCount != null && raw.workerCount > 0
                ? raw.workerCount
                : DEFAULT_WORKER_COUNT;
        Path scopeDirectory = Path.of(optionalString(raw.scopeDirectory, DEFAULT_SCOPE_DIRECTORY));
        String ledgerFileName = optionalString(raw.ledgerFileName, DedupLedger.DEFAULT_FILE_NAME);
        if (ledgerFileName.contains("/") || ledgerFileName.contains("\\")) {
            throw new IllegalArgumentException("ledgerFileName must be a plain file name: " + ledgerFileName);
        }
        float referenceWidth = raw.referenceWidth != null && raw.referenceWidth > 0
                ? raw.referenceWidth
                : DEFAULT_REFERENCE_WIDTH;
        long pollTimeoutMillis = raw.pollTimeoutMillis != null && raw.pollTimeoutMillis > 0
                ? raw.pollTimeoutMillis
                : DEFAULT_POLL_TIMEOUT_MILLIS;
        boolean memoryCacheEnabled = raw.memoryCacheEnabled != null && raw.memoryCacheEnabled;
        Optional<Path> summaryFile = Optional.ofNullable(raw.summaryFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        boolean s3PublishEnabled = raw.s3PublishEnabled != null && raw.s3PublishEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3PublishEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3PublishEnabled is true.");
        }

        return new ConverterConfig(
                workerCount,
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

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public Integer workerCount;
        public String scopeDirectory;
        public String ledgerFileName;
        public Float referenceWidth;
        public Long pollTimeoutMillis;
        public Boolean memoryCacheEnabled;
        public String summaryFile;
        public Boolean s3PublishEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
