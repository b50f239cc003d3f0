package com.example.assetconv;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class RunSummaryWriter {
    private final ObjectMapper mapper;
    private final Path summaryPath;

    /**
     * Persists run totals to a single JSON file.
     */
    public RunSummaryWriter(Path summaryPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.summaryPath = summaryPath;
    }

    /**
     * Writes the summary, creating parent directories when needed.
     */
    public void write(RunSummary summary) throws IOException {
        Path parent = summaryPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(summaryPath.toFile(), summary);
    }

    public RunSummary read() throws IOException {
        return mapper.readValue(summaryPath.toFile(), RunSummary.class);
    }
}
