package com.example.assetconv;

import com.example.assetconv.render.Java2dRasterizer;
import com.example.assetconv.render.PngImageEncoder;
import com.example.assetconv.render.SvgImageLoader;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Runs one batch: feeds every non-empty input line to a {@link WorkerPool}, then
 * drains and joins the pool so all conversions have finished before returning.
 */
public final class ConversionDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionDriver.class);

    private final ConverterConfig config;
    private final ConversionPipeline pipeline;
    private final DedupLedger ledger;

    public ConversionDriver(ConverterConfig config, OutputPublisher publisher) {
        this(config, defaultPipeline(config, publisher));
    }

    ConversionDriver(ConverterConfig config, ConversionPipeline pipeline) {
        this.config = config;
        this.pipeline = pipeline;
        this.ledger = new DedupLedger(config.ledgerFileName(), config.memoryCacheEnabled());
    }

    /**
     * Consumes {@code input} until end of stream and returns the totals for the run.
     */
    public RunSummary run(BufferedReader input) throws IOException, InterruptedException {
        Instant startedAt = Instant.now();
        prepareScopeDirectory(config.scopeDirectory());

        ConversionStats stats = new ConversionStats();
        int workerCount;
        try (WorkerPool pool = new WorkerPool(
                config.workerCount(),
                config.scopeDirectory(),
                config.pollTimeoutMillis(),
                new RequestParser(),
                ledger,
                pipeline,
                stats)) {
            workerCount = pool.workerCount();
            String line;
            while ((line = input.readLine()) != null) {
                if (!line.isEmpty()) {
                    pool.parseAndQueue(line);
                }
            }
            pool.drain();
        }

        RunSummary summary = RunSummary.from(stats, workerCount, startedAt, Instant.now());
        LOGGER.info("Run finished: {} queued, {} converted, {} skipped, {} failed, {} rejected.",
                summary.queued(), summary.converted(), summary.skipped(), summary.failed(), summary.rejected());
        if (config.summaryFile().isPresent()) {
            new RunSummaryWriter(config.summaryFile().get()).write(summary);
        }
        return summary;
    }

    private void prepareScopeDirectory(Path scopeDirectory) {
        try {
            Files.createDirectories(scopeDirectory);
        } catch (IOException ex) {
            LOGGER.warn("Could not create scope directory {}; duplicates will not be detected.", scopeDirectory, ex);
        }
    }

    private static ConversionPipeline defaultPipeline(ConverterConfig config, OutputPublisher publisher) {
        return new ConversionPipeline(
                new SvgImageLoader(new Tika()),
                new Java2dRasterizer(),
                new PngImageEncoder(),
                config.referenceWidth(),
                publisher
        );
    }
}
