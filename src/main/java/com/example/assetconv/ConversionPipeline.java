package com.example.assetconv;

import com.example.assetconv.render.ImageEncoder;
import com.example.assetconv.render.Rasterizer;
import com.example.assetconv.render.VectorImage;
import com.example.assetconv.render.VectorImageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads, rasterizes, encodes and writes one request. Holds no per-request state,
 * so a single instance is shared by every worker.
 */
public final class ConversionPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionPipeline.class);
    private static final Logger PROGRESS = LoggerFactory.getLogger(ProgressLog.NAME);

    private final VectorImageLoader loader;
    private final Rasterizer rasterizer;
    private final ImageEncoder encoder;
    private final float referenceWidth;
    private final OutputPublisher publisher;

    public ConversionPipeline(VectorImageLoader loader,
                              Rasterizer rasterizer,
                              ImageEncoder encoder,
                              float referenceWidth) {
        this(loader, rasterizer, encoder, referenceWidth, OutputPublisher.noop());
    }

    public ConversionPipeline(VectorImageLoader loader,
                              Rasterizer rasterizer,
                              ImageEncoder encoder,
                              float referenceWidth,
                              OutputPublisher publisher) {
        if (referenceWidth <= 0) {
            throw new IllegalArgumentException("Reference width must be positive: " + referenceWidth);
        }
        this.loader = loader;
        this.rasterizer = rasterizer;
        this.encoder = encoder;
        this.referenceWidth = referenceWidth;
        this.publisher = publisher == null ? OutputPublisher.noop() : publisher;
    }

    public ConversionOutcome convert(ConversionRequest request) {
        PROGRESS.info("Running for {}...", request.sourcePath());
        ConversionOutcome outcome;
        try {
            byte[] encoded = render(request);
            Path output = write(Path.of(request.destPath()), encoded);
            publisher.publish(output);
            outcome = ConversionOutcome.converted(request, output);
        } catch (IOException | RuntimeException ex) {
            LOGGER.error("Exception while processing {}: {}", request.sourcePath(), ex.getMessage());
            LOGGER.debug("Failure details for {}", request.sourcePath(), ex);
            outcome = ConversionOutcome.failed(request, String.valueOf(ex.getMessage()));
        }
        PROGRESS.info("Done for {}.", request.sourcePath());
        return outcome;
    }

    private byte[] render(ConversionRequest request) throws IOException {
        int size = request.targetSize();
        float scale = size / referenceWidth;

        VectorImage image = loader.load(Path.of(request.sourcePath()));
        BufferedImage raster = rasterizer.rasterize(image, 0f, 0f, scale, size, size);

        AtomicReference<byte[]> result = new AtomicReference<>();
        encoder.encode(raster, result::set);
        byte[] encoded = result.get();
        if (encoded == null) {
            throw new IOException("Error in image encoder: no data produced for " + request.sourcePath());
        }
        return encoded;
    }

    private Path write(Path destination, byte[] encoded) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // Plain create so the umask applies, as for any directly written file.
        Path temp = destination.resolveSibling(
                destination.getFileName() + "." + Thread.currentThread().getId() + ".part");
        try {
            Files.write(temp, encoded);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        return destination;
    }
}
