package com.example.assetconv;

import com.example.assetconv.render.Java2dRasterizer;
import com.example.assetconv.render.PngImageEncoder;
import com.example.assetconv.render.SvgImageLoader;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ConversionPipelineTest {
    private ConversionPipeline svgPipeline() {
        return new ConversionPipeline(new SvgImageLoader(new Tika()), new Java2dRasterizer(), new PngImageEncoder(), 48f);
    }

    @Test
    void writesSquarePngScaledFromReferenceWidth() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-svg");
        Path source = TestAssets.writeSvg(dir, "icon.svg");
        Path destination = dir.resolve("out/icon.png");

        ConversionOutcome outcome = svgPipeline().convert(new ConversionRequest(source.toString(), destination.toString(), 96));

        assertTrue(outcome.isSuccess());
        assertEquals(destination, outcome.getOutput());
        BufferedImage image = ImageIO.read(destination.toFile());
        assertEquals(96, image.getWidth());
        assertEquals(96, image.getHeight());
        int argb = image.getRGB(90, 90);
        assertEquals(0xFF, (argb >>> 24) & 0xFF);
        assertEquals(0xFF, (argb >>> 16) & 0xFF);
        assertEquals(0x00, argb & 0xFF);
    }

    @Test
    void clipsContentLargerThanTheCanvas() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-clip");
        Path source = dir.resolve("wide.svg");
        Files.writeString(source, """
                <svg xmlns="http://www.w3.org/2000/svg" width="96" height="96">
                  <rect x="24" y="24" width="72" height="72" fill="#0000ff"/>
                </svg>
                """);
        Path destination = dir.resolve("wide.png");

        assertTrue(svgPipeline().convert(new ConversionRequest(source.toString(), destination.toString(), 48)).isSuccess());

        BufferedImage image = ImageIO.read(destination.toFile());
        assertEquals(48, image.getWidth());
        assertEquals(0, (image.getRGB(5, 5) >>> 24) & 0xFF);
        assertEquals(0xFF, image.getRGB(40, 40) & 0xFF);
    }

    @Test
    void missingSourceFailsWithoutOutput() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-missing");
        Path destination = dir.resolve("x.png");

        ConversionOutcome outcome = svgPipeline().convert(
                new ConversionRequest(dir.resolve("missing.svg").toString(), destination.toString(), 32));

        assertEquals(ConversionOutcome.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getFailureReason().contains("missing.svg"));
        assertFalse(Files.exists(destination));
    }

    @Test
    void unparseableSourceFailsWithoutOutput() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-broken");
        Path source = Files.writeString(dir.resolve("broken.svg"), "this is not a vector image");
        Path destination = dir.resolve("broken.png");

        ConversionOutcome outcome = svgPipeline().convert(new ConversionRequest(source.toString(), destination.toString(), 32));

        assertFalse(outcome.isSuccess());
        assertFalse(Files.exists(destination));
    }

    @Test
    void encoderThatNeverCallsTheSinkIsAFailure() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-encoder");
        Path source = Files.writeString(dir.resolve("icon.svg"), "<svg/>");
        Path destination = dir.resolve("icon.png");
        ConversionPipeline pipeline = new ConversionPipeline(
                TestAssets.existenceLoader(),
                TestAssets.blankRasterizer(),
                (image, sink) -> {
                },
                48f);

        ConversionOutcome outcome = pipeline.convert(new ConversionRequest(source.toString(), destination.toString(), 16));

        assertFalse(outcome.isSuccess());
        assertFalse(Files.exists(destination));
    }

    @Test
    void replacesAnExistingDestination() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-replace");
        Path source = Files.writeString(dir.resolve("icon.svg"), "<svg/>");
        Path destination = Files.write(dir.resolve("icon.png"), new byte[] {9, 9, 9, 9, 9, 9, 9, 9});

        assertTrue(TestAssets.fakePipeline(TestAssets.existenceLoader())
                .convert(new ConversionRequest(source.toString(), destination.toString(), 16))
                .isSuccess());

        assertArrayEquals(new byte[] {1, 2, 3, 4}, Files.readAllBytes(destination));
        try (var listing = Files.list(dir)) {
            assertEquals(2L, listing.count());
        }
    }

    @Test
    void passesScaleDerivedFromReferenceWidth() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-scale");
        Path source = Files.writeString(dir.resolve("icon.svg"), "<svg/>");
        List<Float> scales = new ArrayList<>();
        ConversionPipeline pipeline = new ConversionPipeline(
                TestAssets.existenceLoader(),
                (image, x, y, scale, width, height) -> {
                    scales.add(scale);
                    return TestAssets.blankRasterizer().rasterize(image, x, y, scale, width, height);
                },
                TestAssets.fixedBytesEncoder(),
                48f);

        pipeline.convert(new ConversionRequest(source.toString(), dir.resolve("a.png").toString(), 96));
        pipeline.convert(new ConversionRequest(source.toString(), dir.resolve("b.png").toString(), 24));

        assertEquals(List.of(2.0f, 0.5f), scales);
    }

    @Test
    void outputPermissionsMatchAPlainWrite() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-perms");
        assumeTrue(Files.getFileStore(dir).supportsFileAttributeView(PosixFileAttributeView.class));
        Path source = Files.writeString(dir.resolve("icon.svg"), "<svg/>");
        Path destination = dir.resolve("icon.png");
        Path reference = Files.write(dir.resolve("reference.bin"), new byte[] {0});

        assertTrue(TestAssets.fakePipeline(TestAssets.existenceLoader())
                .convert(new ConversionRequest(source.toString(), destination.toString(), 16))
                .isSuccess());

        assertEquals(Files.getPosixFilePermissions(reference), Files.getPosixFilePermissions(destination));
    }

    @Test
    void publishesWrittenOutputs() throws Exception {
        Path dir = Files.createTempDirectory("pipeline-publish");
        Path source = Files.writeString(dir.resolve("icon.svg"), "<svg/>");
        List<Path> published = new ArrayList<>();
        ConversionPipeline pipeline = new ConversionPipeline(
                TestAssets.existenceLoader(),
                TestAssets.blankRasterizer(),
                TestAssets.fixedBytesEncoder(),
                48f,
                published::add);

        pipeline.convert(new ConversionRequest(source.toString(), dir.resolve("icon.png").toString(), 16));
        pipeline.convert(new ConversionRequest(dir.resolve("nope.svg").toString(), dir.resolve("nope.png").toString(), 16));

        assertEquals(List.of(dir.resolve("icon.png")), published);
    }

    @Test
    void rejectsNonPositiveReferenceWidth() {
        assertThrows(IllegalArgumentException.class, () -> new ConversionPipeline(
                TestAssets.existenceLoader(), TestAssets.blankRasterizer(), TestAssets.fixedBytesEncoder(), 0f));
    }
}
