package com.example.assetconv.render;

import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SvgRenderingTest {
    private static final String CIRCLE = """
            <svg xmlns="http://www.w3.org/2000/svg" width="48" height="48">
              <circle cx="24" cy="24" r="12" fill="#00ff00"/>
            </svg>
            """;

    @Test
    void loadsDocumentSize() throws Exception {
        Path file = Files.createTempDirectory("render-load").resolve("circle.svg");
        Files.writeString(file, CIRCLE);

        VectorImage image = new SvgImageLoader(new Tika()).load(file);

        assertEquals(48f, image.width());
        assertEquals(48f, image.height());
        assertEquals(file, image.source());
    }

    @Test
    void rasterizesWithScaleAndLeavesBackgroundTransparent() throws Exception {
        Path file = Files.createTempDirectory("render-raster").resolve("circle.svg");
        Files.writeString(file, CIRCLE);
        VectorImage image = new SvgImageLoader(new Tika()).load(file);

        BufferedImage raster = new Java2dRasterizer().rasterize(image, 0f, 0f, 0.5f, 24, 24);

        assertEquals(24, raster.getWidth());
        assertEquals(0, (raster.getRGB(1, 1) >>> 24) & 0xFF);
        assertEquals(0xFF00FF00, raster.getRGB(12, 12));
    }

    @Test
    void rejectsNonVectorContent() throws Exception {
        Path file = Files.createTempDirectory("render-png").resolve("picture.png");
        BufferedImage pixels = new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB);
        ImageIO.write(pixels, "png", file.toFile());

        assertThrows(IOException.class, () -> new SvgImageLoader(new Tika()).load(file));
    }

    @Test
    void rejectsMissingFile() throws Exception {
        Path missing = Files.createTempDirectory("render-missing").resolve("none.svg");

        assertThrows(IOException.class, () -> new SvgImageLoader(new Tika()).load(missing));
    }

    @Test
    void pngEncoderCallsSinkOnceWithDecodableBytes() throws Exception {
        BufferedImage raster = new BufferedImage(10, 6, BufferedImage.TYPE_INT_ARGB);
        List<byte[]> calls = new ArrayList<>();

        new PngImageEncoder().encode(raster, calls::add);

        assertEquals(1, calls.size());
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(calls.get(0)));
        assertEquals(10, decoded.getWidth());
        assertEquals(6, decoded.getHeight());
    }
}
