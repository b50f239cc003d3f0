package com.example.assetconv.render;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.function.Consumer;

public class PngImageEncoder implements ImageEncoder {
    private static final String FORMAT = "png";

    @Override
    public void encode(BufferedImage image, Consumer<byte[]> sink) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, FORMAT, out)) {
            throw new IOException("No ImageIO writer available for " + FORMAT);
        }
        sink.accept(out.toByteArray());
    }
}
