package com.example.assetconv.render;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.function.Consumer;

@FunctionalInterface
public interface ImageEncoder {
    /**
     * Compresses {@code image} and hands the finished bytes to {@code sink} exactly
     * once. An encoder that cannot produce output either throws or never calls the
     * sink; callers treat both as a failed encode.
     */
    void encode(BufferedImage image, Consumer<byte[]> sink) throws IOException;
}
