package com.example.assetconv.render;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface Rasterizer {
    /**
     * Paints {@code image} onto a fresh {@code width x height} RGBA buffer after
     * translating by the offsets and scaling by {@code scale}. Anything that lands
     * outside the buffer is clipped.
     */
    BufferedImage rasterize(VectorImage image, float xOffset, float yOffset, float scale, int width, int height);
}
