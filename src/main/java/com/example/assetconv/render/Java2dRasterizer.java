package com.example.assetconv.render;

import org.apache.batik.ext.awt.RenderingHintsKeyExt;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.lang.ref.WeakReference;

public class Java2dRasterizer implements Rasterizer {

    @Override
    public BufferedImage rasterize(VectorImage image, float xOffset, float yOffset, float scale, int width, int height) {
        BufferedImage buffer = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = buffer.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            // Batik wants to know the target when painting into an offscreen buffer.
            graphics.setRenderingHint(RenderingHintsKeyExt.KEY_BUFFERED_IMAGE, new WeakReference<>(buffer));
            graphics.setClip(0, 0, width, height);
            graphics.translate(xOffset, yOffset);
            graphics.scale(scale, scale);
            image.root().paint(graphics);
        } finally {
            graphics.dispose();
        }
        return buffer;
    }
}
