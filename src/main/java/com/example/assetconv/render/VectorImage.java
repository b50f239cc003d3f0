package com.example.assetconv.render;

import org.apache.batik.gvt.GraphicsNode;

import java.nio.file.Path;

/**
 * A parsed vector document ready to be painted, expressed in source user units.
 */
public record VectorImage(
        Path source,
        GraphicsNode root,
        float width,
        float height
) {
}
