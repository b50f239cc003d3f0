package com.example.assetconv.render;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface VectorImageLoader {
    /**
     * Parses the vector description stored at {@code source}.
     *
     * @throws IOException if the file cannot be read or is not a valid vector document
     */
    VectorImage load(Path source) throws IOException;
}
