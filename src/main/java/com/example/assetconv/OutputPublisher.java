package com.example.assetconv;

import java.nio.file.Path;

@FunctionalInterface
public interface OutputPublisher extends AutoCloseable {
    void publish(Path output);

    @Override
    default void close() {
        // no-op
    }

    static OutputPublisher noop() {
        return output -> {
        };
    }
}
