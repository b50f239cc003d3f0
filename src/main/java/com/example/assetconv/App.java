package com.example.assetconv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        System.setProperty("java.awt.headless", "true");
        LaunchOptions options = LaunchOptions.parse(args);

        ConverterConfig config = options.configFile().isPresent()
                ? new ConfigLoader().load(options.configFile().get())
                : ConverterConfig.defaults();
        if (options.workerCount().isPresent()) {
            config = config.withWorkerCount(options.workerCount().get());
        }

        OutputPublisher publisher = OutputPublisher.noop();
        if (config.s3PublishEnabled()) {
            publisher = new S3OutputPublisher(
                    config.s3Bucket().orElseThrow(),
                    config.s3Prefix().orElse(""),
                    config.s3Region()
            );
        }

        try (BufferedReader input = openInput(options);
             OutputPublisher closing = publisher) {
            new ConversionDriver(config, closing).run(input);
        }
    }

    private static BufferedReader openInput(LaunchOptions options) {
        if (options.input().isPresent()) {
            Path path = options.input().get();
            try {
                BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                LOGGER.info("Using {}...", path);
                return reader;
            } catch (IOException ex) {
                LOGGER.error("Error: Cannot open '{}', using stdin (press CTRL-D for EOF).", path);
            }
        } else {
            LOGGER.info("Using stdin (press CTRL-D for EOF).");
        }
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }
}
