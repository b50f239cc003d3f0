package com.example.assetconv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Positional command line: {@code [worker_count] [input_path|-] [config.json]}.
 */
public record LaunchOptions(
        Optional<Integer> workerCount,
        Optional<Path> input,
        Optional<Path> configFile
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(LaunchOptions.class);
    private static final String STDIN = "-";

    public static LaunchOptions parse(String[] args) {
        Optional<Integer> workerCount = Optional.empty();
        if (args.length >= 1) {
            try {
                workerCount = Optional.of(Integer.parseInt(args[0].strip()));
            } catch (NumberFormatException ex) {
                LOGGER.warn("Ignoring invalid worker count '{}'.", args[0]);
            }
        }
        Optional<Path> input = args.length >= 2 && !STDIN.equals(args[1])
                ? Optional.of(Path.of(args[1]))
                : Optional.empty();
        Optional<Path> configFile = args.length >= 3
                ? Optional.of(Path.of(args[2]))
                : Optional.empty();
        return new LaunchOptions(workerCount, input, configFile);
    }
}
