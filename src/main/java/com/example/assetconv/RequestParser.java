package com.example.assetconv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses {@code source;destination;size} lines into {@link ConversionRequest}s.
 * Fields past the third are ignored.
 */
public final class RequestParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestParser.class);
    private static final String SEPARATOR = ";";
    private static final int REQUIRED_FIELDS = 3;

    public Optional<ConversionRequest> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String[] tokens = line.split(Pattern.quote(SEPARATOR), -1);
        if (tokens.length < REQUIRED_FIELDS) {
            LOGGER.error("Error: Wrong line format: {} (size: {}).", line, line.length());
            return Optional.empty();
        }

        String source = tokens[0];
        String destination = tokens[1];
        if (!isValidPath(source) || !isValidPath(destination)) {
            LOGGER.error("Error: Invalid path in line: {} (size: {}).", line, line.length());
            return Optional.empty();
        }
        Optional<Integer> size = parseSize(tokens[2]);
        if (size.isEmpty()) {
            LOGGER.error("Error: Invalid size '{}' in line: {} (size: {}).", tokens[2], line, line.length());
            return Optional.empty();
        }
        return Optional.of(new ConversionRequest(source, destination, size.get()));
    }

    private boolean isValidPath(String raw) {
        try {
            Path.of(raw);
            return true;
        } catch (InvalidPathException ex) {
            return false;
        }
    }

    private Optional<Integer> parseSize(String raw) {
        try {
            int value = Integer.parseInt(raw.strip());
            return value > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
