package com.example.assetconv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only record of source identities already handled, one file per scope
 * directory. The file is the only index: every check rescans it.
 * <p>
 * Checks against the same scope directory are mutually exclusive; different
 * directories do not contend. Every I/O problem degrades to "not seen" so the
 * request is converted rather than lost.
 * <p>
 * With {@code rememberHandled} the ledger also keeps, for the process lifetime,
 * the (scope, identity) pairs it has confirmed to be in a file. Entries are never
 * removed from a ledger file, so a remembered pair answers "seen" without a rescan.
 * Misses always go to the file.
 */
public final class DedupLedger {
    private static final Logger LOGGER = LoggerFactory.getLogger(DedupLedger.class);
    public static final String DEFAULT_FILE_NAME = "cache.txt";

    private final String fileName;
    private final boolean rememberHandled;
    private final ConcurrentHashMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<HandledKey> handled = ConcurrentHashMap.newKeySet();

    enum Result {
        SEEN,
        RECORDED,
        UNAVAILABLE
    }

    public DedupLedger() {
        this(DEFAULT_FILE_NAME);
    }

    public DedupLedger(String fileName) {
        this(fileName, false);
    }

    public DedupLedger(String fileName, boolean rememberHandled) {
        this.fileName = fileName;
        this.rememberHandled = rememberHandled;
    }

    /**
     * Returns true if {@code identity} was already recorded under {@code scopeDirectory};
     * otherwise records it and returns false.
     */
    public boolean seenOrRecord(String identity, Path scopeDirectory) {
        return check(identity, scopeDirectory) == Result.SEEN;
    }

    Result check(String identity, Path scopeDirectory) {
        Path scope = scopeDirectory.toAbsolutePath().normalize();
        HandledKey key = new HandledKey(scope, identity);
        if (rememberHandled && handled.contains(key)) {
            LOGGER.debug("\"{}\" already handled under {} in this run.", identity, scope);
            return Result.SEEN;
        }
        ReentrantLock lock = locks.computeIfAbsent(scope, ignored -> new ReentrantLock());
        Result result;
        lock.lock();
        try {
            result = checkAndAppend(identity, scope);
        } finally {
            lock.unlock();
        }
        if (rememberHandled && result != Result.UNAVAILABLE) {
            handled.add(key);
        }
        return result;
    }

    /**
     * Location of the ledger file for {@code scopeDirectory}.
     */
    public Path ledgerFile(Path scopeDirectory) {
        return scopeDirectory.resolve(fileName);
    }

    private Result checkAndAppend(String identity, Path scope) {
        if (!Files.isDirectory(scope)) {
            LOGGER.error("Subfolder does not exist: {}", scope);
            return Result.UNAVAILABLE;
        }

        Path ledger = ledgerFile(scope);
        try {
            if (Files.notExists(ledger)) {
                Files.createFile(ledger);
            }
        } catch (IOException ex) {
            LOGGER.error("Failed to create cache file: {}", ledger, ex);
            return Result.UNAVAILABLE;
        }

        try (BufferedReader reader = Files.newBufferedReader(ledger, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.equals(identity)) {
                    LOGGER.info("Match found for \"{}\" in cache file.", identity);
                    return Result.SEEN;
                }
            }
        } catch (IOException ex) {
            LOGGER.error("Failed to open file: {}", ledger, ex);
            return Result.UNAVAILABLE;
        }

        try (BufferedWriter writer = Files.newBufferedWriter(ledger, StandardCharsets.UTF_8, StandardOpenOption.APPEND)) {
            writer.write(identity);
            writer.write('\n');
        } catch (IOException ex) {
            LOGGER.error("Failed to open file for appending: {}", ledger, ex);
            return Result.UNAVAILABLE;
        }
        LOGGER.info("Appended \"{}\" to cache file.", identity);
        return Result.RECORDED;
    }

    private record HandledKey(Path scope, String identity) {
    }
}
