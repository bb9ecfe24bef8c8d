package com.phillippitts.genesis.service.log;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes each turn as two timestamped lines followed by a blank line:
 * <pre>
 * 2025-03-04T15:07:12.345Z | User: what time is it
 * 2025-03-04T15:07:12.345Z | GENESIS: The current time is 3:07 PM.
 * </pre>
 *
 * <p>Timestamps are ISO-8601 UTC. Write failures are logged and dropped.
 */
public class FileInteractionLog implements InteractionLog {

    private static final Logger LOG = LogManager.getLogger(FileInteractionLog.class);

    private final Path path;
    private final Clock clock;
    private final Lock writeLock = new ReentrantLock();

    public FileInteractionLog(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    @Override
    public void append(String userText, String reply) {
        String ts = Instant.now(clock).toString();
        String entry = ts + " | User: " + userText + "\n"
                + ts + " | GENESIS: " + reply + "\n\n";
        writeLock.lock();
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOG.error("Error logging interaction to file '{}': {}", path, e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    public Path path() {
        return path;
    }
}
