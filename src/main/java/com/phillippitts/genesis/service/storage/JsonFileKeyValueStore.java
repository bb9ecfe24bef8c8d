package com.phillippitts.genesis.service.storage;

import com.phillippitts.genesis.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Key/value store persisted as one JSON object.
 *
 * <p>The file is read once at construction and rewritten in full on every change, through a
 * temporary file that replaces the original. A missing file starts an empty store; an unreadable
 * or corrupt file is logged and also starts empty.
 */
public class JsonFileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileKeyValueStore.class);

    private final Path path;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> entries = new LinkedHashMap<>();

    public JsonFileKeyValueStore(Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        load();
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.writeLock().lock();
        try {
            String previous = entries.put(key, value);
            try {
                persist();
            } catch (StorageException e) {
                if (previous == null) {
                    entries.remove(key);
                } else {
                    entries.put(key, previous);
                }
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<String> get(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(String key) {
        lock.writeLock().lock();
        try {
            String previous = entries.remove(key);
            if (previous == null) {
                return false;
            }
            try {
                persist();
            } catch (StorageException e) {
                entries.put(key, previous);
                throw e;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> keys() {
        lock.readLock().lock();
        try {
            return Set.copyOf(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path path() {
        return path;
    }

    private void load() {
        if (!Files.exists(path)) {
            LOG.info("Key/value store {} does not exist yet; starting empty", path);
            return;
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return;
            }
            JSONObject json = new JSONObject(content);
            for (String key : json.keySet()) {
                entries.put(key, String.valueOf(json.get(key)));
            }
            LOG.info("Loaded {} entries from key/value store {}", entries.size(), path);
        } catch (IOException | JSONException e) {
            LOG.error("Key/value store {} is unreadable; starting empty", path, e);
            entries.clear();
        }
    }

    // Caller holds the write lock
    private void persist() {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSONObject json = new JSONObject();
            entries.forEach(json::put);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, json.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write key/value store " + path, e);
        }
    }
}
