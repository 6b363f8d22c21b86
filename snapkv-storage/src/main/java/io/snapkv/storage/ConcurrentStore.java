package io.snapkv.storage;

import io.snapkv.common.exception.InvalidKeyException;
import io.snapkv.common.exception.StorageException;
import io.snapkv.storage.codec.ValueCodec;
import io.snapkv.storage.snapshot.SnapshotFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiPredicate;

/**
 * Concurrent {@link KeyValueStore} with optional write-through snapshot persistence.
 *
 * <p>Reads go straight to a {@link ConcurrentHashMap}. When a snapshot file is configured,
 * every mutation and the rewrite of the full image happen under one lock, so the file always
 * holds the mapping as of the latest completed mutation. Each write costs O(n) in the number
 * of entries.
 */
public final class ConcurrentStore<V> implements KeyValueStore<V> {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentStore.class);

    private final ConcurrentHashMap<String, V> entries;
    private final ReentrantLock writeLock;
    private final SnapshotFile<V> snapshotFile;
    private final WriteFailurePolicy writeFailurePolicy;

    private ConcurrentStore(
        Map<String, V> initial,
        SnapshotFile<V> snapshotFile,
        WriteFailurePolicy writeFailurePolicy
    ) {
        this.entries = new ConcurrentHashMap<>(initial);
        this.writeLock = new ReentrantLock();
        this.snapshotFile = snapshotFile;
        this.writeFailurePolicy = writeFailurePolicy;
    }

    public static <V> ConcurrentStore<V> inMemory() {
        return new ConcurrentStore<>(Map.of(), null, WriteFailurePolicy.PROPAGATE);
    }

    /**
     * Opens a store, loading the configured snapshot file if one exists.
     *
     * @throws StoreException.RecoveryException if an existing snapshot cannot be read or decoded
     */
    public static <V> ConcurrentStore<V> open(StoreConfig config, ValueCodec<V> codec) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(codec, "codec must not be null");

        if (!config.persistent()) {
            return new ConcurrentStore<>(Map.of(), null, config.writeFailurePolicy());
        }

        SnapshotFile<V> file = SnapshotFile.at(config.snapshotFile().get(), codec, config.fsync());
        Optional<Map<String, V>> loaded;
        try {
            loaded = file.read();
        } catch (StorageException e) {
            throw new StoreException.RecoveryException("Failed to load snapshot " + file.path(), e);
        }

        if (loaded.isPresent()) {
            log.info("Recovered {} entries from {}", loaded.get().size(), file.path());
        } else {
            log.info("No snapshot at {}, starting empty", file.path());
        }

        return new ConcurrentStore<>(loaded.orElse(Map.of()), file, config.writeFailurePolicy());
    }

    @Override
    public Optional<V> load(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void store(String key, V value) {
        InvalidKeyException.requireValid(key);
        Objects.requireNonNull(value, "value must not be null");

        if (snapshotFile == null) {
            entries.put(key, value);
            return;
        }

        writeLock.lock();
        try {
            entries.put(key, value);
            persist();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        if (key == null || key.isEmpty()) {
            return;
        }

        if (snapshotFile == null) {
            entries.remove(key);
            return;
        }

        writeLock.lock();
        try {
            if (entries.remove(key) != null) {
                persist();
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void range(BiPredicate<String, V> visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        for (Map.Entry<String, V> entry : entries.entrySet()) {
            if (!visitor.test(entry.getKey(), entry.getValue())) {
                return;
            }
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    public Optional<Path> snapshotPath() {
        return snapshotFile == null ? Optional.empty() : Optional.of(snapshotFile.path());
    }

    private void persist() {
        Map<String, V> image = new HashMap<>(entries);
        try {
            snapshotFile.write(image);
            log.debug("Wrote {} entries to {}", image.size(), snapshotFile.path());
        } catch (StorageException e) {
            switch (writeFailurePolicy) {
                case PROPAGATE -> throw new StoreException.PersistenceException(
                    "Failed to persist snapshot " + snapshotFile.path(), e);
                case LOG -> log.warn("Failed to persist snapshot {}, continuing in memory",
                    snapshotFile.path(), e);
            }
        }
    }
}
