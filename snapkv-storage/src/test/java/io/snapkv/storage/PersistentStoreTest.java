package io.snapkv.storage;

import io.snapkv.common.ContentHash;
import io.snapkv.common.exception.CorruptionException;
import io.snapkv.common.exception.IOStorageException;
import io.snapkv.storage.codec.GsonValueCodec;
import io.snapkv.storage.codec.ValueCodec;
import io.snapkv.storage.snapshot.SnapshotFile;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class PersistentStoreTest {

    record Item(String name, int count, List<String> tags, Map<String, String> labels, Instant updated) {}

    record Owned(String id, String owner) {
        Owned {
            Objects.requireNonNull(owner, "owner must not be null");
        }
    }

    private static final ValueCodec<String> RAW_JSON = new ValueCodec<String>() {
        @Override
        public byte[] encode(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    private static final ValueCodec<Item> CODEC = GsonValueCodec.of(Item.class);

    @TempDir
    Path tempDir;

    private Path snapshotPath() {
        return tempDir.resolve("items.db");
    }

    private ConcurrentStore<Item> open() {
        return ConcurrentStore.open(StoreConfig.fileBacked(snapshotPath()), CODEC);
    }

    private static Item item(String name, int count) {
        return new Item(name, count, List.of("t1", "t2"), Map.of("env", "test"), Instant.parse("2024-05-01T10:15:30Z"));
    }

    private static Map<String, Item> contents(KeyValueStore<Item> store) {
        Map<String, Item> result = new HashMap<>();
        store.range((key, value) -> {
            result.put(key, value);
            return true;
        });
        return result;
    }

    @Nested
    class Recovery {

        @Test
        void missingFileStartsEmpty() {
            ConcurrentStore<Item> store = open();

            assertThat(store.size()).isZero();
            assertThat(Files.exists(snapshotPath())).isFalse();
        }

        @Test
        void reopenYieldsFinalState() {
            ConcurrentStore<Item> store = open();
            store.store("a", item("a", 1));
            store.store("b", item("b", 2));
            store.store("c", item("c", 3));
            store.store("a", item("a", 10));
            store.delete("b");
            Map<String, Item> before = contents(store);

            ConcurrentStore<Item> reopened = open();

            assertThat(contents(reopened)).isEqualTo(before);
            assertThat(reopened.load("a")).contains(item("a", 10));
            assertThat(reopened.load("b")).isEmpty();
        }

        @Test
        void deleteIsDurable() {
            ConcurrentStore<Item> store = open();
            store.store("a", item("a", 1));
            store.delete("a");

            assertThat(open().load("a")).isEmpty();
        }

        @Test
        void deletingEverythingLeavesAnEmptySnapshot() {
            ConcurrentStore<Item> store = open();
            store.store("a", item("a", 1));
            store.delete("a");

            assertThat(Files.exists(snapshotPath())).isTrue();
            assertThat(open().size()).isZero();
        }

        @Test
        void hashSurvivesRoundTrip() {
            Item original = item("x", 1);
            String before = ContentHash.of(original);
            open().store("x", original);

            Item reloaded = open().load("x").orElseThrow();

            assertThat(ContentHash.of(reloaded)).isEqualTo(before);
        }

        @Test
        void createsParentDirectories() {
            Path nested = tempDir.resolve("a/b/c/items.db");
            ConcurrentStore<Item> store = ConcurrentStore.open(StoreConfig.fileBacked(nested), CODEC);

            store.store("k", item("k", 1));

            assertThat(Files.exists(nested)).isTrue();
            assertThat(store.snapshotPath()).contains(nested.toAbsolutePath());
        }

        @Test
        void garbageFileFailsConstruction() throws Exception {
            Files.write(snapshotPath(), new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17});

            assertThatThrownBy(PersistentStoreTest.this::open)
                .isInstanceOf(StoreException.RecoveryException.class)
                .hasCauseInstanceOf(CorruptionException.class)
                .hasMessageContaining("items.db");
        }

        @Test
        void flippedByteFailsConstruction() throws Exception {
            open().store("a", item("a", 1));
            byte[] bytes = Files.readAllBytes(snapshotPath());
            bytes[bytes.length / 2] ^= 0x01;
            Files.write(snapshotPath(), bytes);

            assertThatThrownBy(PersistentStoreTest.this::open)
                .isInstanceOf(StoreException.RecoveryException.class)
                .rootCause()
                .hasMessageContaining("checksum mismatch");
        }

        @Test
        void valueRejectedByItsTypeFailsConstruction() {
            SnapshotFile.at(snapshotPath(), RAW_JSON, false).write(Map.of("o1", "{\"id\":\"o1\"}"));

            assertThatThrownBy(() -> ConcurrentStore.open(StoreConfig.fileBacked(snapshotPath()), GsonValueCodec.of(Owned.class)))
                .isInstanceOf(StoreException.RecoveryException.class)
                .hasCauseInstanceOf(CorruptionException.class);
        }

        @Test
        void emptyFileFailsConstruction() throws Exception {
            Files.write(snapshotPath(), new byte[0]);

            assertThatThrownBy(PersistentStoreTest.this::open)
                .isInstanceOf(StoreException.RecoveryException.class);
        }
    }

    @Nested
    class WriteFailures {

        private void blockTempFile() throws Exception {
            Files.createDirectories(tempDir.resolve("items.db.tmp"));
        }

        @Test
        void propagateThrowsButKeepsMemoryState() throws Exception {
            ConcurrentStore<Item> store = open();
            blockTempFile();

            assertThatThrownBy(() -> store.store("a", item("a", 1)))
                .isInstanceOf(StoreException.PersistenceException.class)
                .hasCauseInstanceOf(IOStorageException.class);

            assertThat(store.load("a")).contains(item("a", 1));
        }

        @Test
        void logPolicyContinues() throws Exception {
            StoreConfig config = StoreConfig.fileBacked(snapshotPath())
                .withWriteFailurePolicy(WriteFailurePolicy.LOG);
            ConcurrentStore<Item> store = ConcurrentStore.open(config, CODEC);
            blockTempFile();

            assertThatCode(() -> store.store("a", item("a", 1))).doesNotThrowAnyException();
            assertThatCode(() -> store.delete("a")).doesNotThrowAnyException();

            assertThat(store.load("a")).isEmpty();
            assertThat(Files.exists(snapshotPath())).isFalse();
        }

        @Test
        void nextSuccessfulWriteResyncsFile() throws Exception {
            ConcurrentStore<Item> store = open();
            blockTempFile();
            assertThatThrownBy(() -> store.store("a", item("a", 1)))
                .isInstanceOf(StoreException.PersistenceException.class);

            Files.delete(tempDir.resolve("items.db.tmp"));
            store.store("b", item("b", 2));

            assertThat(contents(open())).containsOnlyKeys("a", "b");
        }
    }

    @Test
    void inMemoryConfigNeverTouchesDisk() throws Exception {
        ConcurrentStore<Item> store = ConcurrentStore.open(StoreConfig.inMemory(), CODEC);

        store.store("a", item("a", 1));

        assertThat(store.snapshotPath()).isEmpty();
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void concurrentWritersPersistUnionOfLastWrites() throws Exception {
        ConcurrentStore<Item> store = ConcurrentStore.open(
            StoreConfig.fileBacked(snapshotPath()).withFsync(false), CODEC);
        int threads = 4;
        int keysPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < keysPerThread; i++) {
                        String key = "t" + thread + "-" + i;
                        store.store(key, item(key, 1));
                        store.store(key, item(key, 2));
                        store.load(key);
                        store.range((k, v) -> true);
                    }
                    store.delete("t" + thread + "-0");
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Map<String, Item> reloaded = contents(open());
        assertThat(reloaded).hasSize(threads * (keysPerThread - 1));
        assertThat(reloaded).isEqualTo(contents(store));
        assertThat(reloaded.values()).allMatch(it -> it.count() == 2);
    }
}
