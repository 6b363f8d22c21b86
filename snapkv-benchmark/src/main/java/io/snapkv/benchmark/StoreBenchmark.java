package io.snapkv.benchmark;

import io.snapkv.storage.ConcurrentStore;
import io.snapkv.storage.StoreConfig;
import io.snapkv.storage.codec.GsonValueCodec;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(2)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class StoreBenchmark {

    public record Doc(String name, int count, List<String> tags) {}

    @Param({"100", "1000", "10000"})
    private int keyCount;

    private ConcurrentStore<Doc> memoryStore;
    private ConcurrentStore<Doc> fileStore;
    private List<String> existingKeys;
    private AtomicLong keyCounter;
    private Path dataDir;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        dataDir = Files.createTempDirectory("snapkv-bench");
        memoryStore = ConcurrentStore.inMemory();
        fileStore = ConcurrentStore.open(
            StoreConfig.fileBacked(dataDir.resolve("bench.db")).withFsync(false),
            GsonValueCodec.of(Doc.class)
        );
        existingKeys = new ArrayList<>(keyCount);
        keyCounter = new AtomicLong(0);

        for (int i = 0; i < keyCount; i++) {
            String key = String.format("key%016d", i);
            existingKeys.add(key);
            memoryStore.store(key, doc(i));
        }
        for (int i = 0; i < keyCount; i++) {
            fileStore.store(existingKeys.get(i), doc(i));
        }
    }

    @TearDown(Level.Trial)
    public void teardown() throws IOException {
        try (Stream<Path> paths = Files.walk(dataDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static Doc doc(long i) {
        return new Doc("doc-" + i, (int) i, List.of("a", "b", "c"));
    }

    private String randomExistingKey() {
        return existingKeys.get(ThreadLocalRandom.current().nextInt(existingKeys.size()));
    }

    @Benchmark
    public void storeInMemory() {
        long seq = keyCounter.incrementAndGet();
        memoryStore.store(randomExistingKey(), doc(seq));
    }

    @Benchmark
    public void storeFileBacked() {
        long seq = keyCounter.incrementAndGet();
        fileStore.store(randomExistingKey(), doc(seq));
    }

    @Benchmark
    public void loadExisting(Blackhole bh) {
        bh.consume(memoryStore.load(randomExistingKey()));
    }

    @Benchmark
    public void loadMissing(Blackhole bh) {
        bh.consume(memoryStore.load(String.format("missing%016d", ThreadLocalRandom.current().nextInt())));
    }

    @Benchmark
    public void rangeAll(Blackhole bh) {
        memoryStore.range((key, value) -> {
            bh.consume(value);
            return true;
        });
    }

    @Benchmark
    @Threads(4)
    public void storeConcurrent() {
        long seq = keyCounter.incrementAndGet();
        memoryStore.store(randomExistingKey(), doc(seq));
    }

    @Benchmark
    @Threads(4)
    public void loadConcurrent(Blackhole bh) {
        bh.consume(memoryStore.load(randomExistingKey()));
    }
}
