package io.snapkv.storage;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public record StoreConfig(
    Optional<Path> snapshotFile,
    boolean fsync,
    WriteFailurePolicy writeFailurePolicy
) {
    public StoreConfig {
        Objects.requireNonNull(snapshotFile, "snapshotFile must not be null");
        Objects.requireNonNull(writeFailurePolicy, "writeFailurePolicy must not be null");
    }

    public static StoreConfig inMemory() {
        return new StoreConfig(Optional.empty(), false, WriteFailurePolicy.PROPAGATE);
    }

    public static StoreConfig fileBacked(Path snapshotFile) {
        Objects.requireNonNull(snapshotFile, "snapshotFile must not be null");
        return new StoreConfig(Optional.of(snapshotFile), true, WriteFailurePolicy.PROPAGATE);
    }

    public boolean persistent() {
        return snapshotFile.isPresent();
    }

    public StoreConfig withFsync(boolean fsync) {
        return new StoreConfig(snapshotFile, fsync, writeFailurePolicy);
    }

    public StoreConfig withWriteFailurePolicy(WriteFailurePolicy writeFailurePolicy) {
        return new StoreConfig(snapshotFile, fsync, writeFailurePolicy);
    }
}
