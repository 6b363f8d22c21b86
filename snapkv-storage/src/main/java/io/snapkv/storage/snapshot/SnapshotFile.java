package io.snapkv.storage.snapshot;

import io.snapkv.common.exception.CorruptionException;
import io.snapkv.common.exception.IOStorageException;
import io.snapkv.storage.codec.ValueCodec;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * Full image of a store's mapping on disk.
 *
 * <pre>
 * MAGIC | VERSION | count | count x (keyLen | key | valueLen | value) | CRC32C
 * </pre>
 *
 * Integers are big-endian, keys are UTF-8 and values are produced by the store's codec.
 * Writes go to a sibling temp file that is moved over the target.
 */
public final class SnapshotFile<V> {

    private static final int MAGIC_NUMBER = 0x534E4B56;
    private static final int VERSION = 1;
    private static final int HEADER_SIZE = 4 + 4 + 4;
    private static final int CHECKSUM_SIZE = 4;
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path path;
    private final Path tempPath;
    private final ValueCodec<V> codec;
    private final boolean fsync;

    private SnapshotFile(Path path, ValueCodec<V> codec, boolean fsync) {
        this.path = path;
        this.tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        this.codec = codec;
        this.fsync = fsync;
    }

    public static <V> SnapshotFile<V> at(Path path, ValueCodec<V> codec, boolean fsync) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(codec, "codec must not be null");
        return new SnapshotFile<>(path.toAbsolutePath(), codec, fsync);
    }

    public Path path() {
        return path;
    }

    public Optional<Map<String, V>> read() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new IOStorageException("Failed to read snapshot", path, e);
        }
        return Optional.of(decode(bytes));
    }

    public void write(Map<String, V> entries) {
        byte[] serialized = encode(entries);

        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (FileChannel channel = FileChannel.open(tempPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {

                ByteBuffer buffer = ByteBuffer.wrap(serialized);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (fsync) {
                    channel.force(true);
                }
            }

            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IOStorageException("Failed to write snapshot", path, e);
        }
    }

    byte[] encode(Map<String, V> entries) {
        List<byte[]> keys = new ArrayList<>(entries.size());
        List<byte[]> values = new ArrayList<>(entries.size());
        int size = HEADER_SIZE + CHECKSUM_SIZE;

        for (Map.Entry<String, V> entry : entries.entrySet()) {
            byte[] key = entry.getKey().getBytes(StandardCharsets.UTF_8);
            byte[] value = codec.encode(entry.getValue());
            keys.add(key);
            values.add(value);
            size += 4 + key.length + 4 + value.length;
        }

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.putInt(MAGIC_NUMBER);
        buffer.putInt(VERSION);
        buffer.putInt(keys.size());

        for (int i = 0; i < keys.size(); i++) {
            buffer.putInt(keys.get(i).length);
            buffer.put(keys.get(i));
            buffer.putInt(values.get(i).length);
            buffer.put(values.get(i));
        }

        CRC32C crc = new CRC32C();
        crc.update(buffer.array(), 0, buffer.position());
        buffer.putInt((int) crc.getValue());

        return buffer.array();
    }

    Map<String, V> decode(byte[] bytes) {
        if (bytes.length < HEADER_SIZE + CHECKSUM_SIZE) {
            throw new CorruptionException("Snapshot too short: " + bytes.length + " bytes in " + path);
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        int magic = buffer.getInt();
        if (magic != MAGIC_NUMBER) {
            throw new CorruptionException("Invalid snapshot magic number: " + Integer.toHexString(magic));
        }

        int version = buffer.getInt();
        if (version != VERSION) {
            throw new CorruptionException("Unsupported snapshot version: " + version);
        }

        int checksumPosition = bytes.length - CHECKSUM_SIZE;
        int expectedChecksum = buffer.getInt(checksumPosition);

        CRC32C crc = new CRC32C();
        crc.update(bytes, 0, checksumPosition);
        if ((int) crc.getValue() != expectedChecksum) {
            throw new CorruptionException("Snapshot checksum mismatch in " + path);
        }

        buffer.limit(checksumPosition);

        try {
            int count = buffer.getInt();
            if (count < 0) {
                throw new CorruptionException("Negative snapshot entry count: " + count);
            }

            Map<String, V> entries = new HashMap<>();
            for (int i = 0; i < count; i++) {
                String key = new String(readChunk(buffer), StandardCharsets.UTF_8);
                V value = codec.decode(readChunk(buffer));
                if (entries.put(key, value) != null) {
                    throw new CorruptionException("Duplicate key in snapshot: " + key);
                }
            }

            if (buffer.hasRemaining()) {
                throw new CorruptionException("Trailing bytes after " + count + " snapshot entries");
            }
            return entries;
        } catch (BufferUnderflowException e) {
            throw new CorruptionException("Truncated snapshot entry in " + path, e);
        }
    }

    private static byte[] readChunk(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new CorruptionException("Invalid snapshot chunk length: " + length);
        }
        byte[] chunk = new byte[length];
        buffer.get(chunk);
        return chunk;
    }
}
