package io.snapkv.common.exception;

import java.nio.file.Path;

public final class IOStorageException extends StorageException {

    private final Path path;

    public IOStorageException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
