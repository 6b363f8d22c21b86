package io.snapkv.common.exception;

public abstract sealed class StorageException extends RuntimeException
    permits CorruptionException, IOStorageException, InvalidKeyException {

    protected StorageException(String message) {
        super(message);
    }

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
