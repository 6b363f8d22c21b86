package io.snapkv.common.exception;

public final class InvalidKeyException extends StorageException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public static String requireValid(String key) {
        if (key == null) {
            throw new InvalidKeyException("key must not be null");
        }
        if (key.isEmpty()) {
            throw new InvalidKeyException("key must not be empty");
        }
        return key;
    }
}
