package io.snapkv.storage;

public sealed class StoreException extends RuntimeException
    permits StoreException.RecoveryException,
            StoreException.PersistenceException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class RecoveryException extends StoreException {
        public RecoveryException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class PersistenceException extends StoreException {
        public PersistenceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
