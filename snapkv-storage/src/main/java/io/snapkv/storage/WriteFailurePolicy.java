package io.snapkv.storage;

public enum WriteFailurePolicy {
    PROPAGATE,
    LOG
}
