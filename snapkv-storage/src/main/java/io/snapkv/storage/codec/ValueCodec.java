package io.snapkv.storage.codec;

public interface ValueCodec<V> {

    byte[] encode(V value);

    /**
     * @throws io.snapkv.common.exception.CorruptionException if {@code bytes} is not a valid encoding
     */
    V decode(byte[] bytes);
}
