package io.snapkv.channel;

import java.time.Instant;

public record PutResult(
    String etag,
    Instant lastModified,
    boolean modified
) {

    static PutResult written(ChannelMeta meta) {
        return new PutResult(meta.etag(), meta.lastModified(), true);
    }

    static PutResult notModified(ChannelMeta meta) {
        return new PutResult(meta.etag(), meta.lastModified(), false);
    }
}
