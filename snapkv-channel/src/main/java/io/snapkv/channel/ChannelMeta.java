package io.snapkv.channel;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored form of a channel: the body plus its entity tag and modification time.
 */
public record ChannelMeta(
    String id,
    String etag,
    @SerializedName("last_modified") Instant lastModified,
    Channel channel
) {
    public ChannelMeta {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(etag, "etag must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        Objects.requireNonNull(channel, "channel must not be null");
    }
}
