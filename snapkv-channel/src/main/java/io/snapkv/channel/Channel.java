package io.snapkv.channel;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record Channel(
    String name,
    String region,
    boolean on,
    @SerializedName("segment_duration") int segmentDuration,
    List<String> tags,
    @SerializedName("video_encoders") List<VideoEncoder> videoEncoders,
    @SerializedName("publish_points") List<PublishPoint> publishPoints
) {

    public Channel {
        tags = copyOf(tags);
        videoEncoders = copyOf(videoEncoders);
        publishPoints = copyOf(publishPoints);
    }

    public Channel withName(String name) {
        return new Channel(name, region, on, segmentDuration, tags, videoEncoders, publishPoints);
    }

    public Channel withOn(boolean on) {
        return new Channel(name, region, on, segmentDuration, tags, videoEncoders, publishPoints);
    }

    static <T> List<T> copyOf(List<T> list) {
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
