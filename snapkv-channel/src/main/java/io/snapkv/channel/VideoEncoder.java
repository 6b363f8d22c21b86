package io.snapkv.channel;

public record VideoEncoder(
    String id,
    int width,
    int height,
    int bitrate,
    double framerate
) {
}
