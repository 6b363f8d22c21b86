package io.snapkv.channel;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public final class ChannelValidator {

    public static final Pattern ID_PATTERN = Pattern.compile("[a-zA-Z0-9_-]{2,60}");
    public static final int MAX_NAME_LENGTH = 80;
    public static final int MIN_SEGMENT_DURATION = 2;
    public static final int MAX_SEGMENT_DURATION = 60;
    public static final int MAX_TAGS = 10;
    public static final int MIN_BITRATE = 300;

    private static final Set<String> REGIONS = Set.of("us-west", "us-east");
    private static final Set<Double> FRAMERATES = Set.of(30.0, 25.0, 29.97, 50.0, 60.0);
    private static final Set<String> FORMATS = Set.of("hls", "dash");
    private static final Set<String> DRMS = Set.of("fairplay", "widevine", "playready");
    private static final double ASPECT_RATIO = 16.0 / 9.0;

    private ChannelValidator() {}

    public static void requireValid(String id, Channel channel) {
        List<ErrorDetail> errors = validate(id, channel);
        if (!errors.isEmpty()) {
            throw new ChannelException.ValidationException(errors);
        }
    }

    public static void requireValidId(String id) {
        List<ErrorDetail> errors = new ArrayList<>();
        checkId(id, errors);
        if (!errors.isEmpty()) {
            throw new ChannelException.ValidationException(errors);
        }
    }

    public static List<ErrorDetail> validate(String id, Channel channel) {
        List<ErrorDetail> errors = new ArrayList<>();
        checkId(id, errors);

        if (channel == null) {
            errors.add(new ErrorDetail("body", "request body is required", null));
            return errors;
        }

        if (channel.name() == null) {
            errors.add(new ErrorDetail("body.name", "expected required property name to be present", null));
        } else if (channel.name().length() > MAX_NAME_LENGTH) {
            errors.add(new ErrorDetail("body.name", "expected length <= " + MAX_NAME_LENGTH, channel.name()));
        }

        if (!oneOf(REGIONS, channel.region())) {
            errors.add(new ErrorDetail("body.region", "expected value to be one of " + sorted(REGIONS), channel.region()));
        }

        if (channel.segmentDuration() < MIN_SEGMENT_DURATION) {
            errors.add(new ErrorDetail("body.segment_duration", "expected number >= " + MIN_SEGMENT_DURATION,
                channel.segmentDuration()));
        } else if (channel.segmentDuration() > MAX_SEGMENT_DURATION) {
            errors.add(new ErrorDetail("body.segment_duration", "expected number <= " + MAX_SEGMENT_DURATION,
                channel.segmentDuration()));
        }

        if (channel.tags() != null && channel.tags().size() > MAX_TAGS) {
            errors.add(new ErrorDetail("body.tags", "expected array length <= " + MAX_TAGS, channel.tags().size()));
        }

        List<VideoEncoder> encoders = channel.videoEncoders();
        if (encoders == null || encoders.isEmpty()) {
            errors.add(new ErrorDetail("body.video_encoders", "expected array length >= 1", null));
        } else {
            for (int i = 0; i < encoders.size(); i++) {
                checkEncoder("body.video_encoders[" + i + "]", encoders.get(i), errors);
            }
        }

        List<PublishPoint> points = channel.publishPoints();
        if (points != null) {
            for (int i = 0; i < points.size(); i++) {
                checkPublishPoint("body.publish_points[" + i + "]", points.get(i), errors);
            }
        }

        return errors;
    }

    private static void checkId(String id, List<ErrorDetail> errors) {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            errors.add(new ErrorDetail("path.id", "expected string to match pattern " + ID_PATTERN.pattern(), id));
        }
    }

    private static void checkEncoder(String location, VideoEncoder encoder, List<ErrorDetail> errors) {
        if (encoder == null) {
            errors.add(new ErrorDetail(location, "expected object", null));
            return;
        }
        if (encoder.id() == null || encoder.id().isEmpty()) {
            errors.add(new ErrorDetail(location + ".id", "expected required property id to be present", null));
        }
        if (encoder.width() <= 0 || encoder.width() % 2 != 0) {
            errors.add(new ErrorDetail(location + ".width", "expected positive multiple of 2", encoder.width()));
        }
        if (encoder.height() <= 0 || encoder.height() % 2 != 0) {
            errors.add(new ErrorDetail(location + ".height", "expected positive multiple of 2", encoder.height()));
        }
        if (encoder.bitrate() < MIN_BITRATE) {
            errors.add(new ErrorDetail(location + ".bitrate", "expected number >= " + MIN_BITRATE, encoder.bitrate()));
        }
        if (!FRAMERATES.contains(encoder.framerate())) {
            errors.add(new ErrorDetail(location + ".framerate", "expected value to be one of [25, 29.97, 30, 50, 60]",
                encoder.framerate()));
        }
        if (encoder.height() > 0 && (double) encoder.width() / encoder.height() != ASPECT_RATIO) {
            errors.add(new ErrorDetail(location, "width and height must be in a 16:9 (1.777) aspect ratio",
                (double) encoder.width() / encoder.height()));
        }
    }

    private static void checkPublishPoint(String location, PublishPoint point, List<ErrorDetail> errors) {
        if (point == null) {
            errors.add(new ErrorDetail(location, "expected object", null));
            return;
        }
        if (point.id() == null || point.id().isEmpty()) {
            errors.add(new ErrorDetail(location + ".id", "expected required property id to be present", null));
        }
        if (!oneOf(FORMATS, point.format())) {
            errors.add(new ErrorDetail(location + ".format", "expected value to be one of " + sorted(FORMATS),
                point.format()));
        }
        if (!isAbsoluteUri(point.url())) {
            errors.add(new ErrorDetail(location + ".url", "expected string to be RFC 3986 uri", point.url()));
        }
        if (point.drms() != null) {
            for (int i = 0; i < point.drms().size(); i++) {
                String drm = point.drms().get(i);
                if (!oneOf(DRMS, drm)) {
                    errors.add(new ErrorDetail(location + ".drms[" + i + "]",
                        "expected value to be one of " + sorted(DRMS), drm));
                }
            }
        }
    }

    private static boolean isAbsoluteUri(String value) {
        if (value == null) {
            return false;
        }
        try {
            return new URI(value).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean oneOf(Set<String> allowed, String value) {
        return value != null && allowed.contains(value);
    }

    private static List<String> sorted(Set<String> values) {
        return values.stream().sorted().toList();
    }
}
