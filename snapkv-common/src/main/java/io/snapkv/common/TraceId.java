package io.snapkv.common;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trace identifier in the W3C {@code traceparent} wire format:
 * {@code <2-hex version>-<32-hex trace-id>-<16-hex span-id>-<2-hex flags>}.
 */
public record TraceId(
    int version,
    String traceId,
    String spanId,
    int flags
) {

    public static final int LENGTH = 55;
    public static final int CURRENT_VERSION = 0;

    private static final int TRACE_ID_BYTES = 16;
    private static final int SPAN_ID_BYTES = 8;
    private static final Pattern FORMAT = Pattern.compile(
        "([0-9a-f]{2})-([0-9a-f]{32})-([0-9a-f]{16})-([0-9a-f]{2})"
    );
    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    public TraceId {
        if (version < 0 || version > 0xFE) {
            throw new IllegalArgumentException("version must be in [0, 254]: " + version);
        }
        Objects.requireNonNull(traceId, "traceId must not be null");
        Objects.requireNonNull(spanId, "spanId must not be null");
        if (!isHex(traceId, TRACE_ID_BYTES * 2) || isAllZero(traceId)) {
            throw new IllegalArgumentException("Invalid trace-id: " + traceId);
        }
        if (!isHex(spanId, SPAN_ID_BYTES * 2) || isAllZero(spanId)) {
            throw new IllegalArgumentException("Invalid span-id: " + spanId);
        }
        if (flags < 0 || flags > 0xFF) {
            throw new IllegalArgumentException("flags must be in [0, 255]: " + flags);
        }
    }

    public static TraceId generate() {
        return new TraceId(CURRENT_VERSION, randomHex(TRACE_ID_BYTES), randomHex(SPAN_ID_BYTES), 0);
    }

    public static String newTraceId() {
        return generate().toString();
    }

    public static TraceId parse(String value) {
        Objects.requireNonNull(value, "value must not be null");
        Matcher matcher = FORMAT.matcher(value);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed traceparent: " + value);
        }
        return new TraceId(
            Integer.parseInt(matcher.group(1), 16),
            matcher.group(2),
            matcher.group(3),
            Integer.parseInt(matcher.group(4), 16)
        );
    }

    public TraceId withNewSpan() {
        return new TraceId(version, traceId, randomHex(SPAN_ID_BYTES), flags);
    }

    @Override
    public String toString() {
        return "%02x-%s-%s-%02x".formatted(version, traceId, spanId, flags);
    }

    private static String randomHex(int byteCount) {
        byte[] bytes = new byte[byteCount];
        String hex;
        do {
            RANDOM.nextBytes(bytes);
            hex = HEX.formatHex(bytes);
        } while (isAllZero(hex));
        return hex;
    }

    private static boolean isHex(String value, int length) {
        if (value.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAllZero(String hex) {
        for (int i = 0; i < hex.length(); i++) {
            if (hex.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }
}
