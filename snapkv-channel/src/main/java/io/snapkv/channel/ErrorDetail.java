package io.snapkv.channel;

public record ErrorDetail(
    String location,
    String message,
    Object value
) {

    @Override
    public String toString() {
        return value == null
            ? "%s: %s".formatted(location, message)
            : "%s: %s (value: %s)".formatted(location, message, value);
    }
}
