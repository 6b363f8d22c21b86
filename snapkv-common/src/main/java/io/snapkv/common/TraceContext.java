package io.snapkv.common;

import java.util.Objects;

/**
 * Per-operation correlation state, passed explicitly through call chains.
 */
public record TraceContext(TraceId traceId) {

    public TraceContext {
        Objects.requireNonNull(traceId, "traceId must not be null");
    }

    public static TraceContext start() {
        return new TraceContext(TraceId.generate());
    }

    public static TraceContext continueFrom(String traceparent) {
        return new TraceContext(TraceId.parse(traceparent).withNewSpan());
    }

    public String traceparent() {
        return traceId.toString();
    }
}
