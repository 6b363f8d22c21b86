package io.snapkv.common;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TraceIdTest {

    private static final String TRACEPARENT_PATTERN = "[0-9a-f]{2}-[0-9a-f]{32}-[0-9a-f]{16}-[0-9a-f]{2}";

    @Nested
    class Generate {

        @Test
        void matchesWireFormat() {
            String id = TraceId.newTraceId();

            assertThat(id).hasSize(TraceId.LENGTH);
            assertThat(id).matches(TRACEPARENT_PATTERN);
            assertThat(id).startsWith("00-").endsWith("-00");
        }

        @Test
        void tenThousandCallsProduceNoDuplicates() {
            Set<String> seen = new HashSet<>();

            for (int i = 0; i < 10_000; i++) {
                String id = TraceId.newTraceId();
                assertThat(id).matches(TRACEPARENT_PATTERN);
                seen.add(id);
            }

            assertThat(seen).hasSize(10_000);
        }

        @Test
        void newSpanKeepsTraceId() {
            TraceId original = TraceId.generate();

            TraceId child = original.withNewSpan();

            assertThat(child.traceId()).isEqualTo(original.traceId());
            assertThat(child.spanId()).isNotEqualTo(original.spanId());
        }
    }

    @Nested
    class Parse {

        @Test
        void parsesWellFormedValue() {
            TraceId id = TraceId.parse("00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01");

            assertThat(id.version()).isZero();
            assertThat(id.traceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
            assertThat(id.spanId()).isEqualTo("00f067aa0ba902b7");
            assertThat(id.flags()).isEqualTo(1);
            assertThat(id.toString()).isEqualTo("00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01");
        }

        @Test
        void generatedValueParsesBack() {
            TraceId id = TraceId.generate();

            assertThat(TraceId.parse(id.toString())).isEqualTo(id);
        }

        @Test
        void rejectsUppercaseHex() {
            assertThatThrownBy(() -> TraceId.parse("00-4BF92F3577B34DA6A3CE929D0E0E4736-00F067AA0BA902B7-01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed traceparent");
        }

        @Test
        void rejectsWrongSegmentWidths() {
            assertThatThrownBy(() -> TraceId.parse("00-4bf92f3577b34da6-00f067aa0ba902b7-01"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsAllZeroTraceId() {
            assertThatThrownBy(() -> TraceId.parse("00-00000000000000000000000000000000-00f067aa0ba902b7-01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trace-id");
        }

        @Test
        void rejectsInvalidVersion() {
            assertThatThrownBy(() -> TraceId.parse("ff-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("version");
        }
    }

    @Test
    void contextContinuesIncomingTrace() {
        String incoming = "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";

        TraceContext context = TraceContext.continueFrom(incoming);

        assertThat(context.traceId().traceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(context.traceparent()).isNotEqualTo(incoming).matches(TRACEPARENT_PATTERN);
    }
}
