package com.trace.export.model;

import java.util.Objects;

/**
 * Identity of a span within a trace, plus its propagated trace flags.
 *
 * @param traceId    the trace this span belongs to
 * @param spanId     the span's own id
 * @param traceFlags bit flags; {@link #FLAG_SAMPLED} marks a sampled trace
 */
public record SpanContext(TraceId traceId, SpanId spanId, byte traceFlags) {

    public static final byte FLAG_SAMPLED = 0x01;

    public SpanContext {
        Objects.requireNonNull(traceId, "traceId is required");
        Objects.requireNonNull(spanId, "spanId is required");
    }

    public static SpanContext sampled(TraceId traceId, SpanId spanId) {
        return new SpanContext(traceId, spanId, FLAG_SAMPLED);
    }

    public boolean isSampled() {
        return (traceFlags & FLAG_SAMPLED) != 0;
    }
}
