package com.trace.export.model;

import java.util.Objects;

/**
 * Reference from a span to another span, possibly in a different trace.
 */
public record Link(TraceId traceId, SpanId spanId) {

    public Link {
        Objects.requireNonNull(traceId, "traceId is required");
        Objects.requireNonNull(spanId, "spanId is required");
    }

    public static Link to(SpanContext context) {
        return new Link(context.traceId(), context.spanId());
    }
}
