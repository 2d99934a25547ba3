package com.trace.export.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to another span by trace and span id.
 */
public record SpanRef(
        @JsonProperty("refType") SpanRefType refType,
        @JsonProperty("traceIdLow") long traceIdLow,
        @JsonProperty("traceIdHigh") long traceIdHigh,
        @JsonProperty("spanId") long spanId
) {

    public SpanRef {
        Objects.requireNonNull(refType, "refType is required");
    }
}
