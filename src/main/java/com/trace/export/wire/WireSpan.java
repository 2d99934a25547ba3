package com.trace.export.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A span in wire form. Times are in microseconds.
 */
public record WireSpan(
        @JsonProperty("traceIdLow") long traceIdLow,
        @JsonProperty("traceIdHigh") long traceIdHigh,
        @JsonProperty("spanId") long spanId,
        @JsonProperty("parentSpanId") long parentSpanId,
        @JsonProperty("operationName") String operationName,
        @JsonProperty("flags") int flags,
        @JsonProperty("startTime") long startTime,
        @JsonProperty("duration") long duration,
        @JsonProperty("tags") List<Tag> tags,
        @JsonProperty("logs") List<Log> logs,
        @JsonProperty("references") List<SpanRef> references
) {

    public WireSpan {
        tags = tags != null ? List.copyOf(tags) : List.of();
        logs = logs != null ? List.copyOf(logs) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
    }
}
