package com.trace.export.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Timestamped set of fields attached to a span.
 *
 * @param timestamp microseconds since the epoch
 * @param fields    ordered tags
 */
public record Log(
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("fields") List<Tag> fields
) {

    public Log {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}
