package com.trace.export.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Describes the process that emitted a batch of spans.
 */
public record Process(
        @JsonProperty("serviceName") String serviceName,
        @JsonProperty("tags") List<Tag> tags
) {

    public Process {
        Objects.requireNonNull(serviceName, "serviceName is required");
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
