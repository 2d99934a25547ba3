package com.trace.export.wire;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Unit of upload: one process descriptor and the spans it emitted.
 */
public record Batch(
        @JsonProperty("process") Process process,
        @JsonProperty("spans") List<WireSpan> spans
) {

    public Batch {
        Objects.requireNonNull(process, "process is required");
        spans = spans != null ? List.copyOf(spans) : List.of();
    }

    public int size() {
        return spans.size();
    }
}
