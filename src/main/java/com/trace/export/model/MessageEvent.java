package com.trace.export.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A timestamped message attached to a span.
 */
public record MessageEvent(Instant time, String message, List<Attribute> attributes) {

    public MessageEvent {
        Objects.requireNonNull(time, "time is required");
        message = message != null ? message : "";
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    public MessageEvent(Instant time, String message) {
        this(time, message, List.of());
    }
}
