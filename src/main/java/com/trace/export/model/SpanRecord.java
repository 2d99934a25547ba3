package com.trace.export.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A completed span as handed over by the instrumentation layer.
 * Immutable; all collections are copied on build.
 */
public final class SpanRecord {
    private final SpanContext spanContext;
    private final SpanId parentSpanId;
    private final String name;
    private final Instant startTime;
    private final Instant endTime;
    private final List<Attribute> attributes;
    private final Status status;
    private final List<MessageEvent> messageEvents;
    private final List<Link> links;

    private SpanRecord(Builder builder) {
        this.spanContext = builder.spanContext;
        this.parentSpanId = builder.parentSpanId != null ? builder.parentSpanId : SpanId.invalid();
        this.name = builder.name;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime != null ? builder.endTime : builder.startTime;
        List<Attribute> attrs = new ArrayList<>(builder.attributes.size());
        builder.attributes.forEach((key, value) -> attrs.add(new Attribute(key, value)));
        this.attributes = Collections.unmodifiableList(attrs);
        this.status = builder.status != null ? builder.status : Status.ok();
        this.messageEvents = List.copyOf(builder.messageEvents);
        this.links = List.copyOf(builder.links);
    }

    public SpanContext getSpanContext() {
        return spanContext;
    }

    public TraceId getTraceId() {
        return spanContext.traceId();
    }

    public SpanId getSpanId() {
        return spanContext.spanId();
    }

    public byte getTraceFlags() {
        return spanContext.traceFlags();
    }

    /**
     * Returns the parent span id; {@link SpanId#invalid()} for a root span.
     */
    public SpanId getParentSpanId() {
        return parentSpanId;
    }

    public String getName() {
        return name;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    /**
     * Returns attributes in insertion order. Keys are unique.
     */
    public List<Attribute> getAttributes() {
        return attributes;
    }

    public Status getStatus() {
        return status;
    }

    public List<MessageEvent> getMessageEvents() {
        return messageEvents;
    }

    public List<Link> getLinks() {
        return links;
    }

    @Override
    public String toString() {
        return "SpanRecord{" +
                "traceId=" + spanContext.traceId() +
                ", spanId=" + spanContext.spanId() +
                ", parentSpanId=" + parentSpanId +
                ", name='" + name + '\'' +
                ", status=" + status.code() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SpanContext spanContext;
        private SpanId parentSpanId;
        private String name;
        private Instant startTime;
        private Instant endTime;
        private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        private Status status;
        private final List<MessageEvent> messageEvents = new ArrayList<>();
        private final List<Link> links = new ArrayList<>();

        public Builder spanContext(SpanContext spanContext) {
            this.spanContext = spanContext;
            return this;
        }

        public Builder parentSpanId(SpanId parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        /**
         * Sets an attribute. Re-setting a key replaces the value and keeps the original position.
         */
        public Builder attribute(String key, AttributeValue value) {
            Objects.requireNonNull(key, "key is required");
            Objects.requireNonNull(value, "value is required");
            attributes.put(key, value);
            return this;
        }

        public Builder attribute(Attribute attribute) {
            return attribute(attribute.key(), attribute.value());
        }

        public Builder attributes(List<Attribute> attributes) {
            attributes.forEach(this::attribute);
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder messageEvent(MessageEvent event) {
            messageEvents.add(Objects.requireNonNull(event, "event is required"));
            return this;
        }

        public Builder link(Link link) {
            links.add(Objects.requireNonNull(link, "link is required"));
            return this;
        }

        public SpanRecord build() {
            Objects.requireNonNull(spanContext, "spanContext is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(startTime, "startTime is required");
            if (endTime != null && endTime.isBefore(startTime)) {
                throw new IllegalArgumentException(
                        "endTime " + endTime + " is before startTime " + startTime);
            }
            return new SpanRecord(this);
        }
    }
}
