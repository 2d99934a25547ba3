package com.trace.export.model;

import java.util.Objects;

/**
 * A key and its typed value.
 */
public record Attribute(String key, AttributeValue value) {

    public Attribute {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
    }

    public static Attribute of(String key, String value) {
        return new Attribute(key, AttributeValue.stringValue(value));
    }

    public static Attribute of(String key, boolean value) {
        return new Attribute(key, AttributeValue.boolValue(value));
    }

    public static Attribute of(String key, int value) {
        return new Attribute(key, AttributeValue.int32Value(value));
    }

    public static Attribute of(String key, long value) {
        return new Attribute(key, AttributeValue.int64Value(value));
    }

    public static Attribute of(String key, float value) {
        return new Attribute(key, AttributeValue.float32Value(value));
    }

    public static Attribute of(String key, double value) {
        return new Attribute(key, AttributeValue.float64Value(value));
    }
}
