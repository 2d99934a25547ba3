package com.trace.export.wire;

/**
 * Relation between a span and a span it references.
 */
public enum SpanRefType {
    CHILD_OF
}
