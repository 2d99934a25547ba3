package com.trace.export.model;

/**
 * Closed set of attribute value types produced by the instrumentation layer.
 */
public enum AttributeType {
    STRING,
    BOOL,
    INT32,
    INT64,
    FLOAT32,
    FLOAT64,
    UINT32,
    UINT64,
    BYTES,
    INVALID
}
