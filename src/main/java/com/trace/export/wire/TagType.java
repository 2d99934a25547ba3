package com.trace.export.wire;

/**
 * Value type of a {@link Tag}.
 */
public enum TagType {
    STRING,
    DOUBLE,
    BOOL,
    LONG
}
