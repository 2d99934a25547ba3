package com.trace.export.model;

/**
 * 64-bit span identifier.
 */
public record SpanId(long value) {

    private static final SpanId INVALID = new SpanId(0L);

    public static SpanId invalid() {
        return INVALID;
    }

    /**
     * Parses a hex string of at most 16 characters.
     *
     * @throws IllegalArgumentException if the string is empty, too long, or not hex
     */
    public static SpanId fromHex(String hex) {
        if (hex == null || hex.isEmpty() || hex.length() > 16) {
            throw new IllegalArgumentException("spanId must be 1-16 hex characters: " + hex);
        }
        try {
            return new SpanId(Long.parseUnsignedLong(hex, 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("spanId is not valid hex: " + hex, e);
        }
    }

    public boolean isValid() {
        return value != 0L;
    }

    public String toHex() {
        return String.format("%016x", value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
