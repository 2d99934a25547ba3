package com.trace.export.model;

/**
 * 128-bit trace identifier, held as two signed 64-bit halves.
 *
 * @param high the upper 64 bits
 * @param low  the lower 64 bits
 */
public record TraceId(long high, long low) {

    private static final TraceId INVALID = new TraceId(0L, 0L);

    public static TraceId invalid() {
        return INVALID;
    }

    /**
     * Parses a 32-character hex string. Shorter strings are left-padded with zeros.
     *
     * @throws IllegalArgumentException if the string is empty, too long, or not hex
     */
    public static TraceId fromHex(String hex) {
        if (hex == null || hex.isEmpty() || hex.length() > 32) {
            throw new IllegalArgumentException("traceId must be 1-32 hex characters: " + hex);
        }
        String padded = "0".repeat(32 - hex.length()) + hex;
        try {
            return new TraceId(
                    Long.parseUnsignedLong(padded.substring(0, 16), 16),
                    Long.parseUnsignedLong(padded.substring(16), 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("traceId is not valid hex: " + hex, e);
        }
    }

    public boolean isValid() {
        return high != 0L || low != 0L;
    }

    public String toHex() {
        return String.format("%016x%016x", high, low);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
