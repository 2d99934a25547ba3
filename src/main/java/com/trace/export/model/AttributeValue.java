package com.trace.export.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable typed attribute value.
 *
 * <p>Instances are only created through the typed factories, so {@link #getType()} always
 * matches the accessor that holds the value. Integer types are held widened to {@code long},
 * floating-point types widened to {@code double}.</p>
 */
public final class AttributeValue {

    private static final AttributeValue INVALID = new AttributeValue(AttributeType.INVALID, null, false, 0L, 0.0);

    private final AttributeType type;
    private final Object ref;
    private final boolean boolValue;
    private final long longValue;
    private final double doubleValue;

    private AttributeValue(AttributeType type, Object ref, boolean boolValue, long longValue, double doubleValue) {
        this.type = type;
        this.ref = ref;
        this.boolValue = boolValue;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
    }

    public static AttributeValue stringValue(String value) {
        Objects.requireNonNull(value, "value is required");
        return new AttributeValue(AttributeType.STRING, value, false, 0L, 0.0);
    }

    public static AttributeValue boolValue(boolean value) {
        return new AttributeValue(AttributeType.BOOL, null, value, 0L, 0.0);
    }

    public static AttributeValue int32Value(int value) {
        return new AttributeValue(AttributeType.INT32, null, false, value, 0.0);
    }

    public static AttributeValue int64Value(long value) {
        return new AttributeValue(AttributeType.INT64, null, false, value, 0.0);
    }

    public static AttributeValue float32Value(float value) {
        return new AttributeValue(AttributeType.FLOAT32, null, false, 0L, value);
    }

    public static AttributeValue float64Value(double value) {
        return new AttributeValue(AttributeType.FLOAT64, null, false, 0L, value);
    }

    /**
     * @throws IllegalArgumentException if the value does not fit in 32 unsigned bits
     */
    public static AttributeValue uint32Value(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("uint32 value out of range: " + value);
        }
        return new AttributeValue(AttributeType.UINT32, null, false, value, 0.0);
    }

    /**
     * The bits of {@code value} are interpreted as unsigned.
     */
    public static AttributeValue uint64Value(long value) {
        return new AttributeValue(AttributeType.UINT64, null, false, value, 0.0);
    }

    public static AttributeValue bytesValue(byte[] value) {
        Objects.requireNonNull(value, "value is required");
        return new AttributeValue(AttributeType.BYTES, value.clone(), false, 0L, 0.0);
    }

    public static AttributeValue invalid() {
        return INVALID;
    }

    public AttributeType getType() {
        return type;
    }

    public String getString() {
        checkType(AttributeType.STRING);
        return (String) ref;
    }

    public boolean getBool() {
        checkType(AttributeType.BOOL);
        return boolValue;
    }

    /**
     * Returns the value of any integer-typed attribute, widened to 64 bits.
     */
    public long getLong() {
        if (type != AttributeType.INT32 && type != AttributeType.INT64
                && type != AttributeType.UINT32 && type != AttributeType.UINT64) {
            throw new IllegalStateException("Attribute of type " + type + " has no integer value");
        }
        return longValue;
    }

    /**
     * Returns the value of a floating-point attribute, widened to 64 bits.
     */
    public double getDouble() {
        if (type != AttributeType.FLOAT32 && type != AttributeType.FLOAT64) {
            throw new IllegalStateException("Attribute of type " + type + " has no floating-point value");
        }
        return doubleValue;
    }

    public byte[] getBytes() {
        checkType(AttributeType.BYTES);
        return ((byte[]) ref).clone();
    }

    private void checkType(AttributeType expected) {
        if (type != expected) {
            throw new IllegalStateException("Attribute of type " + type + " is not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue)) return false;
        AttributeValue that = (AttributeValue) o;
        if (type != that.type) return false;
        return switch (type) {
            case STRING -> ref.equals(that.ref);
            case BYTES -> Arrays.equals((byte[]) ref, (byte[]) that.ref);
            case BOOL -> boolValue == that.boolValue;
            case INT32, INT64, UINT32, UINT64 -> longValue == that.longValue;
            case FLOAT32, FLOAT64 -> Double.compare(doubleValue, that.doubleValue) == 0;
            case INVALID -> true;
        };
    }

    @Override
    public int hashCode() {
        int valueHash = switch (type) {
            case STRING -> ref.hashCode();
            case BYTES -> Arrays.hashCode((byte[]) ref);
            case BOOL -> Boolean.hashCode(boolValue);
            case INT32, INT64, UINT32, UINT64 -> Long.hashCode(longValue);
            case FLOAT32, FLOAT64 -> Double.hashCode(doubleValue);
            case INVALID -> 0;
        };
        return 31 * type.hashCode() + valueHash;
    }

    @Override
    public String toString() {
        String rendered = switch (type) {
            case STRING -> (String) ref;
            case BYTES -> Arrays.toString((byte[]) ref);
            case BOOL -> Boolean.toString(boolValue);
            case INT32, INT64, UINT32 -> Long.toString(longValue);
            case UINT64 -> Long.toUnsignedString(longValue);
            case FLOAT32, FLOAT64 -> Double.toString(doubleValue);
            case INVALID -> "";
        };
        return type + "(" + rendered + ")";
    }
}
