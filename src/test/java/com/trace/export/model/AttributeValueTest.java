package com.trace.export.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttributeValueTest {

    @Test
    @DisplayName("Integer types are widened to long")
    void testIntegerWidening() {
        assertEquals(AttributeType.INT32, AttributeValue.int32Value(-7).getType());
        assertEquals(-7L, AttributeValue.int32Value(-7).getLong());
        assertEquals(Long.MAX_VALUE, AttributeValue.int64Value(Long.MAX_VALUE).getLong());
    }

    @Test
    @DisplayName("Float types are widened to double")
    void testFloatWidening() {
        assertEquals(1.5, AttributeValue.float32Value(1.5f).getDouble());
        assertEquals(AttributeType.FLOAT64, AttributeValue.float64Value(2.25).getType());
    }

    @Test
    @DisplayName("Accessing a value through the wrong accessor fails")
    void testWrongAccessor() {
        assertThrows(IllegalStateException.class, () -> AttributeValue.stringValue("x").getBool());
        assertThrows(IllegalStateException.class, () -> AttributeValue.boolValue(true).getLong());
        assertThrows(IllegalStateException.class, () -> AttributeValue.int64Value(1).getDouble());
    }

    @Test
    @DisplayName("uint32 rejects out-of-range values")
    void testUint32Range() {
        assertEquals(0xFFFF_FFFFL, AttributeValue.uint32Value(0xFFFF_FFFFL).getLong());
        assertThrows(IllegalArgumentException.class, () -> AttributeValue.uint32Value(-1));
        assertThrows(IllegalArgumentException.class, () -> AttributeValue.uint32Value(0x1_0000_0000L));
    }

    @Test
    @DisplayName("Bytes are copied in and out")
    void testBytesCopied() {
        byte[] raw = {1, 2, 3};
        AttributeValue value = AttributeValue.bytesValue(raw);
        raw[0] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, value.getBytes());
        value.getBytes()[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, value.getBytes());
    }

    @Test
    @DisplayName("Equality takes type into account")
    void testEquality() {
        assertEquals(AttributeValue.stringValue("a"), AttributeValue.stringValue("a"));
        assertEquals(AttributeValue.bytesValue(new byte[]{1}), AttributeValue.bytesValue(new byte[]{1}));
        assertNotEquals(AttributeValue.int32Value(1), AttributeValue.int64Value(1));
        assertEquals(AttributeValue.int64Value(1).hashCode(), AttributeValue.int64Value(1).hashCode());
    }
}
