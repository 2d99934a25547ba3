package com.trace.export.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpanRecordTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final SpanContext CONTEXT = SpanContext.sampled(new TraceId(1, 2), new SpanId(3));

    @Test
    @DisplayName("Should apply defaults for parent, end time and status")
    void testDefaults() {
        SpanRecord record = SpanRecord.builder()
                .spanContext(CONTEXT)
                .name("root")
                .startTime(START)
                .build();

        assertEquals(SpanId.invalid(), record.getParentSpanId());
        assertEquals(START, record.getEndTime());
        assertTrue(record.getStatus().isOk());
        assertTrue(record.getAttributes().isEmpty());
    }

    @Test
    @DisplayName("Should reject end time before start time")
    void testEndBeforeStart() {
        assertThrows(IllegalArgumentException.class, () -> SpanRecord.builder()
                .spanContext(CONTEXT)
                .name("bad")
                .startTime(START)
                .endTime(START.minusMillis(1))
                .build());
    }

    @Test
    @DisplayName("Should require span context, name and start time")
    void testRequiredFields() {
        assertThrows(NullPointerException.class, () -> SpanRecord.builder().name("x").startTime(START).build());
        assertThrows(NullPointerException.class, () -> SpanRecord.builder().spanContext(CONTEXT).startTime(START).build());
        assertThrows(NullPointerException.class, () -> SpanRecord.builder().spanContext(CONTEXT).name("x").build());
    }

    @Test
    @DisplayName("Re-setting an attribute key replaces the value in place")
    void testAttributeKeysUnique() {
        SpanRecord record = SpanRecord.builder()
                .spanContext(CONTEXT)
                .name("op")
                .startTime(START)
                .attribute(Attribute.of("a", "1"))
                .attribute(Attribute.of("b", 2L))
                .attribute(Attribute.of("a", "3"))
                .build();

        assertEquals(List.of(Attribute.of("a", "3"), Attribute.of("b", 2L)), record.getAttributes());
    }

    @Test
    @DisplayName("Built record is not affected by later builder changes")
    void testImmutable() {
        List<Attribute> eventAttrs = new ArrayList<>(List.of(Attribute.of("k", "v")));
        SpanRecord.Builder builder = SpanRecord.builder()
                .spanContext(CONTEXT)
                .name("op")
                .startTime(START)
                .messageEvent(new MessageEvent(START, "hello", eventAttrs));
        SpanRecord record = builder.build();

        builder.link(new Link(new TraceId(9, 9), new SpanId(9)));
        eventAttrs.add(Attribute.of("extra", true));

        assertTrue(record.getLinks().isEmpty());
        assertEquals(1, record.getMessageEvents().get(0).attributes().size());
        assertThrows(UnsupportedOperationException.class,
                () -> record.getAttributes().add(Attribute.of("x", "y")));
    }

    @Test
    @DisplayName("Status message falls back to the code name")
    void testStatusMessage() {
        assertEquals("OK", Status.ok().message());
        assertEquals("NotFound", Status.of(StatusCode.NOT_FOUND).message());
        assertEquals("no such user", Status.error(StatusCode.NOT_FOUND, "no such user").message());
    }
}
