package com.trace.export.convert;

import com.trace.export.model.Link;
import com.trace.export.model.MessageEvent;
import com.trace.export.model.SpanRecord;
import com.trace.export.model.Status;
import com.trace.export.wire.Log;
import com.trace.export.wire.SpanRef;
import com.trace.export.wire.SpanRefType;
import com.trace.export.wire.Tag;
import com.trace.export.wire.WireSpan;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a {@link SpanRecord} into its {@link WireSpan} form.
 *
 * <p>Tag order is: converted attributes, {@code status.code}, {@code status.message}, then
 * {@code error=true} only when the status is not OK. Each message event becomes a log whose
 * fields are the converted event attributes followed by a {@code message} tag. Each link
 * becomes a {@link SpanRefType#CHILD_OF} reference.</p>
 */
public final class SpanConverter {

    private SpanConverter() {
        // utility class
    }

    public static WireSpan toWireSpan(SpanRecord record) {
        List<Tag> tags = TagConverter.toTags(record.getAttributes());

        Status status = record.getStatus();
        tags.add(TagConverter.intTag(TagConverter.STATUS_CODE_KEY, status.code().value()));
        tags.add(TagConverter.stringTag(TagConverter.STATUS_MESSAGE_KEY, status.message()));
        if (!status.isOk()) {
            tags.add(TagConverter.boolTag(TagConverter.ERROR_KEY, true));
        }

        List<Log> logs = new ArrayList<>(record.getMessageEvents().size());
        for (MessageEvent event : record.getMessageEvents()) {
            List<Tag> fields = TagConverter.toTags(event.attributes());
            fields.add(TagConverter.stringTag(TagConverter.MESSAGE_KEY, event.message()));
            logs.add(new Log(toEpochMicros(event.time()), fields));
        }

        // Links carry no relation kind upstream, so every reference is CHILD_OF.
        List<SpanRef> references = new ArrayList<>(record.getLinks().size());
        for (Link link : record.getLinks()) {
            references.add(new SpanRef(
                    SpanRefType.CHILD_OF,
                    link.traceId().low(),
                    link.traceId().high(),
                    link.spanId().value()));
        }

        return new WireSpan(
                record.getTraceId().low(),
                record.getTraceId().high(),
                record.getSpanId().value(),
                record.getParentSpanId().value(),
                record.getName(),
                Byte.toUnsignedInt(record.getTraceFlags()),
                toEpochMicros(record.getStartTime()),
                toMicros(Duration.between(record.getStartTime(), record.getEndTime())),
                tags,
                logs,
                references);
    }

    static long toEpochMicros(Instant instant) {
        return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000L;
    }

    static long toMicros(Duration duration) {
        return duration.getSeconds() * 1_000_000L + duration.getNano() / 1_000L;
    }
}
