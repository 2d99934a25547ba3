package com.trace.export.convert;

import com.trace.export.model.Attribute;
import com.trace.export.model.AttributeValue;
import com.trace.export.wire.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts typed attributes into wire {@link Tag}s.
 *
 * <p>Strings and booleans map directly, 32/64-bit integers widen to a long tag and
 * 32/64-bit floats widen to a double tag. Every other attribute type yields no tag and
 * is dropped by the list conversions.</p>
 */
public final class TagConverter {

    public static final String STATUS_CODE_KEY = "status.code";
    public static final String STATUS_MESSAGE_KEY = "status.message";
    public static final String ERROR_KEY = "error";
    public static final String MESSAGE_KEY = "message";

    private TagConverter() {
        // utility class
    }

    /**
     * Converts one attribute, or returns empty when its type has no wire representation.
     */
    public static Optional<Tag> toTag(String key, AttributeValue value) {
        return switch (value.getType()) {
            case STRING -> Optional.of(Tag.ofString(key, value.getString()));
            case BOOL -> Optional.of(Tag.ofBool(key, value.getBool()));
            case INT32, INT64 -> Optional.of(Tag.ofLong(key, value.getLong()));
            case FLOAT32, FLOAT64 -> Optional.of(Tag.ofDouble(key, value.getDouble()));
            case UINT32, UINT64, BYTES, INVALID -> Optional.empty();
        };
    }

    public static Optional<Tag> toTag(Attribute attribute) {
        return toTag(attribute.key(), attribute.value());
    }

    /**
     * Converts attributes in order, omitting the ones without a wire representation.
     */
    public static List<Tag> toTags(List<Attribute> attributes) {
        List<Tag> tags = new ArrayList<>(attributes.size());
        for (Attribute attribute : attributes) {
            toTag(attribute).ifPresent(tags::add);
        }
        return tags;
    }

    public static Tag stringTag(String key, String value) {
        return Tag.ofString(key, value);
    }

    public static Tag intTag(String key, long value) {
        return Tag.ofLong(key, value);
    }

    public static Tag boolTag(String key, boolean value) {
        return Tag.ofBool(key, value);
    }
}
