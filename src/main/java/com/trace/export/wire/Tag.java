package com.trace.export.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Wire key/value pair. Exactly one of the value fields is populated, the one named by {@code vType}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tag(
        @JsonProperty("key") String key,
        @JsonProperty("vType") TagType vType,
        @JsonProperty("vStr") String vStr,
        @JsonProperty("vDouble") Double vDouble,
        @JsonProperty("vBool") Boolean vBool,
        @JsonProperty("vLong") Long vLong
) {

    public Tag {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(vType, "vType is required");
        int populated = (vStr != null ? 1 : 0) + (vDouble != null ? 1 : 0)
                + (vBool != null ? 1 : 0) + (vLong != null ? 1 : 0);
        boolean matches = switch (vType) {
            case STRING -> vStr != null;
            case DOUBLE -> vDouble != null;
            case BOOL -> vBool != null;
            case LONG -> vLong != null;
        };
        if (populated != 1 || !matches) {
            throw new IllegalArgumentException("Tag '" + key + "' must carry exactly one " + vType + " value");
        }
    }

    public static Tag ofString(String key, String value) {
        return new Tag(key, TagType.STRING, Objects.requireNonNull(value, "value is required"), null, null, null);
    }

    public static Tag ofDouble(String key, double value) {
        return new Tag(key, TagType.DOUBLE, null, value, null, null);
    }

    public static Tag ofBool(String key, boolean value) {
        return new Tag(key, TagType.BOOL, null, null, value, null);
    }

    public static Tag ofLong(String key, long value) {
        return new Tag(key, TagType.LONG, null, null, null, value);
    }
}
