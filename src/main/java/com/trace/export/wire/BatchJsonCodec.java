package com.trace.export.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Jackson-based JSON encoding of {@link Batch} for HTTP collectors.
 * Thread-safe; a single instance may be shared.
 */
public class BatchJsonCodec {

    private final ObjectMapper objectMapper;

    public BatchJsonCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public BatchJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Batch batch) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(batch);
    }

    public Batch decode(byte[] json) throws IOException {
        return objectMapper.readValue(json, Batch.class);
    }
}
