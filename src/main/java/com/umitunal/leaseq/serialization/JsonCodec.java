package com.umitunal.leaseq.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.umitunal.leaseq.core.QueueException;

import java.io.IOException;

/**
 * JSON codec using Jackson. The default codec for new jobs.
 */
public class JsonCodec implements PayloadCodec {
    public static final String ID = "json";

    private final ObjectMapper mapper;

    public JsonCodec() {
        this(createDefaultMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public byte[] encode(Object payload) throws QueueException {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw QueueException.serialization("Failed to serialize to JSON", e);
        }
    }

    @Override
    public <T> T decode(byte[] bytes, Class<T> type) throws QueueException {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw QueueException.serialization("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
