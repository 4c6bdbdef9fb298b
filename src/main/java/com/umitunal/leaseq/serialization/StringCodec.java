package com.umitunal.leaseq.serialization;

import com.umitunal.leaseq.core.QueueException;

import java.nio.charset.StandardCharsets;

/**
 * Codec for String payloads using UTF-8 encoding.
 */
public class StringCodec implements PayloadCodec {
    public static final String ID = "string";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public byte[] encode(Object payload) throws QueueException {
        if (!(payload instanceof String text)) {
            throw QueueException.serialization("String codec cannot encode " + describe(payload), null);
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public <T> T decode(byte[] bytes, Class<T> type) throws QueueException {
        if (!type.isAssignableFrom(String.class)) {
            throw QueueException.serialization("String codec cannot decode to " + type.getName(), null);
        }
        return type.cast(new String(bytes, StandardCharsets.UTF_8));
    }

    private static String describe(Object payload) {
        return payload == null ? "null" : payload.getClass().getName();
    }
}
