package com.umitunal.leaseq.serialization;

import com.umitunal.leaseq.core.QueueException;

/**
 * Pass-through codec for raw byte arrays.
 * Useful when payload is already serialized.
 */
public class ByteArrayCodec implements PayloadCodec {
    public static final String ID = "bytes";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public byte[] encode(Object payload) throws QueueException {
        if (!(payload instanceof byte[] raw)) {
            throw QueueException.serialization("Byte array codec cannot encode "
                    + (payload == null ? "null" : payload.getClass().getName()), null);
        }
        return raw;
    }

    @Override
    public <T> T decode(byte[] bytes, Class<T> type) throws QueueException {
        if (type != byte[].class && type != Object.class) {
            throw QueueException.serialization("Byte array codec cannot decode to " + type.getName(), null);
        }
        return type.cast(bytes);
    }
}
