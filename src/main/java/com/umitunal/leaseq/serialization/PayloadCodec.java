package com.umitunal.leaseq.serialization;

import com.umitunal.leaseq.core.QueueException;

/**
 * Encodes and decodes job payloads and results.
 *
 * <p>The {@link #id()} travels with every {@code JobMessage} so a consumer can pick the
 * matching codec from a {@link CodecRegistry}.
 */
public interface PayloadCodec {

    /**
     * Stable identifier stored alongside encoded bytes.
     */
    String id();

    /**
     * Encode a payload to bytes.
     *
     * @throws QueueException SERIALIZATION_ERROR if the value cannot be encoded
     */
    byte[] encode(Object payload) throws QueueException;

    /**
     * Decode bytes to a payload of the given type.
     *
     * @throws QueueException SERIALIZATION_ERROR if the bytes do not decode to {@code type}
     */
    <T> T decode(byte[] bytes, Class<T> type) throws QueueException;
}
