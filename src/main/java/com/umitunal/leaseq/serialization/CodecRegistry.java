package com.umitunal.leaseq.serialization;

import com.umitunal.leaseq.core.QueueException;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Codecs by id, with one marked as the default for new jobs.
 */
public class CodecRegistry {
    private final Map<String, PayloadCodec> codecs = new ConcurrentHashMap<>();
    private final String defaultCodecId;

    public CodecRegistry(PayloadCodec defaultCodec) {
        Objects.requireNonNull(defaultCodec, "defaultCodec must not be null");
        this.defaultCodecId = defaultCodec.id();
        register(defaultCodec);
    }

    /**
     * JSON by default, plus the Kryo, string and byte array codecs.
     */
    public static CodecRegistry defaults() {
        return new CodecRegistry(new JsonCodec())
                .register(new KryoCodec())
                .register(new StringCodec())
                .register(new ByteArrayCodec());
    }

    public CodecRegistry register(PayloadCodec codec) {
        Objects.requireNonNull(codec, "codec must not be null");
        PayloadCodec previous = codecs.putIfAbsent(codec.id(), codec);
        if (previous != null && previous != codec) {
            throw new IllegalStateException("Duplicate codec id: " + codec.id());
        }
        return this;
    }

    /**
     * @throws QueueException CODEC_NOT_FOUND when no codec has this id
     */
    public PayloadCodec get(String codecId) throws QueueException {
        PayloadCodec codec = codecId != null ? codecs.get(codecId) : null;
        if (codec == null) {
            throw QueueException.codecNotFound(codecId);
        }
        return codec;
    }

    public PayloadCodec defaultCodec() {
        return codecs.get(defaultCodecId);
    }

    public boolean contains(String codecId) {
        return codecs.containsKey(codecId);
    }

    public Set<String> ids() {
        return Set.copyOf(codecs.keySet());
    }
}
