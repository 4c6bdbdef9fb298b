package com.umitunal.leaseq.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.leaseq.core.QueueException;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary codec using Kryo.
 *
 * Kryo instances are not thread-safe, so each thread gets its own.
 * Payload classes need a no-arg constructor. Unregistered classes under a
 * registration-required factory are reported as serialization errors.
 */
public class KryoCodec implements PayloadCodec {
    public static final String ID = "kryo";

    private final ThreadLocal<Kryo> kryoThreadLocal;

    public KryoCodec() {
        this(Factories::defaultFactory);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration.
     */
    public KryoCodec(KryoFactory factory) {
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public byte[] encode(Object payload) throws QueueException {
        if (payload == null) {
            throw QueueException.serialization("Kryo cannot encode a null payload", null);
        }
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, payload);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException | IllegalArgumentException e) {
            throw QueueException.serialization("Failed to serialize " + payload.getClass().getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public <T> T decode(byte[] bytes, Class<T> type) throws QueueException {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException | IllegalArgumentException e) {
            throw QueueException.serialization("Failed to deserialize " + type.getSimpleName() + " with Kryo", e);
        }
    }

    /**
     * Factory interface for custom Kryo configuration.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }

    public static class Factories {

        /**
         * No registration required, references tracked.
         */
        public static Kryo defaultFactory() {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(true);
            return kryo;
        }

        /**
         * Registration required for the given classes, no reference tracking.
         */
        public static KryoFactory registered(Class<?>... types) {
            return () -> {
                Kryo kryo = new Kryo();
                kryo.setRegistrationRequired(true);
                kryo.setReferences(false);
                for (Class<?> type : types) {
                    kryo.register(type);
                }
                return kryo;
            };
        }
    }
}
