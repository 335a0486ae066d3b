package com.umitunal.qcron.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact binary payload codec using Kryo. Unlike JSON it keeps the exact Java types of
 * parameter values (a {@code long} stays a {@code long}), at the cost of a Java-only format.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    /**
     * Codec for job parameters and results.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static KryoCodec<Map<String, Object>> forPayloadMap() {
        return new KryoCodec<>((Class<Map<String, Object>>) (Class) LinkedHashMap.class);
    }

    @Override
    public byte[] encode(T payload) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, payload);
            output.flush();
            return baos.toByteArray();
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        }
    }

    private static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        // Payload values are arbitrary, so classes cannot be registered up front
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }

    /**
     * Factory interface for custom Kryo configuration.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
