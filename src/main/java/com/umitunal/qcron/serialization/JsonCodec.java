package com.umitunal.qcron.serialization;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON codec using Jackson.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this(mapper.constructType(type), mapper);
    }

    private JsonCodec(JavaType type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    /**
     * Codec for job parameters and results: a JSON object decoded into an insertion-ordered map.
     */
    public static JsonCodec<Map<String, Object>> forPayloadMap() {
        ObjectMapper mapper = createDefaultMapper();
        JavaType mapType = mapper.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, Object.class);
        return new JsonCodec<>(mapType, mapper);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new RuntimeException("Failed to serialize to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new RuntimeException("Failed to deserialize from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }
}
