package com.peril.pubsub.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the built-in codecs. The underlying mappers are configured once and
 * shared; Jackson mappers are thread safe after configuration.
 * Unknown properties in a body are ignored for every payload type.
 */
public final class PayloadCodecs {

    private static final JsonMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final CBORMapper CBOR = CBORMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private PayloadCodecs() {}

    public static <T> PayloadCodec<T> json(Class<T> type) {
        return new JsonCodec<>(JSON, JSON.constructType(type));
    }

    public static <T> PayloadCodec<T> json(TypeReference<T> type) {
        return new JsonCodec<>(JSON, JSON.constructType(type));
    }

    public static <T> PayloadCodec<T> binary(Class<T> type) {
        return new BinaryCodec<>(CBOR, CBOR.constructType(type));
    }

    public static <T> PayloadCodec<T> binary(TypeReference<T> type) {
        return new BinaryCodec<>(CBOR, CBOR.constructType(type));
    }

    /** The shared JSON mapper, for callers that need to inspect JSON bodies directly. */
    public static ObjectMapper jsonMapper() {
        return JSON;
    }
}
