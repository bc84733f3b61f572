package com.peril.pubsub.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.peril.pubsub.DecodeException;
import com.peril.pubsub.EncodeException;

import java.io.IOException;

/**
 * Codec backed by a Jackson mapper. The data format (JSON text, CBOR binary) comes
 * from the mapper's factory.
 */
abstract class JacksonCodec<T> implements PayloadCodec<T> {

    private final JavaType type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    JacksonCodec(ObjectMapper mapper, JavaType type) {
        this.type = type;
        this.reader = mapper.readerFor(type);
        this.writer = mapper.writerFor(type);
    }

    @Override
    public byte[] encode(T value) throws EncodeException {
        if (value == null) {
            throw new EncodeException("Cannot encode null " + typeName() + " as " + contentType(), null);
        }
        try {
            return writer.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new EncodeException("Failed to encode " + typeName() + " as " + contentType(), e);
        }
    }

    @Override
    public T decode(byte[] body) throws DecodeException {
        if (body == null || body.length == 0) {
            throw new DecodeException("Empty " + contentType() + " body for " + typeName(), null);
        }
        T value;
        try {
            value = reader.readValue(body);
        } catch (IOException e) {
            throw new DecodeException("Failed to decode " + contentType() + " body as " + typeName(), e);
        }
        if (value == null) {
            throw new DecodeException("Decoded null " + typeName() + " from " + contentType() + " body", null);
        }
        return value;
    }

    private String typeName() {
        return type.getRawClass().getSimpleName();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "<" + typeName() + ">";
    }
}
