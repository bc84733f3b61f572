package com.peril.pubsub.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Human-readable JSON encoding.
 */
public final class JsonCodec<T> extends JacksonCodec<T> {

    public static final String CONTENT_TYPE = "application/json";

    JsonCodec(ObjectMapper mapper, JavaType type) {
        super(mapper, type);
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }
}
