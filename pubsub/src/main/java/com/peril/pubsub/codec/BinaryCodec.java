package com.peril.pubsub.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

/**
 * Compact binary encoding (CBOR). Field names and types follow the same Jackson
 * mapping as {@link JsonCodec}, so a payload class works with either codec.
 */
public final class BinaryCodec<T> extends JacksonCodec<T> {

    public static final String CONTENT_TYPE = "application/octet-stream";

    BinaryCodec(CBORMapper mapper, JavaType type) {
        super(mapper, type);
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }
}
