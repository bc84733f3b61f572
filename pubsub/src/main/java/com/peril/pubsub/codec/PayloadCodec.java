package com.peril.pubsub.codec;

import com.peril.pubsub.DecodeException;
import com.peril.pubsub.EncodeException;

/**
 * Turns a payload into message bytes and back. Implementations are stateless and
 * may be shared between publishers and subscriptions.
 *
 * @param <T> payload type
 */
public interface PayloadCodec<T> {

    /** Value written to the {@code content_type} message property. */
    String contentType();

    byte[] encode(T value) throws EncodeException;

    T decode(byte[] body) throws DecodeException;
}
