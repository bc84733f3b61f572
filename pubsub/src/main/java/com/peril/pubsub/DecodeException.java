package com.peril.pubsub;

/**
 * The body of a delivery could not be turned into the expected payload type.
 */
public class DecodeException extends MessagingException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
