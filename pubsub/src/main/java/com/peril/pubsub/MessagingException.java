package com.peril.pubsub;

/**
 * Base type for failures raised by the pub/sub layer.
 */
public class MessagingException extends Exception {

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
