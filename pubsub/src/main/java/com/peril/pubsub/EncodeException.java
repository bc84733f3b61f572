package com.peril.pubsub;

public class EncodeException extends MessagingException {

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
