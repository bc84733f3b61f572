package com.peril.pubsub;

/**
 * An ack or nack call failed against the broker. The delivery is left to the
 * broker's own redelivery rules.
 */
public class DispositionException extends MessagingException {

    public DispositionException(long deliveryTag, AckType ackType, Throwable cause) {
        super("Failed to " + ackType.describe() + " deliveryTag=" + deliveryTag
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
    }
}
