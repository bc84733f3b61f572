package com.peril.pubsub;

/**
 * Outcome a {@link MessageHandler} returns for one delivery.
 */
public enum AckType {
    /** Processed; remove from the queue. */
    ACK("ack"),
    /** Not processed now; put back on the queue for redelivery. */
    NACK_REQUEUE("nack and requeue"),
    /** Reject; the broker dead-letters it if the queue has a dead-letter exchange, else drops it. */
    NACK_DISCARD("nack and discard");

    private final String description;

    AckType(String description) {
        this.description = description;
    }

    public String describe() {
        return description;
    }
}
