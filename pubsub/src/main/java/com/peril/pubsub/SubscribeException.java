package com.peril.pubsub;

public class SubscribeException extends MessagingException {

    private final String exchange;
    private final String routingKey;

    public SubscribeException(String exchange, String routingKey, String reason, Throwable cause) {
        super("Failed to subscribe to " + exchange + "@" + routingKey + ": " + reason, cause);
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public String exchange() { return exchange; }
    public String routingKey() { return routingKey; }
}
