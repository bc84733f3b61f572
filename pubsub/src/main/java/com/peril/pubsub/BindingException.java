package com.peril.pubsub;

/**
 * Queue setup failed at the broker. {@link #step()} tells which call failed.
 */
public class BindingException extends MessagingException {

    public enum Step {
        OPEN_CHANNEL,
        DECLARE_QUEUE,
        BIND_QUEUE
    }

    private final Step step;
    private final String exchange;
    private final String queueName;
    private final String routingKey;

    public BindingException(Step step, String exchange, String queueName, String routingKey, Throwable cause) {
        super(describe(step, exchange, queueName, routingKey, cause), cause);
        this.step = step;
        this.exchange = exchange;
        this.queueName = queueName;
        this.routingKey = routingKey;
    }

    private static String describe(Step step, String exchange, String queueName, String routingKey, Throwable cause) {
        String what;
        switch (step) {
            case OPEN_CHANNEL:
                what = "Failed to open a channel";
                break;
            case DECLARE_QUEUE:
                what = "Failed to declare queue '" + queueName + "'";
                break;
            default:
                what = "Failed to bind queue '" + queueName + "'";
        }
        return what + " for " + exchange + "@" + routingKey
                + (cause != null ? ": " + cause.getMessage() : "");
    }

    public Step step() { return step; }
    public String exchange() { return exchange; }
    public String queueName() { return queueName; }
    public String routingKey() { return routingKey; }
}
