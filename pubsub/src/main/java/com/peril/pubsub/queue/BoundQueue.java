package com.peril.pubsub.queue;

import com.rabbitmq.client.Channel;

/**
 * A queue that has been declared and bound, together with the channel it was
 * declared on. {@link #queueName()} is the name the broker returned, which differs
 * from the requested one when the broker generated it.
 */
public final class BoundQueue {
    private final Channel channel;
    private final String queueName;
    private final String exchange;
    private final String routingKey;
    private final QueueDurability durability;

    public BoundQueue(Channel channel, String queueName, String exchange, String routingKey, QueueDurability durability) {
        this.channel = channel;
        this.queueName = queueName;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.durability = durability;
    }

    public Channel channel() { return channel; }
    public String queueName() { return queueName; }
    public String exchange() { return exchange; }
    public String routingKey() { return routingKey; }
    public QueueDurability durability() { return durability; }

    @Override
    public String toString() {
        return "BoundQueue{" + queueName + " <- " + exchange + "@" + routingKey + ", " + durability + '}';
    }
}
