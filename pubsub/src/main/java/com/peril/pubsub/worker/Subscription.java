package com.peril.pubsub.worker;

import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running consumer. It stops when its channel or connection closes;
 * {@link #close()} closes the channel.
 */
public final class Subscription implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final Channel channel;
    private final String queueName;
    private final String consumerTag;
    private final DeliveryStats stats;

    Subscription(Channel channel, String queueName, String consumerTag, DeliveryStats stats) {
        this.channel = channel;
        this.queueName = queueName;
        this.consumerTag = consumerTag;
        this.stats = stats;
    }

    public Channel channel() { return channel; }
    public String queueName() { return queueName; }
    public String consumerTag() { return consumerTag; }
    public DeliveryStats stats() { return stats; }

    public boolean isActive() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) channel.close();
        } catch (Exception e) {
            log.warn("[MQ] Failed to close channel of queue {}: {}", queueName, e.toString());
        }
        log.info("[MQ] Subscription on {} closed ({})", queueName, stats);
    }
}
