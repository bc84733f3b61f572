package com.peril.pubsub.worker;

import com.peril.pubsub.BindingException;
import com.peril.pubsub.MessageHandler;
import com.peril.pubsub.SubscribeException;
import com.peril.pubsub.codec.PayloadCodec;
import com.peril.pubsub.codec.PayloadCodecs;
import com.peril.pubsub.queue.BoundQueue;
import com.peril.pubsub.queue.QueueBindingManager;
import com.peril.pubsub.queue.QueueDurability;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Binds a queue and consumes it with manual acknowledgements.
 * <p>
 * Each {@code subscribe} call gets its own channel and consumer. The client library
 * delivers callbacks for one channel one at a time and in broker order, so a slow
 * handler only holds up its own subscription. {@code subscribe} returns as soon as
 * the consumer is registered.
 */
public class MessageSubscriber {
    private static final Logger log = LoggerFactory.getLogger(MessageSubscriber.class);

    private final Connection conn;
    private final QueueBindingManager bindings;
    private final int prefetch;

    public MessageSubscriber(Connection conn, QueueBindingManager bindings) {
        this(conn, bindings, 0);
    }

    /**
     * @param prefetch unacknowledged deliveries allowed per subscription, 0 for no limit
     */
    public MessageSubscriber(Connection conn, QueueBindingManager bindings, int prefetch) {
        if (prefetch < 0) throw new IllegalArgumentException("prefetch must be >= 0");
        this.conn = conn;
        this.bindings = bindings;
        this.prefetch = prefetch;
    }

    public <T> Subscription subscribe(String exchange,
                                      String queueName,
                                      String routingKey,
                                      QueueDurability durability,
                                      PayloadCodec<T> codec,
                                      MessageHandler<T> handler) throws SubscribeException {
        final BoundQueue bound;
        try {
            bound = bindings.declareAndBind(conn, exchange, queueName, routingKey, durability);
        } catch (BindingException e) {
            log.error("[MQ] Failed to declare and bind to {}@{}: {}", exchange, routingKey, e.getMessage());
            throw new SubscribeException(exchange, routingKey, e.getMessage(), e);
        }

        final Channel ch = bound.channel();
        final String queue = bound.queueName();
        final DeliveryStats stats = new DeliveryStats();
        final DeliveryDispatcher<T> dispatcher = new DeliveryDispatcher<>(ch, queue, codec, handler, stats);

        final String tag;
        try {
            if (prefetch > 0) {
                ch.basicQos(prefetch);
            }
            tag = ch.basicConsume(queue, false, new DefaultConsumer(ch) {
                @Override
                public void handleDelivery(String consumerTag,
                                           Envelope env,
                                           AMQP.BasicProperties props,
                                           byte[] body) {
                    dispatcher.dispatch(env, props, body);
                }

                @Override
                public void handleCancel(String consumerTag) {
                    log.warn("[MQ] Consumer {} on queue {} cancelled by broker", consumerTag, queue);
                }

                @Override
                public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
                    if (sig.isInitiatedByApplication()) {
                        log.info("[MQ] Consumer {} on queue {} stopped ({})", consumerTag, queue, stats);
                    } else {
                        log.warn("[MQ] Consumer {} on queue {} stopped by broker: {}", consumerTag, queue, sig.getMessage());
                    }
                }
            });
        } catch (IOException | RuntimeException e) {
            log.error("[MQ] Failed to consume messages from queue {}: {}", queue, e.toString());
            try {
                if (ch.isOpen()) ch.close();
            } catch (Exception closeErr) {
                log.warn("[MQ] Failed to close channel of queue {}: {}", queue, closeErr.toString());
            }
            throw new SubscribeException(exchange, routingKey, "consume on queue " + queue + " failed", e);
        }

        log.info("[MQ] Consuming queue {} from {}@{} ({}, {}, prefetch={})",
                queue, exchange, routingKey, durability, codec.contentType(), prefetch);
        return new Subscription(ch, queue, tag, stats);
    }

    public <T> Subscription subscribeJson(String exchange, String queueName, String routingKey,
                                          QueueDurability durability, Class<T> type,
                                          MessageHandler<T> handler) throws SubscribeException {
        return subscribe(exchange, queueName, routingKey, durability, PayloadCodecs.json(type), handler);
    }

    public <T> Subscription subscribeBinary(String exchange, String queueName, String routingKey,
                                            QueueDurability durability, Class<T> type,
                                            MessageHandler<T> handler) throws SubscribeException {
        return subscribe(exchange, queueName, routingKey, durability, PayloadCodecs.binary(type), handler);
    }
}
