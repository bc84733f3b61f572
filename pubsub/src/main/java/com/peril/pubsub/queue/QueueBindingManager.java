package com.peril.pubsub.queue;

import com.peril.pubsub.BindingException;
import com.peril.pubsub.BindingException.Step;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Declares a queue on a fresh channel and binds it to an exchange.
 * Every queue gets an {@code x-dead-letter-exchange} argument so rejected messages
 * are rerouted instead of dropped.
 */
public class QueueBindingManager {
    private static final Logger log = LoggerFactory.getLogger(QueueBindingManager.class);

    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";

    private final String deadLetterExchange;

    public QueueBindingManager(String deadLetterExchange) {
        if (deadLetterExchange == null || deadLetterExchange.isBlank()) {
            throw new IllegalArgumentException("deadLetterExchange must not be blank");
        }
        this.deadLetterExchange = deadLetterExchange;
    }

    public BoundQueue declareAndBind(Connection conn,
                                     String exchange,
                                     String queueName,
                                     String routingKey,
                                     QueueDurability durability) throws BindingException {
        final Channel ch;
        try {
            ch = conn.createChannel();
        } catch (IOException | RuntimeException e) {
            log.error("[MQ] Failed to open a channel for {}@{}: {}", exchange, routingKey, e.toString());
            throw new BindingException(Step.OPEN_CHANNEL, exchange, queueName, routingKey, e);
        }
        if (ch == null) {
            // createChannel returns null when the connection has run out of channel numbers
            throw new BindingException(Step.OPEN_CHANNEL, exchange, queueName, routingKey,
                    new IOException("no channel available on connection"));
        }

        final String declaredName;
        try {
            AMQP.Queue.DeclareOk ok = ch.queueDeclare(queueName,
                    durability.durable(), durability.exclusive(), durability.autoDelete(), queueArguments());
            declaredName = ok.getQueue();
        } catch (IOException | RuntimeException e) {
            log.error("[MQ] Failed to declare queue {}: {}", queueName, e.toString());
            closeQuietly(ch);
            throw new BindingException(Step.DECLARE_QUEUE, exchange, queueName, routingKey, e);
        }

        try {
            ch.queueBind(declaredName, exchange, routingKey);
        } catch (IOException | RuntimeException e) {
            log.error("[MQ] Failed to bind queue {} to {}@{}: {}", declaredName, exchange, routingKey, e.toString());
            closeQuietly(ch);
            throw new BindingException(Step.BIND_QUEUE, exchange, declaredName, routingKey, e);
        }

        log.info("[MQ] Declared {} queue {} bound to {}@{} (dlx={})",
                durability, declaredName, exchange, routingKey, deadLetterExchange);
        return new BoundQueue(ch, declaredName, exchange, routingKey, durability);
    }

    Map<String, Object> queueArguments() {
        Map<String, Object> args = new HashMap<>();
        args.put(DEAD_LETTER_EXCHANGE_ARG, deadLetterExchange);
        return args;
    }

    private void closeQuietly(Channel ch) {
        try {
            if (ch.isOpen()) ch.close();
        } catch (Exception e) {
            log.warn("[MQ] Failed to close channel after setup error: {}", e.toString());
        }
    }
}
