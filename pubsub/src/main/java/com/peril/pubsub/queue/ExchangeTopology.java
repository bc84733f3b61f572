package com.peril.pubsub.queue;

import com.peril.pubsub.routing.Routing;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Declares the exchanges publishers and subscribers expect to exist, plus the
 * dead-letter exchange and the queue that collects dead-lettered messages.
 * Safe to run on every start.
 */
public class ExchangeTopology {
    private static final Logger log = LoggerFactory.getLogger(ExchangeTopology.class);

    public static final String DEAD_LETTER_QUEUE = "peril_dlq";

    private final String deadLetterExchange;

    public ExchangeTopology(String deadLetterExchange) {
        this.deadLetterExchange = deadLetterExchange;
    }

    public void declare(Channel ch) throws IOException {
        ch.exchangeDeclare(Routing.EXCHANGE_PERIL_DIRECT, BuiltinExchangeType.DIRECT, true);
        ch.exchangeDeclare(Routing.EXCHANGE_PERIL_TOPIC, BuiltinExchangeType.TOPIC, true);
        ch.exchangeDeclare(deadLetterExchange, BuiltinExchangeType.FANOUT, true);

        ch.queueDeclare(DEAD_LETTER_QUEUE, true, false, false, null);
        // fanout ignores the key
        ch.queueBind(DEAD_LETTER_QUEUE, deadLetterExchange, "");

        log.info("[MQ] Topology ready: {} (direct), {} (topic), {} (fanout) -> {}",
                Routing.EXCHANGE_PERIL_DIRECT, Routing.EXCHANGE_PERIL_TOPIC, deadLetterExchange, DEAD_LETTER_QUEUE);
    }
}
