package com.peril.pubsub.publish;

import com.peril.pubsub.EncodeException;
import com.peril.pubsub.PublishException;
import com.peril.pubsub.codec.PayloadCodec;
import com.peril.pubsub.codec.PayloadCodecs;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Publishes typed payloads to an exchange on a caller-owned channel.
 * Publishing is fire-and-forget: no mandatory flag, no publisher confirms, no retry.
 */
public class MqPublisher {
    private static final Logger log = LoggerFactory.getLogger(MqPublisher.class);

    static final int PERSISTENT_DELIVERY_MODE = 2;

    private final Channel channel;
    private final boolean persistent;

    public MqPublisher(Channel channel) {
        this(channel, false);
    }

    public MqPublisher(Channel channel, boolean persistent) {
        if (channel == null) throw new IllegalArgumentException("channel must not be null");
        this.channel = channel;
        this.persistent = persistent;
    }

    public <T> void publish(String exchange, String routingKey, T value, PayloadCodec<T> codec) throws PublishException {
        final byte[] body;
        try {
            body = codec.encode(value);
        } catch (EncodeException e) {
            log.error("[PUBLISH] encode failed for {}@{}: {}", exchange, routingKey, e.getMessage());
            throw new PublishException(exchange, routingKey, "encoding failed", e);
        }

        AMQP.BasicProperties.Builder props = new AMQP.BasicProperties.Builder()
                .contentType(codec.contentType());
        if (persistent) {
            props.deliveryMode(PERSISTENT_DELIVERY_MODE);
        }

        try {
            channel.basicPublish(exchange, routingKey, false, false, props.build(), body);
        } catch (IOException | ShutdownSignalException e) {
            log.error("[PUBLISH] failed to publish to {}@{}: {}", exchange, routingKey, e.toString());
            throw new PublishException(exchange, routingKey, e.getMessage(), e);
        }
        if (log.isDebugEnabled()) {
            log.debug("[PUBLISH] {}@{} contentType={} bytes={}", exchange, routingKey, codec.contentType(), body.length);
        }
    }

    public <T> void publishJson(String exchange, String routingKey, T value, Class<T> type) throws PublishException {
        publish(exchange, routingKey, value, PayloadCodecs.json(type));
    }

    public <T> void publishBinary(String exchange, String routingKey, T value, Class<T> type) throws PublishException {
        publish(exchange, routingKey, value, PayloadCodecs.binary(type));
    }
}
