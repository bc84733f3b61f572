package com.peril.pubsub.worker;

import com.peril.pubsub.AckType;
import com.peril.pubsub.DecodeException;
import com.peril.pubsub.DispositionException;
import com.peril.pubsub.MessageHandler;
import com.peril.pubsub.codec.PayloadCodec;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Decodes one delivery, hands it to the handler and settles it on the channel it
 * arrived on. Every delivery passed to {@link #dispatch} is acked or nacked exactly once:
 * <ul>
 *   <li>undecodable body, or the codec throws: nack without requeue, handler not called</li>
 *   <li>handler throws or returns {@code null}: nack without requeue</li>
 *   <li>otherwise: the handler's {@link AckType}</li>
 * </ul>
 * Failures are logged and never propagate, so the consumer keeps running.
 */
public class DeliveryDispatcher<T> {
    private static final Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

    private final Channel channel;
    private final String queueName;
    private final PayloadCodec<T> codec;
    private final MessageHandler<T> handler;
    private final DeliveryStats stats;

    public DeliveryDispatcher(Channel channel, String queueName, PayloadCodec<T> codec,
                              MessageHandler<T> handler, DeliveryStats stats) {
        this.channel = channel;
        this.queueName = queueName;
        this.codec = codec;
        this.handler = handler;
        this.stats = stats;
    }

    /**
     * @return the disposition that was attempted for this delivery
     */
    public AckType dispatch(Envelope env, AMQP.BasicProperties props, byte[] body) {
        final long tag = env.getDeliveryTag();
        stats.received.incrementAndGet();

        if (props != null && props.getContentType() != null
                && !codec.contentType().equals(props.getContentType()) && log.isDebugEnabled()) {
            log.debug("[MQ] queue={} tag={} contentType={} decoded with {}",
                    queueName, tag, props.getContentType(), codec.contentType());
        }

        final T value;
        try {
            value = codec.decode(body);
        } catch (DecodeException | RuntimeException e) {
            stats.decodeFailures.incrementAndGet();
            log.warn("[MQ] queue={} tag={} routingKey={} undecodable, discarding: {}",
                    queueName, tag, env.getRoutingKey(), e.toString());
            settle(tag, AckType.NACK_DISCARD);
            return AckType.NACK_DISCARD;
        }

        AckType ackType;
        try {
            ackType = handler.handle(value);
            if (ackType == null) {
                stats.handlerFailures.incrementAndGet();
                log.error("[MQ] queue={} tag={} handler returned no decision, discarding", queueName, tag);
                ackType = AckType.NACK_DISCARD;
            }
        } catch (RuntimeException e) {
            stats.handlerFailures.incrementAndGet();
            log.error("[MQ] queue={} tag={} handler failed, discarding: {}", queueName, tag, e.toString(), e);
            ackType = AckType.NACK_DISCARD;
        }

        settle(tag, ackType);
        return ackType;
    }

    private void settle(long tag, AckType ackType) {
        try {
            dispose(tag, ackType);
            stats.disposed(ackType);
        } catch (DispositionException e) {
            stats.dispositionFailures.incrementAndGet();
            log.error("[MQ] queue={} {}", queueName, e.getMessage());
        }
    }

    void dispose(long tag, AckType ackType) throws DispositionException {
        if (!channel.isOpen()) {
            throw new DispositionException(tag, ackType, new IOException("channel closed"));
        }
        try {
            switch (ackType) {
                case ACK:
                    channel.basicAck(tag, false);
                    break;
                case NACK_REQUEUE:
                    channel.basicNack(tag, false, true);
                    break;
                case NACK_DISCARD:
                    channel.basicNack(tag, false, false);
                    break;
            }
        } catch (IOException | RuntimeException e) {
            throw new DispositionException(tag, ackType, e);
        }
        if (log.isDebugEnabled()) {
            log.debug("[{}] queue={} deliveryTag={}", ackType == AckType.ACK ? "ACK" : "NACK", queueName, tag);
        }
    }
}
