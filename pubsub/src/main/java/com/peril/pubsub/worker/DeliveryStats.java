package com.peril.pubsub.worker;

import com.peril.pubsub.AckType;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one subscription.
 */
public class DeliveryStats {
    final AtomicLong received = new AtomicLong();
    final AtomicLong acked = new AtomicLong();
    final AtomicLong requeued = new AtomicLong();
    final AtomicLong discarded = new AtomicLong();
    final AtomicLong decodeFailures = new AtomicLong();
    final AtomicLong handlerFailures = new AtomicLong();
    final AtomicLong dispositionFailures = new AtomicLong();

    void disposed(AckType ackType) {
        switch (ackType) {
            case ACK:
                acked.incrementAndGet();
                break;
            case NACK_REQUEUE:
                requeued.incrementAndGet();
                break;
            case NACK_DISCARD:
                discarded.incrementAndGet();
                break;
        }
    }

    public long received() { return received.get(); }
    public long acked() { return acked.get(); }
    public long requeued() { return requeued.get(); }
    public long discarded() { return discarded.get(); }
    public long decodeFailures() { return decodeFailures.get(); }
    public long handlerFailures() { return handlerFailures.get(); }
    public long dispositionFailures() { return dispositionFailures.get(); }

    @Override
    public String toString() {
        return String.format("DeliveryStats{received=%d, acked=%d, requeued=%d, discarded=%d, "
                        + "decodeFailures=%d, handlerFailures=%d, dispositionFailures=%d}",
                received(), acked(), requeued(), discarded(),
                decodeFailures(), handlerFailures(), dispositionFailures());
    }
}
