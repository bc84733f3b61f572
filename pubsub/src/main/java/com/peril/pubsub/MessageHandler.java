package com.peril.pubsub;

/**
 * Application callback for a decoded message. Runs on the subscription's delivery
 * thread, so it delays later deliveries on the same queue while it runs.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    AckType handle(T value);
}
