package com.p14n.subsync.bus;

import org.slf4j.LoggerFactory;

/**
 * Interface for subscribers that receive messages from the bus and error
 * notifications.
 *
 * @param <T> The type of messages this subscriber handles
 */
@FunctionalInterface
public interface MessageSubscriber<T> {

    /**
     * Called when a new message is available for processing.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called when processing a message failed.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
        LoggerFactory.getLogger(getClass()).atError()
                .setCause(error)
                .log("Subscriber failed to process message");
    }
}
