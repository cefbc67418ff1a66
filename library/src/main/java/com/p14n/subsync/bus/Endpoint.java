package com.p14n.subsync.bus;

import com.p14n.subsync.data.EndpointAddress;

/**
 * Send target resolved from an {@link EndpointAddress}.
 */
public interface Endpoint {

    EndpointAddress address();

    /**
     * Delivers a message to this endpoint.
     *
     * @param message the message to send
     * @param options per-send settings such as the source address
     * @throws EndpointException if the message could not be delivered
     */
    void send(Object message, SendOptions options);

    default void send(Object message) {
        send(message, SendOptions.none());
    }
}
