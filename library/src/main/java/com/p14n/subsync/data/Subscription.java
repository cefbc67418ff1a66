package com.p14n.subsync.data;

import java.util.UUID;

/**
 * Binding of a message type to the endpoint that wants to receive it.
 *
 * @param correlationId   stable identifier of the subscription
 * @param messageName     name of the subscribed message type
 * @param endpointAddress address messages of that type are delivered to
 */
public record Subscription(UUID correlationId,
                           String messageName,
                           EndpointAddress endpointAddress) {

    public static Subscription create(UUID correlationId, String messageName, EndpointAddress endpointAddress) {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (messageName == null || messageName.trim().isEmpty()) {
            throw new IllegalArgumentException("messageName cannot be null or empty");
        }
        if (endpointAddress == null) {
            throw new IllegalArgumentException("endpointAddress cannot be null");
        }
        return new Subscription(correlationId, messageName, endpointAddress);
    }

    public static Subscription create(String messageName, String endpointAddress) {
        return create(UUID.randomUUID(), messageName, EndpointAddress.parse(endpointAddress));
    }

    @Override
    public String toString() {
        return messageName + " -> " + endpointAddress;
    }
}
