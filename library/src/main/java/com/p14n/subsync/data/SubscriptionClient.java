package com.p14n.subsync.data;

import java.util.UUID;

/**
 * A remote subscriber: where it listens for subscription changes and who it
 * is.
 */
public record SubscriptionClient(EndpointAddress controlAddress, UUID clientId) {

    public static SubscriptionClient create(EndpointAddress controlAddress, UUID clientId) {
        if (controlAddress == null) {
            throw new IllegalArgumentException("controlAddress cannot be null");
        }
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        return new SubscriptionClient(controlAddress, clientId);
    }
}
