package com.p14n.subsync.data;

import java.util.UUID;

/**
 * Published on the bus when a client joins and wants a copy of the
 * subscription cache.
 */
public record SubscriptionClientAdded(EndpointAddress controlAddress, UUID clientId) {

    public SubscriptionClient client() {
        return SubscriptionClient.create(controlAddress, clientId);
    }
}
