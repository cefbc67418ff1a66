package com.p14n.subsync.data;

/**
 * Published on the bus when an endpoint subscribes to a message type.
 */
public record SubscriptionAdded(Subscription subscription) {
}
