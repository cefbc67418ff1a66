package com.p14n.subsync.data;

/**
 * Published on the bus when an endpoint unsubscribes from a message type.
 */
public record SubscriptionRemoved(Subscription subscription) {
}
