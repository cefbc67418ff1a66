package com.p14n.subsync.data;

/**
 * A change to a single subscription, pushed to every active client.
 */
public interface SubscriptionChange {

    Subscription subscription();
}
