package com.p14n.subsync.data;

public record AddSubscription(Subscription subscription) implements SubscriptionChange {
}
