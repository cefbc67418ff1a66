package com.p14n.subsync.data;

public record RemoveSubscription(Subscription subscription) implements SubscriptionChange {
}
