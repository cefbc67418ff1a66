package com.p14n.subsync.data;

import java.util.List;

/**
 * Full snapshot of the active subscriptions, sent to a client when it joins.
 */
public record SubscriptionRefresh(List<Subscription> subscriptions) {

    public SubscriptionRefresh {
        subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
    }
}
