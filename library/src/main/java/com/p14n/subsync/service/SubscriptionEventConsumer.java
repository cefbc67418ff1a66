package com.p14n.subsync.service;

import com.p14n.subsync.data.SubscriptionAdded;
import com.p14n.subsync.data.SubscriptionClientAdded;
import com.p14n.subsync.data.SubscriptionClientRemoved;
import com.p14n.subsync.data.SubscriptionRemoved;

/**
 * The bus events that drive subscription synchronization. Implementations are
 * called from concurrent dispatch threads and must return quickly.
 */
public interface SubscriptionEventConsumer {

    void consume(SubscriptionAdded message);

    void consume(SubscriptionRemoved message);

    void consume(SubscriptionClientAdded message);

    void consume(SubscriptionClientRemoved message);
}
