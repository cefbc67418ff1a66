package com.p14n.subsync.vertx.codec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.p14n.subsync.data.AddSubscription;
import com.p14n.subsync.data.RemoveSubscription;
import com.p14n.subsync.data.SubscriptionAdded;
import com.p14n.subsync.data.SubscriptionClientAdded;
import com.p14n.subsync.data.SubscriptionClientRemoved;
import com.p14n.subsync.data.SubscriptionRefresh;
import com.p14n.subsync.data.SubscriptionRemoved;

/**
 * Maps the message type names carried on the wire to classes.
 */
public class MessageTypes {

    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();

    /**
     * Creates a registry that knows the subscription events and notifications.
     *
     * @return a new registry
     */
    public static MessageTypes defaults() {
        return new MessageTypes()
                .register(SubscriptionAdded.class)
                .register(SubscriptionRemoved.class)
                .register(SubscriptionClientAdded.class)
                .register(SubscriptionClientRemoved.class)
                .register(AddSubscription.class)
                .register(RemoveSubscription.class)
                .register(SubscriptionRefresh.class);
    }

    public MessageTypes register(Class<?> type) {
        Class<?> existing = types.putIfAbsent(type.getSimpleName(), type);
        if (existing != null && existing != type) {
            throw new IllegalArgumentException("Message type name " + type.getSimpleName()
                    + " is already registered for " + existing.getName());
        }
        return this;
    }

    public Class<?> resolve(String name) {
        Class<?> type = types.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown message type " + name);
        }
        return type;
    }
}
