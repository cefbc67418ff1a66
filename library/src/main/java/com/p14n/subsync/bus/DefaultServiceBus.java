package com.p14n.subsync.bus;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.saga.SagaStore;
import com.p14n.subsync.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.subsync.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Base {@link ServiceBus} holding the subscriber registry and the saga store
 * registrations. Published messages are handed to each subscriber as a
 * separate task on the {@link AsyncExecutor}, so subscribers of the same or
 * different types run concurrently.
 */
public abstract class DefaultServiceBus implements ServiceBus {

    private static final Logger logger = LoggerFactory.getLogger(DefaultServiceBus.class);
    private static final AttributeKey<String> MESSAGE_TYPE = AttributeKey.stringKey("message_type");

    protected final ConcurrentHashMap<Class<?>, Set<MessageSubscriber<?>>> subscribers = new ConcurrentHashMap<>();
    protected final Set<SagaStore<?>> sagaStores = new CopyOnWriteArraySet<>();
    protected final AtomicBoolean closed = new AtomicBoolean(false);
    protected final BusMetrics metrics;
    protected final Tracer tracer;
    private final EndpointAddress address;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;

    protected DefaultServiceBus(EndpointAddress address, OpenTelemetry ot, String scopeName) {
        this(address, new DefaultExecutor(4), true, ot, scopeName);
    }

    protected DefaultServiceBus(EndpointAddress address, AsyncExecutor asyncExecutor, OpenTelemetry ot,
            String scopeName) {
        this(address, asyncExecutor, false, ot, scopeName);
    }

    protected DefaultServiceBus(EndpointAddress address, AsyncExecutor asyncExecutor, boolean ownsExecutor,
            OpenTelemetry ot, String scopeName) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        this.address = address;
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
        this.metrics = new BusMetrics(ot.getMeter(scopeName));
        this.tracer = ot.getTracer(scopeName);
    }

    @Override
    public EndpointAddress address() {
        return address;
    }

    protected boolean canProcess(Object message) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }

        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }

        // If no subscribers for this type, message is silently dropped
        Set<MessageSubscriber<?>> subs = subscribers.get(message.getClass());
        return subs != null && !subs.isEmpty();
    }

    @Override
    public void publish(Object message) {
        if (!canProcess(message)) {
            return;
        }
        metrics.recordPublished(message.getClass().getSimpleName());
        dispatch(message);
    }

    /**
     * Hands the message to every local subscriber of its type.
     *
     * @param message the message to deliver
     */
    protected void dispatch(Object message) {
        Set<MessageSubscriber<?>> subs = subscribers.get(message.getClass());
        if (subs == null) {
            return;
        }
        String type = message.getClass().getSimpleName();
        Attributes attributes = Attributes.of(MESSAGE_TYPE, type);

        for (MessageSubscriber<?> subscriber : subs) {
            try {
                asyncExecutor.submit(() -> processWithTelemetry(tracer, "dispatch_message", attributes, () -> {
                    try {
                        deliver(subscriber, message);
                        metrics.recordReceived(type);
                        return true;
                    } catch (Exception e) {
                        notifyError(subscriber, type, e);
                        return false;
                    }
                }));
            } catch (RejectedExecutionException e) {
                logger.atWarn()
                        .addArgument(type)
                        .log("Dropping {} message, dispatch executor is shut down");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> void deliver(MessageSubscriber<T> subscriber, Object message) {
        subscriber.onMessage((T) message);
    }

    private static void notifyError(MessageSubscriber<?> subscriber, String type, Exception error) {
        try {
            subscriber.onError(error);
        } catch (Exception e) {
            // If error handling fails, log it to protect other subscribers
            logger.atWarn()
                    .addArgument(type)
                    .setCause(e)
                    .log("Subscriber error handler failed for {} message");
        }
    }

    @Override
    public <T> UnsubscribeAction subscribe(Class<T> messageType, MessageSubscriber<T> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }

        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (messageType == null) {
            throw new IllegalArgumentException("Message type cannot be null");
        }

        boolean added = subscribers
                .computeIfAbsent(messageType, k -> new CopyOnWriteArraySet<>())
                .add(subscriber);

        if (added) {
            metrics.recordSubscriberAdded(messageType.getSimpleName());
            onSubscribed(messageType);
        }

        return () -> unsubscribe(messageType, subscriber);
    }

    /**
     * Called when a subscriber has been added for a message type. Transports
     * that receive messages from elsewhere use it to start listening.
     *
     * @param messageType the message type now subscribed
     */
    protected void onSubscribed(Class<?> messageType) {
    }

    public boolean unsubscribe(Class<?> messageType, MessageSubscriber<?> subscriber) {
        Set<MessageSubscriber<?>> subs = subscribers.get(messageType);
        if (subs != null) {
            boolean removed = subs.remove(subscriber);
            if (removed) {
                metrics.recordSubscriberRemoved(messageType.getSimpleName());
            }
            return removed;
        }
        return false;
    }

    @Override
    public UnsubscribeAction subscribeSaga(SagaStore<?> store) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }

        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }

        if (sagaStores.add(store)) {
            logger.atDebug().addArgument(store.name()).log("Registered saga store {}");
        }
        return () -> {
            if (sagaStores.remove(store)) {
                logger.atDebug().addArgument(store.name()).log("Unregistered saga store {}");
            }
        };
    }

    @Override
    public Set<SagaStore<?>> sagaStores() {
        return Set.copyOf(sagaStores);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        subscribers.clear();
        sagaStores.clear();
        if (ownsExecutor) {
            asyncExecutor.shutdownNow();
        }
        logger.atInfo().addArgument(address).log("Bus {} closed");
    }

}
