package com.p14n.subsync.vertx;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.p14n.subsync.bus.AsyncExecutor;
import com.p14n.subsync.bus.DefaultExecutor;
import com.p14n.subsync.bus.DefaultServiceBus;
import com.p14n.subsync.bus.Endpoint;
import com.p14n.subsync.bus.EndpointException;
import com.p14n.subsync.bus.MessageSubscriber;
import com.p14n.subsync.bus.SendOptions;
import com.p14n.subsync.bus.UnsubscribeAction;
import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.Envelope;
import com.p14n.subsync.vertx.codec.EnvelopeCodec;
import com.p14n.subsync.vertx.codec.MessageTypes;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link com.p14n.subsync.bus.ServiceBus} on the Vert.x EventBus.
 *
 * <p>
 * Published messages go to the EventBus address
 * {@code subsync.events.<MessageType>} wrapped in an {@link Envelope}, so every
 * bus on the same EventBus (or cluster) that subscribed to the type receives
 * them. Inbound messages are handed to local subscribers through the dispatch
 * executor, never on the event loop.
 * </p>
 *
 * <p>
 * Receive endpoints are EventBus consumers at the address string. Sends use
 * request/reply: {@link Endpoint#send} blocks until the receiver has handled
 * the envelope and fails with {@link EndpointException} when nobody is
 * listening, the receiver fails, or no reply arrives within the send timeout.
 * Do not send from an event loop thread.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Vertx vertx = Vertx.vertx();
 * VertxServiceBus bus = new VertxServiceBus(vertx.eventBus(),
 *         EndpointAddress.parse("vertx://subscription-service"), OpenTelemetry.noop());
 *
 * bus.connect(EndpointAddress.parse("ctl://client-1"), envelope -> {
 *     System.out.println("Got " + envelope.messageType());
 * });
 * }</pre>
 */
public class VertxServiceBus extends DefaultServiceBus {

    private static final Logger logger = LoggerFactory.getLogger(VertxServiceBus.class);

    public static final String EVENTS_PREFIX = "subsync.events.";
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);

    private final EventBus eventBus;
    private final MessageTypes types;
    private final Duration sendTimeout;
    private final Map<Class<?>, MessageConsumer<Envelope>> eventConsumers = new ConcurrentHashMap<>();
    private final Map<EndpointAddress, MessageConsumer<Envelope>> receivers = new ConcurrentHashMap<>();

    public VertxServiceBus(EventBus eventBus, EndpointAddress address, OpenTelemetry ot) {
        this(eventBus, address, new DefaultExecutor(4), true, MessageTypes.defaults(), DEFAULT_SEND_TIMEOUT, ot);
    }

    /**
     * Creates a bus on the given EventBus.
     *
     * @param eventBus      the Vert.x EventBus to use
     * @param address       the address this bus tags its sends with
     * @param asyncExecutor executor for dispatching inbound messages
     * @param types         message types that may arrive over the wire
     * @param sendTimeout   how long a send waits for the receiver's reply
     * @param ot            OpenTelemetry instance for observability
     */
    public VertxServiceBus(EventBus eventBus, EndpointAddress address, AsyncExecutor asyncExecutor,
            MessageTypes types, Duration sendTimeout, OpenTelemetry ot) {
        this(eventBus, address, asyncExecutor, false, types, sendTimeout, ot);
    }

    private VertxServiceBus(EventBus eventBus, EndpointAddress address, AsyncExecutor asyncExecutor,
            boolean ownsExecutor, MessageTypes types, Duration sendTimeout, OpenTelemetry ot) {
        super(address, asyncExecutor, ownsExecutor, ot, "vertx_bus");
        this.eventBus = eventBus;
        this.types = types;
        this.sendTimeout = sendTimeout;

        try {
            eventBus.registerDefaultCodec(Envelope.class, new EnvelopeCodec(types));
        } catch (IllegalStateException e) {
            // another bus on this EventBus got there first
            logger.atDebug().log("Envelope codec already registered");
        }

        logger.atInfo()
                .addArgument(address)
                .log("VertxServiceBus initialized: {}");
    }

    @Override
    public void publish(Object message) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        String type = message.getClass().getSimpleName();

        logger.atDebug()
                .addArgument(type)
                .log("Publishing {} to the EventBus");

        eventBus.publish(EVENTS_PREFIX + type, new Envelope(message, address()));
        metrics.recordPublished(type);
    }

    @Override
    protected void onSubscribed(Class<?> messageType) {
        types.register(messageType);
        eventConsumers.computeIfAbsent(messageType, t -> {
            String eventBusAddress = EVENTS_PREFIX + t.getSimpleName();
            MessageConsumer<Envelope> consumer = eventBus.consumer(eventBusAddress,
                    message -> dispatch(message.body().message()));

            logger.atInfo()
                    .addArgument(t.getSimpleName())
                    .addArgument(eventBusAddress)
                    .log("Listening for {} at address {}");
            return consumer;
        });
    }

    /**
     * Connects a receive endpoint at {@code address}. The receiver runs on the
     * event loop and must not block.
     *
     * @param address  the address to receive at
     * @param receiver gets every envelope sent to the address
     * @return the action that disconnects the receiver
     */
    public UnsubscribeAction connect(EndpointAddress address, MessageSubscriber<Envelope> receiver) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }
        if (address == null || receiver == null) {
            throw new IllegalArgumentException("Address and receiver are required");
        }
        if (receivers.containsKey(address)) {
            throw new IllegalStateException("A receiver is already connected at " + address);
        }

        MessageConsumer<Envelope> consumer = eventBus.consumer(address.toString(), message -> {
            Envelope envelope = message.body();
            try {
                receiver.onMessage(envelope);
                message.reply(Boolean.TRUE);
            } catch (Exception e) {
                logger.atError()
                        .addArgument(envelope.messageType())
                        .addArgument(address)
                        .setCause(e)
                        .log("Error receiving {} at {}");
                message.fail(500, e.getMessage());
            }
        });
        if (receivers.putIfAbsent(address, consumer) != null) {
            consumer.unregister();
            throw new IllegalStateException("A receiver is already connected at " + address);
        }

        logger.atInfo().addArgument(address).log("Receiver connected at {}");
        return () -> {
            if (receivers.remove(address, consumer)) {
                consumer.unregister();
            }
        };
    }

    @Override
    public Endpoint getEndpoint(EndpointAddress address) {
        if (closed.get()) {
            throw new IllegalStateException("Bus is closed");
        }
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        return new EventBusEndpoint(address);
    }

    @Override
    public void close() {
        if (closed.get()) {
            return;
        }
        logger.atInfo().log("Closing VertxServiceBus");

        eventConsumers.values().forEach(MessageConsumer::unregister);
        eventConsumers.clear();
        receivers.values().forEach(MessageConsumer::unregister);
        receivers.clear();

        super.close();
    }

    private class EventBusEndpoint implements Endpoint {
        private final EndpointAddress address;

        EventBusEndpoint(EndpointAddress address) {
            this.address = address;
        }

        @Override
        public EndpointAddress address() {
            return address;
        }

        @Override
        public void send(Object message, SendOptions options) {
            if (message == null) {
                throw new IllegalArgumentException("Message cannot be null");
            }
            Envelope envelope = new Envelope(message, options.sourceAddress());
            DeliveryOptions delivery = new DeliveryOptions().setSendTimeout(sendTimeout.toMillis());

            try {
                eventBus.request(address.toString(), envelope, delivery)
                        .toCompletionStage()
                        .toCompletableFuture()
                        .get(sendTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new EndpointException(address, "Send failed: " + e.getCause().getMessage(), e.getCause());
            } catch (TimeoutException e) {
                throw new EndpointException(address, "No reply within " + sendTimeout, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EndpointException(address, "Interrupted while sending", e);
            }
        }
    }
}
