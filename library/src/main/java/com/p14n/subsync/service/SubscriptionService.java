package com.p14n.subsync.service;

import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import com.p14n.subsync.bus.SendOptions;
import com.p14n.subsync.bus.ServiceBus;
import com.p14n.subsync.bus.UnsubscribeAction;
import com.p14n.subsync.data.AddSubscription;
import com.p14n.subsync.data.ConfigData;
import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.RemoveSubscription;
import com.p14n.subsync.data.Subscription;
import com.p14n.subsync.data.SubscriptionAdded;
import com.p14n.subsync.data.SubscriptionChange;
import com.p14n.subsync.data.SubscriptionClientAdded;
import com.p14n.subsync.data.SubscriptionClientRemoved;
import com.p14n.subsync.data.SubscriptionRefresh;
import com.p14n.subsync.data.SubscriptionRemoved;
import com.p14n.subsync.data.SubscriptionServiceConfig;
import com.p14n.subsync.saga.SagaStore;
import com.p14n.subsync.saga.SubscriptionClientSaga;
import com.p14n.subsync.saga.SubscriptionClientStateMachine;
import com.p14n.subsync.saga.SubscriptionSaga;
import com.p14n.subsync.saga.SubscriptionStateMachine;
import com.p14n.subsync.sequencer.Sequencer;
import com.p14n.subsync.telemetry.ServiceMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.subsync.telemetry.OpenTelemetryFunctions.runWithTelemetry;

/**
 * Keeps the subscription caches of all connected clients in step with the
 * subscriptions known to the bus.
 *
 * <p>
 * The four consume methods only validate, log and queue a work item on the
 * service's {@link Sequencer}, so they are safe to call from any number of
 * dispatch threads. Saga creation, store queries and the sends to clients all
 * happen on the sequencer thread in arrival order:
 * </p>
 * <ul>
 * <li>{@code SubscriptionAdded}/{@code SubscriptionRemoved}: update the
 * subscription saga, then send {@code AddSubscription}/{@code RemoveSubscription}
 * to every active client</li>
 * <li>{@code SubscriptionClientAdded}: activate the client saga, then send it a
 * {@code SubscriptionRefresh} with every active subscription</li>
 * <li>{@code SubscriptionClientRemoved}: logged; the client saga is only
 * retired when {@link SubscriptionServiceConfig#retireClientsOnRemoval()} is
 * set</li>
 * </ul>
 *
 * <p>
 * A failed send to one client is logged and does not stop the others.
 * </p>
 */
public class SubscriptionService implements SubscriptionEventConsumer, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);
    private static final Cleaner CLEANER = Cleaner.create();
    private static final AttributeKey<String> NOTIFICATION = AttributeKey.stringKey("notification");
    private static final AttributeKey<String> DESTINATION = AttributeKey.stringKey("destination");

    private final ServiceBus bus;
    private final SubscriptionStateMachine subscriptions;
    private final SubscriptionClientStateMachine clients;
    private final SubscriptionServiceConfig cfg;
    private final Sequencer sequencer;
    private final ServiceMetrics metrics;
    private final Tracer tracer;
    private final List<UnsubscribeAction> unsubscribeActions = new ArrayList<>();
    private final AtomicReference<ServiceState> state = new AtomicReference<>(ServiceState.Created);
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final Cleaner.Cleanable cleanable;

    public SubscriptionService(ServiceBus bus,
            SagaStore<SubscriptionSaga> subscriptionSagas,
            SagaStore<SubscriptionClientSaga> subscriptionClientSagas,
            OpenTelemetry ot) {
        this(bus, subscriptionSagas, subscriptionClientSagas, new ConfigData(bus.address()), ot);
    }

    public SubscriptionService(ServiceBus bus,
            SagaStore<SubscriptionSaga> subscriptionSagas,
            SagaStore<SubscriptionClientSaga> subscriptionClientSagas,
            SubscriptionServiceConfig cfg,
            OpenTelemetry ot) {
        if (bus == null) {
            throw new IllegalArgumentException("Bus cannot be null");
        }
        this.bus = bus;
        this.subscriptions = new SubscriptionStateMachine(subscriptionSagas);
        this.clients = new SubscriptionClientStateMachine(subscriptionClientSagas);
        this.cfg = cfg;
        this.sequencer = new Sequencer("subscription-service", ot);
        this.metrics = new ServiceMetrics(ot.getMeter("subscription_service"));
        this.tracer = ot.getTracer("subscription_service");
        this.cleanable = CLEANER.register(this, new LeakReporter(disposed, bus.address()));
    }

    @Override
    public void consume(SubscriptionAdded message) {
        Subscription subscription = requireSubscription(message == null ? null : message.subscription());

        logger.atInfo()
                .addArgument(subscription)
                .addArgument(subscription.correlationId())
                .log("Subscription added: {} [{}]");

        var add = new AddSubscription(subscription);
        enqueue(SubscriptionAdded.class, "AddSubscription " + subscription, () -> {
            subscriptions.create(subscription);
            sendToClients(add);
        });
    }

    @Override
    public void consume(SubscriptionRemoved message) {
        Subscription subscription = requireSubscription(message == null ? null : message.subscription());

        logger.atInfo()
                .addArgument(subscription)
                .addArgument(subscription.correlationId())
                .log("Subscription removed: {} [{}]");

        var remove = new RemoveSubscription(subscription);
        enqueue(SubscriptionRemoved.class, "RemoveSubscription " + subscription, () -> {
            subscriptions.markRemoved(subscription.correlationId());
            sendToClients(remove);
        });
    }

    @Override
    public void consume(SubscriptionClientAdded message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        var client = message.client();

        logger.atInfo()
                .addArgument(client.controlAddress())
                .addArgument(client.clientId())
                .log("Subscription client added: {} [{}]");

        enqueue(SubscriptionClientAdded.class, "SubscriptionRefresh " + client.controlAddress(), () -> {
            clients.create(client);
            sendCacheUpdateToClient(client.controlAddress());
        });
    }

    @Override
    public void consume(SubscriptionClientRemoved message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        UUID clientId = message.clientId() != null ? message.clientId() : message.correlationId();
        if (clientId == null) {
            throw new IllegalArgumentException("clientId or correlationId is required");
        }

        logger.atInfo()
                .addArgument(message.controlAddress())
                .addArgument(clientId)
                .log("Subscription client removed: {} [{}]");

        // TODO: retire the client saga by default once client expiry is owned by this service
        if (cfg.retireClientsOnRemoval()) {
            enqueue(SubscriptionClientRemoved.class, "RetireClient " + clientId, () -> clients.remove(clientId));
        }
    }

    /**
     * Registers the consume handlers and both saga stores with the bus.
     *
     * @throws IllegalStateException if the service is already started or
     *                               disposed
     */
    public void start() {
        ServiceState current = state.get();
        if ((current != ServiceState.Created && current != ServiceState.Stopped)
                || !state.compareAndSet(current, ServiceState.Started)) {
            logger.atError().addArgument(state.get()).log("Subscription service cannot start from state {}");
            throw new IllegalStateException("Cannot start from state " + state.get());
        }
        logger.atInfo().addArgument(bus.address()).log("Subscription service starting: {}");

        try {
            unsubscribeActions.add(bus.subscribe(SubscriptionAdded.class, (SubscriptionAdded m) -> consume(m)));
            unsubscribeActions.add(bus.subscribe(SubscriptionRemoved.class, (SubscriptionRemoved m) -> consume(m)));
            unsubscribeActions.add(
                    bus.subscribe(SubscriptionClientAdded.class, (SubscriptionClientAdded m) -> consume(m)));
            unsubscribeActions.add(
                    bus.subscribe(SubscriptionClientRemoved.class, (SubscriptionClientRemoved m) -> consume(m)));

            unsubscribeActions.add(bus.subscribeSaga(clients.store()));
            unsubscribeActions.add(bus.subscribeSaga(subscriptions.store()));
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Failed to start subscription service");
            unsubscribeAll();
            state.set(ServiceState.Stopped);
            throw e;
        }

        logger.atInfo().log("Subscription service started");
    }

    /**
     * Removes every registration made by {@link #start()}, most recent first.
     */
    public void stop() {
        if (!state.compareAndSet(ServiceState.Started, ServiceState.Stopped)) {
            logger.atWarn().addArgument(state.get()).log("Subscription service is not running ({})");
            return;
        }
        logger.atInfo().log("Subscription service stopping");

        unsubscribeAll();

        logger.atInfo().log("Subscription service stopped");
    }

    /**
     * Drains the work queue, waiting at most the configured shutdown timeout,
     * then closes the bus. Later calls do nothing.
     *
     * @throws ShutdownException if the queue did not drain in time or the bus
     *                           failed to close
     */
    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        cleanable.clean();
        if (state.get() == ServiceState.Started) {
            stop();
        }
        state.set(ServiceState.Disposed);

        RuntimeException failure = null;
        try {
            sequencer.shutdown(cfg.shutdownTimeout());
        } catch (RuntimeException e) {
            failure = e;
        }
        try {
            bus.close();
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        if (failure != null) {
            String message = "Error shutting down the subscription service: " + failure.getMessage();
            var exception = new ShutdownException(message, failure);
            logger.atError().setCause(exception).log(message);
            throw exception;
        }
    }

    public ServiceState state() {
        return state.get();
    }

    /**
     * Gets the number of work items waiting behind the one currently running.
     *
     * @return the queue depth
     */
    public int pendingWork() {
        return sequencer.pending();
    }

    private void enqueue(Class<?> event, String description, Runnable work) {
        if (!sequencer.submit(description, work)) {
            logger.atWarn()
                    .addArgument(event.getSimpleName())
                    .addArgument(state.get())
                    .log("Dropped {} event, subscription service is {}");
        }
    }

    private void unsubscribeAll() {
        for (int i = unsubscribeActions.size() - 1; i >= 0; i--) {
            try {
                unsubscribeActions.get(i).unsubscribe();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .log("Error removing bus registration");
            }
        }
        unsubscribeActions.clear();
    }

    private void sendToClients(SubscriptionChange change) {
        List<SubscriptionClientSaga> active = clients.active();

        logger.atDebug()
                .addArgument(change.getClass().getSimpleName())
                .addArgument(change.subscription().messageName())
                .addArgument(active.size())
                .log("Sending {}:{} to {} clients");

        for (SubscriptionClientSaga client : active) {
            send(client.controlAddress(), change);
        }
    }

    private void sendCacheUpdateToClient(EndpointAddress address) {
        List<Subscription> active = subscriptions.active().stream()
                .map(SubscriptionSaga::subscription)
                .collect(Collectors.toList());

        logger.atDebug()
                .addArgument(active.size())
                .addArgument(address)
                .log("Sending refresh of {} subscriptions to {}");

        send(address, new SubscriptionRefresh(active));
    }

    private boolean send(EndpointAddress address, Object message) {
        String type = message.getClass().getSimpleName();
        try {
            runWithTelemetry(tracer, "send_notification",
                    Attributes.of(NOTIFICATION, type, DESTINATION, address.toString()),
                    () -> bus.getEndpoint(address).send(message, SendOptions.from(bus.address())));
            metrics.recordSent(type);
            return true;
        } catch (RuntimeException e) {
            metrics.recordFailed(type);
            logger.atWarn()
                    .addArgument(type)
                    .addArgument(address)
                    .setCause(e)
                    .log("Failed to send {} to {}");
            return false;
        }
    }

    private static Subscription requireSubscription(Subscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }
        if (subscription.correlationId() == null) {
            throw new IllegalArgumentException("Subscription correlationId cannot be null");
        }
        return subscription;
    }

    private static final class LeakReporter implements Runnable {
        private final AtomicBoolean disposed;
        private final EndpointAddress address;

        LeakReporter(AtomicBoolean disposed, EndpointAddress address) {
            this.disposed = disposed;
            this.address = address;
        }

        @Override
        public void run() {
            if (!disposed.get()) {
                logger.atWarn()
                        .addArgument(address)
                        .log("Subscription service {} became unreachable without close(), its queue and bus were not released");
            }
        }
    }
}
