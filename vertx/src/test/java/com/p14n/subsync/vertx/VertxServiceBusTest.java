package com.p14n.subsync.vertx;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import com.p14n.subsync.bus.EndpointException;
import com.p14n.subsync.bus.SendOptions;
import com.p14n.subsync.data.AddSubscription;
import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.Envelope;
import com.p14n.subsync.data.Subscription;
import com.p14n.subsync.data.SubscriptionAdded;
import com.p14n.subsync.data.SubscriptionClientAdded;
import com.p14n.subsync.data.SubscriptionRefresh;
import com.p14n.subsync.saga.InMemorySagaStore;
import com.p14n.subsync.service.SubscriptionService;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class VertxServiceBusTest {

    private static final EndpointAddress SERVICE = EndpointAddress.parse("vertx://subscription-service");
    private static final EndpointAddress CLIENT = EndpointAddress.parse("ctl://client-1");

    private Vertx vertx;
    private VertxServiceBus bus;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        bus = new VertxServiceBus(vertx.eventBus(), SERVICE, OpenTelemetry.noop());
    }

    @AfterEach
    void tearDown() throws Exception {
        bus.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void shouldDeliverPublishedEventsToSubscribers() throws InterruptedException {
        var received = new AtomicReference<SubscriptionAdded>();
        var latch = new CountDownLatch(1);
        bus.subscribe(SubscriptionAdded.class, message -> {
            received.set(message);
            latch.countDown();
        });
        var event = new SubscriptionAdded(Subscription.create("OrderPlaced", "q://orders"));

        bus.publish(event);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(event, received.get());
    }

    @Test
    void shouldDeliverEventsPublishedByAnotherBus() throws InterruptedException {
        var latch = new CountDownLatch(1);
        bus.subscribe(SubscriptionAdded.class, message -> latch.countDown());

        try (var other = new VertxServiceBus(vertx.eventBus(), EndpointAddress.parse("vertx://other"),
                OpenTelemetry.noop())) {
            other.publish(new SubscriptionAdded(Subscription.create("OrderPlaced", "q://orders")));

            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void shouldSendToConnectedReceiverWithSourceAddress() {
        var received = new AtomicReference<Envelope>();
        bus.connect(CLIENT, received::set);
        var change = new AddSubscription(Subscription.create("OrderPlaced", "q://orders"));

        bus.getEndpoint(CLIENT).send(change, SendOptions.from(SERVICE));

        assertEquals(change, received.get().message());
        assertEquals(SERVICE, received.get().sourceAddress());
    }

    @Test
    void shouldFailSendToUnreachableAddress() {
        var e = assertThrows(EndpointException.class,
                () -> bus.getEndpoint(EndpointAddress.parse("ctl://nobody")).send(new SubscriptionRefresh(List.of())));

        assertEquals(EndpointAddress.parse("ctl://nobody"), e.address());
    }

    @Test
    void shouldFailSendWhenReceiverFails() {
        bus.connect(CLIENT, envelope -> {
            throw new IllegalStateException("cache unavailable");
        });

        assertThrows(EndpointException.class,
                () -> bus.getEndpoint(CLIENT).send(new SubscriptionRefresh(List.of())));
    }

    @Test
    void shouldAllowOneReceiverPerAddress() {
        bus.connect(CLIENT, envelope -> {
        });

        assertThrows(IllegalStateException.class, () -> bus.connect(CLIENT, envelope -> {
        }));
    }

    @Test
    void shouldStopReceivingAfterDisconnect() {
        bus.connect(CLIENT, envelope -> {
        }).unsubscribe();

        assertThrows(EndpointException.class,
                () -> bus.getEndpoint(CLIENT).send(new SubscriptionRefresh(List.of())));
    }

    @Test
    void shouldSynchronizeClientsThroughSubscriptionService() throws InterruptedException {
        var inbox = new CopyOnWriteArrayList<Envelope>();
        var refreshed = new CountDownLatch(1);
        var added = new CountDownLatch(2);
        bus.connect(CLIENT, envelope -> {
            inbox.add(envelope);
            refreshed.countDown();
            added.countDown();
        });
        var service = new SubscriptionService(bus, new InMemorySagaStore<>("subscriptions"),
                new InMemorySagaStore<>("clients"), OpenTelemetry.noop());
        var subscription = Subscription.create("OrderPlaced", "q://orders");

        try {
            service.start();
            bus.publish(new SubscriptionClientAdded(CLIENT, UUID.randomUUID()));
            assertTrue(refreshed.await(5, TimeUnit.SECONDS));

            bus.publish(new SubscriptionAdded(subscription));
            assertTrue(added.await(5, TimeUnit.SECONDS));
        } finally {
            service.close();
        }

        assertEquals(List.of(new SubscriptionRefresh(List.of()), new AddSubscription(subscription)),
                inbox.stream().map(Envelope::message).collect(Collectors.toList()));
        assertTrue(inbox.stream().allMatch(e -> SERVICE.equals(e.sourceAddress())));
    }
}
