package com.p14n.subsync.saga;

import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.p14n.subsync.TestUtil.client;
import static com.p14n.subsync.TestUtil.subscription;
import static org.junit.jupiter.api.Assertions.*;

class SagaStateMachineTest {

    private InMemorySagaStore<SubscriptionSaga> subscriptionStore;
    private InMemorySagaStore<SubscriptionClientSaga> clientStore;
    private SubscriptionStateMachine subscriptions;
    private SubscriptionClientStateMachine clients;

    @BeforeEach
    void setUp() {
        subscriptionStore = new InMemorySagaStore<>("subscriptions");
        clientStore = new InMemorySagaStore<>("clients");
        subscriptions = new SubscriptionStateMachine(subscriptionStore);
        clients = new SubscriptionClientStateMachine(clientStore);
    }

    @Test
    void shouldOnlyAllowForwardTransitions() {
        assertTrue(SagaState.Initial.canTransitionTo(SagaState.Active));
        assertTrue(SagaState.Initial.canTransitionTo(SagaState.Removed));
        assertTrue(SagaState.Active.canTransitionTo(SagaState.Removed));
        assertFalse(SagaState.Active.canTransitionTo(SagaState.Initial));
        assertFalse(SagaState.Removed.canTransitionTo(SagaState.Active));
        assertTrue(SagaState.Removed.isTerminal());
    }

    @Test
    void shouldActivateSubscriptionOnCreate() {
        var sub = subscription("OrderPlaced", "q://orders");

        var saga = subscriptions.create(sub);

        assertEquals(SagaState.Active, saga.currentState());
        assertEquals(sub.correlationId(), saga.correlationId());
        assertEquals(sub, saga.subscription());
        assertEquals(1, subscriptions.active().size());
    }

    @Test
    void shouldRetireSubscriptionOnMarkRemoved() {
        var sub = subscription("OrderPlaced", "q://orders");
        subscriptions.create(sub);

        var removed = subscriptions.markRemoved(sub.correlationId());

        assertEquals(SagaState.Removed, removed.orElseThrow().currentState());
        assertTrue(subscriptions.active().isEmpty());
        assertEquals(1, subscriptionStore.queryByState(SagaState.Removed).size());
    }

    @Test
    void shouldKeepRemovedSubscriptionRemovedWhenAddedAgain() {
        var sub = subscription("OrderPlaced", "q://orders");
        subscriptions.create(sub);
        subscriptions.markRemoved(sub.correlationId());

        var again = subscriptions.create(sub);

        assertEquals(SagaState.Removed, again.currentState());
        assertTrue(subscriptions.active().isEmpty());
    }

    @Test
    void shouldTreatDuplicateCreateAsNoOp() {
        var sub = subscription("OrderPlaced", "q://orders");
        subscriptions.create(sub);
        subscriptions.create(sub);

        assertEquals(1, subscriptionStore.size());
        assertEquals(SagaState.Active, subscriptions.find(sub.correlationId()).orElseThrow().currentState());
    }

    @Test
    void shouldIgnoreRemovalOfUnknownSaga() {
        assertTrue(subscriptions.markRemoved(UUID.randomUUID()).isEmpty());
        assertTrue(clients.remove(UUID.randomUUID()).isEmpty());
    }

    @Test
    void shouldTrackClientsByClientId() {
        var x = client("ctl://x");
        var y = client("ctl://y");
        clients.create(x);
        clients.create(y);

        clients.remove(y.clientId());

        var active = clients.active();
        assertEquals(1, active.size());
        assertEquals(x.controlAddress(), active.get(0).controlAddress());
        assertEquals(SagaState.Removed, clients.find(y.clientId()).orElseThrow().currentState());
    }

    @Test
    void shouldRejectCorrelationIdChangesInStore() {
        var sub = subscription("OrderPlaced", "q://orders");
        subscriptions.create(sub);
        var other = SubscriptionSaga.initial(subscription("OrderShipped", "q://shipping"));

        assertThrows(IllegalStateException.class, () -> subscriptionStore.update(sub.correlationId(), s -> other));
    }
}
