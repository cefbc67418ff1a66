package com.p14n.subsync.saga;

import java.util.Optional;
import java.util.UUID;

import com.p14n.subsync.data.Subscription;

/**
 * Lifecycle of a subscription: created and activated on
 * {@code SubscriptionAdded}, retired on {@code SubscriptionRemoved}.
 */
public class SubscriptionStateMachine extends SagaStateMachine<SubscriptionSaga, Subscription> {

    public SubscriptionStateMachine(SagaStore<SubscriptionSaga> store) {
        super(store);
    }

    @Override
    protected SubscriptionSaga initial(Subscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }
        return SubscriptionSaga.initial(subscription);
    }

    @Override
    protected SubscriptionSaga withState(SubscriptionSaga saga, SagaState state) {
        return saga.withState(state);
    }

    public Optional<SubscriptionSaga> markRemoved(UUID correlationId) {
        return transition(correlationId, SagaState.Removed);
    }
}
