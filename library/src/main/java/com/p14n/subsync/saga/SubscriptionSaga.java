package com.p14n.subsync.saga;

import java.util.UUID;

import com.p14n.subsync.data.Subscription;

public record SubscriptionSaga(UUID correlationId,
                               SagaState currentState,
                               Subscription subscription) implements Saga<Subscription> {

    public static SubscriptionSaga initial(Subscription subscription) {
        return new SubscriptionSaga(subscription.correlationId(), SagaState.Initial, subscription);
    }

    public SubscriptionSaga withState(SagaState state) {
        return new SubscriptionSaga(correlationId, state, subscription);
    }

    @Override
    public Subscription payload() {
        return subscription;
    }
}
