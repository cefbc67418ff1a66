package com.p14n.subsync.saga;

import java.util.Optional;
import java.util.UUID;

import com.p14n.subsync.data.SubscriptionClient;

/**
 * Lifecycle of a remote subscriber, keyed by its client identifier.
 */
public class SubscriptionClientStateMachine extends SagaStateMachine<SubscriptionClientSaga, SubscriptionClient> {

    public SubscriptionClientStateMachine(SagaStore<SubscriptionClientSaga> store) {
        super(store);
    }

    @Override
    protected SubscriptionClientSaga initial(SubscriptionClient client) {
        if (client == null) {
            throw new IllegalArgumentException("Client cannot be null");
        }
        return SubscriptionClientSaga.initial(client);
    }

    @Override
    protected SubscriptionClientSaga withState(SubscriptionClientSaga saga, SagaState state) {
        return saga.withState(state);
    }

    public Optional<SubscriptionClientSaga> remove(UUID clientId) {
        return transition(clientId, SagaState.Removed);
    }
}
