package com.p14n.subsync.saga;

import java.util.UUID;

import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.data.SubscriptionClient;

public record SubscriptionClientSaga(UUID correlationId,
                                     SagaState currentState,
                                     SubscriptionClient client) implements Saga<SubscriptionClient> {

    public static SubscriptionClientSaga initial(SubscriptionClient client) {
        return new SubscriptionClientSaga(client.clientId(), SagaState.Initial, client);
    }

    public SubscriptionClientSaga withState(SagaState state) {
        return new SubscriptionClientSaga(correlationId, state, client);
    }

    public EndpointAddress controlAddress() {
        return client.controlAddress();
    }

    @Override
    public SubscriptionClient payload() {
        return client;
    }
}
