package com.p14n.subsync.saga;

import java.util.UUID;

/**
 * A persisted state machine instance keyed by its correlation identifier.
 *
 * @param <P> the value the saga tracks
 */
public interface Saga<P> {

    UUID correlationId();

    SagaState currentState();

    P payload();
}
