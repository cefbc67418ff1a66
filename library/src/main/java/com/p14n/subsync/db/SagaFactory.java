package com.p14n.subsync.db;

import java.util.UUID;

import com.p14n.subsync.saga.Saga;
import com.p14n.subsync.saga.SagaState;

/**
 * Rebuilds a saga from its stored columns.
 */
@FunctionalInterface
public interface SagaFactory<S extends Saga<P>, P> {

    S create(UUID correlationId, SagaState state, P payload);
}
