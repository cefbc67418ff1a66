package com.p14n.subsync.saga;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Keyed, queryable storage for one kind of saga.
 *
 * <p>
 * Implementations are shared between concurrent readers and are responsible
 * for the concurrency control of their own records: {@link #create} and
 * {@link #update} must be atomic per correlation identifier.
 * </p>
 *
 * @param <S> the saga type held by this store
 */
public interface SagaStore<S extends Saga<?>> {

    /**
     * Gets the name of this store, used in logs and metrics.
     *
     * @return the store name
     */
    String name();

    /**
     * Stores the saga unless one with the same correlation identifier exists.
     *
     * @param saga the saga to store
     * @return the stored saga, which is the existing one if there was a clash
     */
    S create(S saga);

    /**
     * Finds a saga by correlation identifier.
     *
     * @param correlationId the saga identifier
     * @return Optional containing the saga if found
     */
    Optional<S> find(UUID correlationId);

    /**
     * Atomically replaces a saga with the result of applying {@code change} to
     * it.
     *
     * @param correlationId the saga identifier
     * @param change        computes the new saga from the current one
     * @return the updated saga, or empty if no saga has this identifier
     */
    Optional<S> update(UUID correlationId, UnaryOperator<S> change);

    /**
     * Returns every saga matching the predicate, in no particular order.
     *
     * @param predicate the filter
     * @return the matching sagas
     */
    List<S> query(Predicate<? super S> predicate);

    default List<S> queryByState(SagaState state) {
        return query(saga -> saga.currentState() == state);
    }

    int size();
}
