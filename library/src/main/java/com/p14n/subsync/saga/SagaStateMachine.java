package com.p14n.subsync.saga;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the {@link SagaState} lifecycle of one kind of saga against its
 * store.
 *
 * <p>
 * The machine is purely data driven: there are no timers and no retries.
 * Transitions that the current state does not allow are ignored, so a replayed
 * event leaves the saga as it was.
 * </p>
 *
 * @param <S> the saga type
 * @param <P> the value the saga tracks
 */
public abstract class SagaStateMachine<S extends Saga<P>, P> {

    private static final Logger logger = LoggerFactory.getLogger(SagaStateMachine.class);

    protected final SagaStore<S> store;

    protected SagaStateMachine(SagaStore<S> store) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        this.store = store;
    }

    protected abstract S initial(P payload);

    protected abstract S withState(S saga, SagaState state);

    /**
     * Creates the saga for {@code payload} and activates it. If a saga with the
     * same correlation identifier exists it is activated when still
     * {@code Initial} and otherwise returned unchanged.
     *
     * @param payload the tracked value
     * @return the stored saga
     */
    public S create(P payload) {
        S stored = store.create(initial(payload));
        return transition(stored.correlationId(), SagaState.Active).orElse(stored);
    }

    /**
     * Moves a saga to {@code next} if its current state allows it.
     *
     * @param correlationId the saga identifier
     * @param next          the requested state
     * @return the saga after the attempt, or empty if there is no such saga
     */
    public Optional<S> transition(UUID correlationId, SagaState next) {
        Optional<S> result = store.update(correlationId, saga -> {
            if (saga.currentState() == next) {
                return saga;
            }
            if (!saga.currentState().canTransitionTo(next)) {
                logger.atDebug()
                        .addArgument(store.name())
                        .addArgument(correlationId)
                        .addArgument(saga.currentState())
                        .addArgument(next)
                        .log("Ignoring {} saga {} transition from {} to {}");
                return saga;
            }
            return withState(saga, next);
        });
        if (result.isEmpty()) {
            logger.atDebug()
                    .addArgument(store.name())
                    .addArgument(correlationId)
                    .log("No {} saga {} to transition");
        }
        return result;
    }

    public Optional<S> find(UUID correlationId) {
        return store.find(correlationId);
    }

    /**
     * Returns the sagas eligible for broadcasts and snapshots.
     *
     * @return every saga in the Active state
     */
    public List<S> active() {
        return store.queryByState(SagaState.Active);
    }

    public SagaStore<S> store() {
        return store;
    }
}
