package com.p14n.subsync.saga;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SagaStore}.
 * <p>
 * State is lost on restart; use {@link com.p14n.subsync.db.JdbcSagaStore}
 * when sagas must survive the process.
 * </p>
 */
public class InMemorySagaStore<S extends Saga<?>> implements SagaStore<S> {

    private final String name;
    private final Map<UUID, S> store = new ConcurrentHashMap<>();

    public InMemorySagaStore(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public S create(S saga) {
        if (saga == null) {
            throw new IllegalArgumentException("Saga cannot be null");
        }
        S existing = store.putIfAbsent(saga.correlationId(), saga);
        return existing == null ? saga : existing;
    }

    @Override
    public Optional<S> find(UUID correlationId) {
        return Optional.ofNullable(store.get(correlationId));
    }

    @Override
    public Optional<S> update(UUID correlationId, UnaryOperator<S> change) {
        return Optional.ofNullable(store.computeIfPresent(correlationId, (id, saga) -> {
            S updated = change.apply(saga);
            if (!id.equals(updated.correlationId())) {
                throw new IllegalStateException("Correlation id of saga " + id + " cannot change");
            }
            return updated;
        }));
    }

    @Override
    public List<S> query(Predicate<? super S> predicate) {
        return store.values().stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }

    @Override
    public int size() {
        return store.size();
    }
}
