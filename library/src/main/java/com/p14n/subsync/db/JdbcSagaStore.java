package com.p14n.subsync.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.subsync.data.Subscription;
import com.p14n.subsync.data.SubscriptionClient;
import com.p14n.subsync.saga.Saga;
import com.p14n.subsync.saga.SagaState;
import com.p14n.subsync.saga.SagaStore;
import com.p14n.subsync.saga.SagaStoreException;
import com.p14n.subsync.saga.SubscriptionClientSaga;
import com.p14n.subsync.saga.SubscriptionSaga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SagaStore} backed by a table in the {@code subsync} schema. The
 * payload is stored as JSON; the state is a separate column so that state
 * queries run in the database.
 *
 * @param <S> the saga type
 * @param <P> the payload type
 */
public class JdbcSagaStore<S extends Saga<P>, P> implements SagaStore<S> {

    private static final Logger logger = LoggerFactory.getLogger(JdbcSagaStore.class);

    private final DataSource ds;
    private final String table;
    private final Class<P> payloadType;
    private final SagaFactory<S, P> factory;
    private final ObjectMapper mapper;

    public JdbcSagaStore(DataSource ds, String table, Class<P> payloadType, SagaFactory<S, P> factory) {
        this(ds, table, payloadType, factory, new ObjectMapper());
    }

    public JdbcSagaStore(DataSource ds, String table, Class<P> payloadType, SagaFactory<S, P> factory,
            ObjectMapper mapper) {
        DatabaseSetup.validateTableName(table);
        this.ds = ds;
        this.table = table;
        this.payloadType = payloadType;
        this.factory = factory;
        this.mapper = mapper;
    }

    public static JdbcSagaStore<SubscriptionSaga, Subscription> subscriptions(DataSource ds) {
        return new JdbcSagaStore<>(ds, DatabaseSetup.SUBSCRIPTION_SAGAS, Subscription.class, SubscriptionSaga::new);
    }

    public static JdbcSagaStore<SubscriptionClientSaga, SubscriptionClient> clients(DataSource ds) {
        return new JdbcSagaStore<>(ds, DatabaseSetup.SUBSCRIPTION_CLIENT_SAGAS, SubscriptionClient.class,
                SubscriptionClientSaga::new);
    }

    @Override
    public String name() {
        return table;
    }

    @Override
    public S create(S saga) {
        if (saga == null) {
            throw new IllegalArgumentException("Saga cannot be null");
        }
        String sql = "INSERT INTO subsync." + table
                + " (correlation_id, current_state, payload) VALUES (?, ?, ?) ON CONFLICT DO NOTHING";

        try (Connection conn = ds.getConnection()) {
            conn.setAutoCommit(false);
            int inserted;
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setObject(1, saga.correlationId());
                stmt.setString(2, saga.currentState().name());
                stmt.setString(3, toJson(saga.payload()));
                inserted = stmt.executeUpdate();
            }
            if (inserted == 0) {
                S existing = select(conn, saga.correlationId(), false)
                        .orElseThrow(() -> new SagaStoreException(
                                "Saga " + saga.correlationId() + " vanished from " + table, null));
                conn.commit();
                return existing;
            }
            conn.commit();
            return saga;
        } catch (SQLException e) {
            throw failure("create", e);
        }
    }

    @Override
    public Optional<S> find(UUID correlationId) {
        try (Connection conn = ds.getConnection()) {
            return select(conn, correlationId, false);
        } catch (SQLException e) {
            throw failure("find", e);
        }
    }

    @Override
    public Optional<S> update(UUID correlationId, UnaryOperator<S> change) {
        String sql = "UPDATE subsync." + table
                + " SET current_state = ?, payload = ?, updated_at = current_timestamp WHERE correlation_id = ?";

        try (Connection conn = ds.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<S> current = select(conn, correlationId, true);
                if (current.isEmpty()) {
                    conn.rollback();
                    return Optional.empty();
                }
                S updated = change.apply(current.get());
                if (!correlationId.equals(updated.correlationId())) {
                    throw new IllegalStateException("Correlation id of saga " + correlationId + " cannot change");
                }
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setString(1, updated.currentState().name());
                    stmt.setString(2, toJson(updated.payload()));
                    stmt.setObject(3, correlationId);
                    stmt.executeUpdate();
                }
                conn.commit();
                return Optional.of(updated);
            } catch (RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw failure("update", e);
        }
    }

    @Override
    public List<S> query(Predicate<? super S> predicate) {
        List<S> result = new ArrayList<>();
        for (S saga : selectWhere(null)) {
            if (predicate.test(saga)) {
                result.add(saga);
            }
        }
        return result;
    }

    @Override
    public List<S> queryByState(SagaState state) {
        return selectWhere(state);
    }

    @Override
    public int size() {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM subsync." + table);
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw failure("count", e);
        }
    }

    private Optional<S> select(Connection conn, UUID correlationId, boolean forUpdate) throws SQLException {
        String sql = "SELECT correlation_id, current_state, payload FROM subsync." + table
                + " WHERE correlation_id = ?" + (forUpdate ? " FOR UPDATE" : "");

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, correlationId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(read(rs));
                }
                return Optional.empty();
            }
        }
    }

    private List<S> selectWhere(SagaState state) {
        String sql = "SELECT correlation_id, current_state, payload FROM subsync." + table
                + (state == null ? "" : " WHERE current_state = ?");

        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (state != null) {
                stmt.setString(1, state.name());
            }
            List<S> sagas = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sagas.add(read(rs));
                }
            }
            return sagas;
        } catch (SQLException e) {
            throw failure("query", e);
        }
    }

    private S read(ResultSet rs) throws SQLException {
        UUID id = rs.getObject("correlation_id", UUID.class);
        SagaState state = SagaState.valueOf(rs.getString("current_state"));
        try {
            return factory.create(id, state, mapper.readValue(rs.getString("payload"), payloadType));
        } catch (JsonProcessingException e) {
            throw new SagaStoreException("Unreadable payload for saga " + id + " in " + table, e);
        }
    }

    private String toJson(P payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SagaStoreException("Cannot serialize payload for " + table, e);
        }
    }

    private SagaStoreException failure(String operation, SQLException e) {
        logger.atError()
                .addArgument(operation)
                .addArgument(table)
                .setCause(e)
                .log("Failed to {} saga in {}");
        return new SagaStoreException("Failed to " + operation + " saga in " + table, e);
    }
}
