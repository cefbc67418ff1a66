package com.p14n.subsync;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import com.p14n.subsync.data.ConfigData;
import com.p14n.subsync.data.EndpointAddress;
import com.p14n.subsync.db.DatabaseSetup;
import com.p14n.subsync.db.JdbcSagaStore;
import com.p14n.subsync.db.PoolSetup;
import com.p14n.subsync.saga.InMemorySagaStore;
import com.p14n.subsync.saga.SagaStore;
import com.p14n.subsync.saga.SubscriptionClientSaga;
import com.p14n.subsync.saga.SubscriptionSaga;
import com.p14n.subsync.service.SubscriptionService;
import com.p14n.subsync.vertx.VertxServiceBus;
import com.zaxxer.hikari.HikariDataSource;

import io.opentelemetry.instrumentation.jdbc.datasource.JdbcTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final String DEFAULT_ADDRESS = "vertx://subscription-service";
    static final String DEFAULT_COLLECTOR = "http://localhost:4317";

    private static String envVal(Map<String, String> env, String name, String defaultValue) {
        var e = env.get(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    /**
     * Reads the service configuration from environment variables. Without
     * {@code SUBSYNC_DB_HOST} the sagas are kept in memory.
     *
     * @param env the environment
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    static ConfigData configFromEnvironment(Map<String, String> env) {
        var address = EndpointAddress.parse(envVal(env, "SUBSYNC_ADDRESS", DEFAULT_ADDRESS));
        var timeout = Duration.ofSeconds(Long.parseLong(envVal(env, "SUBSYNC_SHUTDOWN_TIMEOUT_SECONDS", "60")));
        var retire = Boolean.parseBoolean(envVal(env, "SUBSYNC_RETIRE_CLIENTS", "false"));

        return new ConfigData(
                address,
                timeout,
                retire,
                envVal(env, "SUBSYNC_DB_HOST", null),
                Integer.parseInt(envVal(env, "SUBSYNC_DB_PORT", "5432")),
                envVal(env, "SUBSYNC_DB_USER", "postgres"),
                envVal(env, "SUBSYNC_DB_PASSWORD", "postgres"),
                envVal(env, "SUBSYNC_DB_NAME", "postgres"),
                null);
    }

    public static void main(String[] args) throws Exception {
        var env = System.getenv();
        var cfg = configFromEnvironment(env);
        run(cfg, envVal(env, "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_COLLECTOR));
    }

    private static void close(String name, AutoCloseable c) {
        try {
            if (c != null)
                c.close();
        } catch (Exception e) {
            logger.atWarn().addArgument(name).setCause(e).log("Error closing {}");
        }
    }

    private static void run(ConfigData cfg, String collector) throws InterruptedException {
        OpenTelemetrySdk ot = Opentelemetry.create("subscription-sync", collector);
        Vertx vertx = Vertx.vertx();
        HikariDataSource pool = null;

        SagaStore<SubscriptionSaga> subscriptionSagas;
        SagaStore<SubscriptionClientSaga> clientSagas;
        if (cfg.persistent()) {
            pool = PoolSetup.createPool(cfg);
            DataSource ds = JdbcTelemetry.create(ot).wrap(pool);
            new DatabaseSetup(ds).setupAll();
            subscriptionSagas = JdbcSagaStore.subscriptions(ds);
            clientSagas = JdbcSagaStore.clients(ds);
        } else {
            logger.atWarn().log("No database host configured, sagas are kept in memory");
            subscriptionSagas = new InMemorySagaStore<>(DatabaseSetup.SUBSCRIPTION_SAGAS);
            clientSagas = new InMemorySagaStore<>(DatabaseSetup.SUBSCRIPTION_CLIENT_SAGAS);
        }

        var bus = new VertxServiceBus(vertx.eventBus(), cfg.address(), ot);
        var service = new SubscriptionService(bus, subscriptionSagas, clientSagas, cfg, ot);
        var stopped = new CountDownLatch(1);
        var closeablePool = pool;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down");
            close("subscription service", service);
            close("connection pool", closeablePool);
            close("vertx", () -> vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS));
            close("telemetry", ot);
            stopped.countDown();
        }, "subsync-shutdown"));

        service.start();
        logger.atInfo()
                .addArgument(cfg.address())
                .addArgument(cfg.persistent() ? "jdbc" : "in-memory")
                .log("Subscription service running at {} with {} saga stores");

        stopped.await();
    }
}
