package com.p14n.subsync.data;

import java.time.Duration;
import java.util.Properties;

/**
 * Configuration of a subscription service instance and of the database that
 * backs its saga stores.
 */
public interface SubscriptionServiceConfig {

    /**
     * Gets the address this service sends from and is reachable at.
     *
     * @return the service address
     */
    EndpointAddress address();

    /**
     * Gets how long disposal waits for queued work before abandoning it.
     * Default is 60 seconds.
     *
     * @return the shutdown timeout
     */
    default Duration shutdownTimeout() {
        return Duration.ofSeconds(60);
    }

    /**
     * Whether a {@code SubscriptionClientRemoved} event retires the client
     * saga. Off by default: the removal is only logged and the client keeps
     * receiving broadcasts until something else expires it.
     *
     * @return true to move removed clients to the Removed state
     */
    default boolean retireClientsOnRemoval() {
        return false;
    }

    /**
     * Gets the database host, or null when sagas are kept in memory.
     *
     * @return the database host address
     */
    String dbHost();

    int dbPort();

    String dbUser();

    String dbPassword();

    String dbName();

    /**
     * Gets additional database properties for overriding defaults.
     *
     * @return Properties object containing override values
     */
    Properties overrideProps();

    default boolean persistent() {
        return dbHost() != null && !dbHost().isBlank();
    }

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}
