package com.p14n.subsync.data;

import java.time.Duration;
import java.util.Properties;

public record ConfigData(EndpointAddress address,
        Duration shutdownTimeout,
        boolean retireClientsOnRemoval,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        Properties overrideProps) implements SubscriptionServiceConfig {

    public ConfigData {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be zero or positive");
        }
    }

    public ConfigData(EndpointAddress address,
                      String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(address, Duration.ofSeconds(60), false, dbHost, dbPort, dbUser, dbPassword, dbName, null);
    }

    /**
     * In-memory configuration with the default timeout.
     */
    public ConfigData(EndpointAddress address) {
        this(address, Duration.ofSeconds(60), false, null, 5432, null, null, null, null);
    }

    public ConfigData withShutdownTimeout(Duration timeout) {
        return new ConfigData(address, timeout, retireClientsOnRemoval, dbHost, dbPort, dbUser, dbPassword, dbName,
                overrideProps);
    }

    public ConfigData withRetireClientsOnRemoval(boolean retire) {
        return new ConfigData(address, shutdownTimeout, retire, dbHost, dbPort, dbUser, dbPassword, dbName,
                overrideProps);
    }
}
