package com.p14n.subsync.db;

import com.p14n.subsync.data.SubscriptionServiceConfig;
import com.zaxxer.hikari.HikariDataSource;

public class PoolSetup {
    /**
     * Creates and configures a connection pool using HikariCP.
     *
     * @param cfg Configuration containing database connection details
     * @return Configured DataSource
     */
    public static HikariDataSource createPool(SubscriptionServiceConfig cfg) {
        if (!cfg.persistent()) {
            throw new IllegalArgumentException("No database host configured");
        }
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        ds.setPoolName("subsync");
        if (cfg.overrideProps() != null) {
            ds.setDataSourceProperties(cfg.overrideProps());
        }
        return ds;
    }

}
