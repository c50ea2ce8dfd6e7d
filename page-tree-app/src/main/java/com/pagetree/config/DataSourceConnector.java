package com.pagetree.config;

import com.pagetree.exception.ConnectionException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the page database named by the connection string given on the command line.
 * The returned data source has already handed out and validated one connection.
 */
@Component
public class DataSourceConnector {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConnector.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final ResolverConfig config;

    public DataSourceConnector(ResolverConfig config) {
        this.config = config;
    }

    public HikariDataSource connect(String dsn) {
        ResolverConfig.Datasource settings = config.getDatasource();

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(dsn);
        if (settings.getUsername() != null && !settings.getUsername().isBlank()) {
            cfg.setUsername(settings.getUsername());
            cfg.setPassword(settings.getPassword());
        }
        cfg.setMaximumPoolSize(settings.getPoolSize());
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(settings.getConnectionTimeoutMs());
        cfg.setReadOnly(true);
        cfg.setPoolName("page-tree");

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(cfg);
        } catch (RuntimeException e) {
            throw new ConnectionException("Cannot open data source: " + e.getMessage(), e);
        }

        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                dataSource.close();
                throw new ConnectionException("Data source did not answer validity check", null);
            }
        } catch (SQLException e) {
            dataSource.close();
            throw new ConnectionException("Cannot ping data source: " + e.getMessage(), e);
        }

        log.debug("Connected to {}", dataSource.getPoolName());
        return dataSource;
    }
}
