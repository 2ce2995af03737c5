package com.koni.ems.infrastructure.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Health indicator for PostgreSQL connectivity and the TimescaleDB extension.
 *
 * The check:
 * 1. Obtains a connection from the DataSource
 * 2. Reads the installed TimescaleDB extension version
 * 3. Returns UP with database and extension details, DOWN if the database is
 *    unreachable or the extension is missing
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostgreSQLHealthIndicator implements HealthIndicator {

    private static final String EXTENSION_QUERY =
            "SELECT extversion FROM pg_extension WHERE extname = 'timescaledb'";

    private final DataSource dataSource;

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(EXTENSION_QUERY)) {

            String databaseProductName = connection.getMetaData().getDatabaseProductName();
            String databaseProductVersion = connection.getMetaData().getDatabaseProductVersion();

            if (!resultSet.next()) {
                log.error("PostgreSQL health check failed: timescaledb extension not installed");
                return Health.down()
                        .withDetail("database", databaseProductName)
                        .withDetail("version", databaseProductVersion)
                        .withDetail("error", "TimescaleDBMissing")
                        .build();
            }

            String timescaleVersion = resultSet.getString(1);
            log.debug("PostgreSQL health check passed: product={}, version={}, timescaledb={}",
                    databaseProductName, databaseProductVersion, timescaleVersion);

            return Health.up()
                    .withDetail("database", databaseProductName)
                    .withDetail("version", databaseProductVersion)
                    .withDetail("timescaledb", timescaleVersion)
                    .build();

        } catch (Exception e) {
            log.error("PostgreSQL health check failed", e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
