package com.di.flightwarehouse.support;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * One embedded PostgreSQL per test JVM, initialised with the production {@code schema.sql}.
 * Tests that need it are skipped when the server binaries cannot start on the host.
 */
public final class PostgresTestDatabase {

    private static final String TRUNCATE_ALL = """
        TRUNCATE flights, weather_observations, rejected_records, pipeline_runs,
                 airports, carriers, date_dim RESTART IDENTITY CASCADE
        """;

    private static EmbeddedPostgres server;
    private static JdbcTemplate jdbc;
    private static Exception startFailure;

    private PostgresTestDatabase() {
    }

    /** Returns a template on a freshly truncated schema. */
    public static synchronized JdbcTemplate cleanDatabase() {
        if (jdbc == null && startFailure == null) {
            start();
        }
        assumeTrue(startFailure == null, () -> "Embedded PostgreSQL unavailable: " + startFailure);
        jdbc.execute(TRUNCATE_ALL);
        return jdbc;
    }

    private static void start() {
        try {
            server = EmbeddedPostgres.builder().start();
        } catch (IOException | IllegalStateException e) {
            startFailure = e;
            return;
        }
        DataSource dataSource = server.getPostgresDatabase();
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbc = new JdbcTemplate(dataSource);
        Runtime.getRuntime().addShutdownHook(new Thread(PostgresTestDatabase::stop));
    }

    private static void stop() {
        try {
            server.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
