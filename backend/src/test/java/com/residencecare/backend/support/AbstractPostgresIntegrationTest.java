package com.residencecare.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.slf4j.MDC;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests. The schema comes from the
 * Flyway migrations run at context start; every table is emptied after each test.
 * Concrete subclasses carry {@code @Testcontainers(disabledWithoutDocker = true)}.
 */
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("residencecare_test")
            .withUsername("residencecare")
            .withPassword("residencecare");

    private static final String RESET_SQL = """
            TRUNCATE TABLE
                event_log,
                resident_history,
                device_history,
                measurement_history,
                task_application_history,
                resident_tag,
                task_application,
                task_template,
                measurement,
                device,
                resident,
                tag,
                bed,
                room,
                floor,
                residence
            RESTART IDENTITY CASCADE
            """;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        synchronized (POSTGRES) {
            if (!POSTGRES.isRunning()) {
                POSTGRES.start();
            }
        }
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @AfterEach
    void resetDatabase() {
        MDC.clear();
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute(RESET_SQL);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset database after test", ex);
        }
    }
}
