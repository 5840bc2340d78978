package com.fotoreport.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests.
 * Flyway runs through Spring Boot on context start; every table is emptied after each test.
 */
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("fotoreport_test")
            .withUsername("fotoreport")
            .withPassword("fotoreport_password");

    static {
        logDockerDiagnostics();
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        // keep credential hashing cheap in tests
        registry.add("fotoreport.credentials.iterations", () -> "1000");
    }

    private static void logDockerDiagnostics() {
        try {
            System.out.println("[testcontainers] DOCKER_HOST=" + System.getenv("DOCKER_HOST"));
            DockerClientFactory factory = DockerClientFactory.instance();
            System.out.println("[testcontainers] dockerHost=" + factory.getTransportConfig().getDockerHost());
        } catch (Exception ex) {
            System.out.println("[testcontainers] diagnostics failed: " + ex.getMessage());
        }
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE fotos, reportes, asignaciones, locales, clientes, usuarios
                    RESTART IDENTITY CASCADE
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset tables after test", ex);
        }
    }
}
