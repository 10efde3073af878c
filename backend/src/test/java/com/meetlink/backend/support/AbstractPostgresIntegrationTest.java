package com.meetlink.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import com.meetlink.backend.modules.auth.application.JwtTokenService;
import com.meetlink.backend.modules.provider.application.VideoProviderClient;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests, skipped when Docker is absent.
 * Flyway migrates the schema on context start; every test ends with empty meeting tables.
 * <p>
 * The provider is mocked and time is driven through {@link MutableClock}, reset before each test.
 */
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@Import(AbstractPostgresIntegrationTest.ClockTestConfig.class)
public abstract class AbstractPostgresIntegrationTest {

    protected static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("meetlink_test")
            .withUsername("meetlink")
            .withPassword("meetlink");

    static {
        // One container for the whole run so cached application contexts keep a valid URL.
        if (DockerClientFactory.instance().isDockerAvailable()) {
            POSTGRES.start();
        }
    }

    @MockBean
    protected VideoProviderClient videoProviderClient;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected JwtTokenService jwtTokenService;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @BeforeEach
    void resetClock() {
        clock.setInstant(START);
    }

    @AfterEach
    void truncateMeetingTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("TRUNCATE TABLE meeting_link, meeting_session, audit_log");
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset meeting tables after test", ex);
        }
    }

    protected String bearer(UUID userId, String loginId) {
        return "Bearer " + jwtTokenService.issueAccessToken(userId, loginId, List.of("USER"));
    }

    protected String adminBearer(UUID userId) {
        return "Bearer " + jwtTokenService.issueAccessToken(userId, "admin", List.of("USER", "ADMIN"));
    }

    @TestConfiguration
    static class ClockTestConfig {

        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(START.truncatedTo(ChronoUnit.SECONDS));
        }
    }
}
