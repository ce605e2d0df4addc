package com.topicmatch.backend.support;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway migrates the schema on context start;
 * every test leaves the tables empty. Skipped when no Docker daemon is reachable.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    public static final String TEST_HASH_KEY = "integration-test-callback-key";

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("topicmatch_test")
            .withUsername("topicmatch")
            .withPassword("topicmatch");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("app.solver.base-url", () -> "http://solver.invalid");
        registry.add("app.solver.callback-url", () -> "http://localhost/deferred-assignments/callback");
        registry.add("app.solver.callback-hash-key", () -> TEST_HASH_KEY);
        registry.add("app.scheduling.enabled", () -> "false");
    }

    @AfterEach
    void truncateTables() {
        jdbcTemplate.execute("""
                TRUNCATE TABLE assignment, deferred_assignment_job, student_exclusion, period_student,
                    student_answer, preference, question, topic_constraint, assignment_constraint, topic,
                    selection_period
                CASCADE
                """);
    }
}
