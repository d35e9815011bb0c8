package com.flagship.pledge_ledger.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.mockito.Mockito.when;

/**
 * Shared PostgreSQL container for the integration tests. Started once and
 * reused by every subclass so the cached Spring context keeps a live URL.
 *
 * Kafka publishing is switched off (notifications stay in the outbox) and
 * Redis is mocked, which leaves idempotency on its database path.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestSupport {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("pledge_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("kafka.topic.auto-create", () -> "false");
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @MockBean
    protected ValueOperations<String, String> valueOperations;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        jdbcTemplate.execute("TRUNCATE advance_usages, advance_deposits, pledge_entries, outstanding_records, "
            + "transaction_logs, receipt_reservations, payment_idempotency_keys, notification_outbox RESTART IDENTITY");
    }
}
