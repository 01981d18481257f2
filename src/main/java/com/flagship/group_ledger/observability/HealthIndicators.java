package com.flagship.group_ledger.observability;

import com.flagship.group_ledger.outbox.OutboxEventRepository;
import com.flagship.group_ledger.settlement.SettlementStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Actuator health indicators for the ledger's background work.
 */
public class HealthIndicators {

    /**
     * Down when the outbox backlog grows past the critical threshold.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Warns when expired pending settlements pile up, which means the reclaim
     * scheduler is disabled or failing.
     */
    @Component("settlementHealth")
    public static class OverdueSettlementHealthIndicator implements HealthIndicator {

        private final SettlementStore settlementStore;
        private final Clock clock;
        private final long warningThreshold;

        public OverdueSettlementHealthIndicator(SettlementStore settlementStore, Clock clock,
                                                @Value("${ledger.settlement.overdue-warning-threshold:500}")
                                                long warningThreshold) {
            this.settlementStore = settlementStore;
            this.clock = clock;
            this.warningThreshold = warningThreshold;
        }

        @Override
        public Health health() {
            try {
                long overdue = settlementStore.countExpiredPending(Instant.now(clock));
                Health.Builder builder = overdue < warningThreshold ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("overdueSettlements", overdue)
                        .withDetail("warningThreshold", warningThreshold)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage reports
     * DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response: " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency lookups fall back to the database")
                    .build();
        }
    }
}
