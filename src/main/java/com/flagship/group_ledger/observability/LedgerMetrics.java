package com.flagship.group_ledger.observability;

import com.flagship.group_ledger.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for ledger and settlement operations.
 *
 * Metrics exposed:
 * - ledger.expenses.posted: expenses posted, by split policy
 * - ledger.operations.rejected: business failures, by operation and error code
 * - ledger.idempotency: replayed vs new postings
 * - settlements.transitions: state changes, by target state
 * - settlements.reclaimed: expired records deleted
 * - ledger.operation.latency: timer, by operation
 * - ledger.corruption: invariant violations, should stay at zero
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter corruptionDetected;
    private final Counter settlementsReclaimed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.corruptionDetected = Counter.builder("ledger.corruption")
                .description("Invariant violations detected (zero-sum, overflow, plan postcondition)")
                .register(registry);

        this.settlementsReclaimed = Counter.builder("settlements.reclaimed")
                .description("Expired settlements removed without executing")
                .register(registry);
    }

    public void recordExpensePosted(String splitPolicy) {
        registry.counter("ledger.expenses.posted", "policy", sanitizeTag(splitPolicy)).increment();
    }

    public void recordRejected(String operation, ErrorCode code) {
        registry.counter("ledger.operations.rejected",
                "operation", sanitizeTag(operation),
                "code", code.name(),
                "category", code.getCategory().name()
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    public void recordSettlementTransition(String state) {
        registry.counter("settlements.transitions", "state", sanitizeTag(state)).increment();
    }

    public void recordSettlementsReclaimed(int count) {
        settlementsReclaimed.increment(count);
    }

    public void recordCorruption() {
        corruptionDetected.increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer timer = registry.timer("ledger.operation.latency", "operation", sanitizeTag(operation));
        timer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values to a bounded character set and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
