package com.flagship.group_ledger.observability;

import com.flagship.group_ledger.settlement.SettlementStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for settlements waiting on their debtor or on reclaim.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementMetrics {

    private final SettlementStore settlementStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong pendingCount = new AtomicLong(0);
    private final AtomicLong overdueCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("settlements.pending", pendingCount, AtomicLong::get)
                .description("Settlements initiated but not yet executed or cancelled")
                .register(meterRegistry);

        Gauge.builder("settlements.overdue", overdueCount, AtomicLong::get)
                .description("Pending settlements past their expiry, awaiting reclaim")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            Instant now = Instant.now(clock);
            pendingCount.set(settlementStore.countPending());
            overdueCount.set(settlementStore.countExpiredPending(now));
        } catch (Exception e) {
            log.warn("Failed to refresh settlement metrics: {}", e.getMessage());
        }
    }

    public long getOverdueCount() {
        return overdueCount.get();
    }
}
