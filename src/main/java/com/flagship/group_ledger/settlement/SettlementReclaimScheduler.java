package com.flagship.group_ledger.settlement;

import com.flagship.group_ledger.error.Outcome;
import com.flagship.group_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically reclaims settlements that expired without being executed.
 * Each reclaim is its own transaction; losing a race to an execute or cancel
 * just skips that record.
 */
@Component
@ConditionalOnProperty(name = "ledger.settlement.reclaim.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementReclaimScheduler {

    private final SettlementService settlementService;
    private final LedgerMetrics metrics;

    @Value("${ledger.settlement.reclaim.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${ledger.settlement.reclaim.interval-ms:60000}")
    public void reclaimExpired() {
        try {
            int reclaimed = reclaimBatch();
            if (reclaimed > 0) {
                log.info("Reclaimed {} expired settlements", reclaimed);
            }
        } catch (Exception e) {
            log.error("Error in settlement reclaim loop", e);
        }
    }

    int reclaimBatch() {
        List<Settlement> expired = settlementService.findReclaimable(batchSize);
        int reclaimed = 0;
        for (Settlement settlement : expired) {
            Outcome<Settlement> outcome = settlementService.reclaim(settlement.getId());
            if (outcome.isSuccess()) {
                reclaimed++;
            } else {
                log.debug("Skipped reclaim: settlementId={}, code={}", settlement.getId(), outcome.getError().getCode());
            }
        }
        metrics.recordSettlementsReclaimed(reclaimed);
        return reclaimed;
    }
}
