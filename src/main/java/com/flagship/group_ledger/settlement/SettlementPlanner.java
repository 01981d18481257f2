package com.flagship.group_ledger.settlement;

import com.flagship.group_ledger.ledger.BalanceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Suggests who should pay whom to clear a group's balances. Read-only: the
 * plan is a suggestion, and each payment still goes through
 * {@link SettlementService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementPlanner {

    private final BalanceStore balanceStore;
    private final SettlementOptimizer optimizer;

    @Transactional(readOnly = true)
    public List<PlannedTransfer> computePlan(String groupId) {
        List<PlannedTransfer> plan = optimizer.optimize(balanceStore.getBalances(groupId));
        log.debug("Computed settlement plan: groupId={}, transfers={}", groupId, plan.size());
        return plan;
    }
}
