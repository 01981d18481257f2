package com.flagship.group_ledger.settlement;

import com.flagship.group_ledger.error.LedgerCorruptionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Turns a group's balances into a short list of payments that zeroes them.
 *
 * Greedy: repeatedly match the largest creditor with the largest debtor and
 * settle the smaller of the two amounts. Ties go to the lexicographically
 * smaller member id, so the plan is deterministic. Each round zeroes at least
 * one party, so a group with C creditors and D debtors gets at most C + D - 1
 * payments. Not guaranteed minimal.
 */
@Component
public class SettlementOptimizer {

    private static final Comparator<Party> LARGEST_FIRST =
        Comparator.comparingLong(Party::remaining).reversed().thenComparing(Party::memberId);

    public List<PlannedTransfer> optimize(Map<String, Long> balances) {
        PriorityQueue<Party> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Party> debtors = new PriorityQueue<>(LARGEST_FIRST);
        long totalCredit = 0;
        long totalDebt = 0;

        for (Map.Entry<String, Long> entry : balances.entrySet()) {
            long balance = entry.getValue();
            if (balance > 0) {
                creditors.add(new Party(entry.getKey(), balance));
                totalCredit = Math.addExact(totalCredit, balance);
            } else if (balance < 0) {
                debtors.add(new Party(entry.getKey(), Math.negateExact(balance)));
                totalDebt = Math.addExact(totalDebt, Math.negateExact(balance));
            }
        }
        if (totalCredit != totalDebt) {
            throw new LedgerCorruptionException(String.format(
                "Balances do not sum to zero: credit=%d, debt=%d", totalCredit, totalDebt));
        }

        int maxRounds = Math.max(0, creditors.size() + debtors.size() - 1);
        List<PlannedTransfer> plan = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Party creditor = creditors.poll();
            Party debtor = debtors.poll();
            long amount = Math.min(creditor.remaining(), debtor.remaining());
            plan.add(new PlannedTransfer(debtor.memberId(), creditor.memberId(), amount));

            if (creditor.remaining() > amount) {
                creditors.add(new Party(creditor.memberId(), creditor.remaining() - amount));
            }
            if (debtor.remaining() > amount) {
                debtors.add(new Party(debtor.memberId(), debtor.remaining() - amount));
            }
        }

        verifyPlan(plan, totalCredit, maxRounds, creditors, debtors);
        return plan;
    }

    private static void verifyPlan(List<PlannedTransfer> plan, long totalCredit, int maxRounds,
                                   PriorityQueue<Party> creditors, PriorityQueue<Party> debtors) {
        long planned = plan.stream().mapToLong(PlannedTransfer::getAmount).sum();
        if (planned != totalCredit || !creditors.isEmpty() || !debtors.isEmpty() || plan.size() > maxRounds) {
            throw new LedgerCorruptionException(String.format(
                "Settlement plan postcondition failed: planned=%d, expected=%d, transfers=%d, maxTransfers=%d",
                planned, totalCredit, plan.size(), maxRounds));
        }
    }

    private record Party(String memberId, long remaining) {
    }
}
