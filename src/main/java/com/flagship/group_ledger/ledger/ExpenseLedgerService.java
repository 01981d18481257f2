package com.flagship.group_ledger.ledger;

import com.flagship.group_ledger.error.ErrorCode;
import com.flagship.group_ledger.error.LedgerCorruptionException;
import com.flagship.group_ledger.error.Outcome;
import com.flagship.group_ledger.event.ExpensePostedEvent;
import com.flagship.group_ledger.membership.MembershipOracle;
import com.flagship.group_ledger.observability.LedgerMetrics;
import com.flagship.group_ledger.outbox.OutboxService;
import com.flagship.group_ledger.split.SplitPolicy;
import com.flagship.group_ledger.split.SplitShare;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Posts expenses and maintains per-group balances.
 *
 * Invariants enforced here:
 * 1. Every split set sums exactly to its expense amount
 * 2. Each group's balances sum to zero after every posting
 * 3. Postings to one group are serialized; other groups proceed in parallel
 * 4. Nothing is written until every validation has passed
 *
 * Validation failures come back as {@link Outcome} failures. A broken
 * invariant throws {@link LedgerCorruptionException} and rolls back the unit of work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseLedgerService {

    static final int MAX_PAGE_SIZE = 500;

    private final ExpenseStore expenseStore;
    private final BalanceStore balanceStore;
    private final MembershipOracle membershipOracle;
    private final SplitPolicy defaultSplitPolicy;
    private final ExpenseIdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public Outcome<Expense> applyExpense(String groupId, String payerId, long amount,
                                         List<String> participants, SplitPolicy splitPolicy) {
        return applyExpense(PostExpenseCommand.builder()
            .groupId(groupId)
            .payerId(payerId)
            .amount(amount)
            .participants(participants)
            .splitPolicy(splitPolicy)
            .build());
    }

    /**
     * Validates and posts an expense: the payer is credited the full amount and
     * each participant (the payer included) is debited their share.
     */
    @Transactional
    public Outcome<Expense> applyExpense(PostExpenseCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put("groupId", command.getGroupId());
        try {
            String idempotencyKey = command.getIdempotencyKey();
            if (idempotencyKey != null) {
                Optional<Expense> existing = idempotencyService.findExpense(idempotencyKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Duplicate expense posting, returning existing: expenseId={}, idempotencyKey={}",
                        existing.get().getId(), idempotencyKey);
                    return replayed(command, existing.get());
                }
                metrics.recordIdempotencyMiss();
            }

            SplitPolicy policy = command.getSplitPolicy() != null ? command.getSplitPolicy() : defaultSplitPolicy;
            Outcome<List<SplitShare>> shares = validate(command, policy);
            if (shares.isFailure()) {
                metrics.recordRejected("apply_expense", shares.getError().getCode());
                log.info("Expense rejected: payer={}, amount={}, code={}, reason={}",
                    command.getPayerId(), command.getAmount(),
                    shares.getError().getCode(), shares.getError().getMessage());
                return shares.asFailure();
            }

            ExpenseDraft draft = new ExpenseDraft(command.getGroupId(), command.getPayerId(), command.getAmount(),
                policy.name(), shares.getValue(), Instant.now(clock));

            Expense expense = balanceStore.withGroupLock(command.getGroupId(), () -> {
                if (idempotencyKey != null) {
                    Optional<Expense> raced = expenseStore.findByIdempotencyKey(idempotencyKey);
                    if (raced.isPresent()) {
                        return raced.get();
                    }
                }
                return post(draft, idempotencyKey);
            });

            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, expense.getId());
            }
            return replayed(command, expense);

        } catch (LedgerCorruptionException e) {
            metrics.recordCorruption();
            log.error("Ledger corruption while posting expense: payer={}, amount={}",
                command.getPayerId(), command.getAmount(), e);
            throw e;
        } finally {
            metrics.recordLatency("apply_expense", System.currentTimeMillis() - startTime);
            MDC.remove("groupId");
        }
    }

    /**
     * Runs with the group lock held.
     */
    private Expense post(ExpenseDraft draft, String idempotencyKey) {
        Map<String, Long> deltas = new LinkedHashMap<>();
        deltas.put(draft.getPayerId(), draft.getTotalAmount());
        for (SplitShare share : draft.getShares()) {
            deltas.merge(share.getMember(), -share.getAmount(), Long::sum);
        }

        Map<String, Long> projected = new TreeMap<>(balanceStore.getBalances(draft.getGroupId()));
        deltas.forEach((member, delta) ->
            projected.put(member, EncodedBalance.addSigned(projected.getOrDefault(member, 0L), delta)));
        verifyZeroSum(draft.getGroupId(), projected);

        // Stores without rollback must not keep deltas for an expense that failed to insert.
        Expense expense = expenseStore.insert(draft, idempotencyKey);
        balanceStore.applyDeltas(draft.getGroupId(), deltas);
        verifyZeroSum(draft.getGroupId(), balanceStore.getBalances(draft.getGroupId()));

        MDC.put("expenseId", Long.toString(expense.getId()));
        try {
            outboxService.saveEvent(ExpensePostedEvent.fromExpense(expense));
            metrics.recordExpensePosted(expense.getSplitPolicy());
            log.info("Expense posted: expenseId={}, payer={}, amount={}, participants={}, policy={}",
                expense.getId(), expense.getPayerId(), expense.getTotalAmount(),
                expense.getSplits().size(), expense.getSplitPolicy());
        } finally {
            MDC.remove("expenseId");
        }
        return expense;
    }

    /**
     * An idempotency key replays only the posting it was first used for.
     */
    private Outcome<Expense> replayed(PostExpenseCommand command, Expense expense) {
        boolean samePosting = expense.getGroupId().equals(command.getGroupId())
            && expense.getPayerId().equals(command.getPayerId())
            && expense.getTotalAmount() == command.getAmount()
            && expense.getParticipants().equals(command.getParticipants());
        if (samePosting) {
            return Outcome.success(expense);
        }
        metrics.recordRejected("apply_expense", ErrorCode.IDEMPOTENCY_CONFLICT);
        log.warn("Idempotency key reused for a different posting: idempotencyKey={}, expenseId={}, groupId={}",
            command.getIdempotencyKey(), expense.getId(), expense.getGroupId());
        return Outcome.failure(ErrorCode.IDEMPOTENCY_CONFLICT,
            "Idempotency key %s already posted expense %d in group %s",
            command.getIdempotencyKey(), expense.getId(), expense.getGroupId());
    }

    private Outcome<List<SplitShare>> validate(PostExpenseCommand command, SplitPolicy policy) {
        List<String> participants = command.getParticipants();
        if (command.getAmount() <= 0) {
            return Outcome.failure(ErrorCode.INVALID_AMOUNT, "Amount must be positive: %d", command.getAmount());
        }
        if (participants == null || participants.isEmpty()) {
            return Outcome.failure(ErrorCode.EMPTY_PARTICIPANTS, "Expense needs at least one participant");
        }
        Set<String> seen = new HashSet<>();
        for (String participant : participants) {
            if (!seen.add(participant)) {
                return Outcome.failure(ErrorCode.DUPLICATE_PARTICIPANT, "Participant listed twice: %s", participant);
            }
        }
        if (!seen.contains(command.getPayerId())) {
            return Outcome.failure(ErrorCode.PAYER_NOT_PARTICIPANT,
                "Payer %s is not among the participants", command.getPayerId());
        }
        for (String participant : participants) {
            if (!membershipOracle.isMember(command.getGroupId(), participant)) {
                return Outcome.failure(ErrorCode.NOT_A_MEMBER,
                    "%s is not a member of group %s", participant, command.getGroupId());
            }
        }

        Outcome<List<SplitShare>> shares = policy.computeShares(command.getAmount(), participants);
        if (shares.isSuccess()) {
            checkShares(command, policy, shares.getValue());
        }
        return shares;
    }

    private static void checkShares(PostExpenseCommand command, SplitPolicy policy, List<SplitShare> shares) {
        List<String> participants = command.getParticipants();
        if (shares.size() != participants.size()) {
            throw new IllegalStateException(String.format("Split policy %s returned %d shares for %d participants",
                policy.name(), shares.size(), participants.size()));
        }
        long sum = 0;
        for (int i = 0; i < shares.size(); i++) {
            SplitShare share = shares.get(i);
            if (!share.getMember().equals(participants.get(i)) || share.getAmount() <= 0) {
                throw new IllegalStateException(String.format("Split policy %s returned invalid share %s at %d",
                    policy.name(), share, i));
            }
            sum += share.getAmount();
        }
        if (sum != command.getAmount()) {
            throw new LedgerCorruptionException(String.format(
                "Split policy %s shares sum to %d, expected %d", policy.name(), sum, command.getAmount()));
        }
    }

    private static void verifyZeroSum(String groupId, Map<String, Long> balances) {
        long sum = 0;
        try {
            for (long balance : balances.values()) {
                sum = Math.addExact(sum, balance);
            }
        } catch (ArithmeticException e) {
            throw new LedgerCorruptionException("Balance sum overflowed for group " + groupId, e);
        }
        if (sum != 0) {
            throw new LedgerCorruptionException(
                String.format("Group %s balances sum to %d instead of zero", groupId, sum));
        }
    }

    /**
     * Positive means the group owes the member; negative means the member owes
     * the group. Members never seen in the group read as 0.
     */
    @Transactional(readOnly = true)
    public long getBalance(String groupId, String memberId) {
        return balanceStore.getBalance(groupId, memberId);
    }

    @Transactional(readOnly = true)
    public List<BalanceView> getBalances(String groupId) {
        List<BalanceView> views = new ArrayList<>();
        balanceStore.getBalances(groupId)
            .forEach((member, balance) -> views.add(BalanceView.of(groupId, member, balance)));
        return views;
    }

    @Transactional(readOnly = true)
    public Optional<Expense> getExpense(long expenseId) {
        return expenseStore.findById(expenseId);
    }

    @Transactional(readOnly = true)
    public List<Expense> listGroupExpenses(String groupId, int limit, int offset) {
        checkPage(limit, offset);
        return expenseStore.findByGroup(groupId, Math.min(limit, MAX_PAGE_SIZE), offset);
    }

    /**
     * @param groupId optional, null for all groups
     */
    @Transactional(readOnly = true)
    public List<Expense> listMemberExpenses(String memberId, String groupId, int limit) {
        checkPage(limit, 0);
        return expenseStore.findByParticipant(memberId, groupId, Math.min(limit, MAX_PAGE_SIZE));
    }

    /**
     * Recomputes the group's balances from its expense history, in posting order.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> replayBalances(String groupId) {
        return replay(expenseStore.findAllByGroupInPostingOrder(groupId));
    }

    @Transactional(readOnly = true)
    public LedgerAuditReport auditGroup(String groupId) {
        List<Expense> history = expenseStore.findAllByGroupInPostingOrder(groupId);
        Map<String, Long> replayed = replay(history);
        Map<String, Long> cached = balanceStore.getBalances(groupId);

        Set<String> members = new TreeSet<>(cached.keySet());
        members.addAll(replayed.keySet());

        List<LedgerAuditReport.Discrepancy> discrepancies = new ArrayList<>();
        long cachedSum = 0;
        for (String member : members) {
            long cachedBalance = cached.getOrDefault(member, 0L);
            long replayedBalance = replayed.getOrDefault(member, 0L);
            cachedSum += cachedBalance;
            if (cachedBalance != replayedBalance) {
                discrepancies.add(new LedgerAuditReport.Discrepancy(member, cachedBalance, replayedBalance));
            }
        }

        LedgerAuditReport report = new LedgerAuditReport(groupId, history.size(), cachedSum,
            cached, replayed, List.copyOf(discrepancies));
        if (!report.isConsistent()) {
            log.error("Ledger audit failed: groupId={}, cachedSum={}, discrepancies={}",
                groupId, cachedSum, discrepancies);
        }
        return report;
    }

    /**
     * Overwrites the cached balances with the replayed ones. Returns the new balances.
     */
    @Transactional
    public Map<String, Long> rebuildBalances(String groupId) {
        return balanceStore.withGroupLock(groupId, () -> {
            Map<String, Long> replayed = replayBalances(groupId);
            verifyZeroSum(groupId, replayed);
            balanceStore.replaceBalances(groupId, replayed);
            log.warn("Rebuilt balances from history: groupId={}, members={}", groupId, replayed.size());
            return replayed;
        });
    }

    private static Map<String, Long> replay(List<Expense> history) {
        Map<String, Long> balances = new TreeMap<>();
        for (Expense expense : history) {
            balances.merge(expense.getPayerId(), expense.getTotalAmount(), EncodedBalance::addSigned);
            for (ExpenseSplit split : expense.getSplits()) {
                balances.merge(split.getMemberId(), -split.getOwedAmount(), EncodedBalance::addSigned);
            }
        }
        return balances;
    }

    private static void checkPage(int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
    }
}
