package com.flagship.group_ledger.settlement;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Process-local settlements. Each compare-and-set runs inside
 * {@link ConcurrentHashMap#compute}, which is atomic per key.
 */
public class InMemorySettlementStore implements SettlementStore {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, Settlement> settlements = new ConcurrentHashMap<>();

    @Override
    public Settlement create(SettlementDraft draft) {
        long id = sequence.incrementAndGet();
        Settlement settlement = new Settlement(id, draft.getGroupId(), draft.getExpenseRef(),
            draft.getDebtorId(), draft.getCreditorId(), draft.getAmount(), SettlementState.PENDING,
            draft.getCreatedAt(), draft.getExpiresAt(), null, null);
        settlements.put(id, settlement);
        return settlement;
    }

    @Override
    public Optional<Settlement> findById(long settlementId) {
        return Optional.ofNullable(settlements.get(settlementId));
    }

    @Override
    public boolean markCompleted(long settlementId, String transferRef, Instant completedAt, Instant now) {
        AtomicBoolean changed = new AtomicBoolean();
        settlements.computeIfPresent(settlementId, (id, current) -> {
            if (current.getState() != SettlementState.PENDING || current.isExpired(now)) {
                return current;
            }
            changed.set(true);
            return current.complete(transferRef, completedAt);
        });
        return changed.get();
    }

    @Override
    public boolean markCancelled(long settlementId) {
        AtomicBoolean changed = new AtomicBoolean();
        settlements.computeIfPresent(settlementId, (id, current) -> {
            if (current.getState() != SettlementState.PENDING) {
                return current;
            }
            changed.set(true);
            return current.cancel();
        });
        return changed.get();
    }

    @Override
    public boolean deleteIfExpired(long settlementId, Instant now) {
        AtomicBoolean deleted = new AtomicBoolean();
        settlements.computeIfPresent(settlementId, (id, current) -> {
            if (current.getState() != SettlementState.PENDING || !current.isExpired(now)) {
                return current;
            }
            deleted.set(true);
            return null;
        });
        return deleted.get();
    }

    @Override
    public List<Settlement> findExpiredPending(Instant now, int limit) {
        return pending()
            .filter(settlement -> settlement.isExpired(now))
            .sorted(Comparator.comparing(Settlement::getExpiresAt))
            .limit(limit)
            .toList();
    }

    @Override
    public List<Settlement> findByDebtor(String debtorId) {
        return byIdAscending().filter(settlement -> settlement.getDebtorId().equals(debtorId)).toList();
    }

    @Override
    public List<Settlement> findByCreditor(String creditorId) {
        return byIdAscending().filter(settlement -> settlement.getCreditorId().equals(creditorId)).toList();
    }

    @Override
    public List<Settlement> findByMember(String memberId, String groupId, SettlementState state, int limit) {
        return settlements.values().stream()
            .filter(settlement -> settlement.involves(memberId))
            .filter(settlement -> groupId == null || groupId.equals(settlement.getGroupId()))
            .filter(settlement -> state == null || settlement.getState() == state)
            .sorted(Comparator.comparingLong(Settlement::getId).reversed())
            .limit(limit)
            .toList();
    }

    @Override
    public long countPending() {
        return pending().count();
    }

    @Override
    public long countExpiredPending(Instant now) {
        return pending().filter(settlement -> settlement.isExpired(now)).count();
    }

    private Stream<Settlement> pending() {
        return settlements.values().stream().filter(settlement -> settlement.getState() == SettlementState.PENDING);
    }

    private Stream<Settlement> byIdAscending() {
        return settlements.values().stream().sorted(Comparator.comparingLong(Settlement::getId));
    }
}
