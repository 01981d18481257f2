package com.flagship.group_ledger.settlement;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Settlement storage on Spring Data JPA. Writes join the caller's
 * transaction when there is one, so the completion CAS commits with the
 * wallet transfer.
 */
@Repository
@RequiredArgsConstructor
public class JpaSettlementStore implements SettlementStore {

    private final SettlementRepository repository;

    @Override
    @Transactional
    public Settlement create(SettlementDraft draft) {
        return repository.saveAndFlush(SettlementEntity.pending(draft)).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Settlement> findById(long settlementId) {
        return repository.findById(settlementId).map(SettlementEntity::toDomain);
    }

    @Override
    @Transactional
    public boolean markCompleted(long settlementId, String transferRef, Instant completedAt, Instant now) {
        return repository.markCompleted(settlementId, transferRef, completedAt, now,
            SettlementState.PENDING, SettlementState.COMPLETED) == 1;
    }

    @Override
    @Transactional
    public boolean markCancelled(long settlementId) {
        return repository.markCancelled(settlementId, SettlementState.PENDING, SettlementState.CANCELLED) == 1;
    }

    @Override
    @Transactional
    public boolean deleteIfExpired(long settlementId, Instant now) {
        return repository.deleteIfExpired(settlementId, now, SettlementState.PENDING) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Settlement> findExpiredPending(Instant now, int limit) {
        return repository.findExpired(now, SettlementState.PENDING, PageRequest.of(0, limit))
            .stream()
            .map(SettlementEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Settlement> findByDebtor(String debtorId) {
        return repository.findByDebtorIdOrderByIdAsc(debtorId).stream().map(SettlementEntity::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Settlement> findByCreditor(String creditorId) {
        return repository.findByCreditorIdOrderByIdAsc(creditorId).stream().map(SettlementEntity::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Settlement> findByMember(String memberId, String groupId, SettlementState state, int limit) {
        Specification<SettlementEntity> spec = (root, query, cb) -> cb.or(
            cb.equal(root.get("debtorId"), memberId),
            cb.equal(root.get("creditorId"), memberId));
        if (groupId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("groupId"), groupId));
        }
        if (state != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("state"), state));
        }
        return repository.findAll(spec, PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "id")))
            .stream()
            .map(SettlementEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByState(SettlementState.PENDING);
    }

    @Override
    @Transactional(readOnly = true)
    public long countExpiredPending(Instant now) {
        return repository.countByStateAndExpiresAtBefore(SettlementState.PENDING, now);
    }
}
