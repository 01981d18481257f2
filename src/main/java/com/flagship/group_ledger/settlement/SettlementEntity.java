package com.flagship.group_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA mapping of {@code settlements}. No setters: state changes go through
 * the compare-and-set queries in {@link SettlementRepository}.
 */
@Entity
@Table(name = "settlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SettlementEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "group_id", updatable = false, length = 128)
    private String groupId;

    @Column(name = "expense_ref", updatable = false)
    private Long expenseRef;

    @Column(name = "debtor_id", nullable = false, updatable = false, length = 128)
    private String debtorId;

    @Column(name = "creditor_id", nullable = false, updatable = false, length = 128)
    private String creditorId;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private SettlementState state;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "transfer_ref", length = 64)
    private String transferRef;

    public static SettlementEntity pending(SettlementDraft draft) {
        SettlementEntity entity = new SettlementEntity();
        entity.groupId = draft.getGroupId();
        entity.expenseRef = draft.getExpenseRef();
        entity.debtorId = draft.getDebtorId();
        entity.creditorId = draft.getCreditorId();
        entity.amount = draft.getAmount();
        entity.state = SettlementState.PENDING;
        entity.createdAt = draft.getCreatedAt();
        entity.expiresAt = draft.getExpiresAt();
        return entity;
    }

    public Settlement toDomain() {
        return new Settlement(
            id,
            groupId,
            expenseRef,
            debtorId,
            creditorId,
            amount,
            state,
            createdAt,
            expiresAt,
            completedAt,
            transferRef
        );
    }
}
