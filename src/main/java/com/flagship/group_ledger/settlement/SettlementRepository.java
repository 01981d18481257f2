package com.flagship.group_ledger.settlement;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, Long>,
        JpaSpecificationExecutor<SettlementEntity> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SettlementEntity s
        SET s.state = :completed, s.transferRef = :transferRef, s.completedAt = :completedAt
        WHERE s.id = :id AND s.state = :pending AND s.expiresAt >= :now
        """)
    int markCompleted(@Param("id") long id,
                      @Param("transferRef") String transferRef,
                      @Param("completedAt") Instant completedAt,
                      @Param("now") Instant now,
                      @Param("pending") SettlementState pending,
                      @Param("completed") SettlementState completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SettlementEntity s SET s.state = :cancelled
        WHERE s.id = :id AND s.state = :pending
        """)
    int markCancelled(@Param("id") long id,
                      @Param("pending") SettlementState pending,
                      @Param("cancelled") SettlementState cancelled);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        DELETE FROM SettlementEntity s
        WHERE s.id = :id AND s.state = :pending AND s.expiresAt < :now
        """)
    int deleteIfExpired(@Param("id") long id,
                        @Param("now") Instant now,
                        @Param("pending") SettlementState pending);

    @Query("""
        SELECT s FROM SettlementEntity s
        WHERE s.state = :pending AND s.expiresAt < :now
        ORDER BY s.expiresAt ASC
        """)
    List<SettlementEntity> findExpired(@Param("now") Instant now,
                                       @Param("pending") SettlementState pending,
                                       Pageable pageable);

    List<SettlementEntity> findByDebtorIdOrderByIdAsc(String debtorId);

    List<SettlementEntity> findByCreditorIdOrderByIdAsc(String creditorId);

    long countByState(SettlementState state);

    long countByStateAndExpiresAtBefore(SettlementState state, Instant now);
}
