package com.flagship.group_ledger.settlement;

import com.flagship.group_ledger.error.ErrorCode;
import com.flagship.group_ledger.error.LedgerError;
import com.flagship.group_ledger.error.Outcome;
import com.flagship.group_ledger.event.SettlementCancelledEvent;
import com.flagship.group_ledger.event.SettlementCompletedEvent;
import com.flagship.group_ledger.event.SettlementInitiatedEvent;
import com.flagship.group_ledger.event.SettlementReclaimedEvent;
import com.flagship.group_ledger.membership.MembershipOracle;
import com.flagship.group_ledger.observability.LedgerMetrics;
import com.flagship.group_ledger.outbox.OutboxService;
import com.flagship.group_ledger.transfer.DuplicateTransferException;
import com.flagship.group_ledger.transfer.TransferContentionException;
import com.flagship.group_ledger.transfer.TransferInstruction;
import com.flagship.group_ledger.transfer.TransferPrimitive;
import com.flagship.group_ledger.transfer.TransferProof;
import com.flagship.group_ledger.transfer.TransferRejectedException;
import com.flagship.group_ledger.transfer.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Settlement lifecycle: initiate, execute, cancel and reclaim.
 *
 * Executing a settlement hands the wallet transfer and the PENDING to
 * COMPLETED flip to the {@link TransferPrimitive} as one unit. The flip is a
 * compare-and-set, so at most one of several racing execute, cancel or
 * reclaim calls succeeds, and a settlement is paid at most once.
 *
 * Business failures come back as {@link Outcome} failures; all transfer
 * failures leave the settlement PENDING.
 */
@Service
@Slf4j
public class SettlementService {

    static final int MAX_PAGE_SIZE = 500;

    private final SettlementStore store;
    private final TransferPrimitive transferPrimitive;
    private final MembershipOracle membershipOracle;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;
    private final Duration defaultTtl;
    private final Duration executeTimeout;

    public SettlementService(SettlementStore store,
                             TransferPrimitive transferPrimitive,
                             MembershipOracle membershipOracle,
                             OutboxService outboxService,
                             LedgerMetrics metrics,
                             Clock clock,
                             @Qualifier("settlementExecutor") ExecutorService executor,
                             @Value("${ledger.settlement.default-ttl:PT24H}") Duration defaultTtl,
                             @Value("${ledger.settlement.execute-timeout:PT30S}") Duration executeTimeout) {
        this.store = store;
        this.transferPrimitive = transferPrimitive;
        this.membershipOracle = membershipOracle;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
        this.defaultTtl = defaultTtl;
        this.executeTimeout = executeTimeout;
    }

    /**
     * Creates a PENDING settlement expiring {@code ttl} from now. Only the
     * debtor may initiate.
     */
    @Transactional
    public Outcome<Settlement> initiate(InitiateSettlementCommand command) {
        if (command.getAmount() <= 0) {
            return reject("initiate", LedgerError.of(ErrorCode.INVALID_AMOUNT,
                "Amount must be positive: %d", command.getAmount()));
        }
        if (command.getDebtorId() == null || command.getDebtorId().equals(command.getCreditorId())) {
            return reject("initiate", LedgerError.of(ErrorCode.SAME_PARTIES,
                "Debtor and creditor must be different: %s", command.getDebtorId()));
        }
        if (!command.getDebtorId().equals(command.getCaller())) {
            return reject("initiate", LedgerError.of(ErrorCode.NOT_AUTHORIZED,
                "Only the debtor can initiate a settlement, caller was %s", command.getCaller()));
        }
        Duration ttl = command.getTtl() != null ? command.getTtl() : defaultTtl;
        if (ttl.isZero() || ttl.isNegative()) {
            return reject("initiate", LedgerError.of(ErrorCode.INVALID_TTL, "TTL must be positive: %s", ttl));
        }
        String groupId = command.getGroupId();
        if (groupId != null) {
            for (String party : List.of(command.getDebtorId(), command.getCreditorId())) {
                if (!membershipOracle.isMember(groupId, party)) {
                    return reject("initiate", LedgerError.of(ErrorCode.NOT_A_MEMBER,
                        "%s is not a member of group %s", party, groupId));
                }
            }
        }

        Instant now = Instant.now(clock);
        Instant expiresAt;
        try {
            expiresAt = now.plus(ttl);
        } catch (DateTimeException | ArithmeticException e) {
            return reject("initiate", LedgerError.of(ErrorCode.INVALID_TTL, "TTL too large: %s", ttl));
        }

        Settlement settlement = store.create(new SettlementDraft(groupId, command.getExpenseRef(),
            command.getDebtorId(), command.getCreditorId(), command.getAmount(), now, expiresAt));

        outboxService.saveEvent(SettlementInitiatedEvent.fromSettlement(settlement));
        metrics.recordSettlementTransition(SettlementState.PENDING.name());
        log.info("Settlement initiated: settlementId={}, debtor={}, creditor={}, amount={}, expiresAt={}",
            settlement.getId(), settlement.getDebtorId(), settlement.getCreditorId(),
            settlement.getAmount(), expiresAt);
        return Outcome.success(settlement);
    }

    /**
     * Pays the settlement. Re-executing a completed settlement yields
     * {@code ALREADY_EXECUTED}; a retry after {@code TRANSFER_TIMEOUT} never
     * submits a second transfer.
     */
    public Outcome<Settlement> execute(long settlementId, String caller) {
        long startTime = System.currentTimeMillis();
        MDC.put("settlementId", Long.toString(settlementId));
        try {
            Optional<Settlement> found = store.findById(settlementId);
            if (found.isEmpty()) {
                return reject("execute", notFound(settlementId));
            }
            Settlement settlement = found.get();
            Instant now = Instant.now(clock);

            if (settlement.getState() != SettlementState.PENDING) {
                return reject("execute", stateError(settlement));
            }
            if (settlement.isExpired(now)) {
                return reject("execute", LedgerError.of(ErrorCode.EXPIRED,
                    "Settlement %d expired at %s", settlementId, settlement.getExpiresAt()));
            }
            if (!settlement.getDebtorId().equals(caller)) {
                return reject("execute", LedgerError.of(ErrorCode.NOT_AUTHORIZED,
                    "Only the debtor can execute settlement %d", settlementId));
            }

            String transferKey = transferKey(settlementId);
            TransferStatus status = transferPrimitive.lookup(transferKey);
            if (status != TransferStatus.NONE) {
                log.info("Transfer already submitted for settlement: settlementId={}, status={}", settlementId, status);
                return reject("execute", afterDuplicateTransfer(settlementId));
            }

            return submit(settlement, transferKey);

        } finally {
            metrics.recordLatency("execute_settlement", System.currentTimeMillis() - startTime);
            MDC.remove("settlementId");
        }
    }

    private Outcome<Settlement> submit(Settlement settlement, String transferKey) {
        long settlementId = settlement.getId();
        TransferInstruction instruction = new TransferInstruction(transferKey, settlement.getDebtorId(),
            settlement.getCreditorId(), settlement.getAmount(), "settlement " + settlementId);

        Future<TransferProof> future = executor.submit(() -> {
            MDC.put("settlementId", Long.toString(settlementId));
            try {
                return transferPrimitive.transferAndCommit(instruction, proof -> commitCompletion(settlement, proof));
            } finally {
                MDC.remove("settlementId");
            }
        });

        try {
            TransferProof proof = future.get(executeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Settlement completed = store.findById(settlementId)
                .filter(Settlement::isExecuted)
                .orElseThrow(() -> new IllegalStateException(
                    "Settlement " + settlementId + " not completed after confirmed transfer"));
            metrics.recordSettlementTransition(SettlementState.COMPLETED.name());
            log.info("Settlement executed: settlementId={}, transferRef={}, amount={}",
                settlementId, proof.getTransferRef(), completed.getAmount());
            return Outcome.success(completed);

        } catch (TimeoutException e) {
            log.warn("Transfer did not confirm within {}: settlementId={}, transferKey={}",
                executeTimeout, settlementId, transferKey);
            return reject("execute", LedgerError.of(ErrorCode.TRANSFER_TIMEOUT,
                "Transfer for settlement %d did not confirm within %s", settlementId, executeTimeout));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return reject("execute", LedgerError.of(ErrorCode.TRANSFER_TIMEOUT,
                "Interrupted while waiting for transfer of settlement %d", settlementId));

        } catch (ExecutionException e) {
            return reject("execute", transferFailure(settlementId, e.getCause()));
        }
    }

    /**
     * Runs inside the transfer's unit of work. Throwing undoes the transfer.
     */
    private void commitCompletion(Settlement settlement, TransferProof proof) {
        if (!settlement.getDebtorId().equals(proof.getFromMember())
            || !settlement.getCreditorId().equals(proof.getToMember())
            || settlement.getAmount() != proof.getAmount()) {
            throw new TransferMismatchException(String.format(
                "Transfer %s moved %d from %s to %s, settlement %d expects %d from %s to %s",
                proof.getTransferRef(), proof.getAmount(), proof.getFromMember(), proof.getToMember(),
                settlement.getId(), settlement.getAmount(), settlement.getDebtorId(), settlement.getCreditorId()));
        }

        Instant now = Instant.now(clock);
        if (!store.markCompleted(settlement.getId(), proof.getTransferRef(), now, now)) {
            throw new SettlementConflictException(settlement.getId());
        }
        outboxService.saveEvent(SettlementCompletedEvent.fromSettlement(settlement.complete(proof.getTransferRef(), now)));
    }

    private LedgerError transferFailure(long settlementId, Throwable cause) {
        if (cause instanceof TransferMismatchException) {
            log.error("Transfer mismatch, transfer undone: settlementId={}, reason={}", settlementId, cause.getMessage());
            return LedgerError.of(ErrorCode.TRANSFER_MISMATCH, cause.getMessage());
        }
        if (cause instanceof TransferRejectedException) {
            log.warn("Transfer rejected: settlementId={}, reason={}", settlementId, cause.getMessage());
            return LedgerError.of(ErrorCode.TRANSFER_REJECTED, cause.getMessage());
        }
        if (cause instanceof DuplicateTransferException) {
            return afterDuplicateTransfer(settlementId);
        }
        if (cause instanceof TransferContentionException) {
            log.warn("Transfer contended, nothing moved: settlementId={}", settlementId);
            return LedgerError.of(ErrorCode.TRANSFER_CONTENDED, cause.getMessage());
        }
        if (cause instanceof SettlementConflictException) {
            log.info("Lost state race, transfer undone: settlementId={}", settlementId);
            return store.findById(settlementId)
                .map(current -> current.getState() == SettlementState.PENDING
                    ? LedgerError.of(ErrorCode.EXPIRED, "Settlement %d expired at %s", settlementId, current.getExpiresAt())
                    : stateError(current))
                .orElseGet(() -> notFound(settlementId));
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new IllegalStateException("Unexpected transfer failure for settlement " + settlementId, cause);
    }

    private LedgerError afterDuplicateTransfer(long settlementId) {
        return store.findById(settlementId)
            .filter(Settlement::isExecuted)
            .map(this::stateError)
            .orElseGet(() -> LedgerError.of(ErrorCode.TRANSFER_IN_FLIGHT,
                "A transfer for settlement %d is already in flight", settlementId));
    }

    /**
     * Abandons a PENDING settlement. Only the debtor may cancel.
     */
    @Transactional
    public Outcome<Settlement> cancel(long settlementId, String caller) {
        MDC.put("settlementId", Long.toString(settlementId));
        try {
            Optional<Settlement> found = store.findById(settlementId);
            if (found.isEmpty()) {
                return reject("cancel", notFound(settlementId));
            }
            Settlement settlement = found.get();
            if (!settlement.getDebtorId().equals(caller)) {
                return reject("cancel", LedgerError.of(ErrorCode.NOT_AUTHORIZED,
                    "Only the debtor can cancel settlement %d", settlementId));
            }
            if (settlement.getState() != SettlementState.PENDING) {
                return reject("cancel", stateError(settlement));
            }
            if (!store.markCancelled(settlementId)) {
                return reject("cancel", store.findById(settlementId)
                    .map(this::stateError)
                    .orElseGet(() -> notFound(settlementId)));
            }

            Settlement cancelled = settlement.cancel();
            outboxService.saveEvent(SettlementCancelledEvent.fromSettlement(cancelled, Instant.now(clock)));
            metrics.recordSettlementTransition(SettlementState.CANCELLED.name());
            log.info("Settlement cancelled: settlementId={}, debtor={}", settlementId, caller);
            return Outcome.success(cancelled);
        } finally {
            MDC.remove("settlementId");
        }
    }

    /**
     * Deletes an expired settlement that was never executed. Anyone may
     * reclaim; completed settlements are kept for audit.
     */
    @Transactional
    public Outcome<Settlement> reclaim(long settlementId) {
        MDC.put("settlementId", Long.toString(settlementId));
        try {
            Optional<Settlement> found = store.findById(settlementId);
            if (found.isEmpty()) {
                return reject("reclaim", notFound(settlementId));
            }
            Settlement settlement = found.get();
            Instant now = Instant.now(clock);
            if (settlement.getState() != SettlementState.PENDING) {
                return reject("reclaim", stateError(settlement));
            }
            if (!settlement.isExpired(now)) {
                return reject("reclaim", LedgerError.of(ErrorCode.NOT_EXPIRED,
                    "Settlement %d does not expire until %s", settlementId, settlement.getExpiresAt()));
            }
            if (!store.deleteIfExpired(settlementId, now)) {
                return reject("reclaim", store.findById(settlementId)
                    .map(this::stateError)
                    .orElseGet(() -> notFound(settlementId)));
            }

            Settlement reclaimed = settlement.reclaim();
            outboxService.saveEvent(SettlementReclaimedEvent.fromSettlement(reclaimed, now));
            metrics.recordSettlementTransition(SettlementState.RECLAIMED.name());
            log.info("Settlement reclaimed: settlementId={}, expiredAt={}", settlementId, settlement.getExpiresAt());
            return Outcome.success(reclaimed);
        } finally {
            MDC.remove("settlementId");
        }
    }

    public Outcome<Settlement> getSettlement(long settlementId) {
        return store.findById(settlementId)
            .map(Outcome::success)
            .orElseGet(() -> Outcome.failure(notFound(settlementId)));
    }

    /**
     * True only for COMPLETED settlements; false for unknown ids.
     */
    public boolean isExecuted(long settlementId) {
        return store.findById(settlementId).map(Settlement::isExecuted).orElse(false);
    }

    public List<Settlement> listForDebtor(String debtorId) {
        return store.findByDebtor(debtorId);
    }

    public List<Settlement> listForCreditor(String creditorId) {
        return store.findByCreditor(creditorId);
    }

    /**
     * @param groupId optional filter
     * @param state optional filter
     */
    public List<Settlement> listForMember(String memberId, String groupId, SettlementState state, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return store.findByMember(memberId, groupId, state, Math.min(limit, MAX_PAGE_SIZE));
    }

    /**
     * Expired PENDING settlements, oldest first, for the reclaim scheduler.
     */
    public List<Settlement> findReclaimable(int limit) {
        return store.findExpiredPending(Instant.now(clock), limit);
    }

    static String transferKey(long settlementId) {
        return "settlement-" + settlementId;
    }

    private LedgerError stateError(Settlement settlement) {
        return switch (settlement.getState()) {
            case COMPLETED -> LedgerError.of(ErrorCode.ALREADY_EXECUTED,
                "Settlement %d was already executed", settlement.getId());
            case CANCELLED -> LedgerError.of(ErrorCode.CANCELLED,
                "Settlement %d was cancelled", settlement.getId());
            case RECLAIMED -> notFound(settlement.getId());
            case PENDING -> throw new IllegalStateException("Settlement " + settlement.getId() + " is pending");
        };
    }

    private static LedgerError notFound(long settlementId) {
        return LedgerError.of(ErrorCode.NOT_FOUND, "Settlement %d not found", settlementId);
    }

    private <T> Outcome<T> reject(String operation, LedgerError error) {
        metrics.recordRejected(operation, error.getCode());
        log.info("Settlement {} rejected: code={}, reason={}", operation, error.getCode(), error.getMessage());
        return Outcome.failure(error);
    }
}
