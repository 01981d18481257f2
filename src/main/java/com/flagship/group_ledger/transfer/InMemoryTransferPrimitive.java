package com.flagship.group_ledger.transfer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Process-local wallets with the same all-or-nothing contract as
 * {@link JdbcTransferPrimitive}.
 *
 * Latency and proof tampering can be injected to exercise timeout and
 * mismatch handling.
 */
public class InMemoryTransferPrimitive implements TransferPrimitive {

    private final Clock clock;
    private final Map<String, Long> wallets = new ConcurrentHashMap<>();
    private final Map<String, TransferProof> confirmed = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final Object walletLock = new Object();

    private volatile Duration latency = Duration.ZERO;
    private volatile UnaryOperator<TransferProof> proofTamperer;

    public InMemoryTransferPrimitive(Clock clock) {
        this.clock = clock;
    }

    public InMemoryTransferPrimitive openAccount(String memberId, long openingBalance) {
        wallets.put(memberId, openingBalance);
        return this;
    }

    public long balanceOf(String memberId) {
        return wallets.getOrDefault(memberId, 0L);
    }

    public int confirmedCount() {
        return confirmed.size();
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    /**
     * The next transfer reports the proof produced by {@code tamperer} instead of the real one.
     */
    public void tamperWithNextProof(UnaryOperator<TransferProof> tamperer) {
        this.proofTamperer = tamperer;
    }

    @Override
    public TransferProof transferAndCommit(TransferInstruction instruction, TransferCommit commit) {
        String transferKey = instruction.getTransferKey();
        if (!inFlight.add(transferKey)) {
            throw new DuplicateTransferException(transferKey);
        }
        try {
            if (confirmed.containsKey(transferKey)) {
                throw new DuplicateTransferException(transferKey);
            }
            simulateLatency();

            synchronized (walletLock) {
                String from = instruction.getFromMember();
                String to = instruction.getToMember();
                long amount = instruction.getAmount();

                Long fromBalance = wallets.get(from);
                if (fromBalance == null || fromBalance < amount) {
                    throw new TransferRejectedException(String.format("Wallet %s missing or below %d", from, amount));
                }
                Long toBalance = wallets.get(to);
                if (toBalance == null) {
                    throw new TransferRejectedException("No wallet for " + to);
                }

                wallets.put(from, fromBalance - amount);
                wallets.put(to, toBalance + amount);

                TransferProof proof = new TransferProof("mem-" + sequence.incrementAndGet(), transferKey,
                    from, to, amount, Instant.now(clock));
                UnaryOperator<TransferProof> tamperer = proofTamperer;
                if (tamperer != null) {
                    proofTamperer = null;
                    proof = tamperer.apply(proof);
                }

                try {
                    commit.commit(proof);
                } catch (RuntimeException e) {
                    wallets.put(from, fromBalance);
                    wallets.put(to, toBalance);
                    throw e;
                }
                confirmed.put(transferKey, proof);
                return proof;
            }
        } finally {
            inFlight.remove(transferKey);
        }
    }

    @Override
    public TransferStatus lookup(String transferKey) {
        if (confirmed.containsKey(transferKey)) {
            return TransferStatus.CONFIRMED;
        }
        return inFlight.contains(transferKey) ? TransferStatus.IN_FLIGHT : TransferStatus.NONE;
    }

    private void simulateLatency() {
        Duration delay = latency;
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferRejectedException("Interrupted before transfer was applied");
        }
    }
}
