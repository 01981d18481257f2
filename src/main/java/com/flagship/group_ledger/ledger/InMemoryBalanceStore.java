package com.flagship.group_ledger.ledger;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local balances, kept in {@link EncodedBalance} form.
 *
 * Each group holds an immutable snapshot that writers replace wholesale under
 * the group's lock, so readers never lock and never see a half-applied expense.
 */
public class InMemoryBalanceStore implements BalanceStore {

    private final Map<String, GroupBalances> groups = new ConcurrentHashMap<>();

    @Override
    public <T> T withGroupLock(String groupId, Supplier<T> work) {
        ReentrantLock lock = group(groupId).lock;
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void applyDeltas(String groupId, Map<String, Long> deltas) {
        GroupBalances group = group(groupId);
        group.lock.lock();
        try {
            Map<String, Long> next = new TreeMap<>(group.words);
            deltas.forEach((member, delta) -> {
                long word = next.getOrDefault(member, 0L);
                next.put(member, delta >= 0
                    ? EncodedBalance.credit(word, delta)
                    : EncodedBalance.debit(word, Math.negateExact(delta)));
            });
            group.words = Collections.unmodifiableMap(next);
        } finally {
            group.lock.unlock();
        }
    }

    @Override
    public long getBalance(String groupId, String memberId) {
        GroupBalances group = groups.get(groupId);
        if (group == null) {
            return 0L;
        }
        Long word = group.words.get(memberId);
        return word == null ? 0L : EncodedBalance.decode(word);
    }

    @Override
    public Map<String, Long> getBalances(String groupId) {
        Map<String, Long> balances = new TreeMap<>();
        GroupBalances group = groups.get(groupId);
        if (group != null) {
            group.words.forEach((member, word) -> balances.put(member, EncodedBalance.decode(word)));
        }
        return balances;
    }

    @Override
    public void replaceBalances(String groupId, Map<String, Long> balances) {
        GroupBalances group = group(groupId);
        group.lock.lock();
        try {
            Map<String, Long> next = new TreeMap<>();
            balances.forEach((member, balance) -> next.put(member, EncodedBalance.encode(balance)));
            group.words = Collections.unmodifiableMap(next);
        } finally {
            group.lock.unlock();
        }
    }

    /**
     * Raw encoded word for a member, 0 when absent.
     */
    public long encodedBalance(String groupId, String memberId) {
        GroupBalances group = groups.get(groupId);
        return group == null ? 0L : group.words.getOrDefault(memberId, 0L);
    }

    private GroupBalances group(String groupId) {
        return groups.computeIfAbsent(groupId, id -> new GroupBalances());
    }

    private static final class GroupBalances {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Map<String, Long> words = Collections.emptyMap();
    }
}
