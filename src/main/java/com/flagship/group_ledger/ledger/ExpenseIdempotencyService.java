package com.flagship.group_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps idempotency keys to already-posted expenses.
 *
 * Redis is the fast path; the {@code expenses.idempotency_key} column is the
 * source of truth. A Redis entry is only written after the posting commits,
 * and an entry pointing at a missing expense is ignored.
 */
@Service
@Slf4j
public class ExpenseIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:expense-idempotency:";

    private final ExpenseStore expenseStore;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final Duration ttl;

    public ExpenseIdempotencyService(ExpenseStore expenseStore,
                                     Optional<RedisTemplate<String, String>> redisTemplate,
                                     @Value("${ledger.idempotency.ttl:P7D}") Duration ttl) {
        this.expenseStore = expenseStore;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    public Optional<Expense> findExpense(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<Long> cachedId = readCache(idempotencyKey);
        if (cachedId.isPresent()) {
            Optional<Expense> cached = expenseStore.findById(cachedId.get());
            if (cached.isPresent()) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
            log.warn("Idempotency key {} cached for missing expense {}, ignoring cache entry",
                idempotencyKey, cachedId.get());
        }

        Optional<Expense> stored = expenseStore.findByIdempotencyKey(idempotencyKey);
        stored.ifPresent(expense -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeCache(idempotencyKey, expense.getId());
        });
        return stored;
    }

    /**
     * Caches the mapping once the current transaction commits, or immediately
     * when no transaction is active.
     */
    public void remember(String idempotencyKey, long expenseId) {
        requireKey(idempotencyKey);
        if (redisTemplate.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    writeCache(idempotencyKey, expenseId);
                }
            });
        } else {
            writeCache(idempotencyKey, expenseId);
        }
    }

    private Optional<Long> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return value == null ? Optional.empty() : Optional.of(Long.parseLong(value));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, long expenseId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, Long.toString(expenseId), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
