package com.flagship.group_ledger.config;

import com.flagship.group_ledger.split.EqualSplitPolicy;
import com.flagship.group_ledger.split.SplitCalculator;
import com.flagship.group_ledger.split.SplitPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared collaborators for the ledger services.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Used when an expense is posted without an explicit policy.
     */
    @Bean
    public SplitPolicy defaultSplitPolicy(SplitCalculator splitCalculator) {
        return new EqualSplitPolicy(splitCalculator);
    }

    /**
     * Runs settlement transfers so that callers can stop waiting after
     * {@code ledger.settlement.execute-timeout}. Shut down with the context.
     */
    @Bean(name = "settlementExecutor", destroyMethod = "shutdown")
    public ExecutorService settlementExecutor(@Value("${ledger.settlement.executor-threads:8}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "settlement-transfer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
