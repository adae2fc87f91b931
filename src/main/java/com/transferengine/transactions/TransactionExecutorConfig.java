package com.transferengine.transactions;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for asynchronously submitted transactions.
 */
@Configuration
public class TransactionExecutorConfig {

    @Bean(name = "transactionExecutor")
    public ThreadPoolTaskExecutor transactionExecutor(
            @Value("${transfer-engine.executor.pool-size:16}") int poolSize,
            @Value("${transfer-engine.executor.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("txn-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
