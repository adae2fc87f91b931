package com.transferengine.ledger;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;

/**
 * Wiring for the ledger's unit of work: the transaction template it commits
 * through and the bounded retry applied to transient store failures.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public TransactionTemplate ledgerTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    @Bean
    public Retry ledgerStoreRetry(
            @Value("${transfer-engine.ledger.store-retry.max-attempts:3}") int maxAttempts,
            @Value("${transfer-engine.ledger.store-retry.initial-backoff:50ms}") Duration initialBackoff) {

        RetryConfig config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
            .retryExceptions(TransientDataAccessException.class)
            .build();

        Retry retry = Retry.of("ledgerStore", config);
        retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying ledger unit of work (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().toString()));
        return retry;
    }
}
