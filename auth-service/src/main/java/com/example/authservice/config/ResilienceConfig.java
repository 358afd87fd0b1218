package com.example.authservice.config;

import com.example.authservice.store.TransientStorageException;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j Configuration
 *
 * Retry Strategy for credential store reads:
 * - Max attempts: auth.store.read-attempts (2, i.e. one retry)
 * - Wait duration: auth.store.read-retry-wait
 * - Retry on: TransientStorageException only
 *
 * Mutations are never decorated with this retry: a repeated createIdentity or
 * consumeRefreshToken after an ambiguous failure could produce a second winner.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String CREDENTIAL_STORE_READS = "credentialStoreReads";

    @Bean
    public RetryRegistry retryRegistry(AuthProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.store().readAttempts())
                .waitDuration(properties.store().readRetryWait())
                .retryExceptions(TransientStorageException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);

        var retry = registry.retry(CREDENTIAL_STORE_READS);

        retry.getEventPublisher()
                .onRetry(event ->
                        log.warn("Credential store read retry attempt #{}: {}",
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable().getMessage()))
                .onError(event ->
                        log.error("Credential store read failed after {} retry attempts",
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable()));

        return registry;
    }
}
