package com.rebalance.backend.config;

import com.rebalance.backend.exception.BridgeIoException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.UncheckedIOException;
import java.time.Duration;

@Configuration
public class BridgeResilienceConfig {

    @Bean
    public Retry bridgeWriteRetry(
            @Value("${bridge.retry.max-attempts:3}") int maxAttempts,
            @Value("${bridge.retry.base-delay-ms:50}") long baseDelayMs
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(baseDelayMs), 2.0))
                .retryExceptions(UncheckedIOException.class)
                .ignoreExceptions(BridgeIoException.class)
                .build();
        return Retry.of("bridge-write", config);
    }
}
