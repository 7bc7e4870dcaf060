package io.github.drompincen.payverify.runtime.verification.retry;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RetryConfig {

    @Bean
    public RetryPolicy extractionRetryPolicy(
            @Value("${payverify.retry.max-attempts:3}") int maxAttempts,
            @Value("${payverify.retry.initial-backoff:1s}") Duration initialBackoff,
            @Value("${payverify.retry.attempt-timeout:60s}") Duration attemptTimeout,
            @Value("${payverify.retry.overall-timeout:5m}") Duration overallTimeout) {
        return new RetryPolicy(maxAttempts, initialBackoff, attemptTimeout, overallTimeout);
    }
}
