package io.github.drompincen.payverify.runtime.verification.retry;

import io.github.drompincen.payverify.runtime.verification.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking collaborator call under a {@link RetryPolicy}. Each attempt
 * runs on the given scheduler with its own timeout; disposing the returned
 * {@link Mono} cancels the running attempt and any pending retry.
 */
@Component
public class RetryingExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);

    private final RetryPolicy policy;
    private final Scheduler scheduler;

    @Autowired
    public RetryingExecutor(RetryPolicy policy) {
        this(policy, Schedulers.boundedElastic());
    }

    RetryingExecutor(RetryPolicy policy, Scheduler scheduler) {
        this.policy = policy;
        this.scheduler = scheduler;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Attempt {@code n + 1} starts {@link RetryPolicy#backoffBefore(int) backoffBefore(n)}
     * after attempt {@code n} failed. The overall timeout bounds attempts and waits together.
     */
    public <T> Mono<T> execute(String operation, Callable<T> call) {
        return Mono.defer(() -> {
            AtomicInteger attempts = new AtomicInteger();
            return Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return call.call();
                    })
                    .subscribeOn(scheduler)
                    .timeout(policy.attemptTimeout())
                    .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                        int retry = (int) signal.totalRetries() + 1;
                        if (retry >= policy.maxAttempts()) {
                            return Mono.<Long>error(signal.failure());
                        }
                        log.warn("{} attempt {} failed: {}, retrying...",
                                operation, retry, describe(signal.failure()));
                        return Mono.delay(policy.backoffBefore(retry));
                    })))
                    .timeout(policy.overallTimeout(), Mono.error(() -> new ExtractionException(
                            "Failed to " + operation + ": gave up after " + policy.overallTimeout().toMillis()
                                    + " ms overall timeout (" + attempts(attempts.get()) + ")")))
                    .onErrorMap(e -> !(e instanceof ExtractionException), e -> new ExtractionException(
                            "Failed to " + operation + " after " + attempts(attempts.get()) + ": " + describe(e), e));
        });
    }

    private static String attempts(int count) {
        return count == 1 ? "1 attempt" : count + " attempts";
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
