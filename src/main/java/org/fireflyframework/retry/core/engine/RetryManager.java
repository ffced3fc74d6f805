/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.retry.core.engine;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.core.exception.RetryException;
import org.fireflyframework.retry.core.exception.RetryExhaustedException;
import org.fireflyframework.retry.core.model.RetryPolicy;
import org.fireflyframework.retry.core.observability.RetryEvents;
import org.fireflyframework.retry.core.observability.RetryLoggerEvents;
import org.fireflyframework.retry.core.observability.RetryTracer;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Executes a caller-supplied operation under a {@link RetryPolicy}.
 *
 * <p>Attempts run strictly one after another: a retry resubscribes to the operation only once
 * the previous attempt failed and its backoff delay, scheduled with {@link Mono#delay(Duration)},
 * has elapsed. Retries are driven by {@code retryWhen}, so the operator chain does not grow with
 * the attempt count. The returned {@link Mono} is cold; cancelling its subscription cancels the pending
 * delay or the in-flight attempt and no further attempt is made.
 *
 * <pre>{@code
 * RetryManager retry = new RetryManager(RetryPolicy.forDatabase());
 * Mono<Listing> listing = retry.executeWithRetry(
 *         () -> repository.findById(id), "Load listing", Map.of("type", "database"));
 * }</pre>
 *
 * <p>A successful attempt completes the returned Mono with its value (or empty). Any final
 * failure is surfaced as a single {@link RetryExhaustedException} naming the operation and
 * the number of attempts, with the last failure as its cause.
 */
@Slf4j
public class RetryManager {

    public static final String DEFAULT_OPERATION_NAME = "Operation";

    private final RetryPolicy policy;
    private final RetryEvents events;
    private final RetryTracer tracer;

    public RetryManager() {
        this(RetryPolicy.DEFAULT);
    }

    public RetryManager(RetryPolicy policy) {
        this(policy, new RetryLoggerEvents(), null);
    }

    public RetryManager(RetryPolicy policy, RetryEvents events) {
        this(policy, events, null);
    }

    public RetryManager(RetryPolicy policy, RetryEvents events, RetryTracer tracer) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.events = events != null ? events : new RetryEvents() {};
        this.tracer = tracer;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public <T> Mono<T> executeWithRetry(Supplier<? extends Mono<T>> operation) {
        return executeWithRetry(operation, DEFAULT_OPERATION_NAME, Map.of());
    }

    public <T> Mono<T> executeWithRetry(Supplier<? extends Mono<T>> operation, String operationName) {
        return executeWithRetry(operation, operationName, Map.of());
    }

    /**
     * @param operation     produces the Mono of one attempt; invoked once per attempt
     * @param operationName human-readable name used in logs, events and the final error
     * @param context       free-form entries handed to {@link RetryEvents} listeners
     */
    public <T> Mono<T> executeWithRetry(Supplier<? extends Mono<T>> operation, String operationName,
                                        Map<String, Object> context) {
        Objects.requireNonNull(operation, "operation");
        String name = operationName == null || operationName.isBlank() ? DEFAULT_OPERATION_NAME : operationName;
        Map<String, Object> ctx = copyOf(context);
        Mono<T> execution = Mono.defer(() -> attempts(operation, name, ctx));
        if (tracer != null) {
            Object type = ctx.get(RetryEvents.CONTEXT_TYPE);
            execution = tracer.traceExecution(name, type != null ? type.toString() : "custom", execution);
        }
        return execution;
    }

    /**
     * @param attempt one-based retry number
     */
    public Duration calculateDelay(int attempt) {
        return policy.calculateDelay(attempt);
    }

    private <T> Mono<T> attempts(Supplier<? extends Mono<T>> operation, String name, Map<String, Object> ctx) {
        long startedAt = System.nanoTime();
        AtomicInteger attemptCount = new AtomicInteger();
        return Mono.defer(() -> {
                    attemptCount.incrementAndGet();
                    return Mono.defer(operation);
                })
                .doOnSuccess(result -> fire(e -> e.onSucceeded(name, attemptCount.get(), elapsedMs(startedAt), ctx)))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Throwable error = signal.failure();
                    int attemptNumber = (int) signal.totalRetries() + 1;
                    fire(e -> e.onAttemptFailed(name, attemptNumber, policy.maxAttempts(), error, ctx));
                    if (isRetryable(error, attemptNumber - 1)) {
                        return Mono.delay(policy.calculateDelay(attemptNumber))
                                .doOnNext(tick -> fire(e -> e.onRetry(name, attemptNumber, policy.maxAttempts(), error, ctx)));
                    }
                    fire(e -> e.onFinalFailure(name, attemptNumber, error, ctx));
                    return Mono.<Long>error(new RetryExhaustedException(name, attemptNumber, error, ctx));
                })));
    }

    private boolean isRetryable(Throwable error, int attempt) {
        if (error instanceof RetryException && !((RetryException) error).isRetryable()) {
            return false;
        }
        try {
            return policy.shouldRetry(error, attempt);
        } catch (RuntimeException conditionFailure) {
            log.warn("[retry] Retry condition failed, treating error as permanent: {}", conditionFailure.getMessage());
            error.addSuppressed(conditionFailure);
            return false;
        }
    }

    private void fire(Consumer<RetryEvents> action) {
        try {
            action.accept(events);
        } catch (RuntimeException e) {
            log.warn("[retry] Listener {} failed: {}", events.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static long elapsedMs(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
    }

    private static Map<String, Object> copyOf(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        context.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return Collections.unmodifiableMap(copy);
    }
}
