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

package org.fireflyframework.retry.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable retry configuration: attempt budget, exponential backoff with optional jitter,
 * and the conditions under which a failure is retried.
 *
 * <p>{@code maxRetries} counts retries after the first attempt, so an operation runs at most
 * {@code maxRetries + 1} times. Instances hold no per-call state and may be shared freely.
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        boolean jitter,
        List<RetryCondition> retryConditions
) {
    public static final double JITTER_RATIO = 0.25;

    public static final RetryPolicy DEFAULT = builder().build();

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be non-negative");
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.isNegative() || maxDelay.isZero()) {
            throw new IllegalArgumentException("maxDelay must be positive");
        }
        if (!(backoffMultiplier > 0.0)) throw new IllegalArgumentException("backoffMultiplier must be positive");
        Objects.requireNonNull(retryConditions, "retryConditions");
        retryConditions = retryConditions.isEmpty()
                ? List.of(RetryConditions.transientErrors())
                : List.copyOf(retryConditions);
    }

    /**
     * Delay before the given retry.
     *
     * @param attempt one-based retry number; values below 1 are treated as 1
     */
    public Duration calculateDelay(int attempt) {
        int exponent = Math.max(attempt, 1) - 1;
        double delayMs = baseDelay.toMillis() * Math.pow(backoffMultiplier, exponent);
        delayMs = Math.min(delayMs, maxDelay.toMillis());
        if (jitter) {
            double range = delayMs * JITTER_RATIO;
            double offset = ThreadLocalRandom.current().nextDouble(-range, Math.nextUp(range));
            delayMs = Math.max(0.0, delayMs + offset);
        }
        return Duration.ofMillis((long) Math.floor(delayMs));
    }

    /**
     * @param attempt zero-based index of the attempt that just failed
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        if (attempt >= maxRetries) {
            return false;
        }
        for (RetryCondition condition : retryConditions) {
            if (condition.test(error, attempt)) {
                return true;
            }
        }
        return false;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    // --- Presets ---

    /** Plain defaults with the given overrides; conditions in {@code options} replace the default one. */
    public static RetryPolicy from(RetryOptions options) {
        Builder builder = builder();
        if (options != null) {
            builder.apply(options);
            builder.retryConditions(options.getRetryConditions());
        }
        return builder.build();
    }

    public static RetryPolicy forDatabase() {
        return forDatabase(null);
    }

    /** maxRetries=5, baseDelay=2s, maxDelay=30s, multiplier=1.5, database failure condition. */
    public static RetryPolicy forDatabase(RetryOptions custom) {
        return preset(5, Duration.ofMillis(2000), Duration.ofMillis(30000), 1.5,
                RetryConditions.databaseErrors(), custom);
    }

    public static RetryPolicy forCache() {
        return forCache(null);
    }

    /** maxRetries=3, baseDelay=1s, maxDelay=10s, multiplier=2, cache-store failure condition. */
    public static RetryPolicy forCache(RetryOptions custom) {
        return preset(3, Duration.ofMillis(1000), Duration.ofMillis(10000), 2.0,
                RetryConditions.cacheErrors(), custom);
    }

    public static RetryPolicy forHttp(RetryOptions custom) {
        return preset(3, Duration.ofMillis(1000), Duration.ofMillis(10000), 2.0,
                RetryConditions.httpErrors(), custom);
    }

    public static RetryPolicy forFileSystem(RetryOptions custom) {
        return preset(2, Duration.ofMillis(500), Duration.ofMillis(5000), 2.0,
                RetryConditions.fileSystemErrors(), custom);
    }

    private static RetryPolicy preset(int maxRetries, Duration baseDelay, Duration maxDelay, double multiplier,
                                      RetryCondition presetCondition, RetryOptions custom) {
        Builder builder = builder()
                .maxRetries(maxRetries)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(multiplier);
        List<RetryCondition> conditions = new ArrayList<>();
        if (custom != null) {
            builder.apply(custom);
            conditions.addAll(custom.getRetryConditions());
        }
        conditions.add(presetCondition);
        return builder.retryConditions(conditions).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofMillis(1000);
        private Duration maxDelay = Duration.ofMillis(30000);
        private double backoffMultiplier = 2.0;
        private boolean jitter = true;
        private final List<RetryCondition> retryConditions = new ArrayList<>();

        private Builder() {}

        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder baseDelay(Duration baseDelay) { this.baseDelay = baseDelay; return this; }
        public Builder maxDelay(Duration maxDelay) { this.maxDelay = maxDelay; return this; }
        public Builder backoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; return this; }
        public Builder jitter(boolean jitter) { this.jitter = jitter; return this; }

        public Builder retryCondition(RetryCondition condition) {
            this.retryConditions.add(Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public Builder retryConditions(List<RetryCondition> conditions) {
            this.retryConditions.clear();
            conditions.forEach(this::retryCondition);
            return this;
        }

        Builder apply(RetryOptions options) {
            if (options.getMaxRetries() != null) maxRetries = options.getMaxRetries();
            if (options.getBaseDelay() != null) baseDelay = options.getBaseDelay();
            if (options.getMaxDelay() != null) maxDelay = options.getMaxDelay();
            if (options.getBackoffMultiplier() != null) backoffMultiplier = options.getBackoffMultiplier();
            if (options.getJitter() != null) jitter = options.getJitter();
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffMultiplier, jitter, retryConditions);
        }
    }
}
