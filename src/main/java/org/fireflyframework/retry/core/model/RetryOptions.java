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

/**
 * Per-field overrides applied over a preset when building a {@link RetryPolicy}.
 *
 * <p>Every field is optional: a {@code null} field keeps the preset value. Retry conditions
 * listed here are added to the preset's own condition rather than replacing it.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.forDatabase(new RetryOptions().withMaxRetries(10));
 * }</pre>
 *
 * <p>The class is a JavaBean so it can be bound directly from {@code firefly.retry.*}
 * configuration.
 */
public class RetryOptions {

    private Integer maxRetries;
    private Duration baseDelay;
    private Duration maxDelay;
    private Double backoffMultiplier;
    private Boolean jitter;
    private final List<RetryCondition> retryConditions = new ArrayList<>();

    public Integer getMaxRetries() { return maxRetries; }
    public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBaseDelay() { return baseDelay; }
    public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

    public Duration getMaxDelay() { return maxDelay; }
    public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

    public Double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(Double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

    public Boolean getJitter() { return jitter; }
    public void setJitter(Boolean jitter) { this.jitter = jitter; }

    public List<RetryCondition> getRetryConditions() { return retryConditions; }

    // --- Fluent variants ---

    public RetryOptions withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public RetryOptions withBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
        return this;
    }

    public RetryOptions withMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
        return this;
    }

    public RetryOptions withBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
        return this;
    }

    public RetryOptions withJitter(boolean jitter) {
        this.jitter = jitter;
        return this;
    }

    public RetryOptions withRetryCondition(RetryCondition condition) {
        this.retryConditions.add(condition);
        return this;
    }

    /**
     * Returns a copy whose non-null fields are taken from {@code override} and the rest
     * from this instance. Conditions of both are kept, this instance's first.
     */
    public RetryOptions mergedWith(RetryOptions override) {
        RetryOptions merged = new RetryOptions();
        merged.maxRetries = maxRetries;
        merged.baseDelay = baseDelay;
        merged.maxDelay = maxDelay;
        merged.backoffMultiplier = backoffMultiplier;
        merged.jitter = jitter;
        merged.retryConditions.addAll(retryConditions);
        if (override == null) {
            return merged;
        }
        if (override.maxRetries != null) merged.maxRetries = override.maxRetries;
        if (override.baseDelay != null) merged.baseDelay = override.baseDelay;
        if (override.maxDelay != null) merged.maxDelay = override.maxDelay;
        if (override.backoffMultiplier != null) merged.backoffMultiplier = override.backoffMultiplier;
        if (override.jitter != null) merged.jitter = override.jitter;
        merged.retryConditions.addAll(override.retryConditions);
        return merged;
    }
}
