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

package org.fireflyframework.retry.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link RetryEvents}. Meters are tagged by resource type only; operation
 * names often embed keys or URLs and would explode tag cardinality.
 */
public class RetryMetrics implements RetryEvents {
    static final String PREFIX = "firefly.retry";
    static final String UNTYPED = "custom";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public RetryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onAttemptFailed(String operationName, int attempt, int maxAttempts, Throwable error, Map<String, Object> context) {
        counter("attempts.failed", "type", type(context), "exception", error.getClass().getSimpleName()).increment();
    }

    @Override
    public void onRetry(String operationName, int retryNumber, int maxAttempts, Throwable lastError, Map<String, Object> context) {
        counter("retries", "type", type(context)).increment();
    }

    @Override
    public void onSucceeded(String operationName, int attempts, long durationMs, Map<String, Object> context) {
        String type = type(context);
        counter("operations.completed", "type", type, "success", "true").increment();
        timer("operations.duration", "type", type).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onFinalFailure(String operationName, int totalAttempts, Throwable lastError, Map<String, Object> context) {
        counter("operations.completed", "type", type(context), "success", "false").increment();
    }

    private static String type(Map<String, Object> context) {
        Object type = context != null ? context.get(CONTEXT_TYPE) : null;
        return type != null ? type.toString() : UNTYPED;
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
