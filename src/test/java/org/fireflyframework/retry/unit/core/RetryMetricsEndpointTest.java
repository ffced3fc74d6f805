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

package org.fireflyframework.retry.unit.core;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.retry.core.observability.RetryEvents;
import org.fireflyframework.retry.core.observability.RetryMetrics;
import org.fireflyframework.retry.core.observability.RetryMetricsEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetryMetricsEndpointTest {

    private static final Map<String, Object> DATABASE = Map.of(RetryEvents.CONTEXT_TYPE, "database");
    private static final Map<String, Object> REDIS = Map.of(RetryEvents.CONTEXT_TYPE, "redis");

    private SimpleMeterRegistry registry;
    private RetryMetrics metrics;
    private RetryMetricsEndpoint endpoint;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RetryMetrics(registry);
        endpoint = new RetryMetricsEndpoint(registry);
    }

    private void recordActivity() {
        // database: two failures, then success on the third attempt
        metrics.onAttemptFailed("Query", 1, 6, new ConnectException("refused"), DATABASE);
        metrics.onRetry("Query", 1, 6, null, DATABASE);
        metrics.onAttemptFailed("Query", 2, 6, new ConnectException("refused"), DATABASE);
        metrics.onRetry("Query", 2, 6, null, DATABASE);
        metrics.onSucceeded("Query", 3, 3200, DATABASE);

        // redis: one exhausted operation
        metrics.onAttemptFailed("Redis GET k", 1, 1, new IllegalStateException("bad"), REDIS);
        metrics.onFinalFailure("Redis GET k", 1, new IllegalStateException("bad"), REDIS);

        // untyped
        metrics.onSucceeded("Custom", 1, 5, Map.of());
    }

    @Test
    @SuppressWarnings("unchecked")
    void metrics_summarizesAllTypes() {
        recordActivity();

        Map<String, Object> result = endpoint.metrics();

        Map<String, Object> operations = (Map<String, Object>) result.get("operations");
        assertThat((double) operations.get("total")).isEqualTo(3.0);
        assertThat((double) operations.get("succeeded")).isEqualTo(2.0);
        assertThat((double) operations.get("failed")).isEqualTo(1.0);

        Map<String, Object> attempts = (Map<String, Object>) result.get("attempts");
        assertThat((double) attempts.get("failed")).isEqualTo(3.0);
        assertThat((double) attempts.get("retried")).isEqualTo(2.0);

        Map<String, Object> types = (Map<String, Object>) result.get("types");
        assertThat(types).containsOnlyKeys("custom", "database", "redis");
    }

    @Test
    @SuppressWarnings("unchecked")
    void metricsForType_narrowsToThatType() {
        recordActivity();

        Map<String, Object> result = endpoint.metrics("database");

        assertThat(result.get("type")).isEqualTo("database");
        Map<String, Object> operations = (Map<String, Object>) result.get("operations");
        assertThat((double) operations.get("succeeded")).isEqualTo(1.0);
        assertThat((double) operations.get("failed")).isEqualTo(0.0);
        Map<String, Object> attempts = (Map<String, Object>) result.get("attempts");
        assertThat((double) attempts.get("retried")).isEqualTo(2.0);
    }

    @Test
    void durationTimer_recordsSuccessfulOperations() {
        recordActivity();

        assertThat(registry.get("firefly.retry.operations.duration").tag("type", "database").timer().count())
                .isEqualTo(1L);
        assertThat(registry.get("firefly.retry.attempts.failed")
                .tag("type", "database").tag("exception", "ConnectException").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void metrics_noActivity_returnsZeros() {
        Map<String, Object> result = endpoint.metrics();

        Map<String, Object> operations = (Map<String, Object>) result.get("operations");
        assertThat((double) operations.get("total")).isEqualTo(0.0);
        assertThat((Map<String, Object>) result.get("types")).isEmpty();
    }
}
