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
import io.micrometer.core.instrument.search.Search;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Spring Boot Actuator endpoint exposing retry metrics.
 *
 * <p>Reads the counters registered by {@link RetryMetrics} and returns a structured summary
 * at {@code /actuator/retry-metrics}, optionally narrowed to one resource type
 * ({@code /actuator/retry-metrics/database}).
 */
@Slf4j
@Endpoint(id = "retry-metrics")
public class RetryMetricsEndpoint {

    private static final String PREFIX = RetryMetrics.PREFIX;

    private final MeterRegistry registry;

    public RetryMetricsEndpoint(MeterRegistry registry) {
        this.registry = registry;
    }

    @ReadOperation
    public Map<String, Object> metrics() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("operations", buildOperationMetrics(null));
        result.put("attempts", buildAttemptMetrics(null));
        Map<String, Object> types = new LinkedHashMap<>();
        for (String type : knownTypes()) {
            types.put(type, buildOperationMetrics(type));
        }
        result.put("types", types);
        return result;
    }

    @ReadOperation
    public Map<String, Object> metrics(@Selector String type) {
        if (!knownTypes().contains(type)) {
            log.debug("[retry] No retry metrics recorded for type: {}", type);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", type);
        result.put("operations", buildOperationMetrics(type));
        result.put("attempts", buildAttemptMetrics(type));
        return result;
    }

    private Map<String, Object> buildOperationMetrics(String type) {
        double succeeded = sum(PREFIX + ".operations.completed", type, "success", "true");
        double failed = sum(PREFIX + ".operations.completed", type, "success", "false");
        Map<String, Object> operations = new LinkedHashMap<>();
        operations.put("total", succeeded + failed);
        operations.put("succeeded", succeeded);
        operations.put("failed", failed);
        return operations;
    }

    private Map<String, Object> buildAttemptMetrics(String type) {
        Map<String, Object> attempts = new LinkedHashMap<>();
        attempts.put("failed", sum(PREFIX + ".attempts.failed", type, null, null));
        attempts.put("retried", sum(PREFIX + ".retries", type, null, null));
        return attempts;
    }

    private TreeSet<String> knownTypes() {
        TreeSet<String> types = new TreeSet<>();
        registry.find(PREFIX + ".operations.completed").counters()
                .forEach(c -> {
                    String t = c.getId().getTag("type");
                    if (t != null) types.add(t);
                });
        return types;
    }

    private double sum(String metricName, String type, String tagKey, String tagValue) {
        Search search = registry.find(metricName);
        if (type != null) {
            search = search.tag("type", type);
        }
        if (tagKey != null) {
            search = search.tag(tagKey, tagValue);
        }
        return search.counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
