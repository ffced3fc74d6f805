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

package org.fireflyframework.retry.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.core.observability.RetryMetrics;
import org.fireflyframework.retry.core.observability.RetryMetricsEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer retry metrics and the {@code retry-metrics} actuator endpoint.
 *
 * <p>Activated when Micrometer is on the classpath and a {@code MeterRegistry} bean is available.
 */
@Slf4j
@AutoConfiguration(before = RetryAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(name = "firefly.retry.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class RetryMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(MeterRegistry meterRegistry) {
        log.info("[retry] Metrics initialized with MeterRegistry");
        return new RetryMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetricsEndpoint retryMetricsEndpoint(MeterRegistry meterRegistry) {
        return new RetryMetricsEndpoint(meterRegistry);
    }
}
