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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.fireflyframework.retry.health.ConnectionsHealthIndicator;
import org.fireflyframework.retry.web.ConnectionsHealthController;
import org.fireflyframework.retry.web.DatabaseHealthWebFilter;
import org.fireflyframework.retry.web.RedisHealthWebFilter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the connection request gates, the {@code /health} endpoint and the
 * actuator health indicator.
 */
@Slf4j
@AutoConfiguration(after = RetryAutoConfiguration.class)
public class RetryWebAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.retry.web.enabled", havingValue = "true", matchIfMissing = true)
    public DatabaseHealthWebFilter databaseHealthWebFilter(ServerConnections serverConnections,
                                                           ObjectProvider<ObjectMapper> objectMapper,
                                                           RetryProperties properties) {
        RetryProperties.WebProperties web = properties.getWeb();
        log.info("[retry] Database request gate active for {}", web.getDatabasePaths());
        return new DatabaseHealthWebFilter(serverConnections, objectMapper.getIfAvailable(ObjectMapper::new),
                web.getDatabasePaths(), web.getRetryAfter());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.retry.web.enabled", havingValue = "true", matchIfMissing = true)
    public RedisHealthWebFilter redisHealthWebFilter(ServerConnections serverConnections, RetryProperties properties) {
        log.info("[retry] Redis request check active for {}", properties.getWeb().getRedisPaths());
        return new RedisHealthWebFilter(serverConnections, properties.getWeb().getRedisPaths());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.retry.web.enabled", havingValue = "true", matchIfMissing = true)
    public ConnectionsHealthController connectionsHealthController(ServerConnections serverConnections) {
        return new ConnectionsHealthController(serverConnections);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.retry.health.enabled", havingValue = "true", matchIfMissing = true)
    public ConnectionsHealthIndicator connectionsHealthIndicator(ServerConnections serverConnections) {
        log.info("[retry] Health indicator initialized");
        return new ConnectionsHealthIndicator(serverConnections);
    }
}
