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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.fireflyframework.retry.bootstrap.ServerConnectionsInitializer;
import org.fireflyframework.retry.connection.ConnectionManager;
import org.fireflyframework.retry.core.observability.CompositeRetryEvents;
import org.fireflyframework.retry.core.observability.RetryEvents;
import org.fireflyframework.retry.core.observability.RetryLoggerEvents;
import org.fireflyframework.retry.core.observability.RetryTracer;
import org.fireflyframework.retry.operations.ApiRetryOperations;
import org.fireflyframework.retry.operations.FileRetryOperations;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.web.reactive.function.client.WebClient;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration for the retry engine.
 *
 * <p>Wires the listener chain, the {@link ConnectionManager}, the API and file facades and
 * {@link ServerConnections}, which is initialized against the application's
 * {@code DataSource} and {@code ReactiveRedisConnectionFactory} once all singletons exist.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration"})
@EnableConfigurationProperties(RetryProperties.class)
public class RetryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryLoggerEvents retryLoggerEvents() {
        return new RetryLoggerEvents();
    }

    /** Primary listener that fans out to every other {@link RetryEvents} bean. */
    @Bean
    @Primary
    @ConditionalOnMissingBean(CompositeRetryEvents.class)
    public CompositeRetryEvents retryEvents(ListableBeanFactory beanFactory) {
        List<RetryEvents> delegates = new ArrayList<>();
        for (String name : beanFactory.getBeanNamesForType(RetryEvents.class)) {
            Class<?> type = beanFactory.getType(name);
            if (type != null && !CompositeRetryEvents.class.isAssignableFrom(type)) {
                delegates.add(beanFactory.getBean(name, RetryEvents.class));
            }
        }
        log.info("[retry] Retry listeners: {}", delegates.stream().map(d -> d.getClass().getSimpleName()).toList());
        return new CompositeRetryEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionManager retryConnectionManager(RetryProperties properties, RetryEvents events,
                                                    ObjectProvider<RetryTracer> tracer) {
        return new ConnectionManager(properties.getDefaults(), properties.getDatabase(), properties.getRedis(),
                properties.getHealth().getMaxRetries(), events, tracer.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ApiRetryOperations apiRetryOperations(RetryProperties properties, RetryEvents events,
                                                 ObjectProvider<RetryTracer> tracer,
                                                 ObjectProvider<WebClient.Builder> webClientBuilder) {
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
        return new ApiRetryOperations(webClient, properties.getApi(), events, tracer.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public FileRetryOperations fileRetryOperations(RetryProperties properties, RetryEvents events,
                                                   ObjectProvider<RetryTracer> tracer) {
        return new FileRetryOperations(properties.getFile(), events, tracer.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ServerConnections serverConnections(ConnectionManager connectionManager) {
        return new ServerConnections(connectionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.retry.bootstrap.initialize-on-startup", havingValue = "true", matchIfMissing = true)
    public ServerConnectionsInitializer serverConnectionsInitializer(ServerConnections serverConnections,
                                                                     ObjectProvider<DataSource> dataSource,
                                                                     ObjectProvider<ReactiveRedisConnectionFactory> redisConnectionFactory) {
        log.info("[retry] Connections will be established on startup");
        return new ServerConnectionsInitializer(serverConnections, dataSource, redisConnectionFactory);
    }
}
