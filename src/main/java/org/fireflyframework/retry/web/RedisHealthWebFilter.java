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

package org.fireflyframework.retry.web;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.fireflyframework.retry.operations.RedisRetryOperations;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Checks Redis before requests under the configured path prefixes but never rejects them:
 * an unhealthy or missing cache is logged and the chain continues.
 */
@Slf4j
public class RedisHealthWebFilter implements WebFilter {

    public static final String REDIS_OPERATIONS_ATTRIBUTE = RedisRetryOperations.class.getName();

    private final ServerConnections serverConnections;
    private final List<String> pathPrefixes;

    public RedisHealthWebFilter(ServerConnections serverConnections, List<String> pathPrefixes) {
        this.serverConnections = serverConnections;
        this.pathPrefixes = List.copyOf(pathPrefixes);
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!WebFilterSupport.matches(exchange, pathPrefixes)) {
            return chain.filter(exchange);
        }
        if (!serverConnections.isRedisInitialized()) {
            log.warn("[retry] Redis not initialized, continuing without cache");
            return chain.filter(exchange);
        }
        RedisRetryOperations operations = serverConnections.getRedisOperations();
        exchange.getAttributes().put(REDIS_OPERATIONS_ATTRIBUTE, operations);
        return operations.isHealthy()
                .doOnNext(healthy -> {
                    if (!healthy) {
                        log.warn("[retry] Redis health check failed, continuing with {}", exchange.getRequest().getPath());
                    }
                })
                .then(chain.filter(exchange));
    }
}
