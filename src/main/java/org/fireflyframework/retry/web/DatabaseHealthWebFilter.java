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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.fireflyframework.retry.operations.DatabaseRetryOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Rejects requests under the configured path prefixes while the database is unusable.
 *
 * <ul>
 *   <li>database never initialized: {@code 500 {"error":"Database not available"}}</li>
 *   <li>health probe false: {@code 503 {"error":"Database temporarily unavailable"}} with {@code Retry-After}</li>
 *   <li>otherwise the {@link DatabaseRetryOperations} is stored under {@link #DATABASE_OPERATIONS_ATTRIBUTE}
 *       and the chain continues</li>
 * </ul>
 *
 * <p>The probe runs for every gated request under the health-check budget
 * ({@code firefly.retry.health.max-retries}); while the database is down a rejected request waits
 * for those backoff delays before receiving its 503.
 */
@Slf4j
public class DatabaseHealthWebFilter implements WebFilter {

    public static final String DATABASE_OPERATIONS_ATTRIBUTE = DatabaseRetryOperations.class.getName();

    private final ServerConnections serverConnections;
    private final ObjectMapper objectMapper;
    private final List<String> pathPrefixes;
    private final Duration retryAfter;

    public DatabaseHealthWebFilter(ServerConnections serverConnections, ObjectMapper objectMapper,
                                   List<String> pathPrefixes, Duration retryAfter) {
        this.serverConnections = serverConnections;
        this.objectMapper = objectMapper;
        this.pathPrefixes = List.copyOf(pathPrefixes);
        this.retryAfter = retryAfter;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!WebFilterSupport.matches(exchange, pathPrefixes)) {
            return chain.filter(exchange);
        }
        if (!serverConnections.isDatabaseInitialized()) {
            return WebFilterSupport.writeError(exchange, objectMapper,
                    HttpStatus.INTERNAL_SERVER_ERROR, "Database not available");
        }
        DatabaseRetryOperations operations = serverConnections.getDatabaseOperations();
        exchange.getAttributes().put(DATABASE_OPERATIONS_ATTRIBUTE, operations);
        return operations.isHealthy().flatMap(healthy -> {
            if (healthy) {
                return chain.filter(exchange);
            }
            log.warn("[retry] Database health check failed, rejecting {}", exchange.getRequest().getPath());
            exchange.getResponse().getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter.toSeconds()));
            return WebFilterSupport.writeError(exchange, objectMapper,
                    HttpStatus.SERVICE_UNAVAILABLE, "Database temporarily unavailable");
        });
    }
}
