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

package org.fireflyframework.retry.unit.web;

import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.fireflyframework.retry.operations.RedisRetryOperations;
import org.fireflyframework.retry.web.RedisHealthWebFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class RedisHealthWebFilterTest {

    private ServerConnections serverConnections;
    private RedisHealthWebFilter filter;
    private final AtomicBoolean chained = new AtomicBoolean();
    private final WebFilterChain chain = exchange -> {
        chained.set(true);
        return Mono.empty();
    };

    @BeforeEach
    void setUp() {
        serverConnections = mock(ServerConnections.class);
        filter = new RedisHealthWebFilter(serverConnections, List.of("/api/"));
    }

    private static MockServerWebExchange exchange() {
        return exchange("/api/search");
    }

    private static MockServerWebExchange exchange(String path) {
        return MockServerWebExchange.from(MockServerHttpRequest.get(path).build());
    }

    @Test
    void notInitialized_continues() {
        when(serverConnections.isRedisInitialized()).thenReturn(false);

        StepVerifier.create(filter.filter(exchange(), chain)).verifyComplete();

        assertThat(chained).isTrue();
    }

    @Test
    void unhealthy_stillContinues() {
        RedisRetryOperations operations = mock(RedisRetryOperations.class);
        when(operations.isHealthy()).thenReturn(Mono.just(false));
        when(serverConnections.isRedisInitialized()).thenReturn(true);
        when(serverConnections.getRedisOperations()).thenReturn(operations);
        var exchange = exchange();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chained).isTrue();
        assertThat(exchange.getResponse().getStatusCode()).isNull();
        assertThat((Object) exchange.getAttribute(RedisHealthWebFilter.REDIS_OPERATIONS_ATTRIBUTE)).isSameAs(operations);
    }

    @Test
    void healthy_continuesWithOperationsAttribute() {
        RedisRetryOperations operations = mock(RedisRetryOperations.class);
        when(operations.isHealthy()).thenReturn(Mono.just(true));
        when(serverConnections.isRedisInitialized()).thenReturn(true);
        when(serverConnections.getRedisOperations()).thenReturn(operations);
        var exchange = exchange();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chained).isTrue();
        assertThat(exchange.getResponse().getStatusCode()).isNull();
        assertThat((Object) exchange.getAttribute(RedisHealthWebFilter.REDIS_OPERATIONS_ATTRIBUTE)).isSameAs(operations);
        verify(operations).isHealthy();
    }

    @Test
    void unmatchedPath_passesThroughWithoutChecks() {
        var exchange = exchange("/static/app.js");

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chained).isTrue();
        assertThat((Object) exchange.getAttribute(RedisHealthWebFilter.REDIS_OPERATIONS_ATTRIBUTE)).isNull();
        verifyNoInteractions(serverConnections);
    }
}
