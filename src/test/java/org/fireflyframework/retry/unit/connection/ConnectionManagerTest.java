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

package org.fireflyframework.retry.unit.connection;

import org.fireflyframework.retry.connection.ConnectionManager;
import org.fireflyframework.retry.connection.ConnectionOptions;
import org.fireflyframework.retry.core.exception.RetryExhaustedException;
import org.fireflyframework.retry.core.model.RetryOptions;
import org.fireflyframework.retry.core.observability.RetryEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisCallback;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConnectionManagerTest {

    private EmbeddedDatabase database;
    private final List<String> events = new CopyOnWriteArrayList<>();
    private ConnectionManager connectionManager;

    static RetryOptions fast(int maxRetries) {
        return new RetryOptions()
                .withMaxRetries(maxRetries)
                .withBaseDelay(Duration.ofMillis(1))
                .withMaxDelay(Duration.ofMillis(5))
                .withJitter(false);
    }

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        RetryEvents recording = new RetryEvents() {
            @Override
            public void onSucceeded(String operationName, int attempts, long durationMs, Map<String, Object> context) {
                events.add(operationName + ":" + context.get(CONTEXT_TYPE) + ":" + attempts);
            }
        };
        connectionManager = new ConnectionManager(fast(2), fast(2), fast(2), recording, null);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void connectToDatabase_jdbcFactory_returnsValidatedTemplate() {
        StepVerifier.create(connectionManager.connectToDatabase(
                        connectionManager.createJdbcConnectionFactory(database), ConnectionOptions.defaults()))
                .assertNext(jdbc -> assertThat(jdbc.queryForObject("SELECT 41 + 1", Integer.class)).isEqualTo(42))
                .verifyComplete();

        assertThat(events).containsExactly("Database Connection:database:1");
    }

    @Test
    void connectToDatabase_transientFailures_retriedWithGivenName() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(connectionManager.connectToDatabase(() -> Mono.defer(() -> calls.incrementAndGet() < 3
                                ? Mono.<String>error(new DataAccessResourceFailureException("Connection terminated unexpectedly"))
                                : Mono.just("connected")),
                        ConnectionOptions.named("Reporting Database").with("host", "db-2")))
                .expectNext("connected")
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(events).containsExactly("Reporting Database:database:3");
    }

    @Test
    void connectToRedis_exhausted_namesOperation() {
        StepVerifier.create(connectionManager.connectToRedis(
                        () -> Mono.error(new RedisConnectionFailureException("Connection refused")), null))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(RetryExhaustedException.class)
                        .hasMessage("Redis Connection failed after 3 attempts. Last error: Connection refused"))
                .verify();
    }

    @Test
    void executeDbOperation_connectionError_probesAndAttachesProbeFailure() {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);
        when(jdbc.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("validation: connection refused"));
        var manager = new ConnectionManager(fast(0), fast(0), fast(0), null, null);

        StepVerifier.create(manager.executeDbOperation(jdbc, j -> {
                    throw new DataAccessResourceFailureException("Connection reset by peer");
                }, "Load listings"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RetryExhaustedException.class);
                    Throwable original = error.getCause();
                    assertThat(original).hasMessage("Connection reset by peer");
                    assertThat(original.getSuppressed()).hasSize(1);
                    assertThat(original.getSuppressed()[0]).hasMessage("validation: connection refused");
                })
                .verify();

        verify(jdbc).queryForObject("SELECT 1", Integer.class);
    }

    @Test
    void executeDbOperation_nonConnectionError_skipsProbe() {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);

        StepVerifier.create(connectionManager.executeDbOperation(jdbc, j -> {
                    throw new BadSqlGrammarException("select", "SELEC 1", new SQLException("syntax error", "42601"));
                }, null))
                .expectErrorSatisfies(error -> assertThat(error)
                        .hasMessageStartingWith("Database Operation failed after 1 attempts"))
                .verify();

        verifyNoInteractions(jdbc);
    }

    @Test
    void executeDbOperation_nullResult_completesEmpty() {
        StepVerifier.create(connectionManager.executeDbOperation(new JdbcTemplate(database), j -> null, "Nothing"))
                .verifyComplete();
    }

    @Test
    void checkDatabaseHealth_reportsBooleanWithoutError() {
        StepVerifier.create(connectionManager.checkDatabaseHealth(new JdbcTemplate(database)))
                .expectNext(true)
                .verifyComplete();

        JdbcTemplate broken = mock(JdbcTemplate.class);
        when(broken.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new BadSqlGrammarException("health", "SELECT 1", new SQLException("no")));
        StepVerifier.create(connectionManager.checkDatabaseHealth(broken))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void checkDatabaseHealth_usesHealthCheckBudgetInsteadOfPreset() {
        JdbcTemplate locked = mock(JdbcTemplate.class);
        AtomicInteger calls = new AtomicInteger();
        when(locked.queryForObject("SELECT 1", Integer.class)).thenAnswer(inv -> {
            calls.incrementAndGet();
            throw new CannotAcquireLockException("deadlock detected");
        });
        ConnectionManager noHealthRetries = new ConnectionManager(fast(5), fast(5), fast(5), 0, null, null);

        StepVerifier.create(noHealthRetries.checkDatabaseHealth(locked))
                .expectNext(false)
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(noHealthRetries.getDatabaseRetry().getPolicy().maxRetries()).isEqualTo(5);
        assertThat(noHealthRetries.getDatabaseHealthRetry().getPolicy().baseDelay()).isEqualTo(Duration.ofMillis(1));

        calls.set(0);
        StepVerifier.create(connectionManager.checkDatabaseHealth(locked))
                .expectNext(false)
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(ConnectionManager.DEFAULT_HEALTH_CHECK_RETRIES + 1);
    }

    @Test
    void healthCheckBudget_appliesToRedisPresetToo() {
        ConnectionManager manager = new ConnectionManager(null, null, null, 0, null, null);

        assertThat(manager.getRedisHealthRetry().getPolicy().maxRetries()).isZero();
        assertThat(manager.getRedisHealthRetry().getPolicy().baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(manager.getRedisRetry().getPolicy().maxRetries()).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void executeRedisOperation_connectionError_probesWithPing() {
        ReactiveRedisTemplate<String, String> template = mock(ReactiveRedisTemplate.class);
        when(template.execute(any(ReactiveRedisCallback.class))).thenReturn(Flux.just("PONG"));
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(connectionManager.executeRedisOperation(template, t -> Mono.defer(() ->
                        calls.incrementAndGet() == 1
                                ? Mono.<String>error(new RedisConnectionFailureException("Connection lost to redis:6379"))
                                : Mono.just("value")), "Redis GET k"))
                .expectNext("value")
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(2);
        verify(template, times(1)).execute(any(ReactiveRedisCallback.class));
        assertThat(events).containsExactly("Redis GET k:redis_operation:2");
    }

    @Test
    @SuppressWarnings("unchecked")
    void checkRedisHealth_pingFails_returnsFalse() {
        ReactiveRedisTemplate<String, String> template = mock(ReactiveRedisTemplate.class);
        when(template.execute(any(ReactiveRedisCallback.class)))
                .thenReturn(Flux.error(new IllegalStateException("NOAUTH Authentication required")));

        StepVerifier.create(connectionManager.checkRedisHealth(template))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void createRedisConnectionFactory_pingsThroughNewTemplate() {
        ReactiveRedisConnectionFactory factory = mock(ReactiveRedisConnectionFactory.class);
        ReactiveRedisConnection connection = mock(ReactiveRedisConnection.class);
        when(factory.getReactiveConnection()).thenReturn(connection);
        when(connection.ping()).thenReturn(Mono.just("PONG"));
        when(connection.closeLater()).thenReturn(Mono.empty());

        StepVerifier.create(connectionManager.createRedisConnectionFactory(factory).get())
                .assertNext(template -> assertThat(template.getConnectionFactory()).isSameAs(factory))
                .verifyComplete();

        verify(connection).ping();
    }

    @Test
    void executeWithCustomRetry_usesGivenOptions() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(connectionManager.executeWithCustomRetry(() -> {
                    calls.incrementAndGet();
                    return Mono.error(new IllegalStateException("always"));
                }, fast(1).withRetryCondition((error, attempt) -> true), null))
                .expectErrorMessage("Custom Operation failed after 2 attempts. Last error: always")
                .verify();

        assertThat(calls.get()).isEqualTo(2);
    }
}
