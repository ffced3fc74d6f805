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

package org.fireflyframework.retry.connection;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.core.engine.RetryManager;
import org.fireflyframework.retry.core.model.ErrorClassifier;
import org.fireflyframework.retry.core.model.RetryOptions;
import org.fireflyframework.retry.core.model.RetryPolicy;
import org.fireflyframework.retry.core.model.TransientErrorKind;
import org.fireflyframework.retry.core.observability.RetryEvents;
import org.fireflyframework.retry.core.observability.RetryLoggerEvents;
import org.fireflyframework.retry.core.observability.RetryTracer;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.sql.DataSource;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Establishes and uses database and Redis handles under their resource presets.
 *
 * <p>Holds three {@link RetryManager}s: the database preset, the cache preset and a plain
 * one built from the default options. Operations that fail with a connection-shaped error
 * probe the same handle ({@code SELECT 1} / {@code PING}) before the failure reaches the
 * retry loop; a failed probe is attached to the original error as a suppressed exception.
 *
 * <p>Health checks run the same presets with their own retry budget
 * ({@link #DEFAULT_HEALTH_CHECK_RETRIES} unless configured), so a probe against an unreachable
 * resource answers within a couple of backoff delays instead of the full preset budget.
 */
@Slf4j
public class ConnectionManager {

    static final String VALIDATION_QUERY = "SELECT 1";

    public static final int DEFAULT_HEALTH_CHECK_RETRIES = 1;

    private static final Set<TransientErrorKind> DATABASE_CONNECTION_KINDS = EnumSet.of(
            TransientErrorKind.CONNECTION_LOST, TransientErrorKind.CONNECTION_RESET,
            TransientErrorKind.CONNECTION_REFUSED);

    private static final Set<TransientErrorKind> REDIS_CONNECTION_KINDS = EnumSet.of(
            TransientErrorKind.CONNECTION_REFUSED, TransientErrorKind.CONNECTION_LOST,
            TransientErrorKind.CONNECTION_RESET, TransientErrorKind.CONNECTION_CLOSED);

    private final RetryOptions defaultOptions;
    private final RetryManager databaseRetry;
    private final RetryManager redisRetry;
    private final RetryManager defaultRetry;
    private final RetryManager databaseHealthRetry;
    private final RetryManager redisHealthRetry;
    private final RetryEvents events;
    private final RetryTracer tracer;

    public ConnectionManager() {
        this(new RetryOptions(), new RetryOptions(), new RetryOptions(), new RetryLoggerEvents(), null);
    }

    public ConnectionManager(RetryOptions defaultOptions, RetryOptions databaseOptions, RetryOptions redisOptions,
                             RetryEvents events, RetryTracer tracer) {
        this(defaultOptions, databaseOptions, redisOptions, DEFAULT_HEALTH_CHECK_RETRIES, events, tracer);
    }

    /**
     * @param healthCheckRetries retries allowed to {@code checkDatabaseHealth} / {@code checkRedisHealth};
     *                           the remaining preset values still apply
     */
    public ConnectionManager(RetryOptions defaultOptions, RetryOptions databaseOptions, RetryOptions redisOptions,
                             int healthCheckRetries, RetryEvents events, RetryTracer tracer) {
        this.defaultOptions = defaultOptions != null ? defaultOptions : new RetryOptions();
        this.events = events;
        this.tracer = tracer;
        RetryOptions database = databaseOptions != null ? databaseOptions : new RetryOptions();
        RetryOptions redis = redisOptions != null ? redisOptions : new RetryOptions();
        RetryOptions healthBudget = new RetryOptions().withMaxRetries(healthCheckRetries);
        this.databaseRetry = new RetryManager(RetryPolicy.forDatabase(database), events, tracer);
        this.redisRetry = new RetryManager(RetryPolicy.forCache(redis), events, tracer);
        this.defaultRetry = new RetryManager(RetryPolicy.from(this.defaultOptions), events, tracer);
        this.databaseHealthRetry = new RetryManager(
                RetryPolicy.forDatabase(database.mergedWith(healthBudget)), events, tracer);
        this.redisHealthRetry = new RetryManager(
                RetryPolicy.forCache(redis.mergedWith(healthBudget)), events, tracer);
    }

    public RetryManager getDatabaseRetry() { return databaseRetry; }

    public RetryManager getRedisRetry() { return redisRetry; }

    public RetryManager getDefaultRetry() { return defaultRetry; }

    public RetryManager getDatabaseHealthRetry() { return databaseHealthRetry; }

    public RetryManager getRedisHealthRetry() { return redisHealthRetry; }

    // --- Connecting ---

    public <C> Mono<C> connectToDatabase(Supplier<? extends Mono<C>> connectionFactory, ConnectionOptions options) {
        return connect(databaseRetry, connectionFactory, options, "Database Connection", "database");
    }

    public <C> Mono<C> connectToRedis(Supplier<? extends Mono<C>> connectionFactory, ConnectionOptions options) {
        return connect(redisRetry, connectionFactory, options, "Redis Connection", "redis");
    }

    private <C> Mono<C> connect(RetryManager retry, Supplier<? extends Mono<C>> connectionFactory,
                                ConnectionOptions options, String defaultName, String type) {
        ConnectionOptions opts = options != null ? options : ConnectionOptions.defaults();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(RetryEvents.CONTEXT_TYPE, type);
        context.putAll(opts.getContext());
        String name = opts.getName() != null ? opts.getName() : defaultName;
        return retry.executeWithRetry(connectionFactory, name, context);
    }

    /** Builds a {@link JdbcTemplate} and validates it with {@code SELECT 1}. */
    public Supplier<Mono<JdbcTemplate>> createJdbcConnectionFactory(DataSource dataSource) {
        return () -> Mono.fromCallable(() -> {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            jdbcTemplate.queryForObject(VALIDATION_QUERY, Integer.class);
            log.info("[retry] Database connection established: {}", dataSource.getClass().getSimpleName());
            return jdbcTemplate;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /** Builds a string template over the factory and validates it with {@code PING}. */
    public Supplier<Mono<ReactiveRedisTemplate<String, String>>> createRedisConnectionFactory(
            ReactiveRedisConnectionFactory connectionFactory) {
        return () -> Mono.defer(() -> {
            ReactiveRedisTemplate<String, String> template = new ReactiveStringRedisTemplate(connectionFactory);
            return ping(template)
                    .doOnSuccess(pong -> log.info("[retry] Redis connection established: {}",
                            connectionFactory.getClass().getSimpleName()))
                    .thenReturn(template);
        });
    }

    // --- Operations ---

    public <T> Mono<T> executeDbOperation(JdbcTemplate jdbcTemplate, Function<JdbcTemplate, T> operation,
                                          String operationName) {
        return runDbOperation(databaseRetry, jdbcTemplate, operation,
                operationName != null ? operationName : "Database Operation");
    }

    public <T> Mono<T> executeRedisOperation(ReactiveRedisTemplate<String, String> template,
                                             Function<ReactiveRedisTemplate<String, String>, Mono<T>> operation,
                                             String operationName) {
        return runRedisOperation(redisRetry, template, operation,
                operationName != null ? operationName : "Redis Operation");
    }

    /**
     * Runs {@code operation} under a one-off policy: plain defaults merged with {@code options}.
     */
    public <T> Mono<T> executeWithCustomRetry(Supplier<? extends Mono<T>> operation, RetryOptions options,
                                              String operationName) {
        RetryPolicy policy = RetryPolicy.from(defaultOptions.mergedWith(options));
        RetryManager custom = new RetryManager(policy, events, tracer);
        return custom.executeWithRetry(operation, operationName != null ? operationName : "Custom Operation",
                Map.of(RetryEvents.CONTEXT_TYPE, "custom"));
    }

    // --- Health ---

    public Mono<Boolean> checkDatabaseHealth(JdbcTemplate jdbcTemplate) {
        return runDbOperation(databaseHealthRetry, jdbcTemplate,
                jdbc -> jdbc.queryForObject(VALIDATION_QUERY, Integer.class), "Database Health Check")
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.error("[retry] Database health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    public Mono<Boolean> checkRedisHealth(ReactiveRedisTemplate<String, String> template) {
        return runRedisOperation(redisHealthRetry, template, ConnectionManager::ping, "Redis Health Check")
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.error("[retry] Redis health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private static <T> Mono<T> runDbOperation(RetryManager retry, JdbcTemplate jdbcTemplate,
                                              Function<JdbcTemplate, T> operation, String name) {
        return retry.executeWithRetry(
                () -> Mono.fromCallable(() -> applyWithProbe(jdbcTemplate, operation))
                        .subscribeOn(Schedulers.boundedElastic()),
                name, Map.of(RetryEvents.CONTEXT_TYPE, "database_operation"));
    }

    private static <T> Mono<T> runRedisOperation(RetryManager retry, ReactiveRedisTemplate<String, String> template,
                                                 Function<ReactiveRedisTemplate<String, String>, Mono<T>> operation,
                                                 String name) {
        return retry.executeWithRetry(
                () -> Mono.defer(() -> operation.apply(template))
                        .onErrorResume(error -> probeRedis(template, error)),
                name, Map.of(RetryEvents.CONTEXT_TYPE, "redis_operation"));
    }

    private static <T> T applyWithProbe(JdbcTemplate jdbcTemplate, Function<JdbcTemplate, T> operation) {
        try {
            return operation.apply(jdbcTemplate);
        } catch (RuntimeException error) {
            if (ErrorClassifier.hasAnyKind(error, DATABASE_CONNECTION_KINDS)) {
                log.debug("[retry] Connection error on database operation, validating connection");
                try {
                    jdbcTemplate.queryForObject(VALIDATION_QUERY, Integer.class);
                } catch (RuntimeException probeFailure) {
                    error.addSuppressed(probeFailure);
                }
            }
            throw error;
        }
    }

    private static <T> Mono<T> probeRedis(ReactiveRedisTemplate<String, String> template, Throwable error) {
        if (!ErrorClassifier.hasAnyKind(error, REDIS_CONNECTION_KINDS)) {
            return Mono.error(error);
        }
        log.debug("[retry] Connection error on Redis operation, validating connection");
        return ping(template)
                .onErrorResume(probeFailure -> {
                    error.addSuppressed(probeFailure);
                    return Mono.empty();
                })
                .then(Mono.error(error));
    }

    static Mono<String> ping(ReactiveRedisTemplate<String, String> template) {
        return template.execute(connection -> connection.ping()).next();
    }
}
