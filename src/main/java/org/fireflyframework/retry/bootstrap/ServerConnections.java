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

package org.fireflyframework.retry.bootstrap;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.retry.connection.ConnectionManager;
import org.fireflyframework.retry.connection.ConnectionOptions;
import org.fireflyframework.retry.operations.DatabaseRetryOperations;
import org.fireflyframework.retry.operations.RedisRetryOperations;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.core.publisher.Mono;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.Objects;

/**
 * Owns the application's primary database and Redis handles once they have been established
 * through the {@link ConnectionManager}, and exposes the matching operations facades.
 *
 * <p>One instance per application, registered as a bean and injected where needed.
 */
@Slf4j
public class ServerConnections {

    private final ConnectionManager connectionManager;

    private volatile DatabaseRetryOperations databaseOperations;
    private volatile RedisRetryOperations redisOperations;

    public ServerConnections(ConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public Mono<JdbcTemplate> initializeDatabase(DataSource dataSource) {
        return connectionManager.connectToDatabase(connectionManager.createJdbcConnectionFactory(dataSource),
                        ConnectionOptions.named("Primary Database Connection"))
                .doOnNext(jdbcTemplate -> {
                    databaseOperations = new DatabaseRetryOperations(jdbcTemplate, connectionManager);
                    log.info("[retry] Database initialized successfully with retry capabilities");
                })
                .doOnError(e -> log.error("[retry] Failed to initialize database after all retries: {}",
                        e.getMessage()));
    }

    public Mono<ReactiveRedisTemplate<String, String>> initializeRedis(ReactiveRedisConnectionFactory connectionFactory) {
        return connectionManager.connectToRedis(connectionManager.createRedisConnectionFactory(connectionFactory),
                        ConnectionOptions.named("Primary Redis Connection"))
                .doOnNext(template -> {
                    redisOperations = new RedisRetryOperations(template, connectionManager);
                    log.info("[retry] Redis initialized successfully with retry capabilities");
                })
                .doOnError(e -> log.error("[retry] Failed to initialize Redis after all retries: {}",
                        e.getMessage()));
    }

    public boolean isDatabaseInitialized() {
        return databaseOperations != null;
    }

    public boolean isRedisInitialized() {
        return redisOperations != null;
    }

    /**
     * @throws IllegalStateException if {@link #initializeDatabase(DataSource)} has not completed
     */
    public DatabaseRetryOperations getDatabaseOperations() {
        DatabaseRetryOperations ops = databaseOperations;
        if (ops == null) {
            throw new IllegalStateException("Database not initialized. Call initializeDatabase() first.");
        }
        return ops;
    }

    /**
     * @throws IllegalStateException if {@link #initializeRedis(ReactiveRedisConnectionFactory)} has not completed
     */
    public RedisRetryOperations getRedisOperations() {
        RedisRetryOperations ops = redisOperations;
        if (ops == null) {
            throw new IllegalStateException("Redis not initialized. Call initializeRedis() first.");
        }
        return ops;
    }

    /** Probes both resources; never fails. */
    public Mono<HealthSnapshot> performHealthChecks() {
        DatabaseRetryOperations db = databaseOperations;
        RedisRetryOperations redis = redisOperations;
        Mono<Boolean> databaseHealth = db != null ? db.isHealthy() : Mono.just(false);
        Mono<Boolean> redisHealth = redis != null ? redis.isHealthy() : Mono.just(false);
        return Mono.zip(databaseHealth.onErrorReturn(false), redisHealth.onErrorReturn(false))
                .map(t -> new HealthSnapshot(t.getT1(), t.getT2(), Instant.now()));
    }
}
