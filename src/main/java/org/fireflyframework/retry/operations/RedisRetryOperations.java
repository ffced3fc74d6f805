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

package org.fireflyframework.retry.operations;

import org.fireflyframework.retry.connection.ConnectionManager;
import org.reactivestreams.Publisher;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Redis commands bound to one {@link ReactiveRedisTemplate}, every call running under the cache preset.
 */
public class RedisRetryOperations {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ConnectionManager connectionManager;

    public RedisRetryOperations(ReactiveRedisTemplate<String, String> redisTemplate,
                                ConnectionManager connectionManager) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    }

    public ReactiveRedisTemplate<String, String> getRedisTemplate() {
        return redisTemplate;
    }

    public <T> Mono<T> executeCommand(Function<ReactiveRedisTemplate<String, String>, Mono<T>> command) {
        return executeCommand(command, "Redis Command");
    }

    public <T> Mono<T> executeCommand(Function<ReactiveRedisTemplate<String, String>, Mono<T>> command,
                                      String operationName) {
        return connectionManager.executeRedisOperation(redisTemplate, command, operationName);
    }

    public Mono<Boolean> set(String key, String value) {
        return executeCommand(t -> t.opsForValue().set(key, value), "Redis SET " + key);
    }

    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return executeCommand(t -> t.opsForValue().set(key, value, ttl), "Redis SET " + key);
    }

    public Mono<String> get(String key) {
        return executeCommand(t -> t.opsForValue().get(key), "Redis GET " + key);
    }

    public Mono<Long> del(String key) {
        return del(List.of(key));
    }

    public Mono<Long> del(List<String> keys) {
        String[] keyArray = keys.toArray(new String[0]);
        return executeCommand(t -> t.delete(keyArray), "Redis DEL " + String.join(", ", keys));
    }

    public Mono<List<Object>> executePipeline(List<Function<ReactiveRedisConnection, Publisher<?>>> commands) {
        return executePipeline(commands, "Redis Pipeline");
    }

    /**
     * Sends {@code commands} as one batch over a single connection and collects one result per
     * emitted value, in command order. All commands are subscribed up front so the driver can
     * pipeline them.
     *
     * <p>The batch is retried as a whole only while none of its commands has completed. Once a
     * command has been applied, a later failure surfaces as a {@link RedisPipelineException}
     * without a retry. The batch is not atomic: a command whose reply was lost may still have
     * been applied before a retry.
     */
    public Mono<List<Object>> executePipeline(List<Function<ReactiveRedisConnection, Publisher<?>>> commands,
                                              String operationName) {
        List<Function<ReactiveRedisConnection, Publisher<?>>> batch = List.copyOf(commands);
        String name = operationName != null ? operationName : "Redis Pipeline";
        return executeCommand(t -> Mono.defer(() -> {
            AtomicInteger applied = new AtomicInteger();
            return t.execute(connection -> Flux.fromIterable(batch)
                            .flatMapSequential(command -> Flux.<Object>from(command.apply(connection))
                                    .doOnComplete(applied::incrementAndGet)))
                    .collectList()
                    .onErrorMap(error -> applied.get() > 0,
                            error -> new RedisPipelineException(name, applied.get(), batch.size(), error));
        }), name);
    }

    public Mono<Boolean> isHealthy() {
        return connectionManager.checkRedisHealth(redisTemplate);
    }
}
