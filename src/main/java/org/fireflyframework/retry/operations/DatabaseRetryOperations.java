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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Database access bound to one {@link JdbcTemplate}, every call running under the database preset.
 *
 * <p>Blocking JDBC work is shifted onto {@code Schedulers.boundedElastic()} by the
 * {@link ConnectionManager}; a query returning {@code null} completes empty.
 */
public class DatabaseRetryOperations {

    private final JdbcTemplate jdbcTemplate;
    private final ConnectionManager connectionManager;
    private final TransactionTemplate transactionTemplate;

    public DatabaseRetryOperations(JdbcTemplate jdbcTemplate, ConnectionManager connectionManager) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.transactionTemplate = new TransactionTemplate(
                new DataSourceTransactionManager(Objects.requireNonNull(jdbcTemplate.getDataSource(), "dataSource")));
    }

    public JdbcTemplate getJdbcTemplate() {
        return jdbcTemplate;
    }

    public <T> Mono<T> executeQuery(Function<JdbcTemplate, T> query) {
        return executeQuery(query, "Database Query");
    }

    public <T> Mono<T> executeQuery(Function<JdbcTemplate, T> query, String operationName) {
        return connectionManager.executeDbOperation(jdbcTemplate, query, operationName);
    }

    public <T> Mono<T> executeTransaction(TransactionCallback<T> callback) {
        return executeTransaction(callback, "Database Transaction");
    }

    /**
     * Runs {@code callback} in a fresh transaction. A failed attempt rolls back before the
     * next one starts, so the callback is retried as a whole.
     */
    public <T> Mono<T> executeTransaction(TransactionCallback<T> callback, String operationName) {
        return connectionManager.executeDbOperation(jdbcTemplate,
                jdbc -> transactionTemplate.execute(callback), operationName);
    }

    public <T> Mono<List<T>> executeParallelQueries(List<Function<JdbcTemplate, T>> queries) {
        return executeParallelQueries(queries, "Parallel Database Queries");
    }

    /**
     * Starts every query at once, each with its own retry budget and named
     * {@code "<operationName> - Query <n>"}. Results keep the input order; a query that
     * completed empty contributes {@code null}. If any query fails the returned Mono fails
     * once all queries have settled.
     */
    public <T> Mono<List<T>> executeParallelQueries(List<Function<JdbcTemplate, T>> queries, String operationName) {
        if (queries.isEmpty()) {
            return Mono.just(List.of());
        }
        List<Mono<Optional<T>>> executions = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            executions.add(executeQuery(queries.get(i), operationName + " - Query " + (i + 1))
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty()));
        }
        return Mono.zipDelayError(executions, results -> {
            List<T> ordered = new ArrayList<>(results.length);
            for (Object result : results) {
                @SuppressWarnings("unchecked")
                Optional<T> value = (Optional<T>) result;
                ordered.add(value.orElse(null));
            }
            return ordered;
        });
    }

    public Mono<Boolean> isHealthy() {
        return connectionManager.checkDatabaseHealth(jdbcTemplate);
    }
}
