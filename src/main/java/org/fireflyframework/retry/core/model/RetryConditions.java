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

package org.fireflyframework.retry.core.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.fireflyframework.retry.core.model.TransientErrorKind.*;

/**
 * Built-in {@link RetryCondition}s used by the presets.
 */
public final class RetryConditions {

    static final Set<TransientErrorKind> TRANSIENT_KINDS = EnumSet.of(
            CONNECTION_REFUSED, HOST_UNRESOLVED, TIMEOUT, CONNECTION_RESET, BROKEN_PIPE,
            CONNECTION_CLOSED, TEMPORARY_FAILURE, SERVICE_UNAVAILABLE, SERVER_ERROR);

    static final Set<TransientErrorKind> DATABASE_KINDS = EnumSet.of(
            CONNECTION_LOST, CONNECTION_RESET, CONNECTION_REFUSED, POOL_EXHAUSTED,
            CONNECTION_ACQUIRE_TIMEOUT, DATABASE_UNAVAILABLE, LOCK_TIMEOUT, DEADLOCK);

    static final Set<TransientErrorKind> CACHE_KINDS = EnumSet.of(
            CONNECTION_REFUSED, CONNECTION_LOST, CONNECTION_RESET, CACHE_UNAVAILABLE,
            CLUSTER_DOWN, CACHE_LOADING, MASTER_DOWN, REPLICA_NOT_READY);

    static final Set<TransientErrorKind> HTTP_KINDS = EnumSet.of(
            CONNECTION_REFUSED, TIMEOUT, RETRYABLE_HTTP_STATUS);

    static final Set<TransientErrorKind> FILE_SYSTEM_KINDS = EnumSet.of(
            RESOURCE_BUSY, TOO_MANY_OPEN_FILES, FILE_TABLE_FULL, NOT_YET_VISIBLE);

    private static final RetryCondition TRANSIENT = onKinds(TRANSIENT_KINDS);
    private static final RetryCondition DATABASE = onKinds(DATABASE_KINDS);
    private static final RetryCondition CACHE = onKinds(CACHE_KINDS);
    private static final RetryCondition HTTP = onKinds(HTTP_KINDS);
    private static final RetryCondition FILE_SYSTEM = onKinds(FILE_SYSTEM_KINDS);

    private RetryConditions() {}

    /** Network-level transient failures: refused, unresolved, timed out, reset, 5xx text. */
    public static RetryCondition transientErrors() { return TRANSIENT; }

    public static RetryCondition databaseErrors() { return DATABASE; }

    public static RetryCondition cacheErrors() { return CACHE; }

    /** Connection refused, timeouts and HTTP 408, 429, 500, 502, 503 and 504. */
    public static RetryCondition httpErrors() { return HTTP; }

    public static RetryCondition fileSystemErrors() { return FILE_SYSTEM; }

    public static RetryCondition onKinds(TransientErrorKind first, TransientErrorKind... rest) {
        return onKinds(EnumSet.of(first, rest));
    }

    public static RetryCondition onKinds(Set<TransientErrorKind> kinds) {
        Set<TransientErrorKind> copy = kinds.isEmpty() ? Set.of() : EnumSet.copyOf(kinds);
        return (error, attempt) -> ErrorClassifier.hasAnyKind(error, copy);
    }

    @SafeVarargs
    public static RetryCondition onTypes(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> list = List.of(types);
        return (error, attempt) -> list.stream().anyMatch(type -> type.isInstance(error));
    }
}
