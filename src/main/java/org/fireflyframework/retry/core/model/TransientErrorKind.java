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

/**
 * Closed set of failure kinds the retry engine treats as potentially transient.
 *
 * <p>Kinds are assigned by {@link ErrorClassifier}, from typed signals where the I/O layer
 * provides one and from message patterns otherwise.
 */
public enum TransientErrorKind {

    // Network
    CONNECTION_REFUSED,
    HOST_UNRESOLVED,
    TIMEOUT,
    CONNECTION_RESET,
    BROKEN_PIPE,
    CONNECTION_CLOSED,
    CONNECTION_LOST,
    TEMPORARY_FAILURE,
    SERVICE_UNAVAILABLE,
    SERVER_ERROR,

    // Relational store
    POOL_EXHAUSTED,
    CONNECTION_ACQUIRE_TIMEOUT,
    DATABASE_UNAVAILABLE,
    LOCK_TIMEOUT,
    DEADLOCK,

    // Cache store
    CACHE_UNAVAILABLE,
    CLUSTER_DOWN,
    CACHE_LOADING,
    MASTER_DOWN,
    REPLICA_NOT_READY,

    // File system
    RESOURCE_BUSY,
    TOO_MANY_OPEN_FILES,
    FILE_TABLE_FULL,
    NOT_YET_VISIBLE,

    // HTTP
    RETRYABLE_HTTP_STATUS
}
