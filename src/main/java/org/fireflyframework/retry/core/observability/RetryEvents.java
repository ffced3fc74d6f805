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

package org.fireflyframework.retry.core.observability;

import java.util.Map;

/**
 * Listener for retry lifecycle events. All methods default to no-ops; listeners are
 * observers only and cannot influence whether an attempt is retried.
 *
 * <p>Attempt numbers are one-based. {@code context} is the caller-supplied bag passed to
 * {@code executeWithRetry}, typically carrying a {@code type} entry naming the resource.
 */
public interface RetryEvents {

    String CONTEXT_TYPE = "type";

    default void onAttemptFailed(String operationName, int attempt, int maxAttempts, Throwable error,
                                 Map<String, Object> context) {}

    /** Fired after the backoff delay elapsed and right before the retry is started. */
    default void onRetry(String operationName, int retryNumber, int maxAttempts, Throwable lastError,
                         Map<String, Object> context) {}

    default void onSucceeded(String operationName, int attempts, long durationMs, Map<String, Object> context) {}

    default void onFinalFailure(String operationName, int totalAttempts, Throwable lastError,
                                Map<String, Object> context) {}
}
