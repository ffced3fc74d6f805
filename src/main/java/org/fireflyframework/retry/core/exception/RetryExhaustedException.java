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

package org.fireflyframework.retry.core.exception;

import java.util.Map;

/**
 * Raised once an operation's attempt budget is spent or a non-retryable failure occurred.
 * The last underlying failure is available as {@link #getCause()}.
 */
public final class RetryExhaustedException extends RetryException {

    private final String operationName;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, Throwable lastError) {
        this(operationName, attempts, lastError, Map.of());
    }

    public RetryExhaustedException(String operationName, int attempts, Throwable lastError,
                                   Map<String, Object> context) {
        super(operationName + " failed after " + attempts + " attempts. Last error: " + describe(lastError),
                "RETRY_EXHAUSTED", context, lastError);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
