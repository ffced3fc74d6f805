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

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class RetryLoggerEvents implements RetryEvents {
    @Override
    public void onAttemptFailed(String operationName, int attempt, int maxAttempts, Throwable error, Map<String, Object> context) {
        log.warn("[retry] attempt.failed operation={} attempt={}/{} error={}", operationName, attempt, maxAttempts, message(error));
    }
    @Override
    public void onRetry(String operationName, int retryNumber, int maxAttempts, Throwable lastError, Map<String, Object> context) {
        log.info("[retry] retrying operation={} attempt={}/{} error={} context={}", operationName, retryNumber + 1, maxAttempts, message(lastError), context);
    }
    @Override
    public void onSucceeded(String operationName, int attempts, long durationMs, Map<String, Object> context) {
        if (attempts > 1) {
            log.info("[retry] succeeded.on.retry operation={} attempt={} durationMs={}", operationName, attempts, durationMs);
        }
    }
    @Override
    public void onFinalFailure(String operationName, int totalAttempts, Throwable lastError, Map<String, Object> context) {
        log.error("[retry] exhausted operation={} totalAttempts={} error={} context={}", operationName, totalAttempts, message(lastError), context);
    }

    private static String message(Throwable error) {
        return error == null ? null : error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
