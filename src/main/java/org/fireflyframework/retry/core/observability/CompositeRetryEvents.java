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

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class CompositeRetryEvents implements RetryEvents {
    private final List<RetryEvents> delegates;

    public CompositeRetryEvents(List<RetryEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<RetryEvents> getDelegates() {
        return delegates;
    }

    private void safeForEach(Consumer<RetryEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-retry-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onAttemptFailed(String operationName, int attempt, int maxAttempts, Throwable error, Map<String, Object> context) { safeForEach(d -> d.onAttemptFailed(operationName, attempt, maxAttempts, error, context)); }
    @Override public void onRetry(String operationName, int retryNumber, int maxAttempts, Throwable lastError, Map<String, Object> context) { safeForEach(d -> d.onRetry(operationName, retryNumber, maxAttempts, lastError, context)); }
    @Override public void onSucceeded(String operationName, int attempts, long durationMs, Map<String, Object> context) { safeForEach(d -> d.onSucceeded(operationName, attempts, durationMs, context)); }
    @Override public void onFinalFailure(String operationName, int totalAttempts, Throwable lastError, Map<String, Object> context) { safeForEach(d -> d.onFinalFailure(operationName, totalAttempts, lastError, context)); }
}
