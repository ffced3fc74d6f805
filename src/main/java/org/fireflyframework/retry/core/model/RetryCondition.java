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
 * Decides whether a failed attempt may be followed by another one.
 *
 * <p>An error is retryable when any configured condition accepts it.
 */
@FunctionalInterface
public interface RetryCondition {

    /**
     * @param error   the failure of the attempt
     * @param attempt zero-based index of the attempt that failed
     */
    boolean test(Throwable error, int attempt);

    default RetryCondition or(RetryCondition other) {
        return (error, attempt) -> test(error, attempt) || other.test(error, attempt);
    }
}
