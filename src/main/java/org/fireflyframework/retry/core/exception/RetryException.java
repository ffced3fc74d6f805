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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for failures raised by the retry engine itself.
 */
public class RetryException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> context;

    public RetryException(String message, String errorCode) {
        this(message, errorCode, Map.of(), null);
    }

    public RetryException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, Map.of(), cause);
    }

    public RetryException(String message, String errorCode, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Whether a {@code RetryManager} may attempt the failed operation again. When {@code false}
     * the retry conditions are not consulted, even if the cause chain looks transient.
     */
    public boolean isRetryable() {
        return true;
    }
}
