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

import org.fireflyframework.retry.core.exception.RetryException;

import java.util.Map;

/**
 * A Redis pipeline failed after at least one of its commands had already been applied.
 * Replaying the batch would apply those commands twice, so it is never retried.
 */
public final class RedisPipelineException extends RetryException {

    private final int appliedCommands;
    private final int totalCommands;

    public RedisPipelineException(String operationName, int appliedCommands, int totalCommands, Throwable cause) {
        super(operationName + " failed after " + appliedCommands + " of " + totalCommands
                        + " commands were applied: " + cause.getMessage(),
                "PIPELINE_PARTIALLY_APPLIED",
                Map.of("appliedCommands", appliedCommands, "totalCommands", totalCommands),
                cause);
        this.appliedCommands = appliedCommands;
        this.totalCommands = totalCommands;
    }

    public int getAppliedCommands() {
        return appliedCommands;
    }

    public int getTotalCommands() {
        return totalCommands;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
