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

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import reactor.core.publisher.Mono;

public class RetryTracer {
    private final ObservationRegistry observationRegistry;

    public RetryTracer(ObservationRegistry observationRegistry) {
        this.observationRegistry = observationRegistry;
    }

    public <T> Mono<T> traceExecution(String operationName, String type, Mono<T> mono) {
        return Mono.defer(() -> {
            Observation observation = Observation.createNotStarted("retry.execution", observationRegistry)
                    .lowCardinalityKeyValue("retry.type", type)
                    .highCardinalityKeyValue("retry.operation", operationName);
            return mono.doOnSubscribe(s -> observation.start())
                       .doOnError(observation::error)
                       .doFinally(signal -> observation.stop());
        });
    }
}
