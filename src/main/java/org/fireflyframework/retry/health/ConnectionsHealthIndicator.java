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

package org.fireflyframework.retry.health;

import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

/**
 * Reports DOWN while the database probe fails; Redis is reported as a detail only.
 *
 * <p>Each call runs both probes under the health-check budget
 * ({@code firefly.retry.health.max-retries}), so during an outage a call takes roughly that many
 * backoff delays of the resource preset before answering.
 */
public class ConnectionsHealthIndicator implements ReactiveHealthIndicator {

    private final ServerConnections serverConnections;

    public ConnectionsHealthIndicator(ServerConnections serverConnections) {
        this.serverConnections = serverConnections;
    }

    @Override
    public Mono<Health> health() {
        return serverConnections.performHealthChecks()
                .map(snapshot -> {
                    Health.Builder builder = snapshot.database() ? Health.up() : Health.down()
                            .withDetail("reason", "Database unhealthy");
                    return builder
                            .withDetail("database", snapshot.database())
                            .withDetail("redis", snapshot.redis())
                            .withDetail("checkedAt", snapshot.timestamp().toString())
                            .build();
                })
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
