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

package org.fireflyframework.retry.web;

import org.fireflyframework.retry.bootstrap.ServerConnections;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ConnectionsHealthController {

    private final ServerConnections serverConnections;

    public ConnectionsHealthController(ServerConnections serverConnections) {
        this.serverConnections = serverConnections;
    }

    @GetMapping("${firefly.retry.web.health-path:/health}")
    public Mono<Map<String, Object>> health() {
        return serverConnections.performHealthChecks().map(snapshot -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", snapshot.database() ? "ok" : "degraded");
            body.put("timestamp", snapshot.timestamp().toString());
            body.put("database", snapshot.database());
            body.put("redis", snapshot.redis());
            return body;
        });
    }
}
