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

package org.fireflyframework.retry.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name and extra listener context for a connection attempt.
 */
public final class ConnectionOptions {

    private final String name;
    private final Map<String, Object> context;

    private ConnectionOptions(String name, Map<String, Object> context) {
        this.name = name;
        this.context = context;
    }

    public static ConnectionOptions defaults() {
        return new ConnectionOptions(null, Map.of());
    }

    public static ConnectionOptions named(String name) {
        return new ConnectionOptions(name, Map.of());
    }

    public ConnectionOptions with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(context);
        copy.put(key, value);
        return new ConnectionOptions(name, Collections.unmodifiableMap(copy));
    }

    public String getName() { return name; }

    public Map<String, Object> getContext() { return context; }
}
