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

package org.fireflyframework.retry.bootstrap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;

import javax.sql.DataSource;

/**
 * Establishes the primary database and then the Redis connection once all singletons exist.
 * A resource whose bean is absent is skipped; a connection that exhausts its retries aborts startup.
 */
@Slf4j
public class ServerConnectionsInitializer implements SmartInitializingSingleton {

    private final ServerConnections serverConnections;
    private final ObjectProvider<DataSource> dataSource;
    private final ObjectProvider<ReactiveRedisConnectionFactory> redisConnectionFactory;

    public ServerConnectionsInitializer(ServerConnections serverConnections,
                                        ObjectProvider<DataSource> dataSource,
                                        ObjectProvider<ReactiveRedisConnectionFactory> redisConnectionFactory) {
        this.serverConnections = serverConnections;
        this.dataSource = dataSource;
        this.redisConnectionFactory = redisConnectionFactory;
    }

    @Override
    public void afterSingletonsInstantiated() {
        DataSource ds = dataSource.getIfUnique();
        if (ds != null) {
            serverConnections.initializeDatabase(ds).block();
        } else {
            log.info("[retry] No unique DataSource bean, skipping database initialization");
        }
        ReactiveRedisConnectionFactory factory = redisConnectionFactory.getIfUnique();
        if (factory != null) {
            serverConnections.initializeRedis(factory).block();
        } else {
            log.info("[retry] No unique ReactiveRedisConnectionFactory bean, skipping Redis initialization");
        }
    }
}
