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

package org.fireflyframework.retry.config;

import org.fireflyframework.retry.connection.ConnectionManager;
import org.fireflyframework.retry.core.model.RetryOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the retry engine and its resource presets.
 *
 * <p>Each resource section overrides only the fields it sets; the rest come from the
 * resource's preset. {@code defaults} applies to custom retries.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   retry:
 *     defaults:
 *       max-retries: 3
 *       base-delay: 1s
 *       max-delay: 30s
 *     database:
 *       max-retries: 8
 *       max-delay: 1m
 *     redis:
 *       jitter: false
 *     api:
 *       max-retries: 5
 *     file:
 *       base-delay: 200ms
 *     bootstrap:
 *       initialize-on-startup: true
 *     web:
 *       enabled: true
 *       database-paths: [/api/]
 *       redis-paths: [/api/]
 *       retry-after: 30s
 *     health:
 *       enabled: true
 *       max-retries: 1
 *     metrics:
 *       enabled: true
 *     tracing:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.retry")
public class RetryProperties {

    @NestedConfigurationProperty
    private RetryOptions defaults = new RetryOptions();

    @NestedConfigurationProperty
    private RetryOptions database = new RetryOptions();

    @NestedConfigurationProperty
    private RetryOptions redis = new RetryOptions();

    @NestedConfigurationProperty
    private RetryOptions api = new RetryOptions();

    @NestedConfigurationProperty
    private RetryOptions file = new RetryOptions();

    @NestedConfigurationProperty
    private BootstrapProperties bootstrap = new BootstrapProperties();

    @NestedConfigurationProperty
    private WebProperties web = new WebProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private TracingProperties tracing = new TracingProperties();

    // --- Getters and Setters ---

    public RetryOptions getDefaults() { return defaults; }
    public void setDefaults(RetryOptions defaults) { this.defaults = defaults; }

    public RetryOptions getDatabase() { return database; }
    public void setDatabase(RetryOptions database) { this.database = database; }

    public RetryOptions getRedis() { return redis; }
    public void setRedis(RetryOptions redis) { this.redis = redis; }

    public RetryOptions getApi() { return api; }
    public void setApi(RetryOptions api) { this.api = api; }

    public RetryOptions getFile() { return file; }
    public void setFile(RetryOptions file) { this.file = file; }

    public BootstrapProperties getBootstrap() { return bootstrap; }
    public void setBootstrap(BootstrapProperties bootstrap) { this.bootstrap = bootstrap; }

    public WebProperties getWeb() { return web; }
    public void setWeb(WebProperties web) { this.web = web; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public TracingProperties getTracing() { return tracing; }
    public void setTracing(TracingProperties tracing) { this.tracing = tracing; }

    // --- Nested property classes ---

    public static class BootstrapProperties {
        private boolean initializeOnStartup = true;

        public boolean isInitializeOnStartup() { return initializeOnStartup; }
        public void setInitializeOnStartup(boolean initializeOnStartup) { this.initializeOnStartup = initializeOnStartup; }
    }

    public static class WebProperties {
        private boolean enabled = true;
        private List<String> databasePaths = new ArrayList<>(List.of("/api/"));
        private List<String> redisPaths = new ArrayList<>(List.of("/api/"));
        private Duration retryAfter = Duration.ofSeconds(30);
        private String healthPath = "/health";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<String> getDatabasePaths() { return databasePaths; }
        public void setDatabasePaths(List<String> databasePaths) { this.databasePaths = databasePaths; }

        public List<String> getRedisPaths() { return redisPaths; }
        public void setRedisPaths(List<String> redisPaths) { this.redisPaths = redisPaths; }

        public Duration getRetryAfter() { return retryAfter; }
        public void setRetryAfter(Duration retryAfter) { this.retryAfter = retryAfter; }

        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }
    }

    public static class HealthProperties {
        private boolean enabled = true;
        private int maxRetries = ConnectionManager.DEFAULT_HEALTH_CHECK_RETRIES;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class TracingProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
