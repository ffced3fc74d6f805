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

package org.fireflyframework.retry.unit.core;

import org.fireflyframework.retry.core.model.RetryConditions;
import org.fireflyframework.retry.core.model.RetryOptions;
import org.fireflyframework.retry.core.model.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.AccessDeniedException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private static RetryPolicy noJitter(int maxRetries, long baseMs, long maxMs, double multiplier) {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .baseDelay(Duration.ofMillis(baseMs))
                .maxDelay(Duration.ofMillis(maxMs))
                .backoffMultiplier(multiplier)
                .jitter(false)
                .build();
    }

    @Test
    void calculateDelay_exponentialBackoff_cappedAtMaxDelay() {
        var policy = noJitter(5, 1000, 3000, 2.0);
        assertThat(policy.calculateDelay(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.calculateDelay(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.calculateDelay(3)).isEqualTo(Duration.ofMillis(3000));
        assertThat(policy.calculateDelay(4)).isEqualTo(Duration.ofMillis(3000));
    }

    @Test
    void calculateDelay_fractionalMultiplier_floorsToWholeMillis() {
        var policy = noJitter(5, 2000, 30000, 1.5);
        assertThat(policy.calculateDelay(2)).isEqualTo(Duration.ofMillis(3000));
        assertThat(policy.calculateDelay(3)).isEqualTo(Duration.ofMillis(4500));
        assertThat(policy.calculateDelay(4)).isEqualTo(Duration.ofMillis(6750));
    }

    @Test
    void calculateDelay_attemptBelowOne_treatedAsFirstRetry() {
        var policy = noJitter(3, 1000, 10000, 2.0);
        assertThat(policy.calculateDelay(0)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.calculateDelay(-4)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void calculateDelay_withJitter_staysWithinQuarterOfNominal() {
        var policy = RetryPolicy.builder()
                .baseDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofMillis(10000))
                .jitter(true)
                .build();
        for (int i = 0; i < 500; i++) {
            assertThat(policy.calculateDelay(1).toMillis()).isBetween(750L, 1250L);
            assertThat(policy.calculateDelay(2).toMillis()).isBetween(1500L, 2500L);
        }
    }

    @Test
    void calculateDelay_withJitterAtCap_mayExceedMaxDelayByJitterOnly() {
        var policy = RetryPolicy.builder()
                .baseDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofMillis(3000))
                .jitter(true)
                .build();
        for (int i = 0; i < 200; i++) {
            assertThat(policy.calculateDelay(10).toMillis()).isBetween(2250L, 3750L);
        }
    }

    @Test
    void builderDefaults_haveDocumentedValues() {
        var policy = RetryPolicy.DEFAULT;
        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.maxAttempts()).isEqualTo(4);
        assertThat(policy.baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoffMultiplier()).isEqualTo(2.0);
        assertThat(policy.jitter()).isTrue();
        assertThat(policy.retryConditions()).containsExactly(RetryConditions.transientErrors());
    }

    @Test
    void invalidValues_throwIllegalArgumentException() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxRetries must be non-negative");
        assertThatThrownBy(() -> RetryPolicy.builder().baseDelay(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("baseDelay must be positive");
        assertThatThrownBy(() -> RetryPolicy.builder().maxDelay(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxDelay must be positive");
        assertThatThrownBy(() -> RetryPolicy.builder().backoffMultiplier(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("backoffMultiplier must be positive");
    }

    @Test
    void zeroRetries_isValidAndNeverRetries() {
        var policy = RetryPolicy.builder().maxRetries(0).build();
        assertThat(policy.maxAttempts()).isEqualTo(1);
        assertThat(policy.shouldRetry(new ConnectException("Connection refused"), 0)).isFalse();
    }

    @Test
    void shouldRetry_retryableError_untilBudgetSpent() {
        var policy = noJitter(3, 10, 100, 2.0);
        var error = new IOException("connect ECONNREFUSED 10.0.0.5:5432");
        assertThat(policy.shouldRetry(error, 0)).isTrue();
        assertThat(policy.shouldRetry(error, 2)).isTrue();
        assertThat(policy.shouldRetry(error, 3)).isFalse();
    }

    @Test
    void shouldRetry_permanentError_returnsFalse() {
        var policy = noJitter(3, 10, 100, 2.0);
        assertThat(policy.shouldRetry(new IllegalArgumentException("Validation failed"), 0)).isFalse();
    }

    @Test
    void shouldRetry_customCondition_receivesAttemptIndex() {
        var policy = RetryPolicy.builder()
                .retryCondition((error, attempt) -> attempt < 1)
                .build();
        var error = new IllegalStateException("anything");
        assertThat(policy.shouldRetry(error, 0)).isTrue();
        assertThat(policy.shouldRetry(error, 1)).isFalse();
    }

    @Test
    void onTypes_retriesListedTypesAndSubclassesOnly() {
        var policy = RetryPolicy.builder()
                .retryCondition(RetryConditions.onTypes(IOException.class, IllegalStateException.class))
                .build();
        assertThat(policy.shouldRetry(new IOException("disk"), 0)).isTrue();
        assertThat(policy.shouldRetry(new AccessDeniedException("/var/data"), 0)).isTrue();
        assertThat(policy.shouldRetry(new IllegalStateException("stale"), 0)).isTrue();
        assertThat(policy.shouldRetry(new IllegalArgumentException("bad id"), 0)).isFalse();
    }

    @Test
    void from_options_overridesOnlySetFields() {
        var policy = RetryPolicy.from(new RetryOptions().withMaxRetries(7).withJitter(false));
        assertThat(policy.maxRetries()).isEqualTo(7);
        assertThat(policy.jitter()).isFalse();
        assertThat(policy.baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void forDatabase_presetValues() {
        var policy = RetryPolicy.forDatabase();
        assertThat(policy.maxRetries()).isEqualTo(5);
        assertThat(policy.baseDelay()).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofMillis(30000));
        assertThat(policy.backoffMultiplier()).isEqualTo(1.5);
    }

    @Test
    void forDatabase_retriesConnectionLossButNotSyntaxErrors() {
        var policy = RetryPolicy.forDatabase();
        assertThat(policy.shouldRetry(new RuntimeException("Connection terminated unexpectedly"), 0)).isTrue();
        assertThat(policy.shouldRetry(new RuntimeException("deadlock detected"), 4)).isTrue();
        assertThat(policy.shouldRetry(new RuntimeException("syntax error at or near \"SELEC\""), 0)).isFalse();
        assertThat(policy.shouldRetry(new RuntimeException("Connection terminated unexpectedly"), 5)).isFalse();
    }

    @Test
    void forDatabase_customOptions_overridePresetAndKeepCondition() {
        var policy = RetryPolicy.forDatabase(new RetryOptions()
                .withMaxRetries(8)
                .withRetryCondition((error, attempt) -> error instanceof IllegalStateException));
        assertThat(policy.maxRetries()).isEqualTo(8);
        assertThat(policy.backoffMultiplier()).isEqualTo(1.5);
        assertThat(policy.shouldRetry(new IllegalStateException("custom"), 0)).isTrue();
        assertThat(policy.shouldRetry(new RuntimeException("Connection lost"), 0)).isTrue();
    }

    @Test
    void forCache_presetValuesAndCondition() {
        var policy = RetryPolicy.forCache();
        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.baseDelay()).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofMillis(10000));
        assertThat(policy.backoffMultiplier()).isEqualTo(2.0);
        assertThat(policy.shouldRetry(new RedisConnectionFailureException("Unable to connect"), 0)).isTrue();
        assertThat(policy.shouldRetry(new RuntimeException("CLUSTERDOWN The cluster is down"), 0)).isTrue();
        assertThat(policy.shouldRetry(new RuntimeException("WRONGTYPE Operation against a key"), 0)).isFalse();
    }

    @Test
    void forHttpAndFileSystem_presetValues() {
        var http = RetryPolicy.forHttp(null);
        assertThat(http.maxRetries()).isEqualTo(3);
        assertThat(http.maxDelay()).isEqualTo(Duration.ofMillis(10000));

        var file = RetryPolicy.forFileSystem(new RetryOptions().withBaseDelay(Duration.ofMillis(100)));
        assertThat(file.maxRetries()).isEqualTo(2);
        assertThat(file.baseDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(file.maxDelay()).isEqualTo(Duration.ofMillis(5000));
        assertThat(file.shouldRetry(new IOException("EBUSY: resource busy or locked"), 0)).isTrue();
        assertThat(file.shouldRetry(new IOException("EACCES: permission denied"), 0)).isFalse();
    }
}
