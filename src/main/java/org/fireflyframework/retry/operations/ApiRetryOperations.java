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

import org.fireflyframework.retry.core.engine.RetryManager;
import org.fireflyframework.retry.core.model.RetryOptions;
import org.fireflyframework.retry.core.model.RetryPolicy;
import org.fireflyframework.retry.core.observability.RetryEvents;
import org.fireflyframework.retry.core.observability.RetryLoggerEvents;
import org.fireflyframework.retry.core.observability.RetryTracer;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Outbound HTTP calls under the API preset: up to 3 retries from 1s to 10s, retrying
 * refused or timed-out connections and 408, 429, 500, 502, 503 and 504 responses.
 *
 * <pre>{@code
 * api.get("/quotes/{id}", Quote.class)
 *    .subscribe(quote -> ...);
 * }</pre>
 */
public class ApiRetryOperations {

    private static final Map<String, Object> CONTEXT = Map.of(RetryEvents.CONTEXT_TYPE, "api");

    private final WebClient webClient;
    private final RetryManager retryManager;

    public ApiRetryOperations(WebClient webClient) {
        this(webClient, new RetryOptions(), new RetryLoggerEvents(), null);
    }

    public ApiRetryOperations(WebClient webClient, RetryOptions options, RetryEvents events, RetryTracer tracer) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.retryManager = new RetryManager(RetryPolicy.forHttp(options), events, tracer);
    }

    public RetryManager getRetryManager() {
        return retryManager;
    }

    public <T> Mono<T> makeRequest(Supplier<? extends Mono<T>> request) {
        return makeRequest(request, "API Request");
    }

    public <T> Mono<T> makeRequest(Supplier<? extends Mono<T>> request, String operationName) {
        return retryManager.executeWithRetry(request, operationName, CONTEXT);
    }

    public <T> Mono<T> get(String uri, Class<T> responseType) {
        return get(uri, responseType, Map.of());
    }

    public <T> Mono<T> get(String uri, Class<T> responseType, Map<String, String> headers) {
        return makeRequest(() -> withHeaders(webClient.get().uri(uri), headers)
                .retrieve()
                .bodyToMono(responseType), "GET " + uri);
    }

    public <T> Mono<T> post(String uri, Object body, Class<T> responseType) {
        return post(uri, body, responseType, Map.of());
    }

    public <T> Mono<T> post(String uri, Object body, Class<T> responseType, Map<String, String> headers) {
        return makeRequest(() -> withHeaders(webClient.post().uri(uri).bodyValue(body), headers)
                .retrieve()
                .bodyToMono(responseType), "POST " + uri);
    }

    private static WebClient.RequestHeadersSpec<?> withHeaders(WebClient.RequestHeadersSpec<?> spec,
                                                              Map<String, String> headers) {
        WebClient.RequestHeadersSpec<?> s = spec;
        if (headers != null) {
            for (Map.Entry<String, String> e : headers.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    s = s.header(e.getKey(), e.getValue());
                }
            }
        }
        return s;
    }
}
