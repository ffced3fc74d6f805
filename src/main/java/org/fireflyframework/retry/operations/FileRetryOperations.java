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
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * File reads, writes and deletes under the file-system preset: up to 2 retries from 500ms
 * to 5s while a file is busy, the process is out of descriptors, or the file is not there yet.
 */
public class FileRetryOperations {

    private static final Map<String, Object> CONTEXT = Map.of(RetryEvents.CONTEXT_TYPE, "file");

    private final RetryManager retryManager;

    public FileRetryOperations() {
        this(new RetryOptions(), new RetryLoggerEvents(), null);
    }

    public FileRetryOperations(RetryOptions options, RetryEvents events, RetryTracer tracer) {
        this.retryManager = new RetryManager(RetryPolicy.forFileSystem(options), events, tracer);
    }

    public RetryManager getRetryManager() {
        return retryManager;
    }

    public Mono<byte[]> readFile(Path path) {
        return run(() -> Files.readAllBytes(path), "Read file " + path);
    }

    public Mono<String> readFile(Path path, Charset charset) {
        return run(() -> Files.readString(path, charset), "Read file " + path);
    }

    public Mono<Void> writeFile(Path path, byte[] data) {
        return run(() -> {
            Files.write(path, data);
            return null;
        }, "Write file " + path);
    }

    public Mono<Void> writeFile(Path path, String content, Charset charset) {
        return run(() -> {
            Files.writeString(path, content, charset);
            return null;
        }, "Write file " + path);
    }

    public Mono<Void> deleteFile(Path path) {
        return run(() -> {
            Files.delete(path);
            return null;
        }, "Delete file " + path);
    }

    private <T> Mono<T> run(Callable<T> io, String operationName) {
        return retryManager.executeWithRetry(
                () -> Mono.fromCallable(io).subscribeOn(Schedulers.boundedElastic()),
                operationName, CONTEXT);
    }
}
