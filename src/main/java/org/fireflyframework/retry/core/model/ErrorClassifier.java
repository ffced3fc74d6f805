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

package org.fireflyframework.retry.core.model;

import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps a failure to the set of {@link TransientErrorKind}s it exhibits.
 *
 * <p>The cause chain is inspected link by link. Typed signals (exception classes, SQLSTATE
 * codes, HTTP status codes) are read first; message patterns cover errors that only
 * describe themselves in text.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final Set<Integer> RETRYABLE_HTTP_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private static final Map<TransientErrorKind, Pattern> MESSAGE_PATTERNS = new LinkedHashMap<>();

    static {
        // OS-level error codes are matched case-sensitively on word boundaries
        pattern(TransientErrorKind.CONNECTION_REFUSED, "\\bECONNREFUSED\\b|(?i:connection.*refused)");
        pattern(TransientErrorKind.HOST_UNRESOLVED, "\\bENOTFOUND\\b|(?i:name or service not known)");
        pattern(TransientErrorKind.TIMEOUT, "\\bETIMEDOUT\\b|(?i:network timeout|timed out)");
        pattern(TransientErrorKind.CONNECTION_RESET, "\\bECONNRESET\\b|(?i:connection.*reset)");
        pattern(TransientErrorKind.BROKEN_PIPE, "\\bEPIPE\\b|(?i:broken pipe)");
        pattern(TransientErrorKind.CONNECTION_CLOSED, "(?i:socket hang up|socket.*closed)");
        pattern(TransientErrorKind.CONNECTION_LOST, "(?i:connection.*terminated|connection.*lost)");
        pattern(TransientErrorKind.TEMPORARY_FAILURE, "(?i:temporary failure)");
        pattern(TransientErrorKind.SERVICE_UNAVAILABLE, "(?i:service unavailable)");
        pattern(TransientErrorKind.SERVER_ERROR, "(?i:internal server error)");

        pattern(TransientErrorKind.POOL_EXHAUSTED, "(?i:pool.*exhausted)");
        pattern(TransientErrorKind.CONNECTION_ACQUIRE_TIMEOUT,
                "(?i:timeout.*acquiring.*connection|connection is not available, request timed out)");
        pattern(TransientErrorKind.DATABASE_UNAVAILABLE, "(?i:database.*unavailable)");
        pattern(TransientErrorKind.LOCK_TIMEOUT, "(?i:lock.*timeout)");
        pattern(TransientErrorKind.DEADLOCK, "(?i:deadlock)");

        pattern(TransientErrorKind.CACHE_UNAVAILABLE, "(?i:redis.*unavailable|cache.*unavailable)");
        pattern(TransientErrorKind.CLUSTER_DOWN, "(?i:cluster.*down)");
        pattern(TransientErrorKind.CACHE_LOADING, "(?i:loading.*redis)");
        pattern(TransientErrorKind.MASTER_DOWN, "(?i:master.*down)");
        pattern(TransientErrorKind.REPLICA_NOT_READY, "(?i:replica.*not.*ready)");

        pattern(TransientErrorKind.RESOURCE_BUSY, "\\bEBUSY\\b|(?i:resource busy|being used by another process)");
        pattern(TransientErrorKind.TOO_MANY_OPEN_FILES, "\\bEMFILE\\b|(?i:too many open files)");
        pattern(TransientErrorKind.FILE_TABLE_FULL, "\\bENFILE\\b|(?i:file table overflow)");
        pattern(TransientErrorKind.NOT_YET_VISIBLE, "\\bENOENT\\b");
    }

    private ErrorClassifier() {}

    private static void pattern(TransientErrorKind kind, String regex) {
        MESSAGE_PATTERNS.put(kind, Pattern.compile(regex));
    }

    /**
     * Returns every kind exhibited anywhere in the cause chain of {@code error}; empty for
     * {@code null} or for errors considered permanent.
     */
    public static Set<TransientErrorKind> classify(Throwable error) {
        if (error == null) {
            return Collections.emptySet();
        }
        EnumSet<TransientErrorKind> kinds = EnumSet.noneOf(TransientErrorKind.class);
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH && seen.add(current)) {
            classifyTyped(current, kinds);
            classifyMessage(current.getMessage(), kinds);
            current = current.getCause();
        }
        return kinds;
    }

    /**
     * Returns {@code true} when the cause chain of {@code error} exhibits at least one of
     * the given kinds.
     */
    public static boolean hasAnyKind(Throwable error, Set<TransientErrorKind> expected) {
        if (expected.isEmpty()) return false;
        Set<TransientErrorKind> actual = classify(error);
        for (TransientErrorKind kind : expected) {
            if (actual.contains(kind)) return true;
        }
        return false;
    }

    static Set<TransientErrorKind> classifyMessage(String message) {
        EnumSet<TransientErrorKind> kinds = EnumSet.noneOf(TransientErrorKind.class);
        classifyMessage(message, kinds);
        return kinds;
    }

    private static void classifyMessage(String message, Set<TransientErrorKind> kinds) {
        if (message == null || message.isEmpty()) return;
        MESSAGE_PATTERNS.forEach((kind, pattern) -> {
            if (pattern.matcher(message).find()) {
                kinds.add(kind);
            }
        });
    }

    private static void classifyTyped(Throwable error, Set<TransientErrorKind> kinds) {
        if (error instanceof ConnectException) {
            kinds.add(TransientErrorKind.CONNECTION_REFUSED);
        } else if (error instanceof UnknownHostException) {
            kinds.add(TransientErrorKind.HOST_UNRESOLVED);
        } else if (error instanceof SocketTimeoutException || error instanceof TimeoutException) {
            kinds.add(TransientErrorKind.TIMEOUT);
        } else if (error instanceof ClosedChannelException) {
            kinds.add(TransientErrorKind.CONNECTION_CLOSED);
        } else if (error instanceof NoSuchFileException) {
            kinds.add(TransientErrorKind.NOT_YET_VISIBLE);
        } else if (error instanceof WebClientResponseException wcre) {
            classifyHttpStatus(wcre.getStatusCode().value(), kinds);
        } else if (error instanceof SQLException sql) {
            classifySql(sql, kinds);
        } else if (error instanceof RedisConnectionFailureException) {
            kinds.add(TransientErrorKind.CACHE_UNAVAILABLE);
        } else if (error instanceof CannotAcquireLockException) {
            kinds.add(TransientErrorKind.LOCK_TIMEOUT);
        } else if (error instanceof PessimisticLockingFailureException) {
            kinds.add(TransientErrorKind.DEADLOCK);
        } else if (error instanceof QueryTimeoutException) {
            kinds.add(TransientErrorKind.TIMEOUT);
        } else if (error instanceof DataAccessResourceFailureException) {
            kinds.add(TransientErrorKind.DATABASE_UNAVAILABLE);
        }
    }

    static void classifyHttpStatus(int status, Set<TransientErrorKind> kinds) {
        if (RETRYABLE_HTTP_STATUSES.contains(status)) {
            kinds.add(TransientErrorKind.RETRYABLE_HTTP_STATUS);
        }
        if (status == 500) {
            kinds.add(TransientErrorKind.SERVER_ERROR);
        } else if (status == 503) {
            kinds.add(TransientErrorKind.SERVICE_UNAVAILABLE);
        }
    }

    private static void classifySql(SQLException sql, Set<TransientErrorKind> kinds) {
        if (sql instanceof SQLTransientConnectionException) {
            kinds.add(TransientErrorKind.CONNECTION_ACQUIRE_TIMEOUT);
        } else if (sql instanceof SQLNonTransientConnectionException) {
            kinds.add(TransientErrorKind.CONNECTION_LOST);
        } else if (sql instanceof SQLTimeoutException) {
            kinds.add(TransientErrorKind.TIMEOUT);
        }
        String state = sql.getSQLState();
        if (state == null) return;
        if (state.startsWith("08")) {
            kinds.add(TransientErrorKind.CONNECTION_LOST);
        } else if ("40001".equals(state) || "40P01".equals(state)) {
            kinds.add(TransientErrorKind.DEADLOCK);
        } else if ("55P03".equals(state)) {
            kinds.add(TransientErrorKind.LOCK_TIMEOUT);
        } else if ("57P03".equals(state)) {
            kinds.add(TransientErrorKind.DATABASE_UNAVAILABLE);
        } else if ("53300".equals(state)) {
            kinds.add(TransientErrorKind.POOL_EXHAUSTED);
        }
    }
}
