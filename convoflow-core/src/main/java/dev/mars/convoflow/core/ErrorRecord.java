/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.convoflow.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a conversation's error history.
 */
public class ErrorRecord {

    private final String state;
    private final String executor;
    private final String message;
    private final boolean recoverable;
    private final boolean retryable;
    private final Instant timestamp;

    public ErrorRecord(String state, String executor, String message,
                       boolean recoverable, boolean retryable, Instant timestamp) {
        this.state = state != null ? state : "unknown";
        this.executor = executor;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.recoverable = recoverable;
        this.retryable = retryable;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ErrorRecord engineError(String state, String message) {
        return new ErrorRecord(state, null, message, false, false, Instant.now());
    }

    public String getState() {
        return state;
    }

    /**
     * Executor that failed, or {@code null} for engine-level errors.
     */
    public String getExecutor() {
        return executor;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * History line in the form {@code [executor] message}.
     */
    public String getSummary() {
        return executor != null ? "[" + executor + "] " + message : message;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("state", state);
        map.put("executor", executor);
        map.put("message", message);
        map.put("recoverable", recoverable);
        map.put("retryable", retryable);
        map.put("timestamp", timestamp.toString());
        return map;
    }

    @Override
    public String toString() {
        return "ErrorRecord{" +
               "state='" + state + '\'' +
               ", error='" + getSummary() + '\'' +
               ", timestamp=" + timestamp +
               '}';
    }
}
