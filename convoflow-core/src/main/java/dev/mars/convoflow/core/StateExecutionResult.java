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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@code executeState} call, returned to the caller for persistence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StateExecutionResult {

    private final String nextState;
    private final String event;
    private final ExecutionContext context;
    private final boolean completed;
    private final String error;
    private final Map<String, Object> metadata;

    public StateExecutionResult(String nextState, String event, ExecutionContext context,
                                boolean completed, String error, Map<String, Object> metadata) {
        this.nextState = nextState;
        this.event = event;
        this.context = Objects.requireNonNull(context, "Execution context cannot be null");
        this.completed = completed;
        this.error = error;
        this.metadata = metadata != null ? java.util.Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * State to move to, or {@code null} to stay in the current state.
     */
    public String getNextState() {
        return nextState;
    }

    /**
     * Event that drove the transition, or {@code null} when none was triggered.
     */
    public String getEvent() {
        return event;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public boolean isCompleted() {
        return completed;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean hasError() {
        return error != null;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Copy of this result with extra metadata entries.
     */
    public StateExecutionResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new StateExecutionResult(nextState, event, context, completed, error, merged);
    }

    public static Builder builder(ExecutionContext context) {
        return new Builder(context);
    }

    @Override
    public String toString() {
        return "StateExecutionResult{" +
               "nextState='" + nextState + '\'' +
               ", event='" + event + '\'' +
               ", completed=" + completed +
               ", error='" + error + '\'' +
               '}';
    }

    public static class Builder {
        private final ExecutionContext context;
        private String nextState;
        private String event;
        private boolean completed;
        private String error;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(ExecutionContext context) {
            this.context = context;
        }

        public Builder nextState(String nextState) {
            this.nextState = nextState;
            return this;
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                metadata.forEach(this::metadata);
            }
            return this;
        }

        public StateExecutionResult build() {
            return new StateExecutionResult(nextState, event, context, completed, error, metadata);
        }
    }
}
