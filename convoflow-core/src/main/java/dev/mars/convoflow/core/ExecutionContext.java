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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Conversation-scoped state threaded through every turn: a free-form data bag
 * plus the engine-owned {@link SystemState}.
 * <p>
 * A context is mutated by one turn at a time; it is not safe for concurrent turns.
 */
public class ExecutionContext {

    private final Map<String, Object> data;
    private final SystemState system;

    public ExecutionContext(Map<String, Object> data, SystemState system) {
        this.data = new LinkedHashMap<>(data != null ? data : Map.of());
        this.system = Objects.requireNonNull(system, "System state cannot be null");
    }

    public Map<String, Object> getData() {
        return data;
    }

    public SystemState getSystem() {
        return system;
    }

    public String getSessionId() {
        return system.getSessionId();
    }

    public String getCurrentState() {
        return system.getCurrentState();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "system=" + system +
               ", dataKeys=" + data.keySet() +
               '}';
    }

    /**
     * Builder for ExecutionContext.
     */
    public static class Builder {
        private String sessionId;
        private String flowId;
        private String flowRunId;
        private String userId;
        private String currentState;
        private Map<String, Object> data = Map.of();
        private List<ErrorRecord> errorHistory = List.of();

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder flowId(String flowId) {
            this.flowId = flowId;
            return this;
        }

        public Builder flowRunId(String flowRunId) {
            this.flowRunId = flowRunId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder currentState(String currentState) {
            this.currentState = currentState;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder errorHistory(List<ErrorRecord> errorHistory) {
            this.errorHistory = errorHistory;
            return this;
        }

        public ExecutionContext build() {
            if (sessionId == null) {
                sessionId = UUID.randomUUID().toString();
            }
            if (flowRunId == null) {
                flowRunId = "run_" + UUID.randomUUID();
            }
            SystemState system = new SystemState(sessionId, flowId, flowRunId, userId, currentState, errorHistory);
            return new ExecutionContext(data, system);
        }
    }
}
