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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Engine-owned part of an execution context.
 */
public class SystemState {

    private final String sessionId;
    private final String flowId;
    private final String flowRunId;
    private final String userId;
    private final Instant startTime;
    private volatile String currentState;
    private final List<ErrorRecord> errorHistory;

    public SystemState(String sessionId, String flowId, String flowRunId, String userId,
                       String currentState, List<ErrorRecord> errorHistory) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.flowId = flowId;
        this.flowRunId = flowRunId;
        this.userId = userId;
        this.currentState = currentState;
        this.startTime = Instant.now();
        this.errorHistory = new ArrayList<>(errorHistory != null ? errorHistory : List.of());
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFlowId() {
        return flowId;
    }

    public String getFlowRunId() {
        return flowRunId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public String getCurrentState() {
        return currentState;
    }

    public void setCurrentState(String currentState) {
        this.currentState = currentState;
    }

    public synchronized void addError(ErrorRecord error) {
        errorHistory.add(Objects.requireNonNull(error, "Error cannot be null"));
    }

    public synchronized List<ErrorRecord> getErrorHistory() {
        return List.copyOf(errorHistory);
    }

    @Override
    public String toString() {
        return "SystemState{" +
               "sessionId='" + sessionId + '\'' +
               ", flowId='" + flowId + '\'' +
               ", currentState='" + currentState + '\'' +
               ", errors=" + errorHistory.size() +
               '}';
    }
}
