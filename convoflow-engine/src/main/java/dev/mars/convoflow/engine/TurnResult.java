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

package dev.mars.convoflow.engine;

import dev.mars.convoflow.core.StateExecutionResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a whole user turn, after auto-advancing through non-blocking states.
 */
public class TurnResult {

    private final String flowId;
    private final String currentState;
    private final boolean completed;
    private final String error;
    private final String response;
    private final List<String> steps;
    private final StateExecutionResult lastResult;

    public TurnResult(String flowId, String currentState, boolean completed, String error, String response,
                      List<String> steps, StateExecutionResult lastResult) {
        this.flowId = flowId;
        this.currentState = currentState;
        this.completed = completed;
        this.error = error;
        this.response = response;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.lastResult = lastResult;
    }

    public String getFlowId() {
        return flowId;
    }

    /**
     * State the conversation rests in after this turn.
     */
    public String getCurrentState() {
        return currentState;
    }

    public boolean isCompleted() {
        return completed;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * User-facing text placed in {@code _last_response} by executors, or the
     * validator's suggestion when input was rejected.
     */
    public Optional<String> getResponse() {
        return Optional.ofNullable(response);
    }

    /**
     * States executed during this turn, in order.
     */
    public List<String> getSteps() {
        return steps;
    }

    public StateExecutionResult getLastResult() {
        return lastResult;
    }

    @Override
    public String toString() {
        return "TurnResult{" +
               "flowId='" + flowId + '\'' +
               ", currentState='" + currentState + '\'' +
               ", completed=" + completed +
               ", error='" + error + '\'' +
               ", steps=" + steps +
               '}';
    }
}
