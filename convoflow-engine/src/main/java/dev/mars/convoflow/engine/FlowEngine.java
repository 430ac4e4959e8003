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

import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.StateExecutionResult;
import dev.mars.convoflow.core.ValidationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Core interface for executing conversation flows one state per turn.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface FlowEngine {

    /**
     * Executes the context's current state.
     *
     * @param flow    the flow definition
     * @param context the conversation context, mutated in place
     * @param event   incoming event, or {@code null} on first entry
     * @return a future that always completes normally; failures are reported in the result
     */
    CompletableFuture<StateExecutionResult> executeState(FlowDefinition flow, ExecutionContext context, String event);

    default CompletableFuture<StateExecutionResult> executeState(FlowDefinition flow, ExecutionContext context) {
        return executeState(flow, context, null);
    }

    /**
     * Structural check of a flow against this engine's executors. Never throws.
     */
    ValidationResult validateFlow(FlowDefinition flow);
}
