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

package dev.mars.convoflow.executor;

import dev.mars.convoflow.core.ActionExecutionResult;
import dev.mars.convoflow.core.ExecutionContext;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only lookup from executor name to implementation.
 * Shared between sessions, so implementations must be safe for concurrent reads.
 */
public interface ExecutorRegistry {

    boolean has(String name);

    /**
     * Runs the named executor. A missing executor completes the future with
     * {@link dev.mars.convoflow.core.exceptions.ExecutorNotFoundException}.
     */
    CompletableFuture<ActionExecutionResult> execute(String name, Map<String, Object> config, ExecutionContext context);

    /**
     * Whether the named executor accepts the given raw config. Unknown executors return {@code false}.
     */
    boolean validateConfig(String name, Map<String, Object> config);

    Set<String> names();
}
