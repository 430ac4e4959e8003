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
import java.util.concurrent.CompletableFuture;

/**
 * A pluggable capability invoked by flow actions.
 * <p>
 * Implementations receive an already interpolated config and may read or write
 * the context data. A failure is reported either as an unsuccessful result or as
 * an exceptionally completed future; the engine treats both the same way.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ActionExecutor {

    /**
     * Executes the capability.
     *
     * @param config  interpolated action config
     * @param context conversation context, mutable
     * @return a future completing with the result
     */
    CompletableFuture<ActionExecutionResult> execute(Map<String, Object> config, ExecutionContext context);

    /**
     * Load-time sanity check of a raw (not yet interpolated) config.
     */
    default boolean validate(Map<String, Object> config) {
        return true;
    }
}
