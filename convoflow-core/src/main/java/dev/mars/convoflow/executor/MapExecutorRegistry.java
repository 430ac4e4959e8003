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
import dev.mars.convoflow.core.exceptions.ExecutorNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable registry built once at startup and injected into the engine.
 */
public class MapExecutorRegistry implements ExecutorRegistry {

    private static final Logger logger = Logger.getLogger(MapExecutorRegistry.class.getName());

    private final Map<String, ActionExecutor> executors;

    public MapExecutorRegistry(Map<String, ActionExecutor> executors) {
        Objects.requireNonNull(executors, "Executors cannot be null");
        this.executors = Map.copyOf(executors);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean has(String name) {
        return name != null && executors.containsKey(name);
    }

    @Override
    public CompletableFuture<ActionExecutionResult> execute(String name, Map<String, Object> config,
                                                           ExecutionContext context) {
        ActionExecutor executor = name != null ? executors.get(name) : null;
        if (executor == null) {
            return CompletableFuture.failedFuture(new ExecutorNotFoundException(name));
        }
        try {
            CompletableFuture<ActionExecutionResult> future = executor.execute(config, context);
            if (future == null) {
                return CompletableFuture.completedFuture(
                        ActionExecutionResult.failure("Executor " + name + " returned no result"));
            }
            return future;
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Executor " + name + " threw synchronously", e);
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean validateConfig(String name, Map<String, Object> config) {
        ActionExecutor executor = name != null ? executors.get(name) : null;
        if (executor == null) {
            return false;
        }
        try {
            return executor.validate(config != null ? config : Map.of());
        } catch (RuntimeException e) {
            logger.warning("Config validation for executor " + name + " failed: " + e.getMessage());
            return false;
        }
    }

    @Override
    public Set<String> names() {
        return executors.keySet();
    }

    @Override
    public String toString() {
        return "MapExecutorRegistry{executors=" + executors.keySet() + '}';
    }

    public static class Builder {
        private final Map<String, ActionExecutor> executors = new LinkedHashMap<>();

        public Builder register(String name, ActionExecutor executor) {
            Objects.requireNonNull(name, "Executor name cannot be null");
            Objects.requireNonNull(executor, "Executor cannot be null");
            if (executors.putIfAbsent(name, executor) != null) {
                throw new IllegalArgumentException("Executor already registered: " + name);
            }
            return this;
        }

        public MapExecutorRegistry build() {
            return new MapExecutorRegistry(executors);
        }
    }
}
