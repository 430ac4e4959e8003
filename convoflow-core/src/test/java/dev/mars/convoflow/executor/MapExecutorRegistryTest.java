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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MapExecutorRegistryTest {

    private ActionExecutor echo;
    private ActionExecutor strict;
    private MapExecutorRegistry registry;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        echo = (config, ctx) -> CompletableFuture.completedFuture(ActionExecutionResult.success(config.get("value")));
        strict = mock(ActionExecutor.class);
        when(strict.validate(anyMap())).thenAnswer(invocation -> {
            Map<?, ?> config = invocation.getArgument(0);
            return config.containsKey("endpoint");
        });
        when(strict.execute(anyMap(), any(ExecutionContext.class))).thenThrow(new IllegalStateException("boom"));

        registry = MapExecutorRegistry.builder()
                .register("echo", echo)
                .register("strict", strict)
                .build();
        context = ExecutionContext.builder().sessionId("s1").build();
    }

    @Test
    void testHasAndNames() {
        assertTrue(registry.has("echo"));
        assertFalse(registry.has("missing"));
        assertFalse(registry.has(null));
        assertEquals(Set.of("echo", "strict"), registry.names());
    }

    @Test
    void testExecuteDelegates() throws Exception {
        ActionExecutionResult result = registry.execute("echo", Map.of("value", 42), context).get();

        assertTrue(result.isSuccess());
        assertEquals(42, result.getOutput());
    }

    @Test
    void testMissingExecutorFailsFuture() {
        CompletableFuture<ActionExecutionResult> future = registry.execute("missing", Map.of(), context);

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(ExecutorNotFoundException.class, e.getCause());
        assertEquals("missing", ((ExecutorNotFoundException) e.getCause()).getExecutorName());
    }

    @Test
    void testSynchronousThrowBecomesFailedFuture() {
        CompletableFuture<ActionExecutionResult> future = registry.execute("strict", Map.of(), context);

        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void testValidateConfig() {
        assertTrue(registry.validateConfig("echo", Map.of()));
        assertTrue(registry.validateConfig("strict", Map.of("endpoint", "/orders")));
        assertFalse(registry.validateConfig("strict", Map.of()));
        assertFalse(registry.validateConfig("missing", Map.of()));
    }

    @Test
    void testDuplicateRegistrationRejected() {
        MapExecutorRegistry.Builder builder = MapExecutorRegistry.builder().register("echo", echo);

        assertThrows(IllegalArgumentException.class, () -> builder.register("echo", echo));
    }
}
