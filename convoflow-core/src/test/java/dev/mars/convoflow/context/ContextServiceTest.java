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

package dev.mars.convoflow.context;

import dev.mars.convoflow.core.ErrorRecord;
import dev.mars.convoflow.core.ExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextServiceTest {

    private ContextService contextService;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        contextService = new ContextService();
        context = ExecutionContext.builder()
                .sessionId("session-1")
                .flowId("food_order_v1")
                .currentState("greet")
                .data(Map.of("profile", Map.of("name", "Ravi")))
                .build();
    }

    @Test
    void testGetDottedPath() {
        assertEquals("Ravi", contextService.get(context, "profile.name"));
        assertNull(contextService.get(context, "profile.phone"));
        assertNull(contextService.get(context, "missing.path"));
    }

    @Test
    void testSetCreatesIntermediateMaps() {
        contextService.set(context, "order.delivery.slot", "evening");

        assertEquals("evening", contextService.get(context, "order.delivery.slot"));
        assertTrue(context.getData().get("order") instanceof Map);
    }

    @Test
    void testSetIntoImmutableNestedMap() {
        contextService.set(context, "profile.phone", "9876543210");

        assertEquals("9876543210", contextService.get(context, "profile.phone"));
        assertEquals("Ravi", contextService.get(context, "profile.name"));
    }

    @Test
    void testRemove() {
        contextService.set(context, "a.b", 1);
        contextService.remove(context, "a.b");
        contextService.remove(context, "x.y.z");

        assertNull(contextService.get(context, "a.b"));
        assertNotNull(contextService.get(context, "a"));
    }

    @Test
    void testGetInt() {
        contextService.set(context, "counter", 2);
        contextService.set(context, "text", "5");
        contextService.set(context, "bad", "five");

        assertEquals(2, contextService.getInt(context, "counter", 0));
        assertEquals(5, contextService.getInt(context, "text", 0));
        assertEquals(7, contextService.getInt(context, "bad", 7));
        assertEquals(0, contextService.getInt(context, "none", 0));
    }

    @Test
    void testInterpolateConfig() {
        Map<String, Object> config = contextService.interpolateConfig(
                Map.of("greeting", "Hi {{profile.name || 'there'}}"), context);

        assertEquals("Hi Ravi", config.get("greeting"));
        assertTrue(contextService.interpolateConfig(Map.of(), context).isEmpty());
    }

    @Test
    void testRecordErrorMirrorsLastError() {
        contextService.recordError(context, new ErrorRecord("greet", "nlu", "timeout", true, false, Instant.now()));

        assertEquals(1, contextService.getErrorHistory(context).size());
        assertEquals("[nlu] timeout", contextService.getErrorHistory(context).get(0).getSummary());

        @SuppressWarnings("unchecked")
        Map<String, Object> lastError = (Map<String, Object>) context.getData().get(ContextService.LAST_ERROR);
        assertEquals("nlu", lastError.get("executor"));
        assertEquals("timeout", lastError.get("message"));
        assertEquals(true, lastError.get("recoverable"));
    }

    @Test
    void testUpdateStateAndEvaluateExpression() {
        contextService.updateState(context, "confirm");
        contextService.set(context, "confirmed", true);

        assertEquals("confirm", context.getCurrentState());
        assertTrue(contextService.evaluateExpression(context, "context.confirmed == true"));
    }
}
