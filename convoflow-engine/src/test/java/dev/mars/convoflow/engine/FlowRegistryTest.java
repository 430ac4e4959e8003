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

import dev.mars.convoflow.config.ConvoflowConfiguration;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.exceptions.FlowDefinitionException;
import dev.mars.convoflow.executor.MapExecutorRegistry;
import dev.mars.convoflow.monitoring.FlowMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlowRegistryTest {

    private FlowRegistry registry;

    @BeforeEach
    void setUp() {
        StateMachineEngine engine = StateMachineEngine.builder(MapExecutorRegistry.builder().build())
                .configuration(ConvoflowConfiguration.defaults())
                .metrics(FlowMetrics.noop())
                .build();
        registry = new FlowRegistry(engine);
    }

    private static FlowDefinition flow(String id, String module, String trigger) {
        return FlowDefinition.builder(id)
                .module(module)
                .trigger(trigger)
                .initialState("start")
                .finalState("start")
                .state(FlowState.builder("start", StateType.END).build())
                .build();
    }

    @Test
    void testRegisterAndGet() throws Exception {
        registry.register(flow("food_order_v1", "food", "order_food"));

        assertEquals(1, registry.size());
        assertTrue(registry.get("food_order_v1").isPresent());
        assertTrue(registry.get("missing").isEmpty());
    }

    @Test
    void testRegisterRejectsInvalidFlow() {
        FlowDefinition broken = FlowDefinition.builder("broken")
                .initialState("nowhere")
                .state(FlowState.builder("start", StateType.END).build())
                .build();

        FlowDefinitionException e = assertThrows(FlowDefinitionException.class, () -> registry.register(broken));

        assertEquals("broken", e.getFlowId());
        assertTrue(e.getMessage().contains("Initial state 'nowhere' not found"));
        assertEquals(0, registry.size());
    }

    @Test
    void testReplaceAndUnregister() throws Exception {
        registry.register(flow("auth", "auth", "login"));
        registry.register(flow("auth", "auth", "sign_in"));

        assertEquals(1, registry.size());
        assertEquals("sign_in", registry.get("auth").orElseThrow().getTrigger());

        assertTrue(registry.unregister("auth"));
        assertFalse(registry.unregister("auth"));
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void testFindByTriggerMatchingOrder() throws Exception {
        registry.register(flow("menu_pipe", "food", "browse|show_menu"));
        registry.register(flow("menu_prefixed", "food", "intent.show_menu"));
        registry.register(flow("menu_exact", "food", "show_menu"));

        assertEquals("menu_exact", registry.findByTrigger("SHOW_MENU").orElseThrow().getId());

        registry.unregister("menu_exact");
        assertEquals("menu_prefixed", registry.findByTrigger("show_menu").orElseThrow().getId());

        registry.unregister("menu_prefixed");
        assertEquals("menu_pipe", registry.findByTrigger("show_menu").orElseThrow().getId());
        assertEquals("menu_pipe", registry.findByTrigger("browse").orElseThrow().getId());
    }

    @Test
    void testFindByTriggerWithinModule() throws Exception {
        registry.register(flow("food_track", "food", "track_order"));
        registry.register(flow("parcel_track", "parcel", "track_order"));

        assertEquals("parcel_track", registry.findByTrigger("track_order", "parcel").orElseThrow().getId());
        assertEquals("food_track", registry.findByTrigger("track_order").orElseThrow().getId());
        assertTrue(registry.findByTrigger("track_order", "rides").isEmpty());
    }

    @Test
    void testFindByTriggerIgnoresBlankIntent() throws Exception {
        registry.register(flow("greeting", null, "greet"));

        assertTrue(registry.findByTrigger(" ").isEmpty());
        assertTrue(registry.findByTrigger(null).isEmpty());
        assertTrue(registry.findByTrigger("farewell").isEmpty());
    }
}
