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
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.StateValidatorConfig;
import dev.mars.convoflow.core.ValidationResult;
import dev.mars.convoflow.executor.MapExecutorRegistry;
import dev.mars.convoflow.monitoring.FlowMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Load-time checks performed by {@link StateMachineEngine#validateFlow}.
 */
class FlowValidationTest {

    private StateMachineEngine engine;

    @BeforeEach
    void setUp() {
        MapExecutorRegistry registry = MapExecutorRegistry.builder()
                .register("send_message", new MessageExecutor())
                .register("php_api", new ScriptedExecutor().requiring("endpoint"))
                .build();
        engine = StateMachineEngine.builder(registry)
                .configuration(ConvoflowConfiguration.defaults())
                .metrics(FlowMetrics.noop())
                .build();
    }

    private FlowDefinition validFlow() {
        return FlowDefinition.builder("greeting")
                .initialState("greet")
                .finalState("done")
                .state(FlowState.builder("greet", StateType.ACTION)
                        .action(FlowAction.builder("send_message").config(Map.of("text", "Hi")).build())
                        .transition("success", "ask")
                        .build())
                .state(FlowState.builder("ask", StateType.WAIT)
                        .validator(new StateValidatorConfig("text", Map.of(), 3, "done", "answer"))
                        .transition("user_message", "done")
                        .build())
                .state(FlowState.builder("done", StateType.END).build())
                .build();
    }

    @Test
    void testValidFlow() {
        ValidationResult result = engine.validateFlow(validFlow());

        assertTrue(result.isValid());
        assertEquals(0, result.getErrorCount());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testEmptyStates() {
        ValidationResult result = engine.validateFlow(FlowDefinition.builder("empty").initialState("start").build());

        assertFalse(result.isValid());
        assertEquals(List.of("Flow states is missing or empty"), result.getErrorMessages());
    }

    @Test
    void testMissingInitialAndFinalStates() {
        FlowDefinition flow = FlowDefinition.builder("broken")
                .initialState("start")
                .finalState("finish")
                .state(FlowState.builder("only", StateType.END).build())
                .build();

        ValidationResult result = engine.validateFlow(flow);

        assertEquals(List.of(
                "Initial state 'start' not found",
                "Final state 'finish' not found"), result.getErrorMessages());
    }

    @Test
    void testDanglingTransitionAndValidatorTarget() {
        FlowDefinition flow = FlowDefinition.builder("dangling")
                .initialState("ask")
                .state(FlowState.builder("ask", StateType.WAIT)
                        .validator(new StateValidatorConfig("text", Map.of(), 2, "human_agent", null))
                        .transition("user_message", "confirm")
                        .build())
                .build();

        ValidationResult result = engine.validateFlow(flow);

        assertEquals(List.of(
                "State 'ask' transition 'user_message' points to non-existent state 'confirm'",
                "State 'ask' validator points to non-existent state 'human_agent'"), result.getErrorMessages());
    }

    @Test
    void testUnknownExecutorAndInvalidConfig() {
        FlowDefinition flow = FlowDefinition.builder("orders")
                .initialState("fetch")
                .state(FlowState.builder("fetch", StateType.ACTION)
                        .onEntry(FlowAction.builder("typing_indicator").build())
                        .action(FlowAction.builder("php_api").id("get_menu").config(Map.of("method", "GET")).build())
                        .build())
                .build();

        ValidationResult result = engine.validateFlow(flow);

        assertEquals(List.of(
                "State 'fetch' uses unknown executor 'typing_indicator'",
                "State 'fetch' action 'get_menu' has invalid config for executor 'php_api'"),
                result.getErrorMessages());
    }

    @Test
    void testDecisionWithoutConditionsIsWarning() {
        FlowDefinition flow = FlowDefinition.builder("routing")
                .initialState("route")
                .state(FlowState.builder("route", StateType.DECISION).transition("default", "end").build())
                .state(FlowState.builder("end", StateType.END).build())
                .build();

        ValidationResult result = engine.validateFlow(flow);

        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
        assertEquals("states.route.conditions", result.getWarnings().get(0).getFieldPath());
    }

    @Test
    void testValidationIsDeterministic() {
        FlowDefinition flow = FlowDefinition.builder("broken")
                .initialState("missing")
                .state(FlowState.builder("a", StateType.WAIT).transition("x", "nowhere").build())
                .state(FlowState.builder("b", StateType.ACTION)
                        .action(FlowAction.builder("unknown").build())
                        .build())
                .build();

        ValidationResult first = engine.validateFlow(flow);
        ValidationResult second = engine.validateFlow(flow);

        assertEquals(3, first.getErrorCount());
        assertEquals(first.getErrorMessages(), second.getErrorMessages());
    }

    @Test
    void testValidationDoesNotExecuteActions() {
        ScriptedExecutor executor = new ScriptedExecutor();
        StateMachineEngine recording = StateMachineEngine.builder(
                        MapExecutorRegistry.builder().register("send_message", executor).build())
                .configuration(ConvoflowConfiguration.defaults())
                .metrics(FlowMetrics.noop())
                .build();

        recording.validateFlow(validFlow());

        assertEquals(0, executor.getCallCount());
    }
}
