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

package dev.mars.convoflow.engine.yaml;

import dev.mars.convoflow.core.ErrorStrategy;
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.core.FlowCondition;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.StateValidatorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlFlowDefinitionParserTest {

    private YamlFlowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlFlowDefinitionParser();
    }

    private Path resource(String name) throws Exception {
        return Paths.get(getClass().getResource("/flows/" + name).toURI());
    }

    @Test
    void testParseCompleteFlow() throws Exception {
        FlowDefinition flow = parser.parse(resource("food_order.yaml"));

        assertEquals("food_order_v1", flow.getId());
        assertEquals("Food Order", flow.getName());
        assertEquals("2.1.0", flow.getVersion());
        assertEquals("food", flow.getModule());
        assertEquals("intent.order_food", flow.getTrigger());
        assertEquals("food_order", flow.getContextSchema());
        assertEquals("check_location", flow.getInitialState());
        assertEquals(List.of("completed", "cancelled"), flow.getFinalStates());
        assertEquals(List.of("check_location", "ask_location", "search_restaurants", "completed", "cancelled"),
                List.copyOf(flow.getStates().keySet()));
    }

    @Test
    void testParseDecisionState() throws Exception {
        FlowState state = parser.parse(resource("food_order.yaml")).getState("check_location");

        assertEquals(StateType.DECISION, state.getType());
        assertEquals(List.of(new FlowCondition("location != null", "has_location")), state.getConditions());
        assertEquals(List.of("has_location", "default"), List.copyOf(state.getTransitions().keySet()));
    }

    @Test
    void testParseWaitStateWithValidator() throws Exception {
        FlowState state = parser.parse(resource("food_order.yaml")).getState("ask_location");

        assertEquals(StateType.WAIT, state.getType());
        assertEquals(1, state.getOnEntry().size());
        assertEquals("send_message", state.getOnEntry().get(0).getId());

        StateValidatorConfig validator = state.getValidator();
        assertEquals("text", validator.getType());
        assertEquals(Map.of("minLength", 3), validator.getConfig());
        assertEquals(Integer.valueOf(2), validator.getMaxFailures());
        assertEquals("cancelled", validator.getOnInvalidTransition());
        assertEquals("location_text", validator.getOutput());
    }

    @Test
    void testParseActionPolicies() throws Exception {
        FlowState state = parser.parse(resource("food_order.yaml")).getState("search_restaurants");

        FlowAction search = state.getActions().get(0);
        assertEquals("search", search.getId());
        assertEquals("php_api", search.getExecutor());
        assertEquals("{{search_query || 'popular'}}", search.getConfig().get("query"));
        assertEquals("restaurants", search.getOutput());
        assertEquals(ErrorStrategy.RETRY, search.getOnError());
        assertEquals(2, search.getEffectiveMaxRetries());

        FlowAction notify = state.getActions().get(1);
        assertEquals(ErrorStrategy.CONTINUE, notify.getOnError());
        assertFalse(notify.isRetryEnabled());

        FlowAction analytics = state.getOnExit().get(0);
        assertEquals(ErrorStrategy.FAIL, analytics.getOnError());
        assertTrue(analytics.isRetryEnabled());
        assertEquals(1, analytics.getEffectiveMaxRetries());
    }

    @Test
    void testSingleFinalStateString() throws Exception {
        FlowDefinition flow = parser.parseFromString(
                "id: tiny\n" +
                "initialState: end\n" +
                "finalStates: end\n" +
                "states:\n" +
                "  end:\n" +
                "    type: final\n");

        assertEquals(List.of("end"), flow.getFinalStates());
        assertEquals(StateType.FINAL, flow.getState("end").getType());
        assertEquals("1.0.0", flow.getVersion());
    }

    @Test
    void testMissingIdRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "initialState: a\nstates:\n  a:\n    type: end\n"));

        assertEquals("id", e.getFieldPath());
        assertEquals("Field 'id': Flow id is required", e.getMessage());
    }

    @Test
    void testMissingStatesRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "id: empty\ninitialState: a\n"));

        assertEquals("empty", e.getFlowId());
        assertEquals("states", e.getFieldPath());
    }

    @Test
    void testUnknownStateTypeRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "id: f\ninitialState: a\nstates:\n  a:\n    type: parallel\n"));

        assertEquals("states.a.type", e.getFieldPath());
        assertTrue(e.getMessage().startsWith("Flow 'f': Field 'states.a.type': "));
    }

    @Test
    void testActionWithoutExecutorRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "id: f\ninitialState: a\nstates:\n  a:\n    type: action\n    actions:\n      - id: x\n"));

        assertEquals("states.a.actions[0].executor", e.getFieldPath());
    }

    @Test
    void testUnknownErrorStrategyRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "id: f\ninitialState: a\nstates:\n  a:\n    type: action\n    onEntry:\n" +
                "      - executor: api\n        onError: explode\n"));

        assertEquals("states.a.onEntry[0].onError", e.getFieldPath());
    }

    @Test
    void testIncompleteConditionRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "id: f\ninitialState: a\nstates:\n  a:\n    type: decision\n    conditions:\n" +
                "      - expression: \"x > 1\"\n"));

        assertEquals("states.a.conditions[0]", e.getFieldPath());
    }

    @Test
    void testValidatorWithoutTypeRejected() {
        FlowParseException e = assertThrows(FlowParseException.class, () -> parser.parseFromString(
                "id: f\ninitialState: a\nstates:\n  a:\n    type: wait\n    validator:\n      maxFailures: 2\n"));

        assertEquals("states.a.validator.type", e.getFieldPath());
    }

    @Test
    void testYesNoAndNumericTransitionKeysStayStrings() throws Exception {
        FlowDefinition flow = parser.parseFromString(
                "id: confirm_order\n" +
                "initialState: confirm\n" +
                "finalStates: [placed, off]\n" +
                "states:\n" +
                "  confirm:\n" +
                "    type: wait\n" +
                "    transitions:\n" +
                "      yes: placed\n" +
                "      no: confirm\n" +
                "      1: placed\n" +
                "      on: off\n" +
                "  placed:\n" +
                "    type: end\n" +
                "  off:\n" +
                "    type: end\n" +
                "    onEntry:\n" +
                "      - executor: notify\n" +
                "        retryOnError: true\n");

        FlowState confirm = flow.getState("confirm");
        assertEquals(Map.of("yes", "placed", "no", "confirm", "1", "placed", "on", "off"),
                confirm.getTransitions());
        assertEquals(List.of("placed", "off"), flow.getFinalStates());
        assertTrue(flow.hasState("off"));
        assertTrue(flow.getState("off").getOnEntry().get(0).isRetryEnabled());
    }

    @Test
    void testMalformedYamlRejected() {
        assertThrows(FlowParseException.class, () -> parser.parseFromString("id: [unclosed"));
        assertThrows(FlowParseException.class, () -> parser.parseFromString(""));
    }

    @Test
    void testMissingFileRejected() {
        FlowParseException e = assertThrows(FlowParseException.class,
                () -> parser.parse(Paths.get("does-not-exist.yaml")));

        assertTrue(e.getMessage().contains("does-not-exist.yaml"));
    }
}
