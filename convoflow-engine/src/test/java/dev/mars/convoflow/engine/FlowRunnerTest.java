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
import dev.mars.convoflow.context.ContextService;
import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.StateValidatorConfig;
import dev.mars.convoflow.core.exceptions.FlowDefinitionException;
import dev.mars.convoflow.executor.MapExecutorRegistry;
import dev.mars.convoflow.monitoring.FlowMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class FlowRunnerTest {

    private StateMachineEngine engine;
    private FlowRunner runner;
    private FlowDefinition greeting;

    @BeforeEach
    void setUp() {
        MapExecutorRegistry registry = MapExecutorRegistry.builder()
                .register("send_message", new MessageExecutor())
                .build();
        engine = StateMachineEngine.builder(registry)
                .delayScheduler(new RecordingDelayScheduler())
                .configuration(ConvoflowConfiguration.defaults())
                .metrics(FlowMetrics.noop())
                .build();
        runner = new FlowRunner(engine, new ContextService(), ConvoflowConfiguration.defaults());

        greeting = FlowDefinition.builder("greeting")
                .initialState("welcome")
                .finalStates(List.of("done", "denied"))
                .state(FlowState.builder("welcome", StateType.ACTION)
                        .action(message("Welcome!"))
                        .transition("success", "ask_name")
                        .build())
                .state(FlowState.builder("ask_name", StateType.WAIT)
                        .onEntry(message("What is your name?"))
                        .validator(new StateValidatorConfig("text", Map.of("minLength", 2), null, null, "name"))
                        .transition("user_message", "check")
                        .build())
                .state(FlowState.builder("check", StateType.DECISION)
                        .condition("name == 'admin'", "reserved")
                        .transition("reserved", "denied")
                        .transition("default", "greet")
                        .build())
                .state(FlowState.builder("greet", StateType.ACTION)
                        .action(message("Hello {{name}}"))
                        .transition("success", "done")
                        .build())
                .state(FlowState.builder("done", StateType.END).build())
                .state(FlowState.builder("denied", StateType.END).build())
                .build();
    }

    private static FlowAction message(String text) {
        return FlowAction.builder("send_message").config(Map.of("text", text)).build();
    }

    private static ExecutionContext newSession() {
        return ExecutionContext.builder().sessionId("session-1").flowId("greeting").build();
    }

    @Test
    void testStartRunsUntilWaitState() throws Exception {
        ExecutionContext context = newSession();

        TurnResult turn = runner.start(greeting, context).join();

        assertEquals("ask_name", turn.getCurrentState());
        assertEquals("ask_name", context.getCurrentState());
        assertFalse(turn.isCompleted());
        assertEquals(List.of("welcome", "ask_name"), turn.getSteps());
        assertEquals("What is your name?", turn.getResponse().orElseThrow());
        assertTrue(turn.getError().isEmpty());
    }

    @Test
    void testResumeCompletesConversation() throws Exception {
        ExecutionContext context = newSession();
        runner.start(greeting, context).join();

        TurnResult turn = runner.resume(greeting, context, "Bo").join();

        assertEquals("done", turn.getCurrentState());
        assertTrue(turn.isCompleted());
        assertEquals(List.of("ask_name", "check", "greet"), turn.getSteps());
        assertEquals("Hello Bo", turn.getResponse().orElseThrow());
        assertEquals("Bo", context.getData().get("_user_message"));
        assertNotNull(context.getData().get("_last_message_at"));
    }

    @Test
    void testDecisionRoutesToAlternativeEnd() throws Exception {
        ExecutionContext context = newSession();
        runner.start(greeting, context).join();

        TurnResult turn = runner.resume(greeting, context, "admin").join();

        assertEquals("denied", turn.getCurrentState());
        assertTrue(turn.isCompleted());
    }

    @Test
    void testRejectedInputKeepsState() throws Exception {
        ExecutionContext context = newSession();
        runner.start(greeting, context).join();

        TurnResult turn = runner.resume(greeting, context, "B").join();

        assertEquals("ask_name", turn.getCurrentState());
        assertFalse(turn.isCompleted());
        assertEquals("Input too short (min: 2)", turn.getError().orElseThrow());
        assertEquals("Please enter at least 2 characters.", turn.getResponse().orElseThrow());
        assertEquals(List.of("ask_name"), turn.getSteps());
    }

    @Test
    void testStartRejectsInvalidFlow() {
        FlowDefinition broken = FlowDefinition.builder("broken")
                .initialState("nowhere")
                .state(FlowState.builder("end", StateType.END).build())
                .build();

        FlowDefinitionException e = assertThrows(FlowDefinitionException.class,
                () -> runner.start(broken, newSession()));

        assertEquals(List.of("Initial state 'nowhere' not found"), e.getErrors());
    }

    @Test
    void testResumeWithoutCurrentStateFails() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> runner.resume(greeting, newSession(), "hello").join());

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testAutoAdvanceLimit() throws Exception {
        FlowDefinition loop = FlowDefinition.builder("loop")
                .initialState("a")
                .state(FlowState.builder("a", StateType.ACTION).action(message("a")).transition("success", "b").build())
                .state(FlowState.builder("b", StateType.ACTION).action(message("b")).transition("success", "a").build())
                .build();
        Properties properties = new Properties();
        properties.setProperty(ConvoflowConfiguration.MAX_AUTO_ITERATIONS, "3");
        FlowRunner limited = new FlowRunner(engine, new ContextService(), new ConvoflowConfiguration(properties));
        ExecutionContext context = newSession();

        TurnResult turn = limited.start(loop, context).join();

        assertEquals(List.of("a", "b", "a", "b"), turn.getSteps());
        assertEquals("a", turn.getCurrentState());
        assertFalse(turn.isCompleted());
    }
}
