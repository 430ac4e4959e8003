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
import dev.mars.convoflow.core.ActionExecutionResult;
import dev.mars.convoflow.core.ErrorStrategy;
import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateExecutionResult;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.executor.ActionExecutor;
import dev.mars.convoflow.executor.MapExecutorRegistry;
import dev.mars.convoflow.monitoring.FlowMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Many conversations sharing one engine, with real asynchronous executors and backoff.
 */
class ConcurrentSessionsTest {

    private StateMachineEngine engine;
    private FlowRunner runner;
    private FlowDefinition flow;

    @BeforeEach
    void setUp() {
        ActionExecutor slowEcho = (config, context) -> CompletableFuture.supplyAsync(
                () -> ActionExecutionResult.success("echo:" + config.get("value")),
                CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS));
        ActionExecutor unavailable = (config, context) ->
                CompletableFuture.completedFuture(ActionExecutionResult.failure("service unavailable"));

        Properties properties = new Properties();
        properties.setProperty(ConvoflowConfiguration.RETRY_BASE_DELAY_MS, "200");
        ConvoflowConfiguration configuration = new ConvoflowConfiguration(properties);

        engine = StateMachineEngine.builder(MapExecutorRegistry.builder()
                        .register("echo", slowEcho)
                        .register("unavailable", unavailable)
                        .build())
                .configuration(configuration)
                .metrics(FlowMetrics.noop())
                .build();
        runner = new FlowRunner(engine);

        flow = FlowDefinition.builder("echo_flow")
                .initialState("ask")
                .finalStates(List.of("done", "gave_up"))
                .state(FlowState.builder("ask", StateType.WAIT)
                        .transition("user_message", "echo")
                        .transition("flaky", "call_backend")
                        .build())
                .state(FlowState.builder("echo", StateType.ACTION)
                        .action(FlowAction.builder("echo")
                                .config(Map.of("value", "{{_user_message}}"))
                                .output("reply")
                                .build())
                        .transition("success", "done")
                        .build())
                .state(FlowState.builder("call_backend", StateType.ACTION)
                        .action(FlowAction.builder("unavailable").onError(ErrorStrategy.RETRY).maxRetries(1).build())
                        .transition("success", "done")
                        .transition("error", "gave_up")
                        .build())
                .state(FlowState.builder("done", StateType.END).build())
                .state(FlowState.builder("gave_up", StateType.END).build())
                .build();
    }

    private static ExecutionContext sessionAt(String id) {
        return ExecutionContext.builder().sessionId(id).flowId("echo_flow").currentState("ask").build();
    }

    @Test
    void testSessionsProgressIndependently() {
        List<ExecutionContext> contexts = new ArrayList<>();
        List<CompletableFuture<TurnResult>> turns = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            ExecutionContext context = sessionAt("session-" + i);
            contexts.add(context);
            turns.add(runner.resume(flow, context, "message " + i));
        }

        await().atMost(5, TimeUnit.SECONDS).until(() -> turns.stream().allMatch(CompletableFuture::isDone));

        for (int i = 0; i < contexts.size(); i++) {
            TurnResult turn = turns.get(i).join();
            assertTrue(turn.isCompleted());
            assertEquals("done", turn.getCurrentState());
            assertEquals("echo:message " + i, contexts.get(i).getData().get("reply"));
        }
    }

    @Test
    void testBackoffDoesNotBlockOtherSessions() {
        ExecutionContext waiting = sessionAt("backing-off");
        ExecutionContext other = sessionAt("other");

        CompletableFuture<TurnResult> slow = runner.resume(flow, waiting, "check status", "flaky");
        CompletableFuture<TurnResult> fast = runner.resume(flow, other, "hello");

        await().atMost(2, TimeUnit.SECONDS).until(fast::isDone);
        assertFalse(slow.isDone());
        assertEquals("done", fast.join().getCurrentState());

        await().atMost(5, TimeUnit.SECONDS).until(slow::isDone);
        TurnResult result = slow.join();
        assertEquals("gave_up", result.getCurrentState());
        assertEquals("Max retries exceeded: service unavailable", result.getError().orElseThrow());
    }

    @Test
    void testEngineIsReusableAcrossFlows() {
        StateExecutionResult first = engine.executeState(flow, sessionAt("a"), "user_message").join();
        StateExecutionResult second = engine.executeState(flow, sessionAt("b"), "flaky").join();

        assertEquals("echo", first.getNextState());
        assertEquals("call_backend", second.getNextState());
    }
}
