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
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateExecutionResult;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.ValidationResult;
import dev.mars.convoflow.core.exceptions.FlowDefinitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Drives a whole user turn on top of {@link FlowEngine#executeState}.
 * <p>
 * After the first state of a turn runs, action and decision states are entered
 * and executed automatically until the flow reaches a wait state, completes,
 * or stops transitioning. A wait state is executed once on entry so its prompts
 * run, then the turn ends.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowRunner {

    private static final Logger logger = Logger.getLogger(FlowRunner.class.getName());

    public static final String USER_MESSAGE = "_user_message";
    public static final String LAST_MESSAGE_AT = "_last_message_at";
    public static final String LAST_RESPONSE = "_last_response";
    public static final String USER_MESSAGE_EVENT = "user_message";

    private final FlowEngine engine;
    private final ContextService contextService;
    private final int maxAutoIterations;

    public FlowRunner(FlowEngine engine) {
        this(engine, new ContextService(), new ConvoflowConfiguration());
    }

    public FlowRunner(FlowEngine engine, ContextService contextService, ConvoflowConfiguration configuration) {
        this.engine = Objects.requireNonNull(engine, "Flow engine cannot be null");
        this.contextService = Objects.requireNonNull(contextService, "Context service cannot be null");
        this.maxAutoIterations = Objects.requireNonNull(configuration, "Configuration cannot be null")
                .getMaxAutoIterations();
    }

    /**
     * Starts a flow from its initial state.
     *
     * @throws FlowDefinitionException if the flow fails validation
     */
    public CompletableFuture<TurnResult> start(FlowDefinition flow, ExecutionContext context)
            throws FlowDefinitionException {
        ValidationResult validation = engine.validateFlow(flow);
        if (!validation.isValid()) {
            throw new FlowDefinitionException(flow.getId(), validation.getErrorMessages());
        }

        logger.info("Starting flow " + flow.getId() + " for session " + context.getSessionId());
        contextService.updateState(context, flow.getInitialState());
        List<String> steps = new ArrayList<>();
        steps.add(flow.getInitialState());

        return engine.executeState(flow, context, null)
                .thenCompose(result -> advance(flow, context, result, steps, 0));
    }

    /**
     * Resumes a flow with a new user message, using the {@code user_message} event.
     */
    public CompletableFuture<TurnResult> resume(FlowDefinition flow, ExecutionContext context, String message) {
        return resume(flow, context, message, USER_MESSAGE_EVENT);
    }

    public CompletableFuture<TurnResult> resume(FlowDefinition flow, ExecutionContext context,
                                                String message, String event) {
        String currentState = context.getCurrentState();
        if (currentState == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Session " + context.getSessionId() + " has no current state"));
        }

        contextService.set(context, USER_MESSAGE, message);
        contextService.set(context, LAST_MESSAGE_AT, Instant.now().toString());
        contextService.remove(context, LAST_RESPONSE);

        List<String> steps = new ArrayList<>();
        steps.add(currentState);

        return engine.executeState(flow, context, event != null ? event : USER_MESSAGE_EVENT)
                .thenCompose(result -> advance(flow, context, result, steps, 0));
    }

    private CompletableFuture<TurnResult> advance(FlowDefinition flow, ExecutionContext context,
                                                  StateExecutionResult result, List<String> steps,
                                                  int iterations) {
        String nextState = result.getNextState();
        if (nextState != null) {
            contextService.updateState(context, nextState);
        }
        if (nextState == null || result.isCompleted()) {
            return CompletableFuture.completedFuture(toTurnResult(flow, context, result, steps));
        }
        if (iterations >= maxAutoIterations) {
            logger.warning("Auto-advance limit of " + maxAutoIterations + " reached in flow " + flow.getId() +
                    " at state " + nextState);
            return CompletableFuture.completedFuture(toTurnResult(flow, context, result, steps));
        }

        FlowState state = flow.getState(nextState);
        StateType type = state != null ? state.getType() : null;
        if (type != StateType.ACTION && type != StateType.DECISION && type != StateType.WAIT) {
            return CompletableFuture.completedFuture(toTurnResult(flow, context, result, steps));
        }

        steps.add(nextState);
        return engine.executeState(flow, context, null).thenCompose(next -> {
            if (type == StateType.WAIT) {
                if (next.getNextState() != null) {
                    contextService.updateState(context, next.getNextState());
                }
                return CompletableFuture.completedFuture(toTurnResult(flow, context, next, steps));
            }
            return advance(flow, context, next, steps, iterations + 1);
        });
    }

    private TurnResult toTurnResult(FlowDefinition flow, ExecutionContext context,
                                    StateExecutionResult result, List<String> steps) {
        String currentState = context.getCurrentState();
        FlowState state = currentState != null ? flow.getState(currentState) : null;
        boolean completed = result.isCompleted()
                || flow.isFinalState(currentState)
                || (state != null && state.getType().isTerminal());

        Object response = contextService.get(context, LAST_RESPONSE);
        if (response == null) {
            response = result.getMetadata().get("suggestedResponse");
        }

        TurnResult turn = new TurnResult(flow.getId(), currentState, completed, result.getError().orElse(null),
                response != null ? response.toString() : null, steps, result);
        logger.info("Turn finished: " + turn);
        return turn;
    }
}
