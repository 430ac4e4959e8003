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
import dev.mars.convoflow.core.ErrorRecord;
import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.core.FlowCondition;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateExecutionResult;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.ValidationResult;
import dev.mars.convoflow.executor.ExecutorRegistry;
import dev.mars.convoflow.monitoring.FlowMetrics;
import dev.mars.convoflow.validation.ContextSchemaValidator;
import dev.mars.convoflow.validation.InputValidator;
import dev.mars.convoflow.validation.NoOpContextSchemaValidator;
import dev.mars.convoflow.validation.RuleBasedInputValidator;
import dev.mars.convoflow.validation.SchemaValidationOptions;
import dev.mars.convoflow.validation.SchemaValidationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes exactly one state transition per call.
 * <p>
 * A call checks for an intent interruption, runs entry actions on first entry,
 * gates resumed wait states on input validation, runs the state body, resolves
 * the triggered event and next state, and runs exit actions when leaving.
 * The engine holds no per-conversation state, so one instance serves all sessions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StateMachineEngine implements FlowEngine {

    private static final Logger logger = Logger.getLogger(StateMachineEngine.class.getName());

    static final String DEFAULT_EVENT = "default";
    static final String SUCCESS_EVENT = "success";
    static final String ERROR_EVENT = "error";
    static final String COMPLETED_EVENT = "completed";
    static final String VALIDATION_FAILED_EVENT = "validation_failed";

    private final ExecutorRegistry registry;
    private final ContextService contextService;
    private final ContextSchemaValidator schemaValidator;
    private final ConvoflowConfiguration configuration;
    private final FlowMetrics metrics;
    private final ActionSequenceExecutor actionExecutor;
    private final IntentInterruptHandler interruptHandler;
    private final InputValidationGate validationGate;

    public StateMachineEngine(ExecutorRegistry registry) {
        this(builder(registry));
    }

    private StateMachineEngine(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "Executor registry cannot be null");
        this.configuration = builder.configuration != null ? builder.configuration : new ConvoflowConfiguration();
        this.contextService = builder.contextService != null ? builder.contextService : new ContextService();
        this.schemaValidator = builder.schemaValidator != null ? builder.schemaValidator : NoOpContextSchemaValidator.INSTANCE;
        this.metrics = builder.metrics != null ? builder.metrics
                : configuration.isMetricsEnabled() ? FlowMetrics.getInstance() : FlowMetrics.noop();

        InputValidator inputValidator = builder.inputValidator != null ? builder.inputValidator : new RuleBasedInputValidator();
        DelayScheduler delayScheduler = builder.delayScheduler != null ? builder.delayScheduler : new DelayedExecutorScheduler();
        Duration baseDelay = configuration.getRetryBaseDelay();

        this.actionExecutor = new ActionSequenceExecutor(registry, contextService, delayScheduler, baseDelay, metrics);
        this.interruptHandler = new IntentInterruptHandler(contextService);
        this.validationGate = new InputValidationGate(inputValidator, contextService,
                configuration.getValidationMaxFailures(), metrics);
    }

    public static Builder builder(ExecutorRegistry registry) {
        return new Builder(registry);
    }

    @Override
    public CompletableFuture<StateExecutionResult> executeState(FlowDefinition flow, ExecutionContext context,
                                                                String event) {
        Objects.requireNonNull(flow, "Flow definition cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");

        String stateName = context.getCurrentState();
        FlowState state = stateName != null ? flow.getState(stateName) : null;
        if (state == null) {
            logger.severe("State not found: " + stateName + " in flow " + flow.getId());
            return CompletableFuture.completedFuture(StateExecutionResult.builder(context)
                    .completed(true)
                    .error("State not found: " + stateName)
                    .build());
        }

        Instant startTime = Instant.now();
        metrics.recordTurnStarted(flow.getId(), state.getType().id());

        CompletableFuture<StateExecutionResult> turn;
        try {
            turn = executeInternal(flow, state, context, event);
        } catch (RuntimeException e) {
            turn = CompletableFuture.failedFuture(e);
        }

        return turn.handle((result, throwable) -> {
            StateExecutionResult outcome = throwable == null
                    ? result
                    : engineFailure(context, stateName, throwable);
            outcome = checkContextSchema(flow, outcome);
            double seconds = Duration.between(startTime, Instant.now()).toNanos() / 1_000_000_000.0;
            metrics.recordTurnCompleted(flow.getId(), state.getType().id(), seconds, outcome.hasError());
            return outcome;
        });
    }

    private CompletableFuture<StateExecutionResult> executeInternal(FlowDefinition flow, FlowState state,
                                                                    ExecutionContext context, String event) {
        logger.info("Executing state: " + state.getName() + " (type: " + state.getType().id() + ")" +
                (event != null ? " with event: " + event : ""));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("state", state.getName());
        metadata.put("stateType", state.getType().id());

        Optional<InterruptOutcome> interrupt = interruptHandler.handle(flow, state, context);
        if (interrupt.isPresent()) {
            metrics.recordInterrupt(flow.getId(), interrupt.get().getIntent());
            metadata.put("interrupt", interrupt.get().getIntent());
            if (interrupt.get().isCancel()) {
                return CompletableFuture.completedFuture(cancelResult(flow, context, interrupt.get(), metadata));
            }
        }

        CompletableFuture<ActionSequenceResult> entry = event == null
                ? actionExecutor.execute(state.getOnEntry(), context, state.getName())
                : CompletableFuture.completedFuture(ActionSequenceResult.empty());

        return entry.thenCompose(entryResult -> {
            if (entryResult.isAborted()) {
                return abort(state, context, entryResult.getAbortError(), metadata);
            }

            if (state.getType() == StateType.WAIT && event != null && state.getValidator() != null) {
                ValidationOutcome validation = validationGate.apply(flow, state, context);
                switch (validation.getKind()) {
                    case REJECTED:
                        return CompletableFuture.completedFuture(rejectResult(context, event, validation, metadata));
                    case ESCALATED:
                        metadata.put("validationError", validation.getReason());
                        metadata.put("validationFailures", validation.getFailureCount());
                        return leave(flow, state, context, VALIDATION_FAILED_EVENT, validation.getTarget(), metadata);
                    case PASSED:
                    default:
                        break;
                }
            }

            return executeBody(flow, state, context, event, metadata);
        });
    }

    private CompletableFuture<StateExecutionResult> executeBody(FlowDefinition flow, FlowState state,
                                                                ExecutionContext context, String event,
                                                                Map<String, Object> metadata) {
        switch (state.getType()) {
            case ACTION:
                return actionExecutor.execute(state.getActions(), context, state.getName())
                        .thenCompose(actions -> actions.isAborted()
                                ? abort(state, context, actions.getAbortError(), metadata)
                                : finish(flow, state, context, resolveActionEvent(actions, event), metadata));
            case WAIT:
                if (event == null) {
                    logger.info("State " + state.getName() + " waiting for input");
                    return CompletableFuture.completedFuture(StateExecutionResult.builder(context)
                            .metadata(metadata)
                            .build());
                }
                return actionExecutor.execute(state.getActions(), context, state.getName())
                        .thenCompose(actions -> actions.isAborted()
                                ? abort(state, context, actions.getAbortError(), metadata)
                                : finish(flow, state, context, resolveResumedWaitEvent(actions, event), metadata));
            case DECISION:
                // A miss leaves the event undefined so the default transition applies.
                return finish(flow, state, context, evaluateConditions(state, context), metadata);
            case END:
            case FINAL:
            default:
                return finish(flow, state, context, COMPLETED_EVENT, metadata);
        }
    }

    /**
     * Explicit event first, then {@code success} when every action succeeded,
     * then {@code error} when any failed, else the incoming event.
     */
    String resolveActionEvent(ActionSequenceResult actions, String incomingEvent) {
        String explicit = actions.findExplicitEvent();
        if (explicit != null) {
            return explicit;
        }
        if (actions.allSucceeded()) {
            return SUCCESS_EVENT;
        }
        if (actions.anyFailed()) {
            return ERROR_EVENT;
        }
        return incomingEvent;
    }

    /**
     * A resumed wait state keeps its incoming event unless an action produced
     * something more specific than {@code default} or {@code success}.
     */
    String resolveResumedWaitEvent(ActionSequenceResult actions, String incomingEvent) {
        String actionEvent = actions.findExplicitEvent();
        if (actionEvent == null && actions.anyFailed()) {
            actionEvent = ERROR_EVENT;
        }
        if (actionEvent != null && !DEFAULT_EVENT.equals(actionEvent) && !SUCCESS_EVENT.equals(actionEvent)) {
            return actionEvent;
        }
        return incomingEvent;
    }

    private String evaluateConditions(FlowState state, ExecutionContext context) {
        for (FlowCondition condition : state.getConditions()) {
            if (contextService.evaluateExpression(context, condition.getExpression())) {
                logger.fine("Condition matched: " + condition.getExpression() + " -> " + condition.getEvent());
                return condition.getEvent();
            }
        }
        logger.fine("No condition matched in decision state " + state.getName());
        return null;
    }

    static String resolveNextState(FlowState state, String event) {
        Map<String, String> transitions = state.getTransitions();
        String target = event != null ? transitions.get(event) : null;
        if (target == null && !DEFAULT_EVENT.equals(event)) {
            target = transitions.get(DEFAULT_EVENT);
        }
        return target;
    }

    private CompletableFuture<StateExecutionResult> finish(FlowDefinition flow, FlowState state,
                                                           ExecutionContext context, String event,
                                                           Map<String, Object> metadata) {
        String nextState = resolveNextState(state, event);
        logger.fine("State " + state.getName() + " triggered event " + event + " -> " + nextState);
        return leave(flow, state, context, event, nextState, metadata);
    }

    private CompletableFuture<StateExecutionResult> leave(FlowDefinition flow, FlowState state,
                                                          ExecutionContext context, String event,
                                                          String nextState, Map<String, Object> metadata) {
        CompletableFuture<ActionSequenceResult> exit = nextState != null
                ? actionExecutor.execute(state.getOnExit(), context, state.getName())
                : CompletableFuture.completedFuture(ActionSequenceResult.empty());

        return exit.thenApply(exitResult -> {
            if (exitResult.isAborted()) {
                logger.severe("Exit actions of state " + state.getName() + " failed: " + exitResult.getAbortError());
                return StateExecutionResult.builder(context)
                        .event(ERROR_EVENT)
                        .error(exitResult.getAbortError())
                        .metadata(metadata)
                        .build();
            }

            boolean completed = (nextState != null && flow.isFinalState(nextState))
                    || (nextState == null && !state.hasTransitions());

            logger.info("State complete: " + state.getName() + " -> " + (nextState != null ? nextState : "STAY") +
                    " (event: " + (event != null ? event : "none") + ", completed: " + completed + ")");

            return StateExecutionResult.builder(context)
                    .nextState(nextState)
                    .event(event)
                    .completed(completed)
                    .metadata(metadata)
                    .build();
        });
    }

    /**
     * A failing {@code fail}/{@code retry} action stops the state. The error
     * transition is taken when declared, otherwise the conversation stays put.
     */
    private CompletableFuture<StateExecutionResult> abort(FlowState state, ExecutionContext context,
                                                          String error, Map<String, Object> metadata) {
        String nextState = state.getTransitions().get(ERROR_EVENT);
        logger.severe("State " + state.getName() + " aborted: " + error +
                (nextState != null ? " -> " + nextState : ""));

        CompletableFuture<ActionSequenceResult> exit = nextState != null
                ? actionExecutor.execute(state.getOnExit(), context, state.getName())
                : CompletableFuture.completedFuture(ActionSequenceResult.empty());

        return exit.thenApply(exitResult -> {
            if (exitResult.isAborted()) {
                logger.warning("Exit actions of state " + state.getName() + " failed during abort: " +
                        exitResult.getAbortError());
            }
            return StateExecutionResult.builder(context)
                    .nextState(nextState)
                    .event(ERROR_EVENT)
                    .completed(false)
                    .error(error)
                    .metadata(metadata)
                    .build();
        });
    }

    private StateExecutionResult cancelResult(FlowDefinition flow, ExecutionContext context,
                                              InterruptOutcome interrupt, Map<String, Object> metadata) {
        String target = interrupt.getTarget();
        boolean completed = target == null || flow.isFinalState(target);
        return StateExecutionResult.builder(context)
                .nextState(target)
                .event(IntentInterruptHandler.CANCEL_EVENT)
                .completed(completed)
                .metadata(metadata)
                .build();
    }

    private StateExecutionResult rejectResult(ExecutionContext context, String event,
                                              ValidationOutcome validation, Map<String, Object> metadata) {
        return StateExecutionResult.builder(context)
                .event(event)
                .completed(false)
                .error(validation.getReason())
                .metadata(metadata)
                .metadata("validationError", validation.getReason())
                .metadata("suggestedResponse", validation.getSuggestedResponse())
                .metadata("validationFailures", validation.getFailureCount())
                .build();
    }

    private StateExecutionResult engineFailure(ExecutionContext context, String stateName, Throwable throwable) {
        String message = Futures.message(throwable);
        logger.log(Level.SEVERE, "Error executing state " + stateName + ": " + message);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "State execution exception details for: " + stateName, Futures.unwrap(throwable));
        }
        try {
            contextService.recordError(context, ErrorRecord.engineError(stateName, message));
        } catch (RuntimeException e) {
            logger.warning("Failed to record engine error: " + e.getMessage());
        }
        return StateExecutionResult.builder(context)
                .completed(false)
                .error(message)
                .metadata("state", stateName)
                .build();
    }

    /**
     * Post-turn schema check. Violations are logged and reported in metadata only.
     */
    private StateExecutionResult checkContextSchema(FlowDefinition flow, StateExecutionResult result) {
        if (flow.getContextSchema() == null || !configuration.isSchemaValidationEnabled()) {
            return result;
        }
        try {
            SchemaValidationResult validation = schemaValidator.validate(flow.getContextSchema(),
                    result.getContext().getData(), SchemaValidationOptions.defaults());
            if (validation.isValid()) {
                return result;
            }
            logger.warning("Context schema '" + flow.getContextSchema() + "' violated in flow " + flow.getId() +
                    ": " + String.join("; ", validation.getErrors()));
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("schemaValid", false);
            extra.put("schemaErrors", validation.getErrors());
            return result.withMetadata(extra);
        } catch (RuntimeException e) {
            logger.warning("Context schema check failed for flow " + flow.getId() + ": " + e.getMessage());
            return result;
        }
    }

    @Override
    public ValidationResult validateFlow(FlowDefinition flow) {
        ValidationResult result = new ValidationResult();
        if (flow == null) {
            result.addError("Flow definition is missing");
            return result;
        }
        if (flow.getStates().isEmpty()) {
            result.addError("states", "Flow states is missing or empty");
            return result;
        }

        if (!flow.hasState(flow.getInitialState())) {
            result.addError("initialState", "Initial state '" + flow.getInitialState() + "' not found");
        }

        for (String finalState : flow.getFinalStates()) {
            if (!flow.hasState(finalState)) {
                result.addError("finalStates", "Final state '" + finalState + "' not found");
            }
        }

        for (Map.Entry<String, FlowState> entry : flow.getStates().entrySet()) {
            String stateName = entry.getKey();
            FlowState state = entry.getValue();
            String statePath = "states." + stateName;

            for (Map.Entry<String, String> transition : state.getTransitions().entrySet()) {
                String target = transition.getValue();
                if (target != null && !flow.hasState(target)) {
                    result.addError(statePath + ".transitions." + transition.getKey(),
                            "State '" + stateName + "' transition '" + transition.getKey() +
                            "' points to non-existent state '" + target + "'");
                }
            }

            if (state.getValidator() != null && state.getValidator().getOnInvalidTransition() != null
                    && !flow.hasState(state.getValidator().getOnInvalidTransition())) {
                result.addError(statePath + ".validator.onInvalidTransition",
                        "State '" + stateName + "' validator points to non-existent state '" +
                        state.getValidator().getOnInvalidTransition() + "'");
            }

            if (state.getType() == StateType.DECISION && state.getConditions().isEmpty()) {
                result.addWarning(statePath + ".conditions",
                        "Decision state '" + stateName + "' has no conditions");
            }

            for (FlowAction action : state.getAllActions()) {
                if (!registry.has(action.getExecutor())) {
                    result.addError(statePath, "State '" + stateName + "' uses unknown executor '" +
                            action.getExecutor() + "'");
                } else if (!registry.validateConfig(action.getExecutor(), action.getConfig())) {
                    result.addError(statePath, "State '" + stateName + "' action '" + action.getId() +
                            "' has invalid config for executor '" + action.getExecutor() + "'");
                }
            }
        }

        if (!result.isValid()) {
            logger.fine("Flow " + flow.getId() + " failed validation: " + result.getErrorMessages());
        }
        return result;
    }

    public static class Builder {
        private final ExecutorRegistry registry;
        private ContextService contextService;
        private InputValidator inputValidator;
        private ContextSchemaValidator schemaValidator;
        private DelayScheduler delayScheduler;
        private ConvoflowConfiguration configuration;
        private FlowMetrics metrics;

        private Builder(ExecutorRegistry registry) {
            this.registry = registry;
        }

        public Builder contextService(ContextService contextService) {
            this.contextService = contextService;
            return this;
        }

        public Builder inputValidator(InputValidator inputValidator) {
            this.inputValidator = inputValidator;
            return this;
        }

        public Builder schemaValidator(ContextSchemaValidator schemaValidator) {
            this.schemaValidator = schemaValidator;
            return this;
        }

        public Builder delayScheduler(DelayScheduler delayScheduler) {
            this.delayScheduler = delayScheduler;
            return this;
        }

        public Builder configuration(ConvoflowConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder metrics(FlowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public StateMachineEngine build() {
            return new StateMachineEngine(this);
        }
    }
}
