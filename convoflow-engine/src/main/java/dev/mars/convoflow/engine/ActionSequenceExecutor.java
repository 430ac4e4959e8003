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

import dev.mars.convoflow.context.ContextService;
import dev.mars.convoflow.core.ActionExecutionResult;
import dev.mars.convoflow.core.ErrorRecord;
import dev.mars.convoflow.core.ErrorStrategy;
import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.executor.ExecutorRegistry;
import dev.mars.convoflow.monitoring.FlowMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a list of actions strictly in order, applying each action's retry and
 * error policy. Each config is interpolated right before its action runs, so
 * outputs written by earlier actions are visible to later ones.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class ActionSequenceExecutor {

    private static final Logger logger = Logger.getLogger(ActionSequenceExecutor.class.getName());

    private final ExecutorRegistry registry;
    private final ContextService contextService;
    private final DelayScheduler delayScheduler;
    private final Duration baseDelay;
    private final FlowMetrics metrics;

    ActionSequenceExecutor(ExecutorRegistry registry, ContextService contextService,
                           DelayScheduler delayScheduler, Duration baseDelay, FlowMetrics metrics) {
        this.registry = registry;
        this.contextService = contextService;
        this.delayScheduler = delayScheduler;
        this.baseDelay = baseDelay;
        this.metrics = metrics;
    }

    CompletableFuture<ActionSequenceResult> execute(List<FlowAction> actions, ExecutionContext context,
                                                    String stateName) {
        if (actions.isEmpty()) {
            return CompletableFuture.completedFuture(ActionSequenceResult.empty());
        }
        return runFrom(0, actions, context, stateName, new ArrayList<>());
    }

    private CompletableFuture<ActionSequenceResult> runFrom(int index, List<FlowAction> actions,
                                                            ExecutionContext context, String stateName,
                                                            List<ActionExecutionResult> results) {
        if (index >= actions.size()) {
            return CompletableFuture.completedFuture(new ActionSequenceResult(results, null));
        }

        FlowAction action = actions.get(index);
        return runAction(action, context).thenCompose(result -> {
            results.add(result);

            if (action.getOutput() != null && result.getOutput() != null) {
                contextService.set(context, action.getOutput(), result.getOutput());
            }

            if (!result.isSuccess()) {
                String abortError = handleFailure(action, result, context, stateName);
                if (abortError != null) {
                    return CompletableFuture.completedFuture(new ActionSequenceResult(results, abortError));
                }
            }

            return runFrom(index + 1, actions, context, stateName, results);
        });
    }

    private CompletableFuture<ActionExecutionResult> runAction(FlowAction action, ExecutionContext context) {
        Map<String, Object> config;
        try {
            config = contextService.interpolateConfig(action.getConfig(), context);
        } catch (RuntimeException e) {
            logger.warning("Config interpolation failed for action " + action.getId() + ": " + e.getMessage());
            return CompletableFuture.completedFuture(
                    ActionExecutionResult.failure("Config interpolation failed: " + e.getMessage()));
        }
        return attempt(action, config, context, 1);
    }

    private CompletableFuture<ActionExecutionResult> attempt(FlowAction action, Map<String, Object> config,
                                                             ExecutionContext context, int attempt) {
        int maxRetries = action.getEffectiveMaxRetries();
        metrics.recordActionExecuted(action.getExecutor());

        return invoke(action.getExecutor(), config, context).thenCompose(result -> {
            if (result.isSuccess() || !action.isRetryEnabled() || attempt > maxRetries) {
                return CompletableFuture.completedFuture(result);
            }

            Duration delay = RetryBackoff.delayFor(baseDelay, attempt);
            logger.warning("Action " + action.getExecutor() + " failed (attempt " + attempt + "/" +
                    (maxRetries + 1) + "), retrying in " + delay.toMillis() + "ms: " +
                    result.getError().orElse("unknown error"));
            metrics.recordActionRetry(action.getExecutor());

            return delayScheduler.delay(delay)
                    .thenCompose(ignored -> attempt(action, config, context, attempt + 1));
        });
    }

    /**
     * Calls the registry and folds thrown or exceptional outcomes into a failure result.
     */
    private CompletableFuture<ActionExecutionResult> invoke(String executor, Map<String, Object> config,
                                                            ExecutionContext context) {
        CompletableFuture<ActionExecutionResult> future;
        try {
            future = registry.execute(executor, config, context);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(
                    ActionExecutionResult.failure("Executor " + executor + " returned no result"));
        }
        return future.handle((result, throwable) -> {
            if (throwable != null) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Executor " + executor + " threw", Futures.unwrap(throwable));
                }
                return ActionExecutionResult.failure(Futures.message(throwable));
            }
            return result != null ? result : ActionExecutionResult.failure("Executor " + executor + " returned no result");
        });
    }

    /**
     * Records the failure and decides whether the sequence continues.
     *
     * @return the abort message, or {@code null} to continue with the next action
     */
    private String handleFailure(FlowAction action, ActionExecutionResult result,
                                 ExecutionContext context, String stateName) {
        ErrorStrategy strategy = action.getOnError();
        String message = result.getError().orElse("Unknown executor error");

        contextService.recordError(context, new ErrorRecord(stateName, action.getExecutor(), message,
                strategy.isRecoverable(), action.isRetryEnabled(), Instant.now()));
        metrics.recordActionFailed(action.getExecutor());

        switch (strategy) {
            case CONTINUE:
            case SKIP:
                logger.warning("Executor " + action.getExecutor() + " failed but continuing: " + message);
                return null;
            case RETRY:
                logger.severe("Executor " + action.getExecutor() + " failed after retries: " + message);
                return "Max retries exceeded: " + message;
            case FAIL:
            default:
                logger.severe("Executor " + action.getExecutor() + " failed (strategy: fail): " + message);
                return message;
        }
    }
}
