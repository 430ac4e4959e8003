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
import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateValidatorConfig;
import dev.mars.convoflow.monitoring.FlowMetrics;
import dev.mars.convoflow.validation.InputValidationResult;
import dev.mars.convoflow.validation.InputValidator;

import java.util.logging.Logger;

/**
 * Validates raw input for a wait state resumed with an event, tracking
 * consecutive failures per state in {@code _validation_failures.<state>}.
 */
class InputValidationGate {

    private static final Logger logger = Logger.getLogger(InputValidationGate.class.getName());

    static final String FAILURES_PREFIX = "_validation_failures.";
    static final String VALIDATION_ERROR = "_validation_error";
    static final String SUGGESTED_RESPONSE = "_validation_suggested_response";
    static final String DEFAULT_OUTPUT = "_validated_input";

    private final InputValidator validator;
    private final ContextService contextService;
    private final int defaultMaxFailures;
    private final FlowMetrics metrics;

    InputValidationGate(InputValidator validator, ContextService contextService,
                        int defaultMaxFailures, FlowMetrics metrics) {
        this.validator = validator;
        this.contextService = contextService;
        this.defaultMaxFailures = defaultMaxFailures;
        this.metrics = metrics;
    }

    ValidationOutcome apply(FlowDefinition flow, FlowState state, ExecutionContext context) {
        StateValidatorConfig config = state.getValidator();
        String counterPath = FAILURES_PREFIX + state.getName();
        InputValidationResult result = validator.validate(config, context);

        if (result.isValid()) {
            String output = config.getOutput() != null ? config.getOutput() : DEFAULT_OUTPUT;
            contextService.set(context, output, result.getExtractedValue());
            contextService.set(context, counterPath, 0);
            contextService.remove(context, VALIDATION_ERROR);
            contextService.remove(context, SUGGESTED_RESPONSE);
            return ValidationOutcome.passed();
        }

        int failures = contextService.getInt(context, counterPath, 0) + 1;
        int maxFailures = config.getMaxFailures() != null ? config.getMaxFailures() : defaultMaxFailures;
        String reason = result.getReason().orElse("Invalid input");
        String suggestion = result.getSuggestedResponse().orElse(null);

        contextService.set(context, counterPath, failures);
        contextService.set(context, VALIDATION_ERROR, reason);
        if (suggestion != null) {
            contextService.set(context, SUGGESTED_RESPONSE, suggestion);
        } else {
            contextService.remove(context, SUGGESTED_RESPONSE);
        }
        metrics.recordValidationFailure(flow.getId(), state.getName());

        if (failures >= maxFailures && config.getOnInvalidTransition() != null) {
            logger.warning("Validation failed " + failures + " times in state " + state.getName() +
                    ", moving to " + config.getOnInvalidTransition());
            contextService.set(context, counterPath, 0);
            return ValidationOutcome.escalated(reason, suggestion, failures, config.getOnInvalidTransition());
        }

        logger.info("Validation failed in state " + state.getName() + " (" + failures + "/" + maxFailures + "): " + reason);
        return ValidationOutcome.rejected(reason, suggestion, failures);
    }
}
