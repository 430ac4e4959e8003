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
import dev.mars.convoflow.context.ContextValues;
import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Applies an out-of-band intent classification before a state runs.
 * <p>
 * Cancel intents redirect to the state's {@code cancel} transition or the
 * flow's first final state. Help intents only set {@code _help_requested}.
 * Any other intent is recorded in {@code _pending_flow_switch} for the caller.
 * The interrupt flag is cleared in every case.
 */
class IntentInterruptHandler {

    private static final Logger logger = Logger.getLogger(IntentInterruptHandler.class.getName());

    static final String INTERRUPT_FLAG = "_intent_interrupt";
    static final String CURRENT_INTENT = "_current_intent";
    static final String HELP_REQUESTED = "_help_requested";
    static final String PENDING_FLOW_SWITCH = "_pending_flow_switch";
    static final String CANCEL_EVENT = "cancel";

    private static final Set<String> CANCEL_INTENTS = Set.of("cancel", "stop", "reset");
    private static final Set<String> HELP_INTENTS = Set.of("help", "menu", "main_menu");

    private final ContextService contextService;

    IntentInterruptHandler(ContextService contextService) {
        this.contextService = contextService;
    }

    Optional<InterruptOutcome> handle(FlowDefinition flow, FlowState state, ExecutionContext context) {
        if (!ContextValues.isTruthy(contextService.get(context, INTERRUPT_FLAG))) {
            return Optional.empty();
        }
        Object rawIntent = contextService.get(context, CURRENT_INTENT);
        if (rawIntent == null || rawIntent.toString().isBlank()) {
            return Optional.empty();
        }

        String intent = rawIntent.toString().trim().toLowerCase(Locale.ROOT);
        contextService.set(context, INTERRUPT_FLAG, false);

        if (CANCEL_INTENTS.contains(intent)) {
            String target = state.getTransitions().get(CANCEL_EVENT);
            if (target == null) {
                target = flow.getFirstFinalState();
            }
            logger.info("Intent '" + intent + "' interrupts state " + state.getName() + " -> " +
                    (target != null ? target : "END"));
            return Optional.of(InterruptOutcome.cancel(intent, target));
        }

        if (HELP_INTENTS.contains(intent)) {
            contextService.set(context, HELP_REQUESTED, true);
            logger.info("Help requested in state " + state.getName());
            return Optional.of(InterruptOutcome.help(intent));
        }

        contextService.set(context, PENDING_FLOW_SWITCH, intent);
        logger.info("Intent '" + intent + "' recorded as pending flow switch from " + flow.getId());
        return Optional.of(InterruptOutcome.flowSwitch(intent));
    }
}
