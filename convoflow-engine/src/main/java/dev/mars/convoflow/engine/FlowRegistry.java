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

import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.ValidationResult;
import dev.mars.convoflow.core.exceptions.FlowDefinitionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Validated flows by id, with lookup by trigger intent.
 * Triggers may list several intents separated by {@code |}.
 */
public class FlowRegistry {

    private static final Logger logger = Logger.getLogger(FlowRegistry.class.getName());

    private final FlowEngine engine;
    private final Map<String, FlowDefinition> flows = new LinkedHashMap<>();

    public FlowRegistry(FlowEngine engine) {
        this.engine = Objects.requireNonNull(engine, "Flow engine cannot be null");
    }

    /**
     * Validates and registers a flow, replacing any flow with the same id.
     *
     * @throws FlowDefinitionException listing every validation error
     */
    public synchronized void register(FlowDefinition flow) throws FlowDefinitionException {
        Objects.requireNonNull(flow, "Flow definition cannot be null");
        ValidationResult validation = engine.validateFlow(flow);
        if (!validation.isValid()) {
            logger.warning("Rejected flow " + flow.getId() + ": " + validation.getErrorMessages());
            throw new FlowDefinitionException(flow.getId(), validation.getErrorMessages());
        }
        for (ValidationResult.FlowIssue warning : validation.getWarnings()) {
            logger.warning("Flow " + flow.getId() + ": " + warning);
        }
        if (flows.put(flow.getId(), flow) != null) {
            logger.info("Replaced flow: " + flow.getId());
        } else {
            logger.info("Registered flow: " + flow.getId() + " (trigger: " + flow.getTrigger() + ")");
        }
    }

    public synchronized boolean unregister(String flowId) {
        return flows.remove(flowId) != null;
    }

    public synchronized Optional<FlowDefinition> get(String flowId) {
        return Optional.ofNullable(flows.get(flowId));
    }

    public synchronized List<FlowDefinition> list() {
        return List.copyOf(flows.values());
    }

    public Optional<FlowDefinition> findByTrigger(String intent) {
        return findByTrigger(intent, null);
    }

    /**
     * Finds a flow for an intent: an exact trigger match wins, then a
     * {@code intent.<name>} trigger, then any {@code |}-separated trigger entry.
     * When a module is given only flows of that module are considered.
     */
    public synchronized Optional<FlowDefinition> findByTrigger(String intent, String module) {
        if (intent == null || intent.isBlank()) {
            return Optional.empty();
        }
        String normalized = intent.trim().toLowerCase(Locale.ROOT);

        List<FlowDefinition> candidates = new ArrayList<>();
        for (FlowDefinition flow : flows.values()) {
            if (flow.getTrigger() != null && (module == null || module.equals(flow.getModule()))) {
                candidates.add(flow);
            }
        }

        for (FlowDefinition flow : candidates) {
            if (flow.getTrigger().equalsIgnoreCase(normalized)) {
                return Optional.of(flow);
            }
        }
        for (FlowDefinition flow : candidates) {
            if (flow.getTrigger().equalsIgnoreCase("intent." + normalized)) {
                return Optional.of(flow);
            }
        }
        for (FlowDefinition flow : candidates) {
            for (String pattern : flow.getTrigger().split("\\|")) {
                if (pattern.trim().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return Optional.of(flow);
                }
            }
        }
        logger.fine("No flow for intent " + normalized + (module != null ? " in module " + module : ""));
        return Optional.empty();
    }

    public synchronized int size() {
        return flows.size();
    }
}
