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

package dev.mars.convoflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named node of a flow. Transitions keep their declared order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowState {

    private final String name;
    private final StateType type;
    private final String description;
    private final List<FlowAction> actions;
    private final List<FlowAction> onEntry;
    private final List<FlowAction> onExit;
    private final Map<String, String> transitions;
    private final List<FlowCondition> conditions;
    private final StateValidatorConfig validator;

    public FlowState(String name, StateType type, String description,
                     List<FlowAction> actions, List<FlowAction> onEntry, List<FlowAction> onExit,
                     Map<String, String> transitions, List<FlowCondition> conditions,
                     StateValidatorConfig validator) {
        this.name = Objects.requireNonNull(name, "State name cannot be null");
        this.type = Objects.requireNonNull(type, "State type cannot be null");
        this.description = description;
        this.actions = actions != null ? List.copyOf(actions) : List.of();
        this.onEntry = onEntry != null ? List.copyOf(onEntry) : List.of();
        this.onExit = onExit != null ? List.copyOf(onExit) : List.of();
        this.transitions = transitions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(transitions))
                : Map.of();
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.validator = validator;
    }

    public String getName() {
        return name;
    }

    public StateType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public List<FlowAction> getActions() {
        return actions;
    }

    public List<FlowAction> getOnEntry() {
        return onEntry;
    }

    public List<FlowAction> getOnExit() {
        return onExit;
    }

    public Map<String, String> getTransitions() {
        return transitions;
    }

    public boolean hasTransitions() {
        return !transitions.isEmpty();
    }

    public List<FlowCondition> getConditions() {
        return conditions;
    }

    public StateValidatorConfig getValidator() {
        return validator;
    }

    /**
     * Every action declared on this state: entry, main, then exit.
     */
    public List<FlowAction> getAllActions() {
        List<FlowAction> all = new ArrayList<>(onEntry.size() + actions.size() + onExit.size());
        all.addAll(onEntry);
        all.addAll(actions);
        all.addAll(onExit);
        return all;
    }

    public static Builder builder(String name, StateType type) {
        return new Builder(name, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowState that = (FlowState) o;
        return Objects.equals(name, that.name) &&
               type == that.type &&
               Objects.equals(actions, that.actions) &&
               Objects.equals(onEntry, that.onEntry) &&
               Objects.equals(onExit, that.onExit) &&
               Objects.equals(transitions, that.transitions) &&
               Objects.equals(conditions, that.conditions) &&
               Objects.equals(validator, that.validator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, actions, onEntry, onExit, transitions, conditions, validator);
    }

    @Override
    public String toString() {
        return "FlowState{" +
               "name='" + name + '\'' +
               ", type=" + type +
               ", actions=" + actions.size() +
               ", transitions=" + transitions +
               '}';
    }

    public static class Builder {
        private final String name;
        private final StateType type;
        private String description;
        private final List<FlowAction> actions = new ArrayList<>();
        private final List<FlowAction> onEntry = new ArrayList<>();
        private final List<FlowAction> onExit = new ArrayList<>();
        private final Map<String, String> transitions = new LinkedHashMap<>();
        private final List<FlowCondition> conditions = new ArrayList<>();
        private StateValidatorConfig validator;

        private Builder(String name, StateType type) {
            this.name = name;
            this.type = type;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder action(FlowAction action) {
            this.actions.add(action);
            return this;
        }

        public Builder actions(List<FlowAction> actions) {
            this.actions.addAll(actions);
            return this;
        }

        public Builder onEntry(FlowAction action) {
            this.onEntry.add(action);
            return this;
        }

        public Builder onExit(FlowAction action) {
            this.onExit.add(action);
            return this;
        }

        public Builder transition(String event, String target) {
            this.transitions.put(event, target);
            return this;
        }

        public Builder condition(String expression, String event) {
            this.conditions.add(new FlowCondition(expression, event));
            return this;
        }

        public Builder validator(StateValidatorConfig validator) {
            this.validator = validator;
            return this;
        }

        public FlowState build() {
            return new FlowState(name, type, description, actions, onEntry, onExit,
                    transitions, conditions, validator);
        }
    }
}
