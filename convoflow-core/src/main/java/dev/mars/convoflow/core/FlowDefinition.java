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
 * Immutable graph of named states making up one conversation flow.
 * States keep their declared order so validation output is stable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final String module;
    private final String trigger;
    private final String initialState;
    private final List<String> finalStates;
    private final Map<String, FlowState> states;
    private final String contextSchema;

    public FlowDefinition(String id, String name, String description, String version, String module,
                          String trigger, String initialState, List<String> finalStates,
                          Map<String, FlowState> states, String contextSchema) {
        this.id = Objects.requireNonNull(id, "Flow ID cannot be null");
        this.name = name != null ? name : id;
        this.description = description;
        this.version = version != null ? version : "1.0.0";
        this.module = module;
        this.trigger = trigger;
        this.initialState = Objects.requireNonNull(initialState, "Initial state cannot be null");
        this.finalStates = finalStates != null ? List.copyOf(finalStates) : List.of();
        this.states = states != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(states))
                : Map.of();
        this.contextSchema = contextSchema;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public String getModule() {
        return module;
    }

    public String getTrigger() {
        return trigger;
    }

    public String getInitialState() {
        return initialState;
    }

    public List<String> getFinalStates() {
        return finalStates;
    }

    public Map<String, FlowState> getStates() {
        return states;
    }

    public FlowState getState(String stateName) {
        return stateName != null ? states.get(stateName) : null;
    }

    public boolean hasState(String stateName) {
        return stateName != null && states.containsKey(stateName);
    }

    public boolean isFinalState(String stateName) {
        return stateName != null && finalStates.contains(stateName);
    }

    /**
     * First declared final state, or {@code null} when the flow declares none.
     */
    public String getFirstFinalState() {
        return finalStates.isEmpty() ? null : finalStates.get(0);
    }

    /**
     * Name of the context schema checked after each turn, or {@code null}.
     */
    public String getContextSchema() {
        return contextSchema;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowDefinition that = (FlowDefinition) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(version, that.version) &&
               Objects.equals(initialState, that.initialState) &&
               Objects.equals(finalStates, that.finalStates) &&
               Objects.equals(states, that.states) &&
               Objects.equals(contextSchema, that.contextSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, initialState, finalStates, states, contextSchema);
    }

    @Override
    public String toString() {
        return "FlowDefinition{" +
               "id='" + id + '\'' +
               ", version='" + version + '\'' +
               ", module='" + module + '\'' +
               ", initialState='" + initialState + '\'' +
               ", finalStates=" + finalStates +
               ", states=" + states.keySet() +
               '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private String version;
        private String module;
        private String trigger;
        private String initialState;
        private final List<String> finalStates = new ArrayList<>();
        private final Map<String, FlowState> states = new LinkedHashMap<>();
        private String contextSchema;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder trigger(String trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder finalState(String finalState) {
            this.finalStates.add(finalState);
            return this;
        }

        public Builder finalStates(List<String> finalStates) {
            this.finalStates.addAll(finalStates);
            return this;
        }

        public Builder state(FlowState state) {
            this.states.put(state.getName(), state);
            return this;
        }

        public Builder contextSchema(String contextSchema) {
            this.contextSchema = contextSchema;
            return this;
        }

        public FlowDefinition build() {
            return new FlowDefinition(id, name, description, version, module, trigger,
                    initialState, finalStates, states, contextSchema);
        }
    }
}
