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

package dev.mars.convoflow.engine.yaml;

import dev.mars.convoflow.core.ErrorStrategy;
import dev.mars.convoflow.core.FlowAction;
import dev.mars.convoflow.core.FlowDefinition;
import dev.mars.convoflow.core.FlowState;
import dev.mars.convoflow.core.StateType;
import dev.mars.convoflow.core.StateValidatorConfig;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * YAML-based implementation of FlowDefinitionParser.
 * Parses flow documents using SnakeYAML with the safe constructor; state and
 * transition order follow the document.
 * <p>
 * Only {@code true} and {@code false} resolve to booleans, so events such as
 * {@code yes}, {@code no} and {@code on} stay strings. Scalar mapping keys of
 * any other type are read as their string form.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlFlowDefinitionParser implements FlowDefinitionParser {

    private final Yaml yaml;

    public YamlFlowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new StrictBooleanResolver());
    }

    @Override
    public FlowDefinition parse(Path file) throws FlowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new FlowParseException("Failed to read YAML file: " + file, e);
        }
    }

    @Override
    public FlowDefinition parseFromString(String content) throws FlowParseException {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new FlowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new FlowParseException("Empty or invalid YAML content");
        }
        return parseFlowDefinition(stringKeys((Map<?, ?>) loaded));
    }

    private FlowDefinition parseFlowDefinition(Map<String, Object> data) throws FlowParseException {
        String id = getStringValue(data, "id");
        if (id == null || id.isBlank()) {
            throw new FlowParseException(null, "id", "Flow id is required");
        }

        String initialState = getStringValue(data, "initialState");
        if (initialState == null || initialState.isBlank()) {
            throw new FlowParseException(id, "initialState", "Initial state is required");
        }

        Map<String, Object> statesMap = getMapValue(data, "states");
        if (statesMap == null || statesMap.isEmpty()) {
            throw new FlowParseException(id, "states", "At least one state is required");
        }

        FlowDefinition.Builder builder = FlowDefinition.builder(id)
                .name(getStringValue(data, "name"))
                .description(getStringValue(data, "description"))
                .version(getStringValue(data, "version", "1.0.0"))
                .module(getStringValue(data, "module"))
                .trigger(getStringValue(data, "trigger"))
                .initialState(initialState)
                .finalStates(getStringList(data, "finalStates", id))
                .contextSchema(getStringValue(data, "contextSchema"));

        for (Map.Entry<String, Object> entry : statesMap.entrySet()) {
            Map<String, Object> stateData = asMap(entry.getValue());
            if (stateData == null) {
                throw new FlowParseException(id, "states." + entry.getKey(), "State must be a mapping");
            }
            builder.state(parseState(id, entry.getKey(), stateData));
        }

        return builder.build();
    }

    private FlowState parseState(String flowId, String name, Map<String, Object> data) throws FlowParseException {
        String path = "states." + name;
        StateType type;
        try {
            type = StateType.fromString(getStringValue(data, "type"));
        } catch (IllegalArgumentException e) {
            throw new FlowParseException(flowId, path + ".type",
                    "Unknown state type: " + getStringValue(data, "type"), e);
        }

        FlowState.Builder builder = FlowState.builder(name, type)
                .description(getStringValue(data, "description"));

        for (FlowAction action : parseActions(flowId, path + ".actions", getListValue(data, "actions"))) {
            builder.action(action);
        }
        for (FlowAction action : parseActions(flowId, path + ".onEntry", getListValue(data, "onEntry"))) {
            builder.onEntry(action);
        }
        for (FlowAction action : parseActions(flowId, path + ".onExit", getListValue(data, "onExit"))) {
            builder.onExit(action);
        }

        Map<String, Object> transitions = getMapValue(data, "transitions");
        if (transitions != null) {
            for (Map.Entry<String, Object> transition : transitions.entrySet()) {
                if (transition.getValue() != null) {
                    builder.transition(transition.getKey(), transition.getValue().toString());
                }
            }
        }

        List<?> conditions = getListValue(data, "conditions");
        if (conditions != null) {
            for (int i = 0; i < conditions.size(); i++) {
                Map<String, Object> condition = asMap(conditions.get(i));
                String expression = getStringValue(condition, "expression");
                String event = getStringValue(condition, "event");
                if (expression == null || event == null) {
                    throw new FlowParseException(flowId, path + ".conditions[" + i + "]",
                            "Condition requires expression and event");
                }
                builder.condition(expression, event);
            }
        }

        Map<String, Object> validator = getMapValue(data, "validator");
        if (validator != null) {
            builder.validator(parseValidator(flowId, path + ".validator", validator));
        }

        return builder.build();
    }

    private List<FlowAction> parseActions(String flowId, String path, List<?> actionsList)
            throws FlowParseException {
        List<FlowAction> actions = new ArrayList<>();
        if (actionsList == null) {
            return actions;
        }
        for (int i = 0; i < actionsList.size(); i++) {
            String actionPath = path + "[" + i + "]";
            Map<String, Object> data = asMap(actionsList.get(i));
            if (data == null) {
                throw new FlowParseException(flowId, actionPath, "Action must be a mapping");
            }
            String executor = getStringValue(data, "executor");
            if (executor == null || executor.isBlank()) {
                throw new FlowParseException(flowId, actionPath + ".executor", "Executor is required");
            }

            ErrorStrategy onError;
            try {
                onError = ErrorStrategy.fromString(getStringValue(data, "onError"));
            } catch (IllegalArgumentException e) {
                throw new FlowParseException(flowId, actionPath + ".onError",
                        "Unknown error strategy: " + getStringValue(data, "onError"), e);
            }

            Map<String, Object> config = getMapValue(data, "config");
            actions.add(FlowAction.builder(executor)
                    .id(getStringValue(data, "id"))
                    .config(config != null ? config : Map.of())
                    .output(getStringValue(data, "output"))
                    .onError(onError)
                    .retryCount(getIntValue(data, "retryCount", 0))
                    .maxRetries(getIntValue(data, "maxRetries", 0))
                    .retryOnError(getBooleanValue(data, "retryOnError", false))
                    .build());
        }
        return actions;
    }

    private StateValidatorConfig parseValidator(String flowId, String path, Map<String, Object> data)
            throws FlowParseException {
        String type = getStringValue(data, "type");
        if (type == null || type.isBlank()) {
            throw new FlowParseException(flowId, path + ".type", "Validator type is required");
        }
        int maxFailures = getIntValue(data, "maxFailures", 0);
        return new StateValidatorConfig(type, getMapValue(data, "config"),
                maxFailures > 0 ? maxFailures : null,
                getStringValue(data, "onInvalidTransition"),
                getStringValue(data, "output"));
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? stringKeys((Map<?, ?>) value) : null;
    }

    private List<?> getListValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<?>) value : null;
    }

    private Map<String, Object> asMap(Object value) {
        return value instanceof Map ? stringKeys((Map<?, ?>) value) : null;
    }

    private Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private List<String> getStringList(Map<String, Object> data, String key, String flowId) throws FlowParseException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof String text) {
            return List.of(text);
        }
        if (!(value instanceof List<?> list)) {
            throw new FlowParseException(flowId, key, "Expected a list of state names");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            return Boolean.parseBoolean(text) || "yes".equalsIgnoreCase(text) || "on".equalsIgnoreCase(text);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * YAML 1.1 resolves {@code yes/no/on/off/y/n} to booleans. Flow documents
     * use those words as event and state names, so only {@code true} and
     * {@code false} keep the boolean tag.
     */
    static class StrictBooleanResolver extends Resolver {

        private static final Pattern BOOLEAN = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");

        @Override
        public Tag resolve(NodeId kind, String value, boolean implicit) {
            Tag tag = super.resolve(kind, value, implicit);
            if (Tag.BOOL.equals(tag) && !BOOLEAN.matcher(value).matches()) {
                return Tag.STR;
            }
            return tag;
        }
    }
}
