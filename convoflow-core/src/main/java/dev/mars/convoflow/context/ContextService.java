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

package dev.mars.convoflow.context;

import dev.mars.convoflow.core.ErrorRecord;
import dev.mars.convoflow.core.ExecutionContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads, writes and renders conversation data for the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ContextService {

    private static final Logger logger = Logger.getLogger(ContextService.class.getName());

    public static final String LAST_ERROR = "_lastError";

    private final TemplateInterpolator interpolator;
    private final ExpressionEvaluator evaluator;

    public ContextService() {
        this(new TemplateInterpolator(), new ExpressionEvaluator());
    }

    public ContextService(TemplateInterpolator interpolator, ExpressionEvaluator evaluator) {
        this.interpolator = Objects.requireNonNull(interpolator, "Template interpolator cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Expression evaluator cannot be null");
    }

    /**
     * Reads a dotted path from the context data, or {@code null} when absent.
     */
    public Object get(ExecutionContext context, String path) {
        return ContextValues.getPath(context.getData(), path);
    }

    public int getInt(ExecutionContext context, String path, int defaultValue) {
        Object value = get(context, path);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                logger.fine("Non-numeric value at " + path + ": " + text);
            }
        }
        return defaultValue;
    }

    /**
     * Writes a value at a dotted path, creating intermediate maps as needed.
     * Intermediate maps are copied before they are modified, so values loaded
     * from immutable sources can still be updated.
     */
    @SuppressWarnings("unchecked")
    public void set(ExecutionContext context, String path, Object value) {
        Objects.requireNonNull(path, "Path cannot be null");
        String[] segments = path.split("\\.");
        Map<String, Object> current = context.getData();
        for (int i = 0; i < segments.length - 1; i++) {
            Object child = current.get(segments[i]);
            Map<String, Object> next = child instanceof Map
                    ? new LinkedHashMap<>((Map<String, Object>) child)
                    : new LinkedHashMap<>();
            current.put(segments[i], next);
            current = next;
        }
        current.put(segments[segments.length - 1], value);
    }

    /**
     * Removes the value at a dotted path. Missing paths are ignored.
     */
    @SuppressWarnings("unchecked")
    public void remove(ExecutionContext context, String path) {
        String[] segments = path.split("\\.");
        Map<String, Object> current = context.getData();
        for (int i = 0; i < segments.length - 1; i++) {
            Object child = current.get(segments[i]);
            if (!(child instanceof Map)) {
                return;
            }
            Map<String, Object> next = new LinkedHashMap<>((Map<String, Object>) child);
            current.put(segments[i], next);
            current = next;
        }
        current.remove(segments[segments.length - 1]);
    }

    public String interpolate(String template, Map<String, Object> data) {
        return interpolator.interpolate(template, data);
    }

    public Object interpolateObject(Object value, Map<String, Object> data) {
        return interpolator.interpolateObject(value, data);
    }

    /**
     * Interpolates an action config map against the context data.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> interpolateConfig(Map<String, Object> config, ExecutionContext context) {
        if (config == null || config.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) interpolator.interpolateObject(config, context.getData());
    }

    public boolean evaluateExpression(ExecutionContext context, String expression) {
        return evaluator.evaluateCondition(expression, context.getData());
    }

    /**
     * Appends to the error history and mirrors the record into {@code _lastError}.
     */
    public void recordError(ExecutionContext context, ErrorRecord error) {
        context.getSystem().addError(error);
        context.getData().put(LAST_ERROR, error.toMap());
    }

    public void updateState(ExecutionContext context, String state) {
        context.getSystem().setCurrentState(state);
    }

    public List<ErrorRecord> getErrorHistory(ExecutionContext context) {
        return context.getSystem().getErrorHistory();
    }
}
