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

import dev.mars.convoflow.core.exceptions.TemplateInterpolationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{ ... }}} placeholders in action configs.
 * <p>
 * A placeholder holds one or more terms separated by {@code ||}. Terms are tried
 * left to right and the first truthy value wins; when none is truthy the last
 * term's value is used. A term is a dotted context path ({@code items.0.name}),
 * a quoted string, a number, {@code true}, {@code false}, {@code null},
 * {@code []} or {@code {}}.
 * <p>
 * Block markers used by prompt templates ({@code {{#each}}}, {@code {{/each}}},
 * {@code {{else}}}) are left untouched.
 */
public class TemplateInterpolator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.+?)\\}\\}", Pattern.DOTALL);
    private static final Pattern SINGLE_PLACEHOLDER = Pattern.compile("^\\s*\\{\\{(.+?)\\}\\}\\s*$", Pattern.DOTALL);
    private static final Pattern PATH = Pattern.compile("^[\\w$-]+(\\.[\\w$-]+)*$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    /**
     * Replaces every placeholder with the string form of its value.
     * Unresolved values render as the empty string.
     *
     * @throws TemplateInterpolationException if a placeholder term is malformed
     */
    public String interpolate(String template, Map<String, Object> data) {
        if (template == null) {
            return null;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String expression = matcher.group(1).trim();
            String replacement = isBlockMarker(expression)
                    ? matcher.group()
                    : ContextValues.stringify(evaluate(expression, data));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Interpolates maps and lists recursively. A string consisting of exactly one
     * placeholder yields the raw value (list, map, number) instead of its string form.
     */
    public Object interpolateObject(Object value, Map<String, Object> data) {
        if (value instanceof String text) {
            Matcher single = SINGLE_PLACEHOLDER.matcher(text);
            if (single.matches()) {
                String expression = single.group(1).trim();
                if (!expression.contains("}}") && !isBlockMarker(expression)) {
                    return evaluate(expression, data);
                }
            }
            return interpolate(text, data);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), interpolateObject(entry.getValue(), data));
            }
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(interpolateObject(item, data));
            }
            return resolved;
        }
        return value;
    }

    /**
     * Checks if a template contains any placeholders.
     */
    public boolean hasPlaceholders(String template) {
        return template != null && PLACEHOLDER.matcher(template).find();
    }

    /**
     * Evaluates a fallback chain such as {@code user.name || "guest"}.
     */
    public Object evaluate(String expression, Map<String, Object> data) {
        List<String> terms = splitTerms(expression);
        Object value = null;
        for (String term : terms) {
            value = evaluateTerm(term, data);
            if (ContextValues.isTruthy(value)) {
                return value;
            }
        }
        return value;
    }

    private Object evaluateTerm(String term, Map<String, Object> data) {
        if (term.isEmpty()) {
            throw new TemplateInterpolationException("Empty term in placeholder");
        }
        char first = term.charAt(0);
        if ((first == '"' || first == '\'') && term.length() >= 2 && term.charAt(term.length() - 1) == first) {
            return term.substring(1, term.length() - 1);
        }
        switch (term) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
                return null;
            case "[]":
                return new ArrayList<>();
            case "{}":
                return new LinkedHashMap<>();
            default:
                break;
        }
        if (NUMBER.matcher(term).matches()) {
            return term.contains(".") ? (Object) Double.valueOf(term) : (Object) Long.valueOf(term);
        }
        if (!PATH.matcher(term).matches()) {
            throw new TemplateInterpolationException("Malformed placeholder term: " + term);
        }
        return ContextValues.getPath(data, term);
    }

    private List<String> splitTerms(String expression) {
        List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == '|' && i + 1 < expression.length() && expression.charAt(i + 1) == '|') {
                terms.add(current.toString().trim());
                current.setLength(0);
                i++;
            } else {
                current.append(c);
            }
        }
        if (quote != 0) {
            throw new TemplateInterpolationException("Unterminated string literal in placeholder: " + expression);
        }
        terms.add(current.toString().trim());
        if (terms.contains("")) {
            throw new TemplateInterpolationException("Empty term in placeholder: " + expression);
        }
        return terms;
    }

    private boolean isBlockMarker(String expression) {
        return expression.startsWith("#") || expression.startsWith("/") || expression.equals("else");
    }
}
