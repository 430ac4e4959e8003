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

import dev.mars.convoflow.core.exceptions.ExpressionEvaluationException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Evaluates decision conditions as Spring expressions.
 * <p>
 * The root object exposes every top-level data key plus {@code context} for the
 * whole data map, so {@code context.authenticated == true} and
 * {@code authenticated == true} are equivalent. Evaluation is restricted to
 * property reads and instance methods; type references and constructors are
 * unavailable.
 */
public class ExpressionEvaluator {

    private static final Logger logger = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    /**
     * @throws ExpressionEvaluationException if the expression cannot be parsed or evaluated
     */
    public Object evaluate(String expression, Map<String, Object> data) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionEvaluationException(String.valueOf(expression), "expression is empty", null);
        }

        Expression parsed;
        try {
            parsed = cache.computeIfAbsent(expression, parser::parseExpression);
        } catch (ParseException e) {
            throw new ExpressionEvaluationException(expression, e.getMessage(), e);
        }

        Map<String, Object> root = new LinkedHashMap<>(data != null ? data : Map.of());
        root.put("context", data != null ? data : Map.of());

        EvaluationContext evaluationContext = SimpleEvaluationContext
                .forPropertyAccessors(new MapPropertyAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .withInstanceMethods()
                .withRootObject(root)
                .build();

        try {
            Object value = parsed.getValue(evaluationContext);
            logger.fine("Expression '" + expression + "' evaluated to " + value);
            return value;
        } catch (EvaluationException e) {
            throw new ExpressionEvaluationException(expression, e.getMessage(), e);
        }
    }

    public boolean evaluateCondition(String expression, Map<String, Object> data) {
        return ContextValues.isTruthy(evaluate(expression, data));
    }
}
