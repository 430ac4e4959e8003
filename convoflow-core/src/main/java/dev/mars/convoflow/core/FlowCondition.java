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

import java.util.Objects;

/**
 * A decision-state branch: when {@code expression} evaluates truthy, {@code event} is triggered.
 */
public class FlowCondition {

    private final String expression;
    private final String event;

    public FlowCondition(String expression, String event) {
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null");
        this.event = Objects.requireNonNull(event, "Event cannot be null");
    }

    public String getExpression() {
        return expression;
    }

    public String getEvent() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowCondition that = (FlowCondition) o;
        return Objects.equals(expression, that.expression) &&
               Objects.equals(event, that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, event);
    }

    @Override
    public String toString() {
        return "FlowCondition{" +
               "expression='" + expression + '\'' +
               ", event='" + event + '\'' +
               '}';
    }
}
