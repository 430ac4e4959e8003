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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structural check outcome for a flow definition. Errors make the flow
 * unusable, warnings are advisory. Issues keep the order they were reported
 * in, so repeated checks of the same flow list them identically.
 */
public class ValidationResult {

    private static final String STATES_PREFIX = "states.";

    private final List<FlowIssue> issues = new ArrayList<>();

    public void addError(String message) {
        addError(null, message);
    }

    public void addError(String fieldPath, String message) {
        issues.add(new FlowIssue(true, fieldPath, message));
    }

    public void addWarning(String fieldPath, String message) {
        issues.add(new FlowIssue(false, fieldPath, message));
    }

    public List<FlowIssue> getErrors() {
        return issues.stream().filter(FlowIssue::isError).toList();
    }

    public List<FlowIssue> getWarnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }

    public List<String> getErrorMessages() {
        return issues.stream().filter(FlowIssue::isError).map(FlowIssue::getMessage).toList();
    }

    /**
     * Errors and warnings reported under {@code states.<stateName>}.
     */
    public List<FlowIssue> getIssuesForState(String stateName) {
        return issues.stream()
                .filter(issue -> Objects.equals(stateName, issue.getStateName()))
                .toList();
    }

    public boolean isValid() {
        return issues.stream().noneMatch(FlowIssue::isError);
    }

    public boolean hasWarnings() {
        return issues.stream().anyMatch(issue -> !issue.isError());
    }

    public int getErrorCount() {
        return (int) issues.stream().filter(FlowIssue::isError).count();
    }

    @Override
    public String toString() {
        if (issues.isEmpty()) {
            return "ValidationResult{valid}";
        }
        return "ValidationResult{" + (isValid() ? "valid" : "invalid") + ": " +
               issues.stream().map(FlowIssue::toString).collect(Collectors.joining("; ")) + '}';
    }

    /**
     * One problem found in a flow definition, located by a dotted field path
     * such as {@code states.ask.transitions.yes}.
     */
    public static final class FlowIssue {

        private final boolean error;
        private final String fieldPath;
        private final String message;

        FlowIssue(boolean error, String fieldPath, String message) {
            this.error = error;
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public boolean isError() {
            return error;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        /**
         * @return the state the path points into, or {@code null} for flow-level issues
         */
        public String getStateName() {
            if (fieldPath == null || !fieldPath.startsWith(STATES_PREFIX)) {
                return null;
            }
            String rest = fieldPath.substring(STATES_PREFIX.length());
            int dot = rest.indexOf('.');
            return dot < 0 ? rest : rest.substring(0, dot);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FlowIssue that)) return false;
            return error == that.error &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(error, fieldPath, message);
        }

        @Override
        public String toString() {
            String location = fieldPath != null ? " at " + fieldPath : "";
            return (error ? "error" : "warning") + location + ": " + message;
        }
    }
}
