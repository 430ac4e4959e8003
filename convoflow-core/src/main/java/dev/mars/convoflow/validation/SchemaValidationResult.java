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

package dev.mars.convoflow.validation;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a context schema check. {@code sanitizedData} is only present
 * when sanitizing was requested.
 */
public class SchemaValidationResult {

    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;
    private final Map<String, Object> sanitizedData;

    public SchemaValidationResult(boolean valid, List<String> errors, List<String> warnings,
                                  Map<String, Object> sanitizedData) {
        this.valid = valid;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.sanitizedData = sanitizedData;
    }

    public static SchemaValidationResult ok(Map<String, Object> data) {
        return new SchemaValidationResult(true, List.of(), List.of(), data);
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Map<String, Object> getSanitizedData() {
        return sanitizedData;
    }

    @Override
    public String toString() {
        return "SchemaValidationResult{" +
               "valid=" + valid +
               ", errors=" + errors +
               ", warnings=" + warnings +
               '}';
    }
}
