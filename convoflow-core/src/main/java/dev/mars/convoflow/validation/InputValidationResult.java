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

import java.util.Optional;

/**
 * Outcome of validating one user message against a state's validator.
 */
public class InputValidationResult {

    private final boolean valid;
    private final Object extractedValue;
    private final String reason;
    private final String suggestedResponse;

    private InputValidationResult(boolean valid, Object extractedValue, String reason, String suggestedResponse) {
        this.valid = valid;
        this.extractedValue = extractedValue;
        this.reason = reason;
        this.suggestedResponse = suggestedResponse;
    }

    public static InputValidationResult valid(Object extractedValue) {
        return new InputValidationResult(true, extractedValue, null, null);
    }

    public static InputValidationResult invalid(String reason, String suggestedResponse) {
        return new InputValidationResult(false, null, reason != null ? reason : "Invalid input", suggestedResponse);
    }

    public boolean isValid() {
        return valid;
    }

    public Object getExtractedValue() {
        return extractedValue;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getSuggestedResponse() {
        return Optional.ofNullable(suggestedResponse);
    }

    @Override
    public String toString() {
        return valid
                ? "InputValidationResult{valid, extracted=" + extractedValue + '}'
                : "InputValidationResult{invalid, reason='" + reason + "'}";
    }
}
