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

package dev.mars.convoflow.engine;

/**
 * Result of the input validation gate for a resumed wait state.
 */
final class ValidationOutcome {

    enum Kind {
        PASSED,
        REJECTED,
        ESCALATED
    }

    private static final ValidationOutcome PASSED = new ValidationOutcome(Kind.PASSED, null, null, 0, null);

    private final Kind kind;
    private final String reason;
    private final String suggestedResponse;
    private final int failureCount;
    private final String target;

    private ValidationOutcome(Kind kind, String reason, String suggestedResponse, int failureCount, String target) {
        this.kind = kind;
        this.reason = reason;
        this.suggestedResponse = suggestedResponse;
        this.failureCount = failureCount;
        this.target = target;
    }

    static ValidationOutcome passed() {
        return PASSED;
    }

    static ValidationOutcome rejected(String reason, String suggestedResponse, int failureCount) {
        return new ValidationOutcome(Kind.REJECTED, reason, suggestedResponse, failureCount, null);
    }

    static ValidationOutcome escalated(String reason, String suggestedResponse, int failureCount, String target) {
        return new ValidationOutcome(Kind.ESCALATED, reason, suggestedResponse, failureCount, target);
    }

    Kind getKind() {
        return kind;
    }

    String getReason() {
        return reason;
    }

    String getSuggestedResponse() {
        return suggestedResponse;
    }

    int getFailureCount() {
        return failureCount;
    }

    String getTarget() {
        return target;
    }
}
