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

import dev.mars.convoflow.core.ActionExecutionResult;

import java.util.List;

/**
 * Results of one sequential run of a state's action list.
 */
final class ActionSequenceResult {

    private static final ActionSequenceResult EMPTY = new ActionSequenceResult(List.of(), null);

    private final List<ActionExecutionResult> results;
    private final String abortError;

    ActionSequenceResult(List<ActionExecutionResult> results, String abortError) {
        this.results = List.copyOf(results);
        this.abortError = abortError;
    }

    static ActionSequenceResult empty() {
        return EMPTY;
    }

    List<ActionExecutionResult> getResults() {
        return results;
    }

    /**
     * Whether a failing action stopped the remaining ones.
     */
    boolean isAborted() {
        return abortError != null;
    }

    String getAbortError() {
        return abortError;
    }

    /**
     * First event explicitly returned by an action, or {@code null}.
     */
    String findExplicitEvent() {
        for (ActionExecutionResult result : results) {
            if (result.getEvent().isPresent()) {
                return result.getEvent().get();
            }
        }
        return null;
    }

    boolean allSucceeded() {
        return !results.isEmpty() && results.stream().allMatch(ActionExecutionResult::isSuccess);
    }

    boolean anyFailed() {
        return results.stream().anyMatch(result -> !result.isSuccess());
    }
}
