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

import java.util.Optional;

/**
 * Outcome of a single executor invocation.
 */
public class ActionExecutionResult {

    private final boolean success;
    private final Object output;
    private final String event;
    private final String error;

    public ActionExecutionResult(boolean success, Object output, String event, String error) {
        this.success = success;
        this.output = output;
        this.event = event;
        this.error = error;
    }

    public static ActionExecutionResult success() {
        return new ActionExecutionResult(true, null, null, null);
    }

    public static ActionExecutionResult success(Object output) {
        return new ActionExecutionResult(true, output, null, null);
    }

    public static ActionExecutionResult success(Object output, String event) {
        return new ActionExecutionResult(true, output, event, null);
    }

    public static ActionExecutionResult failure(String error) {
        return new ActionExecutionResult(false, null, null, error != null ? error : "Unknown executor error");
    }

    public static ActionExecutionResult failure(String error, String event) {
        return new ActionExecutionResult(false, null, event, error != null ? error : "Unknown executor error");
    }

    public boolean isSuccess() {
        return success;
    }

    public Object getOutput() {
        return output;
    }

    public Optional<String> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "ActionExecutionResult{" +
               "success=" + success +
               ", event='" + event + '\'' +
               ", error='" + error + '\'' +
               '}';
    }
}
