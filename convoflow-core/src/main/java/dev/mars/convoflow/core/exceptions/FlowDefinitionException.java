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

package dev.mars.convoflow.core.exceptions;

import java.util.List;

/**
 * Raised when a flow definition fails structural checks at registration.
 */
public class FlowDefinitionException extends ConvoflowException {

    private final String flowId;
    private final List<String> errors;

    public FlowDefinitionException(String flowId, List<String> errors) {
        super("Invalid flow definition '" + flowId + "': " + String.join("; ", errors));
        this.flowId = flowId;
        this.errors = List.copyOf(errors);
    }

    public String getFlowId() {
        return flowId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
