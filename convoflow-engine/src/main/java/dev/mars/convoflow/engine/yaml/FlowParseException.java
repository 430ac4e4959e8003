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

package dev.mars.convoflow.engine.yaml;

import dev.mars.convoflow.core.exceptions.ConvoflowException;

/**
 * Exception thrown when a flow document cannot be read or mapped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowParseException extends ConvoflowException {

    private final String flowId;
    private final String fieldPath;

    public FlowParseException(String message) {
        super(message);
        this.flowId = null;
        this.fieldPath = null;
    }

    public FlowParseException(String message, Throwable cause) {
        super(message, cause);
        this.flowId = null;
        this.fieldPath = null;
    }

    public FlowParseException(String flowId, String fieldPath, String message) {
        super(message);
        this.flowId = flowId;
        this.fieldPath = fieldPath;
    }

    public FlowParseException(String flowId, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.flowId = flowId;
        this.fieldPath = fieldPath;
    }

    public String getFlowId() {
        return flowId;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (flowId != null) {
            sb.append("Flow '").append(flowId).append("': ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
