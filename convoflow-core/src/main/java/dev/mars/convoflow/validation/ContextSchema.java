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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named set of field constraints for a flow's context data.
 */
public class ContextSchema {

    private final String name;
    private final String description;
    private final Map<String, FieldSchema> fields;
    private final boolean allowExtra;

    public ContextSchema(String name, String description, Map<String, FieldSchema> fields, boolean allowExtra) {
        this.name = Objects.requireNonNull(name, "Schema name cannot be null");
        this.description = description;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields != null ? fields : Map.of()));
        this.allowExtra = allowExtra;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, FieldSchema> getFields() {
        return fields;
    }

    /**
     * Whether fields not declared in the schema are accepted without a warning.
     */
    public boolean isAllowExtra() {
        return allowExtra;
    }
}
