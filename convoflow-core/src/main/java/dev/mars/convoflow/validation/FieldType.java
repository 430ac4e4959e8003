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
import java.util.Locale;
import java.util.Map;

public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    ANY;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Type of a runtime value, or {@code null} for {@code null}.
     */
    public static FieldType of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence) {
            return STRING;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof List || value.getClass().isArray()) {
            return ARRAY;
        }
        if (value instanceof Map) {
            return OBJECT;
        }
        return OBJECT;
    }
}
