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

import java.util.Map;

/**
 * Accepts every context. Used when no schema validator is wired.
 */
public final class NoOpContextSchemaValidator implements ContextSchemaValidator {

    public static final NoOpContextSchemaValidator INSTANCE = new NoOpContextSchemaValidator();

    private NoOpContextSchemaValidator() {
    }

    @Override
    public SchemaValidationResult validate(String schemaName, Map<String, Object> data,
                                           SchemaValidationOptions options) {
        return SchemaValidationResult.ok(data);
    }
}
