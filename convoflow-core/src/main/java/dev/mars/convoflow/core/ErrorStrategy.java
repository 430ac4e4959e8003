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

import java.util.Locale;

/**
 * What happens to the rest of a state's action list when an action fails.
 */
public enum ErrorStrategy {
    CONTINUE,   // record the failure, run the remaining actions
    SKIP,       // same as CONTINUE
    RETRY,      // retry with exponential backoff, then abort
    FAIL;       // abort the remaining actions

    public boolean isRecoverable() {
        return this == CONTINUE || this == SKIP;
    }

    public static ErrorStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            return FAIL;
        }
        return ErrorStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
