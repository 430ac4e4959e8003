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
 * Kinds of state a flow can declare.
 */
public enum StateType {

    /**
     * Always runs its action list.
     */
    ACTION,

    /**
     * Evaluates conditions in order; the first truthy one supplies the event.
     */
    DECISION,

    /**
     * Prompts on entry and blocks until the next user turn supplies an event.
     */
    WAIT,

    /**
     * Terminal state; implicitly triggers {@code completed}.
     */
    END,

    /**
     * Terminal state; implicitly triggers {@code completed}.
     */
    FINAL;

    public boolean isTerminal() {
        return this == END || this == FINAL;
    }

    public static StateType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("State type cannot be empty");
        }
        return StateType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
