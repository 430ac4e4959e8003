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

/**
 * Base checked exception for convoflow.
 * Provides a common hierarchy for definition-time errors throughout the system.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ConvoflowException extends Exception {

    public ConvoflowException(String message) {
        super(message);
    }

    public ConvoflowException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConvoflowException(Throwable cause) {
        super(cause);
    }
}
