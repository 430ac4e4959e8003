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

import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.StateValidatorConfig;

/**
 * Checks raw user input against a state's validator before the state's actions run.
 * The raw input is read from the context ({@code _user_message}).
 */
public interface InputValidator {

    String USER_MESSAGE = "_user_message";

    InputValidationResult validate(StateValidatorConfig validator, ExecutionContext context);
}
