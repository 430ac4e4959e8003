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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input validation rule attached to a wait state. Checked against the raw
 * user input before the state's actions run on resume.
 */
public class StateValidatorConfig {

    private final String type;
    private final Map<String, Object> config;
    private final Integer maxFailures;
    private final String onInvalidTransition;
    private final String output;

    public StateValidatorConfig(String type, Map<String, Object> config, Integer maxFailures,
                                String onInvalidTransition, String output) {
        this.type = Objects.requireNonNull(type, "Validator type cannot be null");
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.maxFailures = maxFailures != null && maxFailures > 0 ? maxFailures : null;
        this.onInvalidTransition = onInvalidTransition;
        this.output = output;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Configured failure limit, or {@code null} to use the engine default.
     */
    public Integer getMaxFailures() {
        return maxFailures;
    }

    /**
     * State to move to once the failure limit is reached, or {@code null} to stay.
     */
    public String getOnInvalidTransition() {
        return onInvalidTransition;
    }

    /**
     * Context path for the extracted value, or {@code null} for the default path.
     */
    public String getOutput() {
        return output;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateValidatorConfig that = (StateValidatorConfig) o;
        return Objects.equals(type, that.type) &&
               Objects.equals(config, that.config) &&
               Objects.equals(maxFailures, that.maxFailures) &&
               Objects.equals(onInvalidTransition, that.onInvalidTransition) &&
               Objects.equals(output, that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, config, maxFailures, onInvalidTransition, output);
    }

    @Override
    public String toString() {
        return "StateValidatorConfig{" +
               "type='" + type + '\'' +
               ", maxFailures=" + maxFailures +
               ", onInvalidTransition='" + onInvalidTransition + '\'' +
               '}';
    }
}
