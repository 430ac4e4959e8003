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
 * One executor invocation attached to a state, with its template-bearing
 * configuration and error policy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowAction {

    private final String id;
    private final String executor;
    private final Map<String, Object> config;
    private final String output;
    private final ErrorStrategy onError;
    private final int retryCount;
    private final int maxRetries;
    private final boolean retryOnError;

    public FlowAction(String id, String executor, Map<String, Object> config, String output,
                      ErrorStrategy onError, int retryCount, int maxRetries, boolean retryOnError) {
        this.executor = Objects.requireNonNull(executor, "Executor name cannot be null");
        this.id = id != null ? id : executor;
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.output = output;
        this.onError = onError != null ? onError : ErrorStrategy.FAIL;
        this.retryCount = Math.max(0, retryCount);
        this.maxRetries = Math.max(0, maxRetries);
        this.retryOnError = retryOnError;
    }

    public String getId() {
        return id;
    }

    public String getExecutor() {
        return executor;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Context path the action's output is written to, or {@code null}.
     */
    public String getOutput() {
        return output;
    }

    public ErrorStrategy getOnError() {
        return onError;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRetryOnError() {
        return retryOnError;
    }

    /**
     * Retries allowed after the first attempt. {@code retryCount} wins over
     * {@code maxRetries} when both are set.
     */
    public int getEffectiveMaxRetries() {
        return retryCount > 0 ? retryCount : maxRetries;
    }

    public boolean isRetryEnabled() {
        return onError == ErrorStrategy.RETRY || retryOnError;
    }

    public static Builder builder(String executor) {
        return new Builder(executor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowAction that = (FlowAction) o;
        return retryCount == that.retryCount &&
               maxRetries == that.maxRetries &&
               retryOnError == that.retryOnError &&
               Objects.equals(id, that.id) &&
               Objects.equals(executor, that.executor) &&
               Objects.equals(config, that.config) &&
               Objects.equals(output, that.output) &&
               onError == that.onError;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, executor, config, output, onError, retryCount, maxRetries, retryOnError);
    }

    @Override
    public String toString() {
        return "FlowAction{" +
               "id='" + id + '\'' +
               ", executor='" + executor + '\'' +
               ", output='" + output + '\'' +
               ", onError=" + onError +
               ", maxRetries=" + getEffectiveMaxRetries() +
               '}';
    }

    public static class Builder {
        private final String executor;
        private String id;
        private Map<String, Object> config = Map.of();
        private String output;
        private ErrorStrategy onError = ErrorStrategy.FAIL;
        private int retryCount;
        private int maxRetries;
        private boolean retryOnError;

        private Builder(String executor) {
            this.executor = executor;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder onError(ErrorStrategy onError) {
            this.onError = onError;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryOnError(boolean retryOnError) {
            this.retryOnError = retryOnError;
            return this;
        }

        public FlowAction build() {
            return new FlowAction(id, executor, config, output, onError, retryCount, maxRetries, retryOnError);
        }
    }
}
