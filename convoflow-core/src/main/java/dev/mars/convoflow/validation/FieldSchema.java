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
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Constraints on a single context field.
 */
public class FieldSchema {

    private final Set<FieldType> types;
    private final boolean required;
    private final boolean nullable;
    private final Integer minLength;
    private final Integer maxLength;
    private final String pattern;
    private final Double min;
    private final Double max;
    private final List<Object> allowedValues;
    private final FieldSchema items;
    private final Map<String, FieldSchema> properties;
    private final Object defaultValue;

    private FieldSchema(Builder builder) {
        this.types = Collections.unmodifiableSet(EnumSet.copyOf(builder.types));
        this.required = builder.required;
        this.nullable = builder.nullable;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.pattern = builder.pattern;
        this.min = builder.min;
        this.max = builder.max;
        this.allowedValues = builder.allowedValues;
        this.items = builder.items;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.defaultValue = builder.defaultValue;
    }

    public static Builder of(FieldType type, FieldType... more) {
        return new Builder(type, more);
    }

    public Set<FieldType> getTypes() {
        return types;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isNullable() {
        return nullable;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public String getPattern() {
        return pattern;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public List<Object> getAllowedValues() {
        return allowedValues;
    }

    public FieldSchema getItems() {
        return items;
    }

    public Map<String, FieldSchema> getProperties() {
        return properties;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public static class Builder {
        private final Set<FieldType> types;
        private boolean required;
        private boolean nullable;
        private Integer minLength;
        private Integer maxLength;
        private String pattern;
        private Double min;
        private Double max;
        private List<Object> allowedValues;
        private FieldSchema items;
        private final Map<String, FieldSchema> properties = new LinkedHashMap<>();
        private Object defaultValue;

        private Builder(FieldType type, FieldType... more) {
            this.types = EnumSet.of(type, more);
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder nullable() {
            this.nullable = true;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder oneOf(Object... values) {
            this.allowedValues = List.of(values);
            return this;
        }

        public Builder items(FieldSchema items) {
            this.items = items;
            return this;
        }

        public Builder property(String name, FieldSchema schema) {
            this.properties.put(name, schema);
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(this);
        }
    }
}
