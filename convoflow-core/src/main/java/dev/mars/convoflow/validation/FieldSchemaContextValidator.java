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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static dev.mars.convoflow.validation.FieldType.ANY;
import static dev.mars.convoflow.validation.FieldType.ARRAY;
import static dev.mars.convoflow.validation.FieldType.BOOLEAN;
import static dev.mars.convoflow.validation.FieldType.NUMBER;
import static dev.mars.convoflow.validation.FieldType.OBJECT;
import static dev.mars.convoflow.validation.FieldType.STRING;

/**
 * Validates context data against registered {@link ContextSchema}s.
 * <p>
 * Violations of required fields are errors, violations of optional fields are
 * warnings. Unknown schema names validate as valid. Keys starting with
 * {@code _} are never reported as unexpected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FieldSchemaContextValidator implements ContextSchemaValidator {

    private static final Logger logger = Logger.getLogger(FieldSchemaContextValidator.class.getName());

    private final Map<String, ContextSchema> schemas = new ConcurrentHashMap<>();

    public FieldSchemaContextValidator() {
        registerBuiltInSchemas();
    }

    public void registerSchema(ContextSchema schema) {
        Objects.requireNonNull(schema, "Schema cannot be null");
        schemas.put(schema.getName(), schema);
        logger.info("Registered context schema: " + schema.getName());
    }

    public Set<String> getSchemaNames() {
        return Set.copyOf(schemas.keySet());
    }

    public ContextSchema getSchema(String name) {
        return schemas.get(name);
    }

    @Override
    public SchemaValidationResult validate(String schemaName, Map<String, Object> data,
                                           SchemaValidationOptions options) {
        SchemaValidationOptions effective = options != null ? options : SchemaValidationOptions.defaults();
        Map<String, Object> values = data != null ? data : Map.of();
        ContextSchema schema = schemaName != null ? schemas.get(schemaName) : null;

        if (schema == null) {
            logger.warning("Schema not found: " + schemaName + ", skipping validation");
            return SchemaValidationResult.ok(effective.sanitize() ? new LinkedHashMap<>(values) : null);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Object> sanitized = effective.sanitize() ? new LinkedHashMap<>(values) : null;

        for (Map.Entry<String, FieldSchema> entry : schema.getFields().entrySet()) {
            String fieldName = entry.getKey();
            FieldSchema fieldSchema = entry.getValue();
            Object value = values.get(fieldName);

            List<String> fieldErrors = validateField(fieldName, value, fieldSchema);
            if (!fieldErrors.isEmpty()) {
                if (fieldSchema.isRequired()) {
                    errors.addAll(fieldErrors);
                } else {
                    warnings.addAll(fieldErrors);
                }
            }

            if (sanitized != null && !values.containsKey(fieldName) && fieldSchema.getDefaultValue() != null) {
                sanitized.put(fieldName, fieldSchema.getDefaultValue());
            }
        }

        if (!schema.isAllowExtra()) {
            List<String> extra = values.keySet().stream()
                    .filter(key -> !key.startsWith("_") && !schema.getFields().containsKey(key))
                    .collect(Collectors.toList());
            if (!extra.isEmpty()) {
                warnings.add("Unexpected fields: " + String.join(", ", extra));
            }
        }

        boolean valid = errors.isEmpty() && (!effective.strict() || warnings.isEmpty());
        if (!valid) {
            logger.warning("Context validation failed for " + schemaName + ": " + String.join("; ", errors));
        } else if (!warnings.isEmpty()) {
            logger.fine("Context warnings for " + schemaName + ": " + String.join("; ", warnings));
        }

        return new SchemaValidationResult(valid, errors, warnings, sanitized);
    }

    private List<String> validateField(String fieldName, Object value, FieldSchema schema) {
        List<String> errors = new ArrayList<>();

        if (value == null) {
            if (schema.isRequired() && !schema.isNullable()) {
                errors.add("Field '" + fieldName + "' is required");
            }
            return errors;
        }

        FieldType actual = FieldType.of(value);
        if (!schema.getTypes().contains(ANY) && !schema.getTypes().contains(actual)) {
            String expected = schema.getTypes().stream().map(FieldType::id).collect(Collectors.joining("|"));
            errors.add("Field '" + fieldName + "' expected " + expected + ", got " + actual.id());
            return errors;
        }

        if (actual == STRING) {
            String text = value.toString();
            if (schema.getMinLength() != null && text.length() < schema.getMinLength()) {
                errors.add("Field '" + fieldName + "' too short (min: " + schema.getMinLength() + ")");
            }
            if (schema.getMaxLength() != null && text.length() > schema.getMaxLength()) {
                errors.add("Field '" + fieldName + "' too long (max: " + schema.getMaxLength() + ")");
            }
            if (schema.getPattern() != null && !matches(schema.getPattern(), text)) {
                errors.add("Field '" + fieldName + "' does not match pattern");
            }
        }

        if (actual == NUMBER) {
            double number = ((Number) value).doubleValue();
            if (schema.getMin() != null && number < schema.getMin()) {
                errors.add("Field '" + fieldName + "' below minimum (" + format(schema.getMin()) + ")");
            }
            if (schema.getMax() != null && number > schema.getMax()) {
                errors.add("Field '" + fieldName + "' above maximum (" + format(schema.getMax()) + ")");
            }
        }

        if (schema.getAllowedValues() != null && !schema.getAllowedValues().contains(value)) {
            errors.add("Field '" + fieldName + "' must be one of: " + schema.getAllowedValues().stream()
                    .map(String::valueOf).collect(Collectors.joining(", ")));
        }

        if (actual == OBJECT && value instanceof Map<?, ?> map && !schema.getProperties().isEmpty()) {
            for (Map.Entry<String, FieldSchema> property : schema.getProperties().entrySet()) {
                errors.addAll(validateField(fieldName + "." + property.getKey(),
                        map.get(property.getKey()), property.getValue()));
            }
        }

        if (actual == ARRAY && value instanceof List<?> list && schema.getItems() != null) {
            for (int i = 0; i < list.size(); i++) {
                errors.addAll(validateField(fieldName + "[" + i + "]", list.get(i), schema.getItems()));
            }
        }

        return errors;
    }

    private boolean matches(String pattern, String text) {
        try {
            return Pattern.compile(pattern).matcher(text).find();
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid schema pattern '" + pattern + "': " + e.getDescription());
            return true;
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private void registerBuiltInSchemas() {
        Map<String, FieldSchema> base = new LinkedHashMap<>();
        base.put("_user_message", FieldSchema.of(STRING).build());
        base.put("sessionId", FieldSchema.of(STRING).build());
        base.put("phoneNumber", FieldSchema.of(STRING).build());
        base.put("platform", FieldSchema.of(STRING)
                .oneOf("web", "whatsapp", "telegram", "voice")
                .defaultValue("web")
                .build());
        schemas.put("base", new ContextSchema("base", "Common fields required by all flows", base, true));

        Map<String, FieldSchema> foodOrder = new LinkedHashMap<>();
        foodOrder.put("_user_message", FieldSchema.of(STRING).required().build());
        foodOrder.put("location", FieldSchema.of(OBJECT)
                .property("latitude", FieldSchema.of(NUMBER).required().min(-90).max(90).build())
                .property("longitude", FieldSchema.of(NUMBER).required().min(-180).max(180).build())
                .build());
        foodOrder.put("search_query", FieldSchema.of(STRING).build());
        foodOrder.put("cart", FieldSchema.of(ARRAY)
                .items(FieldSchema.of(OBJECT)
                        .property("id", FieldSchema.of(STRING, NUMBER).required().build())
                        .property("name", FieldSchema.of(STRING).required().build())
                        .property("quantity", FieldSchema.of(NUMBER).required().min(1).build())
                        .property("price", FieldSchema.of(NUMBER).required().min(0).build())
                        .build())
                .build());
        foodOrder.put("store_id", FieldSchema.of(STRING, NUMBER).build());
        foodOrder.put("user_authenticated", FieldSchema.of(BOOLEAN).defaultValue(false).build());
        schemas.put("food_order", new ContextSchema("food_order", "Context for food ordering flows", foodOrder, true));

        Map<String, FieldSchema> auth = new LinkedHashMap<>();
        auth.put("_user_message", FieldSchema.of(STRING).build());
        auth.put("phone_number", FieldSchema.of(STRING).pattern("^[6-9]\\d{9}$").build());
        auth.put("otp", FieldSchema.of(STRING).pattern("^\\d{4,6}$").build());
        auth.put("platform", FieldSchema.of(STRING).build());
        schemas.put("auth", new ContextSchema("auth", "Context for authentication flows", auth, true));

        Map<String, FieldSchema> address = new LinkedHashMap<>();
        address.put("_user_message", FieldSchema.of(STRING).build());
        address.put("address_type", FieldSchema.of(STRING).oneOf("home", "work", "other").build());
        address.put("flat_no", FieldSchema.of(STRING).build());
        address.put("landmark", FieldSchema.of(STRING).build());
        address.put("location", FieldSchema.of(OBJECT)
                .property("latitude", FieldSchema.of(NUMBER).required().build())
                .property("longitude", FieldSchema.of(NUMBER).required().build())
                .property("address", FieldSchema.of(STRING).build())
                .build());
        schemas.put("address", new ContextSchema("address", "Context for address management flows", address, true));

        Map<String, FieldSchema> parcel = new LinkedHashMap<>();
        parcel.put("_user_message", FieldSchema.of(STRING).build());
        parcel.put("pickup_address", FieldSchema.of(OBJECT).build());
        parcel.put("delivery_address", FieldSchema.of(OBJECT).build());
        parcel.put("package_type", FieldSchema.of(STRING).build());
        parcel.put("weight_kg", FieldSchema.of(NUMBER).min(0).max(50).build());
        schemas.put("parcel", new ContextSchema("parcel", "Context for parcel booking flows", parcel, true));
    }
}
