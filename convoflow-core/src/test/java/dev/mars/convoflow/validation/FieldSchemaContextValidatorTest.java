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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldSchemaContextValidatorTest {

    private FieldSchemaContextValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FieldSchemaContextValidator();
    }

    @Test
    void testBuiltInSchemasRegistered() {
        assertTrue(validator.getSchemaNames().containsAll(List.of("base", "food_order", "auth", "address", "parcel")));
        assertNotNull(validator.getSchema("food_order"));
    }

    @Test
    void testRequiredFieldMissingIsError() {
        SchemaValidationResult result = validator.validate("food_order", Map.of(), SchemaValidationOptions.defaults());

        assertFalse(result.isValid());
        assertEquals(List.of("Field '_user_message' is required"), result.getErrors());
    }

    @Test
    void testOptionalFieldViolationIsWarning() {
        Map<String, Object> data = Map.of("_user_message", "hi", "weight_kg", 80);

        SchemaValidationResult result = validator.validate("parcel", data, SchemaValidationOptions.defaults());

        assertTrue(result.isValid());
        assertEquals(List.of("Field 'weight_kg' above maximum (50)"), result.getWarnings());
    }

    @Test
    void testStrictModeFailsOnWarnings() {
        Map<String, Object> data = Map.of("phone_number", "12345");

        SchemaValidationResult result = validator.validate("auth", data, new SchemaValidationOptions(true, false));

        assertFalse(result.isValid());
        assertEquals(List.of("Field 'phone_number' does not match pattern"), result.getWarnings());
    }

    @Test
    void testTypeMismatch() {
        Map<String, Object> data = Map.of("_user_message", "hi", "store_id", true);

        SchemaValidationResult result = validator.validate("food_order", data, SchemaValidationOptions.defaults());

        assertEquals(List.of("Field 'store_id' expected string|number, got boolean"), result.getWarnings());
    }

    @Test
    void testNestedObjectAndArrayItems() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("_user_message", "add to cart");
        data.put("location", Map.of("latitude", 120.0, "longitude", 73.8));
        data.put("cart", List.of(Map.of("id", 7, "name", "Dosa", "quantity", 0, "price", 60)));

        SchemaValidationResult result = validator.validate("food_order", data, SchemaValidationOptions.defaults());

        assertTrue(result.isValid());
        assertEquals(List.of(
                "Field 'location.latitude' above maximum (90)",
                "Field 'cart[0].quantity' below minimum (1)"), result.getWarnings());
    }

    @Test
    void testEnumValues() {
        SchemaValidationResult result = validator.validate("address", Map.of("address_type", "gym"),
                SchemaValidationOptions.defaults());

        assertEquals(List.of("Field 'address_type' must be one of: home, work, other"), result.getWarnings());
    }

    @Test
    void testSanitizeAppliesDefaults() {
        SchemaValidationResult result = validator.validate("base", Map.of("sessionId", "s1"),
                new SchemaValidationOptions(false, true));

        assertEquals("web", result.getSanitizedData().get("platform"));
        assertEquals("s1", result.getSanitizedData().get("sessionId"));
    }

    @Test
    void testUnknownSchemaIsValid() {
        SchemaValidationResult result = validator.validate("unknown", Map.of("x", 1), null);

        assertTrue(result.isValid());
        assertNull(result.getSanitizedData());
    }

    @Test
    void testExtraFieldsReportedWhenNotAllowed() {
        validator.registerSchema(new ContextSchema("closed", "Closed schema",
                Map.of("name", FieldSchema.of(FieldType.STRING).build()), false));

        SchemaValidationResult result = validator.validate("closed",
                Map.of("name", "x", "_internal", 1, "extra", 2), SchemaValidationOptions.defaults());

        assertEquals(List.of("Unexpected fields: extra"), result.getWarnings());
    }

    @Test
    void testNullableRequiredField() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("token", null);
        validator.registerSchema(new ContextSchema("nullable", null,
                Map.of("token", FieldSchema.of(FieldType.STRING).required().nullable().build()), true));

        assertTrue(validator.validate("nullable", data, SchemaValidationOptions.defaults()).isValid());
    }

    @Test
    void testNoOpValidatorAlwaysValid() {
        SchemaValidationResult result = NoOpContextSchemaValidator.INSTANCE.validate("food_order", Map.of(),
                SchemaValidationOptions.defaults());

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
    }
}
