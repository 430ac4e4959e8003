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

package dev.mars.convoflow.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConvoflowConfigurationTest {

    @Test
    void testDefaultConfiguration() {
        ConvoflowConfiguration config = ConvoflowConfiguration.defaults();

        assertEquals(1000, config.getRetryBaseDelayMs());
        assertEquals(Duration.ofSeconds(1), config.getRetryBaseDelay());
        assertEquals(3, config.getValidationMaxFailures());
        assertTrue(config.isSchemaValidationEnabled());
        assertEquals(10, config.getMaxAutoIterations());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testCustomProperties() {
        Properties props = new Properties();
        props.setProperty(ConvoflowConfiguration.RETRY_BASE_DELAY_MS, "250");
        props.setProperty(ConvoflowConfiguration.VALIDATION_MAX_FAILURES, "5");
        props.setProperty(ConvoflowConfiguration.SCHEMA_VALIDATION_ENABLED, "false");
        props.setProperty(ConvoflowConfiguration.MAX_AUTO_ITERATIONS, "4");
        props.setProperty(ConvoflowConfiguration.METRICS_ENABLED, "false");

        ConvoflowConfiguration config = new ConvoflowConfiguration(props);

        assertEquals(Duration.ofMillis(250), config.getRetryBaseDelay());
        assertEquals(5, config.getValidationMaxFailures());
        assertFalse(config.isSchemaValidationEnabled());
        assertEquals(4, config.getMaxAutoIterations());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(ConvoflowConfiguration.RETRY_BASE_DELAY_MS, "soon");
        props.setProperty(ConvoflowConfiguration.MAX_AUTO_ITERATIONS, "many");

        ConvoflowConfiguration config = new ConvoflowConfiguration(props);

        assertEquals(1000, config.getRetryBaseDelayMs());
        assertEquals(10, config.getMaxAutoIterations());
    }

    @Test
    void testNegativeDelayClampsToZero() {
        ConvoflowConfiguration config = ConvoflowConfiguration.defaults();
        config.setProperty(ConvoflowConfiguration.RETRY_BASE_DELAY_MS, "-5");

        assertEquals(Duration.ZERO, config.getRetryBaseDelay());
    }

    @Test
    void testGenericPropertyAccess() {
        ConvoflowConfiguration config = ConvoflowConfiguration.defaults();
        config.setProperty("convoflow.custom", "value");

        assertEquals("value", config.getProperty("convoflow.custom"));
        assertEquals("fallback", config.getProperty("convoflow.absent", "fallback"));
        assertNotNull(config.toString());
    }
}
