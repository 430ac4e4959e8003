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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the flow engine.
 * Defaults are overlaid by a {@code convoflow.properties} file (working directory,
 * user home or classpath) and then by {@code convoflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ConvoflowConfiguration {
    private static final Logger logger = Logger.getLogger(ConvoflowConfiguration.class.getName());

    public static final String RETRY_BASE_DELAY_MS = "convoflow.engine.retry.base.delay.ms";
    public static final String VALIDATION_MAX_FAILURES = "convoflow.engine.validation.max.failures";
    public static final String SCHEMA_VALIDATION_ENABLED = "convoflow.engine.schema.validation.enabled";
    public static final String MAX_AUTO_ITERATIONS = "convoflow.runner.max.auto.iterations";
    public static final String METRICS_ENABLED = "convoflow.monitoring.metrics.enabled";

    private static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;
    private static final int DEFAULT_VALIDATION_MAX_FAILURES = 3;
    private static final int DEFAULT_MAX_AUTO_ITERATIONS = 10;

    private final Properties properties;

    public ConvoflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public ConvoflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Configuration with defaults only, ignoring files and system properties.
     */
    public static ConvoflowConfiguration defaults() {
        return new ConvoflowConfiguration(null);
    }

    // Engine configuration
    public long getRetryBaseDelayMs() {
        return getLongProperty(RETRY_BASE_DELAY_MS, DEFAULT_RETRY_BASE_DELAY_MS);
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(Math.max(0, getRetryBaseDelayMs()));
    }

    public int getValidationMaxFailures() {
        return getIntProperty(VALIDATION_MAX_FAILURES, DEFAULT_VALIDATION_MAX_FAILURES);
    }

    public boolean isSchemaValidationEnabled() {
        return getBooleanProperty(SCHEMA_VALIDATION_ENABLED, true);
    }

    // Runner configuration
    public int getMaxAutoIterations() {
        return getIntProperty(MAX_AUTO_ITERATIONS, DEFAULT_MAX_AUTO_ITERATIONS);
    }

    // Monitoring configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(RETRY_BASE_DELAY_MS, String.valueOf(DEFAULT_RETRY_BASE_DELAY_MS));
        properties.setProperty(VALIDATION_MAX_FAILURES, String.valueOf(DEFAULT_VALIDATION_MAX_FAILURES));
        properties.setProperty(SCHEMA_VALIDATION_ENABLED, "true");
        properties.setProperty(MAX_AUTO_ITERATIONS, String.valueOf(DEFAULT_MAX_AUTO_ITERATIONS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "convoflow.properties",
                "config/convoflow.properties",
                System.getProperty("user.home") + "/.convoflow/convoflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("convoflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("convoflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "ConvoflowConfiguration{" +
                "retryBaseDelayMs=" + getRetryBaseDelayMs() +
                ", validationMaxFailures=" + getValidationMaxFailures() +
                ", maxAutoIterations=" + getMaxAutoIterations() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
