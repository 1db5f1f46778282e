package dev.mars.mq.core.config;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;

/**
 * Configuration management for the message queue backends.
 *
 * <p>Properties are layered, later layers winning: {@code /mq-default.properties},
 * {@code /mq-<profile>.properties}, {@code MQ_*} environment variables,
 * {@code mq.*} system properties and finally the overrides passed by code.
 * Environment variable names map to keys by lower-casing, turning {@code __}
 * into {@code -} and {@code _} into {@code .}, so {@code MQ_BACKOFF_MAX__ATTEMPTS}
 * sets {@code mq.backoff.max-attempts}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MqConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(MqConfiguration.class);

    public static final String MEMORY_POLL_INTERVAL = "mq.memory.poll-interval";
    public static final String BACKOFF_MIN = "mq.backoff.min";
    public static final String BACKOFF_MAX = "mq.backoff.max";
    public static final String BACKOFF_FACTOR = "mq.backoff.factor";
    public static final String BACKOFF_MAX_ATTEMPTS = "mq.backoff.max-attempts";
    public static final String METRICS_ENABLED = "mq.metrics.enabled";
    public static final String METRICS_INSTANCE_ID = "mq.metrics.instance-id";

    private final Properties properties;
    private final String profile;

    public MqConfiguration() {
        this(activeProfile());
    }

    public MqConfiguration(String profile) {
        this(profile, Map.of());
    }

    /**
     * Creates a configuration with explicit overrides applied on top of every other layer.
     * Used by tests and embedding code that must not touch system properties.
     *
     * @param profile the configuration profile to use
     * @param overrides property values that win over files, environment and system properties
     */
    public MqConfiguration(String profile, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        if (overrides != null) {
            overrides.forEach(properties::setProperty);
        }
        validateConfiguration();
        logger.info("Loaded MQ configuration for profile: {}", profile);
    }

    /**
     * Profile selected by the mq.profile system property or the MQ_PROFILE environment variable.
     */
    public static String activeProfile() {
        return System.getProperty("mq.profile",
               System.getenv("MQ_PROFILE") != null ? System.getenv("MQ_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/mq-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/mq-" + profile + ".properties");
        }

        System.getenv().forEach((key, value) -> {
            if (key.startsWith("MQ_") && !"MQ_PROFILE".equals(key)) {
                props.setProperty(toPropertyKey(key), value);
            }
        });

        // System properties are applied after the environment so that -D wins
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("mq.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    static String toPropertyKey(String environmentKey) {
        return environmentKey.toLowerCase().replace("__", "-").replace('_', '.');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateMemoryConfig(errors);
        validateBackoffConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateMemoryConfig(List<String> errors) {
        Duration pollInterval = getDuration(MEMORY_POLL_INTERVAL, Duration.ofSeconds(1));
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            errors.add("Memory poll interval must be positive");
        }
    }

    private void validateBackoffConfig(List<String> errors) {
        Duration min = getDuration(BACKOFF_MIN, Duration.ofMillis(200));
        Duration max = getDuration(BACKOFF_MAX, Duration.ofSeconds(30));
        if (min.isZero() || min.isNegative()) {
            errors.add("Backoff minimum must be positive");
        }
        if (max.compareTo(min) < 0) {
            errors.add("Backoff maximum must be greater than or equal to backoff minimum");
        }
        if (getDouble(BACKOFF_FACTOR, 2.0) < 1.0) {
            errors.add("Backoff factor must be at least 1.0");
        }
        if (getInt(BACKOFF_MAX_ATTEMPTS, 0) < 0) {
            errors.add("Backoff max attempts must be non-negative");
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public Duration getMemoryPollInterval() {
        return getDuration(MEMORY_POLL_INTERVAL, Duration.ofSeconds(1));
    }

    public BackoffConfig getBackoffConfig() {
        return new BackoffConfig(
            getDuration(BACKOFF_MIN, Duration.ofMillis(200)),
            getDuration(BACKOFF_MAX, Duration.ofSeconds(30)),
            getDouble(BACKOFF_FACTOR, 2.0),
            getInt(BACKOFF_MAX_ATTEMPTS, 0)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean(METRICS_ENABLED, true),
            getString(METRICS_INSTANCE_ID, "mq-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    /**
     * Exponential backoff settings for reconnecting backends. A max attempts
     * value of zero means retry forever.
     */
    public static class BackoffConfig {
        private final Duration min;
        private final Duration max;
        private final double factor;
        private final int maxAttempts;

        public BackoffConfig(Duration min, Duration max, double factor, int maxAttempts) {
            this.min = min;
            this.max = max;
            this.factor = factor;
            this.maxAttempts = Math.max(0, maxAttempts);
        }

        public Duration getMin() { return min; }
        public Duration getMax() { return max; }
        public double getFactor() { return factor; }
        public int getMaxAttempts() { return maxAttempts; }
        public boolean isUnlimited() { return maxAttempts == 0; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }

    /**
     * Gets a copy of the resolved properties.
     */
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
