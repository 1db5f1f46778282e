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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class MqConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("mq.backoff.factor");
        System.clearProperty("mq.memory.poll-interval");
    }

    @Test
    @DisplayName("Defaults come from mq-default.properties")
    void testDefaults() {
        MqConfiguration config = new MqConfiguration("default");

        assertEquals("default", config.getProfile());
        assertEquals(Duration.ofSeconds(1), config.getMemoryPollInterval());
        assertEquals(".buriedQueue", config.getString("mq.amqp.buried-queue-suffix", null));
        assertEquals("x-retries", config.getString("mq.amqp.retries-header"));

        MqConfiguration.BackoffConfig backoff = config.getBackoffConfig();
        assertEquals(Duration.ofMillis(200), backoff.getMin());
        assertEquals(Duration.ofSeconds(30), backoff.getMax());
        assertEquals(2.0, backoff.getFactor());
        assertTrue(backoff.isUnlimited());

        MqConfiguration.MetricsConfig metrics = config.getMetricsConfig();
        assertTrue(metrics.isEnabled());
        assertTrue(metrics.getInstanceId().startsWith("mq-"));
    }

    @Test
    void testProfileOverridesDefaults() {
        MqConfiguration config = new MqConfiguration("test");

        assertEquals(Duration.ofMillis(50), config.getMemoryPollInterval());
        assertEquals(3, config.getBackoffConfig().getMaxAttempts());
        assertFalse(config.getBackoffConfig().isUnlimited());
        assertEquals(Duration.ofSeconds(30), config.getBackoffConfig().getMax());
    }

    @Test
    @DisplayName("System properties win over files, explicit overrides win over system properties")
    void testPrecedence() {
        System.setProperty("mq.backoff.factor", "3.0");
        System.setProperty("mq.memory.poll-interval", "PT2S");

        MqConfiguration config = new MqConfiguration("test", Map.of("mq.memory.poll-interval", "PT0.1S"));

        assertEquals(3.0, config.getBackoffConfig().getFactor());
        assertEquals(Duration.ofMillis(100), config.getMemoryPollInterval());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        MqConfiguration config = new MqConfiguration("default", Map.of(
            "custom.int", "abc",
            "custom.duration", "five seconds",
            "custom.double", "x"));

        assertEquals(7, config.getInt("custom.int", 7));
        assertEquals(Duration.ofSeconds(5), config.getDuration("custom.duration", Duration.ofSeconds(5)));
        assertEquals(1.5, config.getDouble("custom.double", 1.5));
        assertThrows(IllegalArgumentException.class, () -> config.getString("custom.missing"));
    }

    @Test
    void testValidationErrorsAreCollected() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () ->
            new MqConfiguration("default", Map.of(
                "mq.memory.poll-interval", "PT0S",
                "mq.backoff.min", "PT10S",
                "mq.backoff.max", "PT1S",
                "mq.backoff.factor", "0.5")));

        assertTrue(e.getMessage().contains("poll interval"));
        assertTrue(e.getMessage().contains("Backoff maximum"));
        assertTrue(e.getMessage().contains("Backoff factor"));
    }

    @Test
    void testEnvironmentKeyMapping() {
        assertEquals("mq.backoff.max-attempts", MqConfiguration.toPropertyKey("MQ_BACKOFF_MAX__ATTEMPTS"));
        assertEquals("mq.amqp.publisher-confirms", MqConfiguration.toPropertyKey("MQ_AMQP_PUBLISHER__CONFIRMS"));
        assertEquals("mq.metrics.enabled", MqConfiguration.toPropertyKey("MQ_METRICS_ENABLED"));
    }

    @Test
    void testPropertiesCopyIsDetached() {
        MqConfiguration config = new MqConfiguration("default");
        config.getProperties().setProperty("mq.memory.poll-interval", "PT9S");

        assertEquals(Duration.ofSeconds(1), config.getMemoryPollInterval());
    }
}
