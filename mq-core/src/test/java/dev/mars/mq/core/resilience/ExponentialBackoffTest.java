package dev.mars.mq.core.resilience;

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

import dev.mars.mq.core.config.MqConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class ExponentialBackoffTest {

    @Test
    @DisplayName("Delays grow by the factor and are bounded by the maximum")
    void testGrowthBoundedByMax() {
        ExponentialBackoff backoff = new ExponentialBackoff(
            new MqConfiguration.BackoffConfig(Duration.ofMillis(100), Duration.ofMillis(1000), 2.0, 0));

        assertEquals(Duration.ofMillis(100), backoff.delayForAttempt(1));
        assertEquals(Duration.ofMillis(200), backoff.delayForAttempt(2));
        assertEquals(Duration.ofMillis(400), backoff.delayForAttempt(3));
        assertEquals(Duration.ofMillis(800), backoff.delayForAttempt(4));
        assertEquals(Duration.ofMillis(1000), backoff.delayForAttempt(5));
        assertEquals(Duration.ofMillis(1000), backoff.delayForAttempt(50));
    }

    @Test
    void testDelaysNeverDecrease() {
        ExponentialBackoff backoff = new ExponentialBackoff(
            new MqConfiguration.BackoffConfig(Duration.ofMillis(200), Duration.ofSeconds(30), 1.5, 0));

        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt < 40; attempt++) {
            Duration delay = backoff.delayForAttempt(attempt);
            assertTrue(delay.compareTo(previous) >= 0);
            assertTrue(delay.compareTo(Duration.ofSeconds(30)) <= 0);
            previous = delay;
        }
    }

    @Test
    void testUnlimitedAttempts() {
        ExponentialBackoff backoff = new ExponentialBackoff(
            new MqConfiguration.BackoffConfig(Duration.ofMillis(10), Duration.ofMillis(20), 2.0, 0));

        assertTrue(backoff.canRetry(0));
        assertTrue(backoff.canRetry(10_000));
    }

    @Test
    void testBoundedAttempts() {
        ExponentialBackoff backoff = new ExponentialBackoff(
            new MqConfiguration.BackoffConfig(Duration.ofMillis(10), Duration.ofMillis(20), 2.0, 3));

        assertEquals(3, backoff.getMaxAttempts());
        assertTrue(backoff.canRetry(2));
        assertFalse(backoff.canRetry(3));
    }
}
