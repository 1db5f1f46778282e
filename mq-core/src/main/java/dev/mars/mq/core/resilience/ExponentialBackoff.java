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
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential backoff schedule for reconnect loops, bounded by a maximum
 * interval and optionally by a number of attempts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class ExponentialBackoff {

    private final IntervalFunction intervalFunction;
    private final MqConfiguration.BackoffConfig config;

    public ExponentialBackoff(MqConfiguration.BackoffConfig config) {
        this.config = config;
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
            Math.max(1, config.getMin().toMillis()),
            config.getFactor(),
            Math.max(config.getMin().toMillis(), config.getMax().toMillis()));
    }

    /**
     * Gets the wait before the given attempt, starting at 1.
     */
    public Duration delayForAttempt(int attempt) {
        return Duration.ofMillis(intervalFunction.apply(Math.max(1, attempt)));
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} failed ones.
     */
    public boolean canRetry(int attemptsMade) {
        return config.isUnlimited() || attemptsMade < config.getMaxAttempts();
    }

    public int getMaxAttempts() {
        return config.getMaxAttempts();
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{min=" + config.getMin() + ", max=" + config.getMax()
            + ", factor=" + config.getFactor() + ", maxAttempts=" + config.getMaxAttempts() + "}";
    }
}
