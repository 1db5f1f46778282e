package dev.mars.mq.amqp;

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

import java.time.Duration;

/**
 * Settings of the AMQP backend, resolved from {@code mq.amqp.*} and
 * {@code mq.backoff.*} properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class AmqpConfiguration {

    public static final String BURIED_QUEUE_SUFFIX = "mq.amqp.buried-queue-suffix";
    public static final String BURIED_EXCHANGE_SUFFIX = "mq.amqp.buried-exchange-suffix";
    public static final String BURIED_TIMEOUT = "mq.amqp.buried-timeout";
    public static final String RETRIES_HEADER = "mq.amqp.retries-header";
    public static final String ERROR_HEADER = "mq.amqp.error-header";
    public static final String PUBLISHER_CONFIRMS = "mq.amqp.publisher-confirms";
    public static final String CONFIRM_TIMEOUT = "mq.amqp.confirm-timeout";
    public static final String POLL_INTERVAL = "mq.amqp.poll-interval";

    public static final String DEFAULT_BURIED_QUEUE_SUFFIX = ".buriedQueue";
    public static final String DEFAULT_BURIED_EXCHANGE_SUFFIX = ".buriedExchange";
    public static final String DEFAULT_RETRIES_HEADER = "x-retries";
    public static final String DEFAULT_ERROR_HEADER = "x-error-type";

    private final String buriedQueueSuffix;
    private final String buriedExchangeSuffix;
    private final Duration buriedTimeout;
    private final String retriesHeader;
    private final String errorHeader;
    private final boolean publisherConfirms;
    private final Duration confirmTimeout;
    private final Duration pollInterval;
    private final MqConfiguration.BackoffConfig backoff;

    private AmqpConfiguration(Builder builder) {
        this.buriedQueueSuffix = builder.buriedQueueSuffix;
        this.buriedExchangeSuffix = builder.buriedExchangeSuffix;
        this.buriedTimeout = builder.buriedTimeout;
        this.retriesHeader = builder.retriesHeader;
        this.errorHeader = builder.errorHeader;
        this.publisherConfirms = builder.publisherConfirms;
        this.confirmTimeout = builder.confirmTimeout;
        this.pollInterval = builder.pollInterval;
        this.backoff = builder.backoff;
    }

    /**
     * Resolves the AMQP settings from a loaded configuration.
     */
    public static AmqpConfiguration from(MqConfiguration configuration) {
        return builder()
            .buriedQueueSuffix(configuration.getString(BURIED_QUEUE_SUFFIX, DEFAULT_BURIED_QUEUE_SUFFIX))
            .buriedExchangeSuffix(configuration.getString(BURIED_EXCHANGE_SUFFIX, DEFAULT_BURIED_EXCHANGE_SUFFIX))
            .buriedTimeout(configuration.getDuration(BURIED_TIMEOUT, Duration.ofMillis(500)))
            .retriesHeader(configuration.getString(RETRIES_HEADER, DEFAULT_RETRIES_HEADER))
            .errorHeader(configuration.getString(ERROR_HEADER, DEFAULT_ERROR_HEADER))
            .publisherConfirms(configuration.getBoolean(PUBLISHER_CONFIRMS, false))
            .confirmTimeout(configuration.getDuration(CONFIRM_TIMEOUT, Duration.ofSeconds(5)))
            .pollInterval(configuration.getDuration(POLL_INTERVAL, Duration.ofSeconds(1)))
            .backoff(configuration.getBackoffConfig())
            .build();
    }

    public static AmqpConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBuriedQueueSuffix() { return buriedQueueSuffix; }
    public String getBuriedExchangeSuffix() { return buriedExchangeSuffix; }
    public Duration getBuriedTimeout() { return buriedTimeout; }
    public String getRetriesHeader() { return retriesHeader; }
    public String getErrorHeader() { return errorHeader; }
    public boolean isPublisherConfirms() { return publisherConfirms; }
    public Duration getConfirmTimeout() { return confirmTimeout; }
    public Duration getPollInterval() { return pollInterval; }
    public MqConfiguration.BackoffConfig getBackoff() { return backoff; }

    @Override
    public String toString() {
        return "AmqpConfiguration{" +
                "buriedQueueSuffix='" + buriedQueueSuffix + '\'' +
                ", buriedExchangeSuffix='" + buriedExchangeSuffix + '\'' +
                ", buriedTimeout=" + buriedTimeout +
                ", retriesHeader='" + retriesHeader + '\'' +
                ", errorHeader='" + errorHeader + '\'' +
                ", publisherConfirms=" + publisherConfirms +
                ", confirmTimeout=" + confirmTimeout +
                ", pollInterval=" + pollInterval +
                '}';
    }

    public static class Builder {
        private String buriedQueueSuffix = DEFAULT_BURIED_QUEUE_SUFFIX;
        private String buriedExchangeSuffix = DEFAULT_BURIED_EXCHANGE_SUFFIX;
        private Duration buriedTimeout = Duration.ofMillis(500);
        private String retriesHeader = DEFAULT_RETRIES_HEADER;
        private String errorHeader = DEFAULT_ERROR_HEADER;
        private boolean publisherConfirms = false;
        private Duration confirmTimeout = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofSeconds(1);
        private MqConfiguration.BackoffConfig backoff =
            new MqConfiguration.BackoffConfig(Duration.ofMillis(200), Duration.ofSeconds(30), 2.0, 0);

        public Builder buriedQueueSuffix(String buriedQueueSuffix) {
            this.buriedQueueSuffix = buriedQueueSuffix;
            return this;
        }

        public Builder buriedExchangeSuffix(String buriedExchangeSuffix) {
            this.buriedExchangeSuffix = buriedExchangeSuffix;
            return this;
        }

        public Builder buriedTimeout(Duration buriedTimeout) {
            this.buriedTimeout = buriedTimeout;
            return this;
        }

        public Builder retriesHeader(String retriesHeader) {
            this.retriesHeader = retriesHeader;
            return this;
        }

        public Builder errorHeader(String errorHeader) {
            this.errorHeader = errorHeader;
            return this;
        }

        public Builder publisherConfirms(boolean publisherConfirms) {
            this.publisherConfirms = publisherConfirms;
            return this;
        }

        public Builder confirmTimeout(Duration confirmTimeout) {
            this.confirmTimeout = confirmTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder backoff(MqConfiguration.BackoffConfig backoff) {
            this.backoff = backoff;
            return this;
        }

        public AmqpConfiguration build() {
            if (buriedQueueSuffix == null || buriedQueueSuffix.isEmpty()
                    || buriedExchangeSuffix == null || buriedExchangeSuffix.isEmpty()) {
                throw new IllegalArgumentException("Buried queue and exchange suffixes cannot be empty");
            }
            if (buriedQueueSuffix.equals(buriedExchangeSuffix)) {
                throw new IllegalArgumentException("Buried queue and exchange suffixes must differ");
            }
            if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalArgumentException("Poll interval must be positive");
            }
            if (buriedTimeout == null || buriedTimeout.isZero() || buriedTimeout.isNegative()) {
                throw new IllegalArgumentException("Buried timeout must be positive");
            }
            if (confirmTimeout == null || confirmTimeout.isZero() || confirmTimeout.isNegative()) {
                throw new IllegalArgumentException("Confirm timeout must be positive");
            }
            return new AmqpConfiguration(this);
        }
    }
}
