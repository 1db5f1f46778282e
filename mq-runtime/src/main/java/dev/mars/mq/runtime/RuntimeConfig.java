package dev.mars.mq.runtime;

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

import io.micrometer.core.instrument.MeterRegistry;

import java.util.HashMap;
import java.util.Map;

/**
 * Selects the backends and configuration the runtime wires together.
 *
 * <p>Use the builder to disable backends that are not needed:</p>
 * <pre>{@code
 * RuntimeConfig config = RuntimeConfig.builder()
 *     .enableAmqpBrokers(false)
 *     .profile("test")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class RuntimeConfig {

    private final boolean enableMemoryBrokers;
    private final boolean enableAmqpBrokers;
    private final String profile;
    private final Map<String, String> overrides;
    private final MeterRegistry meterRegistry;

    private RuntimeConfig(Builder builder) {
        this.enableMemoryBrokers = builder.enableMemoryBrokers;
        this.enableAmqpBrokers = builder.enableAmqpBrokers;
        this.profile = builder.profile;
        this.overrides = Map.copyOf(builder.overrides);
        this.meterRegistry = builder.meterRegistry;
    }

    public boolean isMemoryBrokersEnabled() {
        return enableMemoryBrokers;
    }

    public boolean isAmqpBrokersEnabled() {
        return enableAmqpBrokers;
    }

    /**
     * Configuration profile, or null to use the active profile.
     */
    public String getProfile() {
        return profile;
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }

    /**
     * Registry the metrics are bound to, or null to leave them unbound.
     */
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuntimeConfig defaults() {
        return builder().build();
    }

    public static final class Builder {
        private boolean enableMemoryBrokers = true;
        private boolean enableAmqpBrokers = true;
        private String profile;
        private final Map<String, String> overrides = new HashMap<>();
        private MeterRegistry meterRegistry;

        private Builder() {}

        public Builder enableMemoryBrokers(boolean enable) {
            this.enableMemoryBrokers = enable;
            return this;
        }

        public Builder enableAmqpBrokers(boolean enable) {
            this.enableAmqpBrokers = enable;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder property(String key, String value) {
            this.overrides.put(key, value);
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public RuntimeConfig build() {
            return new RuntimeConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RuntimeConfig{" +
                "enableMemoryBrokers=" + enableMemoryBrokers +
                ", enableAmqpBrokers=" + enableAmqpBrokers +
                ", profile=" + profile +
                ", overrides=" + overrides.keySet() +
                '}';
    }
}
