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

import dev.mars.mq.api.Broker;
import dev.mars.mq.api.BrokerProvider;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.core.config.MqConfiguration;
import dev.mars.mq.core.metrics.MqMetrics;
import dev.mars.mq.core.provider.DefaultBrokerProvider;

import java.util.Objects;

/**
 * Everything a bootstrapped application needs: the broker provider with the
 * enabled backends, the loaded configuration and the shared metrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class MqContext {

    private final DefaultBrokerProvider brokerProvider;
    private final RuntimeConfig config;

    MqContext(DefaultBrokerProvider brokerProvider, RuntimeConfig config) {
        this.brokerProvider = Objects.requireNonNull(brokerProvider, "BrokerProvider cannot be null");
        this.config = Objects.requireNonNull(config, "RuntimeConfig cannot be null");
    }

    public BrokerProvider getBrokerProvider() {
        return brokerProvider;
    }

    public RuntimeConfig getConfig() {
        return config;
    }

    public MqConfiguration getConfiguration() {
        return brokerProvider.getConfiguration();
    }

    public MqMetrics getMetrics() {
        return brokerProvider.getMetrics();
    }

    /**
     * Creates a broker for the given URI using the context's configuration and metrics.
     */
    public Broker newBroker(String uri) throws MqException {
        return brokerProvider.newBroker(uri);
    }

    @Override
    public String toString() {
        return "MqContext{" +
                "schemes=" + brokerProvider.getSupportedSchemes() +
                ", config=" + config +
                '}';
    }
}
