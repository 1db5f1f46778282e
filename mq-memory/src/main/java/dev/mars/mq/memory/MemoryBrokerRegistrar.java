package dev.mars.mq.memory;

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
import dev.mars.mq.api.BrokerRegistrar;
import dev.mars.mq.core.config.MqConfiguration;
import dev.mars.mq.core.metrics.MqMetrics;
import dev.mars.mq.core.provider.DefaultBrokerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Registrar for the in-memory brokers: {@code memory://} and {@code memoryfinite://}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MemoryBrokerRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(MemoryBrokerRegistrar.class);

    public static final String SCHEME = "memory";
    public static final String FINITE_SCHEME = "memoryfinite";

    /**
     * Registers both memory schemes with the provided registrar.
     *
     * @param registrar The broker registrar to register with
     */
    public static void registerWith(BrokerRegistrar registrar) {
        registrar.registerBroker(SCHEME, new MemoryBrokerCreator(false));
        registrar.registerBroker(FINITE_SCHEME, new MemoryBrokerCreator(true));
        logger.info("Registered memory brokers for schemes: {}, {}", SCHEME, FINITE_SCHEME);
    }

    /**
     * Unregisters both memory schemes from the provided registrar.
     *
     * @param registrar The broker registrar to unregister from
     */
    public static void unregisterFrom(BrokerRegistrar registrar) {
        registrar.unregisterBroker(SCHEME);
        registrar.unregisterBroker(FINITE_SCHEME);
        logger.info("Unregistered memory brokers");
    }

    private static class MemoryBrokerCreator implements BrokerRegistrar.BrokerCreator {
        private final boolean finite;

        MemoryBrokerCreator(boolean finite) {
            this.finite = finite;
        }

        @Override
        public Broker create(String uri, Map<String, Object> configuration) {
            MqConfiguration config = DefaultBrokerProvider.configurationFrom(configuration);
            MqMetrics metrics = DefaultBrokerProvider.metricsFrom(configuration);
            return new MemoryBroker(finite, config.getMemoryPollInterval(), metrics);
        }
    }
}
