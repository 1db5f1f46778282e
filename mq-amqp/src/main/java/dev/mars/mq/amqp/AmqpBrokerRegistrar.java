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

import dev.mars.mq.api.Broker;
import dev.mars.mq.api.BrokerRegistrar;
import dev.mars.mq.core.metrics.MqMetrics;
import dev.mars.mq.core.provider.DefaultBrokerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Registers the AMQP broker with a {@link BrokerRegistrar} for the
 * {@code amqp} and {@code amqps} schemes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class AmqpBrokerRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(AmqpBrokerRegistrar.class);

    public static final String SCHEME = "amqp";
    public static final String SECURE_SCHEME = "amqps";

    public static void registerWith(BrokerRegistrar registrar) {
        registrar.registerBroker(SCHEME, AmqpBrokerRegistrar::create);
        registrar.registerBroker(SECURE_SCHEME, AmqpBrokerRegistrar::create);
        logger.info("Registered AMQP brokers for schemes: {}, {}", SCHEME, SECURE_SCHEME);
    }

    public static void unregisterFrom(BrokerRegistrar registrar) {
        registrar.unregisterBroker(SCHEME);
        registrar.unregisterBroker(SECURE_SCHEME);
        logger.info("Unregistered AMQP brokers");
    }

    private static Broker create(String uri, Map<String, Object> configuration) throws Exception {
        AmqpConfiguration config = AmqpConfiguration.from(DefaultBrokerProvider.configurationFrom(configuration));
        MqMetrics metrics = DefaultBrokerProvider.metricsFrom(configuration);
        return new AmqpBroker(uri, config, metrics);
    }
}
