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

import dev.mars.mq.api.BrokerProvider;
import dev.mars.mq.core.config.MqConfiguration;
import dev.mars.mq.core.provider.DefaultBrokerProvider;
import dev.mars.mq.test.QueueConformanceTestBase;
import dev.mars.mq.test.categories.TestCategories;
import dev.mars.mq.test.containers.RabbitMqTestContainerFactory;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;

@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class AmqpQueueConformanceTest extends QueueConformanceTestBase {

    @Container
    static final RabbitMQContainer rabbit = RabbitMqTestContainerFactory.createContainer();

    @Override
    protected BrokerProvider brokerProvider() {
        DefaultBrokerProvider provider = new DefaultBrokerProvider(new MqConfiguration("default", Map.of(
            AmqpConfiguration.POLL_INTERVAL, "PT0.05S")));
        AmqpBrokerRegistrar.registerWith(provider);
        return provider;
    }

    @Override
    protected String brokerUri() {
        return RabbitMqTestContainerFactory.amqpUri(rabbit);
    }
}
