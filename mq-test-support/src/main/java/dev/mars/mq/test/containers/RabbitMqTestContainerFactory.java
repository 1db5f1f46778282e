package dev.mars.mq.test.containers;

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
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Creates RabbitMQ containers with a consistent image for
 * integration tests.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class RabbitMqTestContainerFactory {

    private static final Logger logger = LoggerFactory.getLogger(RabbitMqTestContainerFactory.class);

    // Consistent image version across all tests
    public static final String RABBITMQ_IMAGE = "rabbitmq:3.13-management";

    private RabbitMqTestContainerFactory() {
    }

    @SuppressWarnings("resource")
    public static RabbitMQContainer createContainer() {
        logger.debug("Creating RabbitMQ container from image {}", RABBITMQ_IMAGE);
        return new RabbitMQContainer(DockerImageName.parse(RABBITMQ_IMAGE))
            .withReuse(false);
    }

    /**
     * Builds an {@code amqp://} URI with credentials for a started container.
     */
    public static String amqpUri(RabbitMQContainer container) {
        return "amqp://" + container.getAdminUsername() + ":" + container.getAdminPassword()
            + "@" + container.getHost() + ":" + container.getAmqpPort();
    }
}
