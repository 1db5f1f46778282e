package dev.mars.mq.api;

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

import dev.mars.mq.api.error.MqException;

/**
 * Connection to a queue backend, created through a {@link BrokerProvider}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface Broker extends AutoCloseable {

    /**
     * Gets the queue with the given name, creating it on first use. The same
     * name always refers to the same queue state.
     */
    Queue queue(String name) throws MqException;

    /**
     * Gets the backend type, for instance {@code memory} or {@code amqp}.
     */
    String getBrokerType();

    /**
     * Releases every resource held by the broker. Queues obtained from a closed
     * broker must not be used any more.
     */
    @Override
    void close() throws MqException;
}
