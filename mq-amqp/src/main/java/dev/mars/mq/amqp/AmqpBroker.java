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
import dev.mars.mq.api.Queue;
import dev.mars.mq.api.error.AlreadyClosedException;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.core.metrics.MqMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Broker backed by an AMQP 0-9-1 server such as RabbitMQ.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class AmqpBroker implements Broker {

    private static final Logger logger = LoggerFactory.getLogger(AmqpBroker.class);

    public static final String BROKER_TYPE = "amqp";

    private final AmqpConnectionManager connectionManager;
    private final AmqpConfiguration config;
    private final MqMetrics metrics;
    private final Map<String, AmqpQueue> queues = new HashMap<>();
    private volatile boolean closed;

    /**
     * Connects to the broker at the given URI.
     *
     * @throws MqException if the URI is invalid or the broker cannot be reached
     */
    public AmqpBroker(String uri, AmqpConfiguration config, MqMetrics metrics) throws MqException {
        this(new AmqpConnectionManager(uri, config, metrics), config, metrics);
    }

    AmqpBroker(AmqpConnectionManager connectionManager, AmqpConfiguration config, MqMetrics metrics) throws MqException {
        this.connectionManager = connectionManager;
        this.config = config;
        this.metrics = metrics != null ? metrics : MqMetrics.noop();
        if (connectionManager.getState() == AmqpConnectionManager.State.NEW) {
            connectionManager.connect();
        }
        logger.info("Created AMQP broker with {}", config);
    }

    @Override
    public synchronized Queue queue(String name) throws MqException {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (closed) {
            throw new AlreadyClosedException("Broker is closed");
        }
        AmqpQueue queue = queues.get(name);
        if (queue == null) {
            queue = new AmqpQueue(name, this);
            queues.put(name, queue);
        }
        return queue;
    }

    @Override
    public String getBrokerType() {
        return BROKER_TYPE;
    }

    @Override
    public void close() throws MqException {
        List<AmqpQueue> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(queues.values());
            queues.clear();
        }
        toClose.forEach(AmqpQueue::close);
        connectionManager.close();
        logger.info("Closed AMQP broker");
    }

    public boolean isClosed() {
        return closed;
    }

    AmqpConnectionManager getConnectionManager() {
        return connectionManager;
    }

    AmqpConfiguration getConfig() {
        return config;
    }

    MqMetrics getMetrics() {
        return metrics;
    }
}
