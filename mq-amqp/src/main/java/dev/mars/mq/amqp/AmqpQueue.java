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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import dev.mars.mq.api.Job;
import dev.mars.mq.api.JobIdGenerator;
import dev.mars.mq.api.JobIter;
import dev.mars.mq.api.Priority;
import dev.mars.mq.api.Queue;
import dev.mars.mq.api.RepublishCondition;
import dev.mars.mq.api.RepublishConditions;
import dev.mars.mq.api.TxCallback;
import dev.mars.mq.api.error.EmptyJobException;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.api.error.TransactionsNotSupportedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AMQP queue with a buried companion.
 *
 * <p>Topology for a queue {@code q}: a durable fanout exchange
 * {@code q + buriedExchangeSuffix}, a durable queue {@code q + buriedQueueSuffix}
 * bound to it, and the durable main queue {@code q} declared with a maximum
 * priority and the buried exchange as dead letter exchange. The topology is
 * declared again after every reconnect.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class AmqpQueue implements Queue {

    private static final Logger logger = LoggerFactory.getLogger(AmqpQueue.class);

    private final String name;
    private final String buriedQueueName;
    private final String buriedExchangeName;
    private final AmqpBroker broker;
    private final AmqpConfiguration config;
    private final AmqpConnectionManager connectionManager;
    private final AmqpConnectionManager.RecoveryListener topologyRecovery;

    private final ReentrantLock publishLock = new ReentrantLock();
    private Channel publishChannel;

    private final Set<AmqpJobIter> iterators = ConcurrentHashMap.newKeySet();

    AmqpQueue(String name, AmqpBroker broker) throws MqException {
        this.name = name;
        this.broker = broker;
        this.config = broker.getConfig();
        this.connectionManager = broker.getConnectionManager();
        this.buriedQueueName = name + config.getBuriedQueueSuffix();
        this.buriedExchangeName = name + config.getBuriedExchangeSuffix();

        Channel channel = connectionManager.createChannel();
        try {
            declareTopology(channel);
        } catch (IOException | ShutdownSignalException e) {
            throw new MqException(MqErrorCodes.QUEUE_DECLARE_FAILED, "Failed to declare queue " + name, e);
        } finally {
            closeChannel(channel);
        }

        this.topologyRecovery = connection -> {
            Channel recovered = connection.createChannel();
            try {
                declareTopology(recovered);
            } finally {
                closeChannel(recovered);
            }
        };
        connectionManager.addRecoveryListener(topologyRecovery);
        logger.info("Declared AMQP queue {} with buried queue {}", name, buriedQueueName);
    }

    void declareTopology(Channel channel) throws IOException {
        channel.exchangeDeclare(buriedExchangeName, BuiltinExchangeType.FANOUT, true);
        channel.queueDeclare(buriedQueueName, true, false, false, null);
        channel.queueBind(buriedQueueName, buriedExchangeName, "");

        Map<String, Object> args = new HashMap<>();
        args.put("x-max-priority", Priority.maxValue());
        args.put("x-dead-letter-exchange", buriedExchangeName);
        channel.queueDeclare(name, true, false, false, args);
    }

    @Override
    public String getName() {
        return name;
    }

    public String getBuriedQueueName() {
        return buriedQueueName;
    }

    public String getBuriedExchangeName() {
        return buriedExchangeName;
    }

    @Override
    public void publish(Job job) throws MqException {
        validate(job);
        publishTo("", name, job);
        broker.getMetrics().recordPublished(name);
        logger.debug("Published job {} to queue {}", job.getId(), name);
    }

    @Override
    public void publishDelayed(Job job, Duration delay) throws MqException {
        validate(job);
        Objects.requireNonNull(delay, "Delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay cannot be negative: " + delay);
        }
        long ttl = delay.toMillis();
        if (ttl <= 0) {
            publish(job);
            return;
        }

        // a queue per job whose expired message is dead lettered into the main queue
        String delayedQueue = delayedQueueName(name, ttl, job.getId());
        Map<String, Object> args = new HashMap<>();
        args.put("x-dead-letter-exchange", "");
        args.put("x-dead-letter-routing-key", name);
        args.put("x-message-ttl", ttl);
        args.put("x-expires", ttl * 2);

        withPublishChannel(channel -> {
            channel.queueDeclare(delayedQueue, true, false, false, args);
            basicPublish(channel, "", delayedQueue, job);
        });
        broker.getMetrics().recordPublished(name);
        logger.debug("Published job {} to queue {} with delay {}", job.getId(), name, delay);
    }

    /**
     * Name of the holding queue for a delayed job. Target queue and TTL are part
     * of the name because both are declared as queue arguments, which must not
     * differ between declarations of the same queue.
     */
    static String delayedQueueName(String queue, long ttlMillis, String jobId) {
        String id = jobId != null && !jobId.isEmpty() ? jobId : JobIdGenerator.uuid().generate();
        return queue + ".delay." + ttlMillis + "." + id;
    }

    @Override
    public void transaction(TxCallback callback) throws MqException {
        if (config.isPublisherConfirms()) {
            throw new TransactionsNotSupportedException(
                "Transactions are not available when publisher confirms are enabled");
        }
        Objects.requireNonNull(callback, "Transaction callback cannot be null");

        Channel channel = connectionManager.createChannel();
        try {
            channel.txSelect();
            AmqpTransactionQueue staging = new AmqpTransactionQueue(this, channel);
            try {
                callback.execute(staging);
            } catch (Exception e) {
                rollback(channel);
                if (e instanceof MqException) {
                    throw (MqException) e;
                }
                throw new MqException(MqErrorCodes.TRANSACTION_FAILED, "Transaction callback failed: " + e.getMessage(), e);
            }
            channel.txCommit();
            for (int i = 0; i < staging.getPublishedCount(); i++) {
                broker.getMetrics().recordPublished(name);
            }
            logger.debug("Committed transaction with {} jobs on queue {}", staging.getPublishedCount(), name);
        } catch (IOException | ShutdownSignalException e) {
            throw new MqException(MqErrorCodes.TRANSACTION_FAILED, "Transaction on queue " + name + " failed", e);
        } finally {
            closeChannel(channel);
        }
    }

    private void rollback(Channel channel) {
        try {
            channel.txRollback();
        } catch (IOException | ShutdownSignalException e) {
            logger.warn("Rollback of transaction on queue {} failed, the channel will be closed", name, e);
        }
    }

    @Override
    public JobIter consume(int advertisedWindow) throws MqException {
        AmqpJobIter iter = new AmqpJobIter(this, advertisedWindow);
        iterators.add(iter);
        logger.debug("Opened iterator on queue {} with window {}", name, advertisedWindow);
        return iter;
    }

    /**
     * Moves buried messages back to the main queue. The buried queue is drained
     * one message at a time up to the number of messages it held when the call
     * started, or until it stays empty for the buried timeout; messages that do
     * not match are published back to the buried exchange in the order they were read.
     */
    @Override
    public void republishBuried(RepublishCondition... conditions) throws MqException {
        // counted on the publish channel so that jobs buried through it are included
        AtomicLong buried = new AtomicLong();
        withPublishChannel(publish -> buried.set(publish.queueDeclarePassive(buriedQueueName).getMessageCount()));
        long snapshot = buried.get();

        Channel channel = connectionManager.createChannel();
        int republished = 0;
        int kept = 0;
        try {
            channel.basicQos(1);

            LinkedBlockingQueue<AmqpDelivery> deliveries = new LinkedBlockingQueue<>();
            String consumerTag = channel.basicConsume(buriedQueueName, false, new AmqpDelivery.Collector(channel, deliveries));

            Set<String> seen = new HashSet<>();
            long processed = 0;
            while (snapshot == 0 || processed < snapshot) {
                AmqpDelivery delivery = deliveries.poll(config.getBuriedTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (delivery == null) {
                    break;
                }
                Job job = AmqpHeaders.toJob(delivery.getProperties(), delivery.getBody(), config);
                if (job.getId() != null && !seen.add(job.getId())) {
                    // went around once already
                    channel.basicNack(delivery.getDeliveryTag(), false, true);
                    break;
                }

                if (RepublishConditions.complyAll(job, conditions)) {
                    job.setErrorType("");
                    publishTo("", name, job);
                    republished++;
                    broker.getMetrics().recordRepublished(name);
                } else {
                    basicPublish(channel, buriedExchangeName, "", job);
                    kept++;
                }
                channel.basicAck(delivery.getDeliveryTag(), false);
                processed++;
            }
            channel.basicCancel(consumerTag);
        } catch (IOException | ShutdownSignalException e) {
            throw new MqException(MqErrorCodes.REPUBLISH_FAILED, "Failed to republish buried jobs of queue " + name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MqException(MqErrorCodes.INTERRUPTED, "Interrupted while republishing buried jobs of queue " + name, e);
        } finally {
            closeChannel(channel);
        }
        logger.debug("Republished {} buried jobs on queue {}, {} stay buried", republished, name, kept);
    }

    /**
     * Publishes a job to the buried exchange with its current retries and error type.
     */
    void publishToBuried(Job job) throws MqException {
        publishTo(buriedExchangeName, "", job);
    }

    private void publishTo(String exchange, String routingKey, Job job) throws MqException {
        withPublishChannel(channel -> basicPublish(channel, exchange, routingKey, job));
    }

    void basicPublish(Channel channel, String exchange, String routingKey, Job job) throws IOException {
        AMQP.BasicProperties properties = AmqpHeaders.toProperties(job, config);
        channel.basicPublish(exchange, routingKey, properties, job.getRaw());
    }

    @FunctionalInterface
    private interface ChannelAction {
        void run(Channel channel) throws IOException;
    }

    /**
     * Runs an action on the shared publish channel. A channel lost with its
     * connection is replaced once the connection is back; any other failure is reported.
     */
    private void withPublishChannel(ChannelAction action) throws MqException {
        publishLock.lock();
        try {
            while (true) {
                Channel channel = publishChannel();
                try {
                    action.run(channel);
                    if (config.isPublisherConfirms()) {
                        channel.waitForConfirmsOrDie(config.getConfirmTimeout().toMillis());
                    }
                    return;
                } catch (IOException | ShutdownSignalException e) {
                    publishChannel = null;
                    if (channel.getConnection().isOpen()) {
                        closeChannel(channel);
                        throw new MqException(MqErrorCodes.PUBLISH_FAILED, "Failed to publish to queue " + name, e);
                    }
                    logger.warn("Connection lost while publishing to queue {}, retrying after reconnection", name);
                    connectionManager.connectionLost(channel.getConnection());
                } catch (TimeoutException e) {
                    throw new MqException(MqErrorCodes.PUBLISH_FAILED, "Publisher confirm timed out on queue " + name, e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MqException(MqErrorCodes.INTERRUPTED, "Interrupted while waiting for publisher confirm", e);
                }
            }
        } finally {
            publishLock.unlock();
        }
    }

    private Channel publishChannel() throws MqException {
        if (publishChannel == null || !publishChannel.isOpen()) {
            Channel channel = connectionManager.createChannel();
            if (config.isPublisherConfirms()) {
                try {
                    channel.confirmSelect();
                } catch (IOException e) {
                    closeChannel(channel);
                    throw new MqException(MqErrorCodes.PUBLISH_FAILED, "Cannot enable publisher confirms", e);
                }
            }
            publishChannel = channel;
        }
        return publishChannel;
    }

    static void validate(Job job) throws EmptyJobException {
        if (job == null || job.size() == 0) {
            throw new EmptyJobException();
        }
    }

    static void closeChannel(Channel channel) {
        if (channel != null && channel.isOpen()) {
            try {
                channel.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                logger.debug("Ignoring failure while closing channel", e);
            }
        }
    }

    AmqpBroker getBroker() {
        return broker;
    }

    AmqpConfiguration getConfig() {
        return config;
    }

    AmqpConnectionManager getConnectionManager() {
        return connectionManager;
    }

    void removeIterator(AmqpJobIter iter) {
        iterators.remove(iter);
    }

    void close() {
        for (AmqpJobIter iter : new ArrayList<>(iterators)) {
            iter.close();
        }
        iterators.clear();
        connectionManager.removeRecoveryListener(topologyRecovery);
        publishLock.lock();
        try {
            closeChannel(publishChannel);
            publishChannel = null;
        } finally {
            publishLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "AmqpQueue{name='" + name + "'}";
    }
}
