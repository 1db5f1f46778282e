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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import dev.mars.mq.api.Job;
import dev.mars.mq.api.JobIter;
import dev.mars.mq.api.error.AlreadyClosedException;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Iterator over an AMQP queue. Each iterator owns a channel whose prefetch is
 * the advertised window, so the broker enforces the number of unacknowledged jobs.
 *
 * <p>If the channel dies the iterator opens a new one on the next call to
 * {@link #next()}, waiting for the connection to come back when needed. Buffered
 * deliveries of a dead channel are discarded since the broker has requeued them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class AmqpJobIter implements JobIter {

    private static final Logger logger = LoggerFactory.getLogger(AmqpJobIter.class);

    private final AmqpQueue queue;
    private final int window;
    private final Duration pollInterval;
    private final LinkedBlockingQueue<AmqpDelivery> deliveries = new LinkedBlockingQueue<>();
    private final Object channelLock = new Object();
    private final String consumerTag;
    private Channel channel;
    private volatile boolean closed;

    AmqpJobIter(AmqpQueue queue, int advertisedWindow) throws MqException {
        this.queue = queue;
        this.window = Math.max(0, advertisedWindow);
        this.pollInterval = queue.getConfig().getPollInterval();
        this.consumerTag = "mq-" + queue.getName() + "-" + UUID.randomUUID();
        Channel opened = openChannel();
        synchronized (channelLock) {
            channel = opened;
        }
    }

    private Channel openChannel() throws MqException {
        Channel opened = queue.getConnectionManager().createChannel();
        try {
            if (window > 0) {
                opened.basicQos(window);
            }
            opened.basicConsume(queue.getName(), false, consumerTag, new AmqpDelivery.Collector(opened, deliveries));
        } catch (IOException | ShutdownSignalException e) {
            AmqpQueue.closeChannel(opened);
            throw new MqException(MqErrorCodes.CONSUME_FAILED, "Cannot consume from queue " + queue.getName(), e);
        }
        return opened;
    }

    /**
     * Replaces a dead channel. Opening may wait for a reconnect, so it happens
     * outside the lock to keep {@link #close()} responsive.
     */
    private void ensureChannel() throws MqException {
        synchronized (channelLock) {
            if (closed) {
                throw new AlreadyClosedException();
            }
            if (channel != null && channel.isOpen()) {
                return;
            }
        }
        logger.info("Re-opening consumer channel for queue {}", queue.getName());
        Channel opened = openChannel();
        synchronized (channelLock) {
            if (!closed && (channel == null || !channel.isOpen())) {
                channel = opened;
                return;
            }
        }
        AmqpQueue.closeChannel(opened);
        if (closed) {
            throw new AlreadyClosedException();
        }
    }

    @Override
    public Job next() throws MqException {
        try {
            while (true) {
                if (closed) {
                    throw new AlreadyClosedException();
                }
                ensureChannel();
                AmqpDelivery delivery = deliveries.poll(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
                if (delivery == null) {
                    continue;
                }
                if (!delivery.getChannel().isOpen()) {
                    logger.debug("Discarding stale delivery {} on queue {}", delivery.getDeliveryTag(), queue.getName());
                    continue;
                }
                if (closed) {
                    // the broker requeues it when the channel is closed
                    throw new AlreadyClosedException();
                }
                Job job = AmqpHeaders.toJob(delivery.getProperties(), delivery.getBody(), queue.getConfig());
                job.setAcknowledger(new AmqpAcknowledger(job, queue, delivery.getChannel(), delivery.getDeliveryTag()));
                queue.getBroker().getMetrics().recordDelivered(queue.getName());
                logger.debug("Delivered job {} from queue {}", job.getId(), queue.getName());
                return job;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MqException(MqErrorCodes.INTERRUPTED, "Interrupted while waiting for a job on queue " + queue.getName(), e);
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        Channel toClose;
        synchronized (channelLock) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = channel;
            channel = null;
        }
        if (toClose != null && toClose.isOpen()) {
            try {
                toClose.basicCancel(consumerTag);
            } catch (IOException | ShutdownSignalException e) {
                logger.warn("Failed to cancel consumer {} on queue {}", consumerTag, queue.getName(), e);
            }
        }
        AmqpQueue.closeChannel(toClose);
        deliveries.clear();
        queue.removeIterator(this);
        logger.debug("Closed iterator on queue {}", queue.getName());
    }

    public int getWindow() {
        return window;
    }
}
