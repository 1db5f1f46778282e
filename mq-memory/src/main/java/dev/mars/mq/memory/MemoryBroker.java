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
import dev.mars.mq.api.Queue;
import dev.mars.mq.api.error.AlreadyClosedException;
import dev.mars.mq.api.error.MqException;
import dev.mars.mq.core.metrics.MqMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process broker. Queues live as long as the broker and are shared by every
 * caller asking for the same name.
 *
 * <p>A finite broker makes {@code next()} fail with
 * {@link dev.mars.mq.api.error.EndOfStreamException} once its queue is empty,
 * which lets batch jobs drain a queue and stop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MemoryBroker implements Broker {

    private static final Logger logger = LoggerFactory.getLogger(MemoryBroker.class);
    private static final AtomicInteger BROKER_IDS = new AtomicInteger();

    public static final String BROKER_TYPE = "memory";

    private final Map<String, MemoryQueue> queues = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final boolean finite;
    private final Duration pollInterval;
    private final MqMetrics metrics;
    private final ScheduledExecutorService scheduler;

    public MemoryBroker() {
        this(false, Duration.ofSeconds(1), MqMetrics.noop());
    }

    /**
     * @param finite       whether iterators stop with end of stream on an empty queue
     * @param pollInterval how long a blocked {@code next()} waits between checks for closure
     * @param metrics      job flow metrics
     */
    public MemoryBroker(boolean finite, Duration pollInterval, MqMetrics metrics) {
        Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.finite = finite;
        this.pollInterval = pollInterval;
        this.metrics = metrics != null ? metrics : MqMetrics.noop();

        int brokerId = BROKER_IDS.incrementAndGet();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mq-memory-delayed-" + brokerId);
            t.setDaemon(true);
            return t;
        });
        logger.info("Created {} memory broker with poll interval {}", finite ? "finite" : "infinite", pollInterval);
    }

    @Override
    public Queue queue(String name) throws MqException {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (closed.get()) {
            throw new AlreadyClosedException("Broker is closed");
        }
        return queues.computeIfAbsent(name, n -> {
            logger.debug("Creating memory queue: {}", n);
            return new MemoryQueue(n, this);
        });
    }

    @Override
    public String getBrokerType() {
        return BROKER_TYPE;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queues.values().forEach(MemoryQueue::close);
            queues.clear();
            scheduler.shutdownNow();
            logger.info("Closed memory broker");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    boolean isFinite() {
        return finite;
    }

    Duration getPollInterval() {
        return pollInterval;
    }

    MqMetrics getMetrics() {
        return metrics;
    }

    ScheduledExecutorService getScheduler() {
        return scheduler;
    }
}
