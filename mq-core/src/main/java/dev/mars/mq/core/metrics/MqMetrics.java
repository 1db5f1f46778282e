package dev.mars.mq.core.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Job flow counters for every backend.
 *
 * <p>Counters are tagged with the instance id and the queue name, except the
 * reconnect counter which is tagged with the broker type. Until
 * {@link #bindTo(MeterRegistry)} is called every record method is a no-op.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MqMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(MqMetrics.class);

    public static final String JOBS_PUBLISHED = "mq.jobs.published";
    public static final String JOBS_DELIVERED = "mq.jobs.delivered";
    public static final String JOBS_ACKED = "mq.jobs.acked";
    public static final String JOBS_REJECTED = "mq.jobs.rejected";
    public static final String JOBS_BURIED = "mq.jobs.buried";
    public static final String JOBS_REPUBLISHED = "mq.jobs.republished";
    public static final String BROKER_RECONNECTS = "mq.broker.reconnects";

    private final String instanceId;
    private volatile MeterRegistry registry;

    public MqMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * Metrics that never record anything.
     */
    public static MqMetrics noop() {
        return new MqMetrics("noop");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        logger.debug("MQ metrics bound to registry for instance {}", instanceId);
    }

    public void recordPublished(String queue) {
        increment(JOBS_PUBLISHED, "Total number of jobs published", queue);
    }

    public void recordDelivered(String queue) {
        increment(JOBS_DELIVERED, "Total number of jobs handed out to consumers", queue);
    }

    public void recordAcked(String queue) {
        increment(JOBS_ACKED, "Total number of jobs acknowledged", queue);
    }

    public void recordRejected(String queue, boolean requeue) {
        increment(JOBS_REJECTED, "Total number of jobs rejected", queue);
        if (!requeue) {
            increment(JOBS_BURIED, "Total number of jobs moved to the buried queue", queue);
        }
    }

    public void recordRepublished(String queue) {
        increment(JOBS_REPUBLISHED, "Total number of buried jobs republished", queue);
    }

    public void recordReconnect(String brokerType) {
        MeterRegistry current = registry;
        if (current != null) {
            Counter.builder(BROKER_RECONNECTS)
                .description("Total number of successful broker reconnections")
                .tag("instance", instanceId)
                .tag("broker", brokerType)
                .register(current)
                .increment();
        }
    }

    private void increment(String name, String description, String queue) {
        MeterRegistry current = registry;
        if (current != null) {
            Counter.builder(name)
                .description(description)
                .tag("instance", instanceId)
                .tag("queue", queue)
                .register(current)
                .increment();
        }
    }

    public String getInstanceId() {
        return instanceId;
    }

    public boolean isBound() {
        return registry != null;
    }
}
