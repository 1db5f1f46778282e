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

import java.time.Duration;

/**
 * A named job queue of a {@link Broker}.
 *
 * <p>Publishing never blocks behind consumers. Several iterators may consume
 * the same queue; each job is handed out to a single consumer at a time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface Queue {

    /**
     * Gets the name of the queue.
     */
    String getName();

    /**
     * Publishes a job for immediate delivery.
     *
     * @throws dev.mars.mq.api.error.EmptyJobException if the job is null or has no payload
     */
    void publish(Job job) throws MqException;

    /**
     * Publishes a job that becomes visible to consumers only after the delay.
     * Never blocks the caller for the duration of the delay.
     *
     * @throws dev.mars.mq.api.error.EmptyJobException if the job is null or has no payload
     */
    void publishDelayed(Job job, Duration delay) throws MqException;

    /**
     * Runs the callback against a staging queue. When the callback succeeds the
     * staged jobs are published together; when it fails nothing is published and
     * the failure is rethrown.
     *
     * @throws dev.mars.mq.api.error.TransactionsNotSupportedException if the backend cannot stage publishes
     */
    void transaction(TxCallback callback) throws MqException;

    /**
     * Opens an iterator over the queue.
     *
     * @param advertisedWindow maximum number of delivered but unacknowledged jobs,
     *                         {@code <= 0} for unbounded
     */
    JobIter consume(int advertisedWindow) throws MqException;

    /**
     * Republishes the buried jobs matching every condition, all buried jobs when
     * no condition is given. Republished jobs have their error type cleared.
     */
    void republishBuried(RepublishCondition... conditions) throws MqException;
}
