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
import dev.mars.mq.api.Job;
import dev.mars.mq.api.JobIter;
import dev.mars.mq.api.Queue;
import dev.mars.mq.api.RepublishCondition;
import dev.mars.mq.api.TxCallback;
import dev.mars.mq.api.error.MqErrorCodes;
import dev.mars.mq.api.error.MqException;

import java.io.IOException;
import java.time.Duration;

/**
 * Queue handed to a transaction callback. Publishes go to a channel in
 * transaction mode and become visible when the transaction commits.
 */
class AmqpTransactionQueue implements Queue {

    private final AmqpQueue queue;
    private final Channel channel;
    private int publishedCount;

    AmqpTransactionQueue(AmqpQueue queue, Channel channel) {
        this.queue = queue;
        this.channel = channel;
    }

    @Override
    public String getName() {
        return queue.getName();
    }

    @Override
    public synchronized void publish(Job job) throws MqException {
        AmqpQueue.validate(job);
        try {
            queue.basicPublish(channel, "", queue.getName(), job);
        } catch (IOException e) {
            throw new MqException(MqErrorCodes.PUBLISH_FAILED, "Failed to publish job " + job.getId() + " in transaction", e);
        }
        publishedCount++;
    }

    @Override
    public void publishDelayed(Job job, Duration delay) throws MqException {
        publish(job);
    }

    @Override
    public void transaction(TxCallback callback) throws MqException {
        throw invalid("nested transactions");
    }

    @Override
    public JobIter consume(int advertisedWindow) throws MqException {
        throw invalid("consume");
    }

    @Override
    public void republishBuried(RepublishCondition... conditions) throws MqException {
        throw invalid("republishBuried");
    }

    synchronized int getPublishedCount() {
        return publishedCount;
    }

    private MqException invalid(String operation) {
        return new MqException(MqErrorCodes.INVALID_OPERATION,
            operation + " is not allowed inside a transaction on queue " + queue.getName());
    }
}
