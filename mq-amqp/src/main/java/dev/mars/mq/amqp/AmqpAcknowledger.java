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
import dev.mars.mq.api.AbstractAcknowledger;
import dev.mars.mq.api.Job;
import dev.mars.mq.api.error.ConnectionLostException;
import dev.mars.mq.api.error.MqException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Acknowledges a delivery on the channel it arrived on.
 */
class AmqpAcknowledger extends AbstractAcknowledger {

    private static final Logger logger = LoggerFactory.getLogger(AmqpAcknowledger.class);

    private final AmqpQueue queue;
    private final Channel channel;
    private final long deliveryTag;

    AmqpAcknowledger(Job job, AmqpQueue queue, Channel channel, long deliveryTag) {
        super(job);
        this.queue = queue;
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    @Override
    protected void doAck() throws MqException {
        ensureOpen();
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | ShutdownSignalException e) {
            throw lost("ack", e);
        }
        queue.getBroker().getMetrics().recordAcked(queue.getName());
    }

    @Override
    protected void doReject(boolean requeue) throws MqException {
        ensureOpen();
        try {
            if (requeue) {
                channel.basicNack(deliveryTag, false, true);
            } else {
                bury();
            }
        } catch (IOException | ShutdownSignalException e) {
            throw lost("reject", e);
        }
        queue.getBroker().getMetrics().recordRejected(queue.getName(), requeue);
    }

    private void bury() throws IOException {
        try {
            queue.publishToBuried(job);
        } catch (MqException e) {
            // dead lettering keeps the job but loses its updated headers
            logger.warn("Could not publish job {} to the buried exchange, dead lettering it instead", job.getId(), e);
            channel.basicReject(deliveryTag, false);
            return;
        }
        channel.basicAck(deliveryTag, false);
    }

    private void ensureOpen() throws ConnectionLostException {
        if (!channel.isOpen()) {
            throw new ConnectionLostException("Channel of job " + job.getId() + " was closed, the broker has requeued it");
        }
    }

    private ConnectionLostException lost(String operation, Exception cause) {
        return new ConnectionLostException("Cannot " + operation + " job " + job.getId() + " on queue " + queue.getName(), cause);
    }
}
