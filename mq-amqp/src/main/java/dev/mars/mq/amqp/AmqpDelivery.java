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
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;

import java.util.concurrent.BlockingQueue;

/**
 * A delivery together with the channel it arrived on, so that it is acknowledged
 * on the same channel.
 */
final class AmqpDelivery {

    private final Channel channel;
    private final long deliveryTag;
    private final AMQP.BasicProperties properties;
    private final byte[] body;

    AmqpDelivery(Channel channel, long deliveryTag, AMQP.BasicProperties properties, byte[] body) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.properties = properties;
        this.body = body;
    }

    Channel getChannel() {
        return channel;
    }

    long getDeliveryTag() {
        return deliveryTag;
    }

    AMQP.BasicProperties getProperties() {
        return properties;
    }

    byte[] getBody() {
        return body;
    }

    /**
     * Consumer that buffers deliveries for a pulling reader.
     */
    static final class Collector extends DefaultConsumer {

        private final BlockingQueue<AmqpDelivery> deliveries;

        Collector(Channel channel, BlockingQueue<AmqpDelivery> deliveries) {
            super(channel);
            this.deliveries = deliveries;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            deliveries.add(new AmqpDelivery(getChannel(), envelope.getDeliveryTag(), properties, body));
        }
    }
}
